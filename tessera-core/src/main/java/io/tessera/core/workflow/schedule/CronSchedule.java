package io.tessera.core.workflow.schedule;

import io.tessera.core.exception.ValidationException;
import io.tessera.core.workflow.SourceLiterals;

/// A schedule given as a cron expression or a preset such as `@daily`.
///
/// @param expression cron expression, not blank
public record CronSchedule(String expression) implements Schedule {

    public CronSchedule {
        ValidationException.requireText(expression, "CronSchedule expression");
    }

    @Override
    public String render() {
        return SourceLiterals.quote(expression);
    }
}
