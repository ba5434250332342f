package io.tessera.core.workflow.schedule;

import io.tessera.core.discovery.DependencyCarrier;
import io.tessera.core.model.Renderable;

/// When a workflow runs.
///
/// A schedule renders to the value of the workflow's `schedule` argument and
/// may carry dependencies of its own; a custom timetable, for instance, needs
/// its implementation shipped as an include and its package installed.
///
/// ### Implementations
/// - {@link CronSchedule} - a cron expression or preset
/// - {@link Timetable} - a timetable class instantiated with arguments
public interface Schedule extends DependencyCarrier, Renderable {}
