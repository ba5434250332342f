package io.tessera.core.workflow.task;

import io.tessera.core.exception.ValidationException;
import io.tessera.core.workflow.SourceLiterals;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A task invoking a single operator of the target runtime.
///
/// The operator name (e.g. `BashOperator`) doubles as the task type reported by
/// the analyzer. Operator keyword arguments are kept in declaration order; they
/// are extension fields and may hold further dependency carriers such as
/// callbacks, which dependency discovery visits.
///
/// ### Rendered form
/// {@snippet :
/// extract_task = BashOperator(task_id="extract", bash_command="echo hi", pool="etl")
/// }
public class OperatorTask extends Task {

    private final String operator;
    private final Map<String, Object> arguments;

    private OperatorTask(Builder builder) {
        super(builder);
        this.operator = ValidationException.requireText(builder.operator, "OperatorTask operator");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
    }

    public String getOperator() {
        return operator;
    }

    /// Operator keyword arguments, excluding `task_id`, `pool` and callbacks.
    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public String getTaskType() {
        return operator;
    }

    @Override
    public List<Object> getChildren() {
        List<Object> children = super.getChildren();
        children.addAll(arguments.values());
        return children;
    }

    @Override
    public String render() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("task_id", taskId);
        kwargs.putAll(arguments);
        kwargs.putAll(commonArguments());
        return getVariableName()
                + " = "
                + operator
                + "("
                + SourceLiterals.keywordArguments(kwargs)
                + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Task.Builder<Builder> {
        private String operator;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        public Builder operator(String operator) {
            this.operator = operator;
            return this;
        }

        public Builder arguments(Map<String, ?> arguments) {
            ValidationException.requireNonNull(arguments, "arguments").forEach(this::argument);
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(ValidationException.requireText(key, "argument name"), value);
            return this;
        }

        /// Builds the task.
        ///
        /// @return new task, never null
        /// @throws ValidationException if `taskId` or `operator` is missing
        public OperatorTask build() {
            return new OperatorTask(this);
        }
    }
}
