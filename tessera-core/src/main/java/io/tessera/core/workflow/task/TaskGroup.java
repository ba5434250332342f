package io.tessera.core.workflow.task;

import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Requirement;
import io.tessera.core.workflow.SourceLiterals;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A named group of tasks, rendered as a nested block.
///
/// Groups nest to arbitrary depth. The contained tasks are exposed to
/// dependency discovery through {@link #getNestedTasks()}; a group always
/// imports the runtime's task group type in addition to its declared imports.
///
/// ### Rendered form
/// {@snippet :
/// with TaskGroup(group_id="load") as load_task:
///     a_task = EmptyOperator(task_id="a")
///     b_task = EmptyOperator(task_id="b")
///     a_task >> b_task
/// }
public class TaskGroup extends Task {

    public static final String TASK_TYPE = "TaskGroup";

    /// Import every rendered group needs; module only, like {@code Workflow.WORKFLOW_IMPORT}.
    public static final Requirement TASK_GROUP_IMPORT =
            new Requirement(List.of(TASK_TYPE), "airflow.utils.task_group", null, null);

    private final Map<String, Task> tasks;
    private final Set<Requirement> imports;

    private TaskGroup(Builder builder) {
        super(builder);
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tasks));
        Set<Requirement> all = new LinkedHashSet<>();
        all.add(TASK_GROUP_IMPORT);
        all.addAll(super.getImports());
        this.imports = Collections.unmodifiableSet(all);
    }

    /// Returns the contained tasks keyed by task ID, in declaration order.
    ///
    /// @return unmodifiable map, never null (may be empty)
    public Map<String, Task> getTasks() {
        return tasks;
    }

    @Override
    public String getTaskType() {
        return TASK_TYPE;
    }

    @Override
    public Set<Requirement> getImports() {
        return imports;
    }

    @Override
    public List<Task> getNestedTasks() {
        return new ArrayList<>(tasks.values());
    }

    @Override
    public String render() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("group_id", taskId);
        kwargs.putAll(commonArguments());

        StringBuilder sb = new StringBuilder();
        sb.append("with TaskGroup(")
                .append(SourceLiterals.keywordArguments(kwargs))
                .append(") as ")
                .append(getVariableName())
                .append(":\n");
        sb.append(SourceLiterals.indent(renderBody(tasks.values())));
        return sb.toString();
    }

    /// Renders task definitions followed by their dependency statements.
    ///
    /// @param tasks tasks of one scope, not null
    /// @return block body, `pass` when there are no tasks
    public static String renderBody(Collection<Task> tasks) {
        if (tasks.isEmpty()) {
            return "pass";
        }
        List<String> lines = new ArrayList<>();
        for (Task task : tasks) {
            lines.add(task.render());
        }
        for (Task task : tasks) {
            String edge = task.renderDownstream();
            if (!edge.isEmpty()) {
                lines.add(edge);
            }
        }
        return String.join("\n", lines);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Task.Builder<Builder> {
        private final Map<String, Task> tasks = new LinkedHashMap<>();

        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        /// Adds tasks to the group; a task whose ID is already present replaces it.
        public Builder tasks(Collection<? extends Task> tasks) {
            ValidationException.requireNonNull(tasks, "tasks").forEach(this::task);
            return this;
        }

        public Builder task(Task task) {
            ValidationException.requireNonNull(task, "task");
            this.tasks.put(task.getTaskId(), task);
            return this;
        }

        /// Builds the group.
        ///
        /// @return new task group, never null
        /// @throws ValidationException if `taskId` is missing
        public TaskGroup build() {
            return new TaskGroup(this);
        }
    }
}
