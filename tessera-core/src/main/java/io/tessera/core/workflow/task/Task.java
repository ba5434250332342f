package io.tessera.core.workflow.task;

import io.tessera.core.discovery.DependencyCarrier;
import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Renderable;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import io.tessera.core.workflow.SourceLiterals;
import io.tessera.core.workflow.callback.Callback;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Base class for all executable units inside a workflow.
///
/// A task carries its own project-level dependencies (pool, connections,
/// variables, env vars, includes, imports), callbacks keyed by hook name
/// (e.g. `on_success_callback`) and the IDs of the tasks that run after it.
///
/// ### Task Types
/// - {@link OperatorTask} - a single operator invocation
/// - {@link TaskGroup} - a named group of nested tasks
///
/// @implNote Subclasses must be immutable after construction. All collections
/// are unmodifiable, insertion-ordered copies so rendering is reproducible.
public abstract class Task implements DependencyCarrier, Renderable {

    protected final String taskId;
    private final Pool pool;
    private final Set<Connection> connections;
    private final Set<Variable> variables;
    private final Set<EnvVar> envVars;
    private final Set<Include> includes;
    private final Set<Requirement> imports;
    private final Map<String, Callback> callbacks;
    private final Set<String> downstream;

    protected Task(Builder<?> builder) {
        this.taskId = ValidationException.requireText(builder.taskId, "Task taskId");
        this.pool = builder.pool;
        this.connections = frozen(builder.connections);
        this.variables = frozen(builder.variables);
        this.envVars = frozen(builder.envVars);
        this.includes = frozen(builder.includes);
        this.imports = frozen(builder.imports);
        this.callbacks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.callbacks));
        this.downstream = frozen(builder.downstream);
    }

    /// Returns the task identifier, unique within its workflow.
    ///
    /// @return task ID, never null
    public String getTaskId() {
        return taskId;
    }

    /// Returns the type name used when summarizing workflows.
    ///
    /// @return task type name, never null
    public abstract String getTaskType();

    /// Returns the name bound to this task in the generated source.
    public String getVariableName() {
        return SourceLiterals.identifier(taskId) + "_task";
    }

    @Override
    public Pool getPool() {
        return pool;
    }

    @Override
    public Set<Connection> getConnections() {
        return connections;
    }

    @Override
    public Set<Variable> getVariables() {
        return variables;
    }

    @Override
    public Set<EnvVar> getEnvVars() {
        return envVars;
    }

    @Override
    public Set<Include> getIncludes() {
        return includes;
    }

    @Override
    public Set<Requirement> getImports() {
        return imports;
    }

    /// Returns callbacks keyed by hook name.
    ///
    /// @return unmodifiable map, never null (may be empty)
    public Map<String, Callback> getCallbacks() {
        return callbacks;
    }

    /// Returns the IDs of the tasks scheduled after this one.
    ///
    /// @return unmodifiable set, never null (may be empty)
    public Set<String> getDownstream() {
        return downstream;
    }

    @Override
    public List<Object> getChildren() {
        return new ArrayList<>(callbacks.values());
    }

    /// Renders the `upstream >> downstream` statement for this task.
    ///
    /// @return dependency statement, or an empty string when nothing runs after this task
    public String renderDownstream() {
        if (downstream.isEmpty()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (String id : downstream) {
            names.add(SourceLiterals.identifier(id) + "_task");
        }
        String target = names.size() == 1 ? names.get(0) : "[" + String.join(", ", names) + "]";
        return getVariableName() + " >> " + target;
    }

    /// Keyword arguments shared by every task type: pool and callbacks.
    protected Map<String, Object> commonArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (pool != null) {
            arguments.put("pool", pool.name());
        }
        arguments.putAll(callbacks);
        return arguments;
    }

    private static <T> Set<T> frozen(Collection<T> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /// Two tasks are equal when they are of the same type, render identically
    /// and carry the same dependencies.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task that = (Task) o;
        return taskId.equals(that.taskId)
                && render().equals(that.render())
                && Objects.equals(pool, that.pool)
                && connections.equals(that.connections)
                && variables.equals(that.variables)
                && envVars.equals(that.envVars)
                && includes.equals(that.includes)
                && imports.equals(that.imports)
                && downstream.equals(that.downstream);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), taskId, render());
    }

    @Override
    public String toString() {
        return getTaskType() + "(task_id=" + taskId + ")";
    }

    /// Builder state shared by every task type.
    ///
    /// @param <B> concrete builder type, returned from every setter for chaining
    public abstract static class Builder<B extends Builder<B>> {
        private String taskId;
        private Pool pool;
        private final Set<Connection> connections = new LinkedHashSet<>();
        private final Set<Variable> variables = new LinkedHashSet<>();
        private final Set<EnvVar> envVars = new LinkedHashSet<>();
        private final Set<Include> includes = new LinkedHashSet<>();
        private final Set<Requirement> imports = new LinkedHashSet<>();
        private final Map<String, Callback> callbacks = new LinkedHashMap<>();
        private final Set<String> downstream = new LinkedHashSet<>();

        protected Builder() {}

        protected abstract B self();

        public B taskId(String taskId) {
            this.taskId = taskId;
            return self();
        }

        public B pool(Pool pool) {
            this.pool = pool;
            return self();
        }

        public B connections(Collection<Connection> connections) {
            ValidationException.requireNonNull(connections, "connections").forEach(this::connection);
            return self();
        }

        public B connection(Connection connection) {
            this.connections.add(ValidationException.requireNonNull(connection, "connection"));
            return self();
        }

        public B variables(Collection<Variable> variables) {
            ValidationException.requireNonNull(variables, "variables").forEach(this::variable);
            return self();
        }

        public B variable(Variable variable) {
            this.variables.add(ValidationException.requireNonNull(variable, "variable"));
            return self();
        }

        public B envVars(Collection<EnvVar> envVars) {
            ValidationException.requireNonNull(envVars, "envVars").forEach(this::envVar);
            return self();
        }

        public B envVar(EnvVar envVar) {
            this.envVars.add(ValidationException.requireNonNull(envVar, "envVar"));
            return self();
        }

        public B includes(Collection<Include> includes) {
            ValidationException.requireNonNull(includes, "includes").forEach(this::include);
            return self();
        }

        public B include(Include include) {
            this.includes.add(ValidationException.requireNonNull(include, "include"));
            return self();
        }

        public B imports(Collection<Requirement> imports) {
            ValidationException.requireNonNull(imports, "imports").forEach(this::importing);
            return self();
        }

        public B importing(Requirement requirement) {
            this.imports.add(ValidationException.requireNonNull(requirement, "import"));
            return self();
        }

        /// Attaches a callback under a hook name such as `on_failure_callback`.
        public B callback(String hook, Callback callback) {
            this.callbacks.put(
                    ValidationException.requireText(hook, "callback hook"),
                    ValidationException.requireNonNull(callback, "callback"));
            return self();
        }

        public B downstream(String... taskIds) {
            for (String id : taskIds) {
                this.downstream.add(ValidationException.requireText(id, "downstream task ID"));
            }
            return self();
        }
    }
}
