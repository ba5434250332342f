package io.tessera.core.workflow;

import io.tessera.core.TesseraConfig;
import io.tessera.core.discovery.DependencyCarrier;
import io.tessera.core.discovery.DependencyWalker;
import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.Entity;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Renderable;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import io.tessera.core.workflow.callback.Callback;
import io.tessera.core.workflow.schedule.Schedule;
import io.tessera.core.workflow.task.Task;
import io.tessera.core.workflow.task.TaskGroup;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// A translated workflow: a named collection of tasks plus a schedule, written
/// to one source file of the output project.
///
/// Workflows are the only entity whose task graph the project walks for
/// dependencies. Several translation passes may contribute different tasks to
/// the same logical workflow; {@link #merge(Workflow)} combines them.
///
/// ### Structure
/// - **Identity**: `id`, plus the `filePath` the workflow is written to
/// - **Tasks**: top-level tasks keyed by task ID, in declaration order
/// - **Schedule / callbacks / properties**: workflow-level arguments
/// - **Dependencies**: connections, variables, env vars, includes and imports
///   declared on the workflow itself
///
/// @implNote Immutable after construction. All collections are unmodifiable,
/// insertion-ordered copies so rendering is reproducible across runs.
///
/// @see Task for the task hierarchy
/// @see #merge(Workflow) for the combination rules
public final class Workflow
        implements Entity<String, Workflow>, Renderable, DependencyCarrier {

    /// Import every rendered workflow needs. The runtime itself is provided by
    /// the target environment, so no installable package is declared.
    public static final Requirement WORKFLOW_IMPORT =
            new Requirement(List.of("DAG"), "airflow", null, null);

    static final Requirement DATETIME_IMPORT =
            new Requirement(List.of("datetime"), "datetime", null, null);

    private final String id;
    private final String filePath;
    private final String sourceFile;
    private final String description;
    private final Schedule schedule;
    private final LocalDate startDate;
    private final boolean catchup;
    private final int discoveryDepth;
    private final Map<String, Task> tasks;
    private final Map<String, Callback> callbacks;
    private final Map<String, Object> properties;
    private final Set<Requirement> imports;
    private final Set<Connection> connections;
    private final Set<Variable> variables;
    private final Set<EnvVar> envVars;
    private final Set<Include> includes;

    private Workflow(Builder builder) {
        this.id = ValidationException.requireText(builder.id, "Workflow id");
        this.filePath = validFilePath(builder.filePath);
        this.sourceFile = builder.sourceFile;
        this.description = builder.description;
        this.schedule = builder.schedule;
        this.startDate = builder.startDate;
        this.catchup = builder.catchup;
        this.discoveryDepth = builder.discoveryDepth;
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tasks));
        this.callbacks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.callbacks));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.imports = Collections.unmodifiableSet(new LinkedHashSet<>(builder.imports));
        this.connections = Collections.unmodifiableSet(new LinkedHashSet<>(builder.connections));
        this.variables = Collections.unmodifiableSet(new LinkedHashSet<>(builder.variables));
        this.envVars = Collections.unmodifiableSet(new LinkedHashSet<>(builder.envVars));
        this.includes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.includes));
    }

    private static String validFilePath(String filePath) {
        ValidationException.requireText(filePath, "Workflow filePath");
        Path path = Path.of(filePath);
        if (path.isAbsolute()) {
            throw new ValidationException("Workflow filePath must be relative: " + filePath);
        }
        for (Path segment : path) {
            if ("..".equals(segment.toString())) {
                throw new ValidationException(
                        "Workflow filePath must not leave the workflows directory: " + filePath);
            }
        }
        return filePath;
    }

    /// Returns the unique workflow identifier.
    ///
    /// @return workflow ID, never null
    public String getId() {
        return id;
    }

    /// Returns the path of the generated file, relative to the workflows directory.
    ///
    /// @return relative file path, never null
    public String getFilePath() {
        return filePath;
    }

    /// Returns the input file this workflow was translated from.
    ///
    /// @return source file name, or null if unknown
    public String getSourceFile() {
        return sourceFile;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the schedule.
    ///
    /// @return schedule, or null for a workflow that is only triggered manually
    public Schedule getSchedule() {
        return schedule;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public boolean isCatchup() {
        return catchup;
    }

    /// Returns the nesting bound used when rendering collects nested imports.
    ///
    /// @return depth bound, always positive
    public int getDiscoveryDepth() {
        return discoveryDepth;
    }

    /// Returns the top-level tasks by task ID.
    ///
    /// @return unmodifiable map in declaration order, never null (may be empty)
    public Map<String, Task> getTasks() {
        return tasks;
    }

    public Map<String, Callback> getCallbacks() {
        return callbacks;
    }

    /// Returns additional workflow arguments rendered after the built-in ones.
    public Map<String, Object> getProperties() {
        return properties;
    }

    /// Returns the imports the workflow file itself needs: the workflow type,
    /// `datetime` when a start date is set, and any declared imports.
    @Override
    public Set<Requirement> getImports() {
        Set<Requirement> all = new LinkedHashSet<>();
        all.add(WORKFLOW_IMPORT);
        if (startDate != null) {
            all.add(DATETIME_IMPORT);
        }
        all.addAll(imports);
        return Collections.unmodifiableSet(all);
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

    /// Schedule, callbacks and properties. Tasks are walked separately.
    @Override
    public List<Object> getChildren() {
        List<Object> children = new ArrayList<>();
        children.add(schedule);
        children.addAll(callbacks.values());
        children.addAll(properties.values());
        return children;
    }

    @Override
    public String identityKey() {
        return id;
    }

    /// Combines the tasks and settings contributed by another translation pass.
    ///
    /// ### Rules
    /// - `id`, `filePath`, `sourceFile`, `startDate`, `catchup`: kept from this workflow
    /// - `discoveryDepth`: the larger of both bounds
    /// - `description`: kept unless blank
    /// - `schedule`: taken from `other` when it has one
    /// - tasks, callbacks, properties: this workflow's entries, then `other`'s;
    ///   an entry with an existing key replaces it
    /// - imports, connections, variables, env vars, includes: ordered union
    ///
    /// Merging a workflow with itself yields an equal workflow.
    ///
    /// @param other workflow with the same ID, not null
    /// @return combined workflow, never null
    /// @throws IllegalArgumentException if the IDs differ
    @Override
    public Workflow merge(Workflow other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException(
                    "Cannot merge workflow '" + other.id + "' into '" + id + "'");
        }
        Builder builder =
                toBuilder().discoveryDepth(Math.max(discoveryDepth, other.discoveryDepth));
        if (description == null || description.isBlank()) {
            builder.description(other.description);
        }
        if (other.schedule != null) {
            builder.schedule(other.schedule);
        }
        builder.tasks(other.tasks.values());
        other.callbacks.forEach(builder::callback);
        builder.properties(other.properties);
        builder.imports.addAll(other.imports);
        builder.connections.addAll(other.connections);
        builder.variables.addAll(other.variables);
        builder.envVars.addAll(other.envVars);
        builder.includes.addAll(other.includes);
        return builder.build();
    }

    /// Renders the workflow source file.
    ///
    /// The file starts with the sorted, deduplicated import statements needed by
    /// the workflow and everything nested in it, followed by the workflow block
    /// with its task definitions and dependency statements.
    ///
    /// @return workflow source, terminated by a newline
    @Override
    public String render() {
        Set<String> importLines = new TreeSet<>();
        List<Object> roots = new ArrayList<>(tasks.values());
        roots.add(this);
        for (Requirement requirement :
                DependencyWalker.collectImports(roots, discoveryDepth)) {
            String line = requirement.render();
            if (!line.isEmpty()) {
                importLines.add(line);
            }
        }

        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("dag_id", id);
        kwargs.put("schedule", schedule);
        if (startDate != null) {
            kwargs.put("start_date", new DateLiteral(startDate));
        }
        kwargs.put("catchup", catchup);
        if (description != null && !description.isBlank()) {
            kwargs.put("description", description);
        }
        kwargs.putAll(properties);
        kwargs.putAll(callbacks);

        StringBuilder sb = new StringBuilder();
        sb.append(String.join("\n", importLines)).append("\n\n");
        sb.append("with DAG(").append(SourceLiterals.keywordArguments(kwargs)).append(") as dag:\n");
        sb.append(SourceLiterals.indent(TaskGroup.renderBody(tasks.values()))).append("\n");
        return sb.toString();
    }

    private record DateLiteral(LocalDate date) implements Renderable {
        @Override
        public String render() {
            return "datetime(" + date.getYear() + ", " + date.getMonthValue() + ", "
                    + date.getDayOfMonth() + ")";
        }
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this workflow's state.
    public Builder toBuilder() {
        Builder builder =
                new Builder()
                        .id(id)
                        .filePath(filePath)
                        .sourceFile(sourceFile)
                        .description(description)
                        .schedule(schedule)
                        .startDate(startDate)
                        .catchup(catchup)
                        .discoveryDepth(discoveryDepth)
                        .tasks(tasks.values())
                        .properties(properties);
        callbacks.forEach(builder::callback);
        builder.imports.addAll(imports);
        builder.connections.addAll(connections);
        builder.variables.addAll(variables);
        builder.envVars.addAll(envVars);
        builder.includes.addAll(includes);
        return builder;
    }

    /// Builder for constructing immutable Workflow instances.
    ///
    /// Required fields: `id`, `filePath`.
    public static final class Builder {
        private String id;
        private String filePath;
        private String sourceFile;
        private String description;
        private Schedule schedule;
        private LocalDate startDate;
        private boolean catchup;
        private int discoveryDepth = TesseraConfig.DEFAULT_MAX_DISCOVERY_DEPTH;
        private final Map<String, Task> tasks = new LinkedHashMap<>();
        private final Map<String, Callback> callbacks = new LinkedHashMap<>();
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private final Set<Requirement> imports = new LinkedHashSet<>();
        private final Set<Connection> connections = new LinkedHashSet<>();
        private final Set<Variable> variables = new LinkedHashSet<>();
        private final Set<EnvVar> envVars = new LinkedHashSet<>();
        private final Set<Include> includes = new LinkedHashSet<>();

        private Builder() {}

        /// Sets the workflow identifier (required).
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /// Sets the output path relative to the workflows directory (required).
        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder catchup(boolean catchup) {
            this.catchup = catchup;
            return this;
        }

        /// Sets the nesting bound for import collection during rendering.
        ///
        /// A project raises this to its own discovery bound when it accepts the
        /// workflow, so anything the project could walk also renders.
        ///
        /// @param discoveryDepth depth bound, must be positive
        /// @return this builder for chaining, never null
        /// @throws ValidationException if `discoveryDepth` is not positive
        public Builder discoveryDepth(int discoveryDepth) {
            if (discoveryDepth <= 0) {
                throw new ValidationException(
                        "Workflow discoveryDepth must be positive, was " + discoveryDepth);
            }
            this.discoveryDepth = discoveryDepth;
            return this;
        }

        /// Adds top-level tasks; a task whose ID is already present replaces it.
        public Builder tasks(Collection<? extends Task> tasks) {
            ValidationException.requireNonNull(tasks, "tasks").forEach(this::task);
            return this;
        }

        public Builder task(Task task) {
            ValidationException.requireNonNull(task, "task");
            this.tasks.put(task.getTaskId(), task);
            return this;
        }

        public Builder callback(String hook, Callback callback) {
            this.callbacks.put(
                    ValidationException.requireText(hook, "callback hook"),
                    ValidationException.requireNonNull(callback, "callback"));
            return this;
        }

        public Builder properties(Map<String, ?> properties) {
            ValidationException.requireNonNull(properties, "properties").forEach(this::property);
            return this;
        }

        public Builder property(String key, Object value) {
            this.properties.put(ValidationException.requireText(key, "property name"), value);
            return this;
        }

        public Builder importing(Requirement requirement) {
            this.imports.add(ValidationException.requireNonNull(requirement, "import"));
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(ValidationException.requireNonNull(connection, "connection"));
            return this;
        }

        public Builder variable(Variable variable) {
            this.variables.add(ValidationException.requireNonNull(variable, "variable"));
            return this;
        }

        public Builder envVar(EnvVar envVar) {
            this.envVars.add(ValidationException.requireNonNull(envVar, "envVar"));
            return this;
        }

        public Builder include(Include include) {
            this.includes.add(ValidationException.requireNonNull(include, "include"));
            return this;
        }

        /// Builds the immutable workflow instance.
        ///
        /// @return new Workflow instance, never null
        /// @throws ValidationException if `id` or `filePath` is missing, or
        ///     `filePath` is absolute or leaves its directory
        public Workflow build() {
            return new Workflow(this);
        }
    }

    /// Workflows are equal when they share identity and file placement, render
    /// identically and declare the same settings-level dependencies.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workflow workflow)) return false;
        return id.equals(workflow.id)
                && filePath.equals(workflow.filePath)
                && Objects.equals(sourceFile, workflow.sourceFile)
                && render().equals(workflow.render())
                && connections.equals(workflow.connections)
                && variables.equals(workflow.variables)
                && envVars.equals(workflow.envVars)
                && includes.equals(workflow.includes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, filePath);
    }

    @Override
    public String toString() {
        return "Workflow{id='"
                + id
                + "', schedule="
                + (schedule == null ? "None" : schedule.render())
                + ", tasks="
                + tasks.keySet()
                + "}";
    }
}
