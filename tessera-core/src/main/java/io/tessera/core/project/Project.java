package io.tessera.core.project;

import io.tessera.core.TesseraConfig;
import io.tessera.core.discovery.DependencySink;
import io.tessera.core.discovery.DependencyWalker;
import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import io.tessera.core.workflow.Workflow;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Mutable container aggregating every entity produced by the translation passes.
///
/// A project owns one collection per entity kind. Add-operations insert new
/// entities or combine them with the entity already stored under the same key:
///
/// | Kind | Collection | On collision |
/// |------|------------|--------------|
/// | {@link Workflow} | by `id` | merged ({@link Workflow#merge(Workflow)}) |
/// | {@link Pool} | by `name` | merged with the configured pool strategy |
/// | {@link Connection}, {@link Variable}, {@link EnvVar}, {@link Include} | by key | replaced |
/// | {@link Requirement} | set | no-op (structural equality) |
///
/// Adding a workflow also walks its task graph, then the workflow itself, and
/// adds every pool, connection, variable, env var, include and import found at
/// any depth.
///
/// ### Validation
/// Each add-operation checks the whole batch (no null, only the expected kind)
/// before inserting anything. A {@link ValidationException} therefore leaves
/// the project untouched.
///
/// @implNote **Not thread-safe**. Calls must be serialized by the caller. To
/// aggregate in parallel, build one project per shard and {@link #combine}
/// them sequentially.
///
/// @see DependencyWalker for the discovery algorithm
public class Project {

    private final Map<String, Workflow> workflows = new LinkedHashMap<>();
    private final Set<Requirement> requirements = new LinkedHashSet<>();
    private final Map<String, Pool> pools = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, EnvVar> envVars = new LinkedHashMap<>();
    private final Map<String, Include> includes = new LinkedHashMap<>();

    private final TesseraConfig config;
    private final ProjectReporter reporter;
    private final DependencyWalker walker;

    /// Creates an empty project with default configuration, logging through
    /// `java.util.logging`.
    public Project() {
        this(new TesseraConfig(), new LoggingProjectReporter(Project.class));
    }

    /// Creates an empty project.
    ///
    /// @param config discovery depth and pool merge settings, not null
    /// @param reporter sink for diagnostics, not null
    public Project(TesseraConfig config, ProjectReporter reporter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.walker = new DependencyWalker(new DiscoverySink(), config.getMaxDiscoveryDepth());
    }

    // -------------------------------------------------------------------------
    // Workflows
    // -------------------------------------------------------------------------

    public Project addWorkflows(Workflow... workflows) {
        return addWorkflows(asList(workflows));
    }

    /// Adds workflows, merging each into an existing workflow with the same ID,
    /// then discovers the dependencies nested in them.
    ///
    /// Discovery walks the incoming workflow's tasks first, then the workflow
    /// object itself (schedule, callbacks, properties and its own declarations).
    ///
    /// @apiNote **Side effects**:
    /// - Inserts or merges into the workflow collection
    /// - Adds discovered pools, connections, variables, env vars, includes and
    ///   requirements with their usual collision rules
    ///
    /// @param workflows workflows to add, not null
    /// @return this project for chaining
    /// @throws ValidationException if `workflows` is null or holds a null or non-workflow element
    /// @throws io.tessera.core.exception.StructuralException if a task graph nests
    ///     deeper than the configured bound
    public Project addWorkflows(Iterable<? extends Workflow> workflows) {
        for (Workflow workflow : validated(Workflow.class, workflows)) {
            Workflow bounded = withDiscoveryDepth(workflow);
            Workflow existing = this.workflows.get(workflow.getId());
            if (existing != null) {
                reporter.debug("Merging workflow " + workflow.getId());
                this.workflows.put(workflow.getId(), existing.merge(bounded));
            } else {
                this.workflows.put(workflow.getId(), bounded);
            }

            walker.walk(workflow.getTasks().values());
            walker.walk(workflow);
        }
        return this;
    }

    /// Raises the workflow's render bound to the project's discovery bound.
    private Workflow withDiscoveryDepth(Workflow workflow) {
        if (workflow.getDiscoveryDepth() >= config.getMaxDiscoveryDepth()) {
            return workflow;
        }
        return workflow.toBuilder().discoveryDepth(config.getMaxDiscoveryDepth()).build();
    }

    // -------------------------------------------------------------------------
    // Side collections
    // -------------------------------------------------------------------------

    public Project addRequirements(Requirement... requirements) {
        return addRequirements(asList(requirements));
    }

    /// Adds requirements to the requirement set; equal requirements collapse.
    ///
    /// @param requirements requirements to add, not null
    /// @return this project for chaining
    /// @throws ValidationException if `requirements` is null or holds an invalid element
    public Project addRequirements(Iterable<? extends Requirement> requirements) {
        this.requirements.addAll(validated(Requirement.class, requirements));
        return this;
    }

    public Project addPools(Pool... pools) {
        return addPools(asList(pools));
    }

    /// Adds pools; a pool whose name is already present is merged into the
    /// existing one with the configured {@link io.tessera.core.model.PoolMergeStrategy}.
    ///
    /// @param pools pools to add, not null
    /// @return this project for chaining
    /// @throws ValidationException if `pools` is null or holds an invalid element
    public Project addPools(Iterable<? extends Pool> pools) {
        for (Pool pool : validated(Pool.class, pools)) {
            this.pools.merge(pool.name(), pool, config.getPoolMergeStrategy()::merge);
        }
        return this;
    }

    public Project addConnections(Connection... connections) {
        return addConnections(asList(connections));
    }

    /// Adds connections, replacing any connection with the same `connId`.
    ///
    /// @param connections connections to add, not null
    /// @return this project for chaining
    /// @throws ValidationException if `connections` is null or holds an invalid element
    public Project addConnections(Iterable<? extends Connection> connections) {
        for (Connection connection : validated(Connection.class, connections)) {
            this.connections.put(connection.identityKey(), connection);
        }
        return this;
    }

    public Project addVariables(Variable... variables) {
        return addVariables(asList(variables));
    }

    /// Adds variables, replacing any variable with the same key.
    public Project addVariables(Iterable<? extends Variable> variables) {
        for (Variable variable : validated(Variable.class, variables)) {
            this.variables.put(variable.identityKey(), variable);
        }
        return this;
    }

    public Project addEnvVars(EnvVar... envVars) {
        return addEnvVars(asList(envVars));
    }

    /// Adds env vars, replacing any env var with the same key.
    public Project addEnvVars(Iterable<? extends EnvVar> envVars) {
        for (EnvVar envVar : validated(EnvVar.class, envVars)) {
            this.envVars.put(envVar.identityKey(), envVar);
        }
        return this;
    }

    public Project addIncludes(Include... includes) {
        return addIncludes(asList(includes));
    }

    /// Adds includes, replacing any include with the same file path.
    public Project addIncludes(Iterable<? extends Include> includes) {
        for (Include include : validated(Include.class, includes)) {
            this.includes.put(include.identityKey(), include);
        }
        return this;
    }

    // -------------------------------------------------------------------------
    // Combination
    // -------------------------------------------------------------------------

    /// Adds everything held by `other` to this project.
    ///
    /// Every add-operation runs with the other project's collection as input,
    /// so collision rules apply exactly as for individual adds. `other` is not
    /// modified.
    ///
    /// @param other project to fold in, may be null (no-op)
    /// @return this project for chaining
    public Project combine(Project other) {
        if (other == null) {
            return this;
        }
        addWorkflows(new ArrayList<>(other.workflows.values()));
        addRequirements(new ArrayList<>(other.requirements));
        addPools(new ArrayList<>(other.pools.values()));
        addConnections(new ArrayList<>(other.connections.values()));
        addVariables(new ArrayList<>(other.variables.values()));
        addEnvVars(new ArrayList<>(other.envVars.values()));
        addIncludes(new ArrayList<>(other.includes.values()));
        return this;
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    /// Returns the workflows by ID, in insertion order.
    ///
    /// @return unmodifiable view, never null
    public Map<String, Workflow> getWorkflows() {
        return Collections.unmodifiableMap(workflows);
    }

    public Set<Requirement> getRequirements() {
        return Collections.unmodifiableSet(requirements);
    }

    public Map<String, Pool> getPools() {
        return Collections.unmodifiableMap(pools);
    }

    public Map<String, Connection> getConnections() {
        return Collections.unmodifiableMap(connections);
    }

    public Map<String, Variable> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, EnvVar> getEnvVars() {
        return Collections.unmodifiableMap(envVars);
    }

    public Map<String, Include> getIncludes() {
        return Collections.unmodifiableMap(includes);
    }

    public TesseraConfig getConfig() {
        return config;
    }

    public ProjectReporter getReporter() {
        return reporter;
    }

    // -------------------------------------------------------------------------
    // Validation
    // -------------------------------------------------------------------------

    private static <T> List<T> asList(T[] items) {
        if (items == null) {
            throw new ValidationException("Expected values, got null");
        }
        return Arrays.asList(items);
    }

    /// Checks the whole batch before anything is inserted.
    ///
    /// The runtime type check guards against heap pollution through raw or
    /// unchecked collections.
    private static <T> List<T> validated(Class<T> kind, Iterable<?> items) {
        if (items == null) {
            throw new ValidationException(
                    "Expected " + kind.getSimpleName() + " values, got null");
        }
        List<T> batch = new ArrayList<>();
        int index = 0;
        for (Object item : items) {
            if (item == null) {
                throw new ValidationException(
                        "Expected " + kind.getSimpleName() + " at index " + index + ", got null");
            }
            if (!kind.isInstance(item)) {
                throw new ValidationException(
                        "Expected "
                                + kind.getSimpleName()
                                + " at index "
                                + index
                                + ", got "
                                + item.getClass().getSimpleName());
            }
            batch.add(kind.cast(item));
            index++;
        }
        return batch;
    }

    /// Feeds discovered dependencies back into the add-operations.
    private final class DiscoverySink implements DependencySink {
        @Override
        public void onPool(Pool pool) {
            addPools(pool);
        }

        @Override
        public void onConnections(Collection<Connection> found) {
            addConnections(found);
        }

        @Override
        public void onVariables(Collection<Variable> found) {
            addVariables(found);
        }

        @Override
        public void onEnvVars(Collection<EnvVar> found) {
            addEnvVars(found);
        }

        @Override
        public void onIncludes(Collection<Include> found) {
            addIncludes(found);
        }

        @Override
        public void onRequirements(Collection<Requirement> found) {
            addRequirements(found);
        }
    }

    // -------------------------------------------------------------------------
    // Object
    // -------------------------------------------------------------------------

    /// Projects are equal when their workflows render identically and every
    /// other collection holds equal values.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project other)) return false;
        return renderedWorkflows().equals(other.renderedWorkflows())
                && requirements.equals(other.requirements)
                && pools.equals(other.pools)
                && connections.equals(other.connections)
                && variables.equals(other.variables)
                && envVars.equals(other.envVars)
                && includes.equals(other.includes);
    }

    private Map<String, String> renderedWorkflows() {
        Map<String, String> rendered = new LinkedHashMap<>();
        workflows.forEach((id, workflow) -> rendered.put(id, workflow.render()));
        return rendered;
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                workflows.keySet(), requirements, pools, connections, variables, envVars, includes);
    }

    @Override
    public String toString() {
        return "Project(workflows="
                + new TreeSet<>(workflows.keySet())
                + ", requirements="
                + new TreeSet<>(requirements)
                + ", pools="
                + new TreeSet<>(pools.keySet())
                + ", connections="
                + new TreeSet<>(connections.keySet())
                + ", variables="
                + new TreeSet<>(variables.keySet())
                + ", env_vars="
                + new TreeSet<>(envVars.keySet())
                + ")";
    }
}
