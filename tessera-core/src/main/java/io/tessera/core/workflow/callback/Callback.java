package io.tessera.core.workflow.callback;

import io.tessera.core.discovery.DependencyCarrier;
import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Renderable;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import io.tessera.core.workflow.SourceLiterals;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A function invoked by the target runtime when a task or workflow changes state.
///
/// Callbacks are attached to tasks and workflows under a hook name and may
/// themselves need connections (e.g. an SMTP notifier) or imports, which
/// dependency discovery picks up.
///
/// ### Rendered form
/// {@snippet :
/// send_smtp_notification(to="ops@example.com", smtp_conn_id="SMTP")
/// }
public final class Callback implements DependencyCarrier, Renderable {

    private final String function;
    private final Map<String, Object> arguments;
    private final Set<Connection> connections;
    private final Set<Variable> variables;
    private final Set<EnvVar> envVars;
    private final Set<Include> includes;
    private final Set<Requirement> imports;

    private Callback(Builder builder) {
        this.function = ValidationException.requireText(builder.function, "Callback function");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
        this.connections = Collections.unmodifiableSet(new LinkedHashSet<>(builder.connections));
        this.variables = Collections.unmodifiableSet(new LinkedHashSet<>(builder.variables));
        this.envVars = Collections.unmodifiableSet(new LinkedHashSet<>(builder.envVars));
        this.includes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.includes));
        this.imports = Collections.unmodifiableSet(new LinkedHashSet<>(builder.imports));
    }

    public String getFunction() {
        return function;
    }

    public Map<String, Object> getArguments() {
        return arguments;
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

    @Override
    public List<Object> getChildren() {
        return new ArrayList<>(arguments.values());
    }

    @Override
    public String render() {
        return function + "(" + SourceLiterals.keywordArguments(arguments) + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String function;
        private final Map<String, Object> arguments = new LinkedHashMap<>();
        private final Set<Connection> connections = new LinkedHashSet<>();
        private final Set<Variable> variables = new LinkedHashSet<>();
        private final Set<EnvVar> envVars = new LinkedHashSet<>();
        private final Set<Include> includes = new LinkedHashSet<>();
        private final Set<Requirement> imports = new LinkedHashSet<>();

        private Builder() {}

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(ValidationException.requireText(key, "argument name"), value);
            return this;
        }

        public Builder arguments(Map<String, ?> arguments) {
            ValidationException.requireNonNull(arguments, "arguments").forEach(this::argument);
            return this;
        }

        public Builder connections(Collection<Connection> connections) {
            ValidationException.requireNonNull(connections, "connections").forEach(this::connection);
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(ValidationException.requireNonNull(connection, "connection"));
            return this;
        }

        public Builder variables(Collection<Variable> variables) {
            ValidationException.requireNonNull(variables, "variables").forEach(this::variable);
            return this;
        }

        public Builder variable(Variable variable) {
            this.variables.add(ValidationException.requireNonNull(variable, "variable"));
            return this;
        }

        public Builder envVars(Collection<EnvVar> envVars) {
            ValidationException.requireNonNull(envVars, "envVars").forEach(this::envVar);
            return this;
        }

        public Builder envVar(EnvVar envVar) {
            this.envVars.add(ValidationException.requireNonNull(envVar, "envVar"));
            return this;
        }

        public Builder includes(Collection<Include> includes) {
            ValidationException.requireNonNull(includes, "includes").forEach(this::include);
            return this;
        }

        public Builder include(Include include) {
            this.includes.add(ValidationException.requireNonNull(include, "include"));
            return this;
        }

        public Builder importing(Requirement requirement) {
            this.imports.add(ValidationException.requireNonNull(requirement, "import"));
            return this;
        }

        /// Builds the callback.
        ///
        /// @return new callback, never null
        /// @throws ValidationException if `function` is missing
        public Callback build() {
            return new Callback(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Callback that)) return false;
        return function.equals(that.function)
                && arguments.equals(that.arguments)
                && connections.equals(that.connections)
                && variables.equals(that.variables)
                && envVars.equals(that.envVars)
                && includes.equals(that.includes)
                && imports.equals(that.imports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, connections, variables, envVars, includes, imports);
    }

    @Override
    public String toString() {
        return "Callback(function=" + function + ")";
    }
}
