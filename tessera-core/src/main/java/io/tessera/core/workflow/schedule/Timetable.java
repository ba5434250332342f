package io.tessera.core.workflow.schedule;

import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.Include;
import io.tessera.core.model.Requirement;
import io.tessera.core.workflow.SourceLiterals;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A schedule backed by a timetable class.
///
/// The class is instantiated with keyword arguments in the generated source.
/// Its implementation usually ships as an {@link Include} and its imports name
/// the packages it depends on.
///
/// ### Rendered form
/// {@snippet :
/// MultiCronTimetable(cron_defs=["0 */5 * * *", "0 */3 * * *"])
/// }
public final class Timetable implements Schedule {

    private final String className;
    private final Map<String, Object> arguments;
    private final Set<Requirement> imports;
    private final Set<Include> includes;
    private final Set<Connection> connections;

    private Timetable(Builder builder) {
        this.className = ValidationException.requireText(builder.className, "Timetable className");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
        this.imports = Collections.unmodifiableSet(new LinkedHashSet<>(builder.imports));
        this.includes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.includes));
        this.connections = Collections.unmodifiableSet(new LinkedHashSet<>(builder.connections));
    }

    public String getClassName() {
        return className;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public Set<Requirement> getImports() {
        return imports;
    }

    @Override
    public Set<Include> getIncludes() {
        return includes;
    }

    @Override
    public Set<Connection> getConnections() {
        return connections;
    }

    @Override
    public List<Object> getChildren() {
        return new ArrayList<>(arguments.values());
    }

    @Override
    public String render() {
        return className + "(" + SourceLiterals.keywordArguments(arguments) + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String className;
        private final Map<String, Object> arguments = new LinkedHashMap<>();
        private final Set<Requirement> imports = new LinkedHashSet<>();
        private final Set<Include> includes = new LinkedHashSet<>();
        private final Set<Connection> connections = new LinkedHashSet<>();

        private Builder() {}

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(ValidationException.requireText(key, "argument name"), value);
            return this;
        }

        public Builder importing(Requirement requirement) {
            this.imports.add(ValidationException.requireNonNull(requirement, "import"));
            return this;
        }

        public Builder include(Include include) {
            this.includes.add(ValidationException.requireNonNull(include, "include"));
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(ValidationException.requireNonNull(connection, "connection"));
            return this;
        }

        public Timetable build() {
            return new Timetable(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Timetable that)) return false;
        return className.equals(that.className)
                && arguments.equals(that.arguments)
                && imports.equals(that.imports)
                && includes.equals(that.includes)
                && connections.equals(that.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, arguments, imports, includes, connections);
    }

    @Override
    public String toString() {
        return "Timetable(" + className + ")";
    }
}
