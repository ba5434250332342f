package io.tessera.core.discovery;

import io.tessera.core.model.Connection;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import java.util.List;
import java.util.Set;

/// A node of the workflow graph that may carry project-level dependencies.
///
/// Every accessor has a no-op default so a node only overrides what it actually
/// carries. {@link DependencyWalker} reads these accessors instead of probing
/// object internals.
///
/// ### Child nodes
/// {@link #getNestedTasks()} exposes the tasks of a group. {@link #getChildren()}
/// lists the values of every other field that may hold further nodes
/// (callbacks, schedules, extension properties); values may be carriers,
/// collections, maps or plain leaves such as strings.
///
/// @see DependencyWalker
public interface DependencyCarrier {

    /// Returns the pool this node runs in.
    ///
    /// @return pool, or null if the node does not reference one
    default Pool getPool() {
        return null;
    }

    default Set<Connection> getConnections() {
        return Set.of();
    }

    default Set<Variable> getVariables() {
        return Set.of();
    }

    default Set<EnvVar> getEnvVars() {
        return Set.of();
    }

    default Set<Include> getIncludes() {
        return Set.of();
    }

    /// Returns the import declarations the rendered form of this node needs.
    ///
    /// @return requirements, never null (may be empty)
    default Set<Requirement> getImports() {
        return Set.of();
    }

    /// Returns the tasks contained in this node when it groups other tasks.
    ///
    /// @return nested tasks in declaration order, never null (may be empty)
    default List<? extends DependencyCarrier> getNestedTasks() {
        return List.of();
    }

    /// Returns the values of the declared child-node fields of this node.
    ///
    /// @return child field values in declaration order, never null (may be empty,
    ///     elements may be null)
    default List<Object> getChildren() {
        return List.of();
    }
}
