package io.tessera.core.discovery;

import io.tessera.core.model.Connection;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import java.util.Collection;

/// Receives the dependencies found by {@link DependencyWalker}.
///
/// All methods default to no-ops, so a collector only overrides the kinds it
/// is interested in. Collections passed in are never empty.
public interface DependencySink {

    default void onPool(Pool pool) {}

    default void onConnections(Collection<Connection> connections) {}

    default void onVariables(Collection<Variable> variables) {}

    default void onEnvVars(Collection<EnvVar> envVars) {}

    default void onIncludes(Collection<Include> includes) {}

    default void onRequirements(Collection<Requirement> requirements) {}
}
