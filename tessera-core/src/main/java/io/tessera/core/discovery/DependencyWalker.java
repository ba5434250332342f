package io.tessera.core.discovery;

import io.tessera.core.exception.StructuralException;
import io.tessera.core.model.Requirement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Depth-first discovery of every dependency reachable from a workflow graph.
///
/// For each {@link DependencyCarrier} visited, the walker reports its pool,
/// connections, variables, env vars, includes and imports to the
/// {@link DependencySink}, then descends into its nested tasks and finally into
/// its declared child fields. Iterables, map values, optionals and object arrays
/// are traversed transparently, so a carrier stored in a list inside an
/// extension property of a callback is still found.
///
/// ### Termination
/// Strings, characters, numbers, booleans and enum constants are leaves; any
/// other non-carrier object is ignored. The graph is a tree by construction,
/// so there is no visited set; instead the walk fails with a
/// {@link StructuralException} once it nests deeper than `maxDepth`.
///
/// @implNote Not thread-safe. A walker instance may be reused sequentially.
public final class DependencyWalker {

    private final DependencySink sink;
    private final int maxDepth;

    /// Creates a walker reporting to `sink`.
    ///
    /// @param sink receiver of discovered dependencies, not null
    /// @param maxDepth maximum nesting depth, must be positive
    /// @throws IllegalArgumentException if `maxDepth` is not positive
    public DependencyWalker(DependencySink sink, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        this.sink = sink;
        this.maxDepth = maxDepth;
    }

    /// Walks `root` and everything reachable from it.
    ///
    /// @param root a carrier, a container of carriers, or a leaf; may be null
    /// @throws StructuralException if the graph nests deeper than the bound
    public void walk(Object root) {
        visit(root, 0, new ArrayDeque<>());
    }

    private void visit(Object node, int depth, Deque<String> path) {
        if (node == null || isLeaf(node)) {
            return;
        }
        if (depth > maxDepth) {
            throw new StructuralException(maxDepth, new ArrayList<>(path));
        }

        if (node instanceof DependencyCarrier carrier) {
            path.addLast(carrier.getClass().getSimpleName());
            report(carrier);
            for (DependencyCarrier task : carrier.getNestedTasks()) {
                visit(task, depth + 1, path);
            }
            for (Object child : carrier.getChildren()) {
                visit(child, depth + 1, path);
            }
            path.removeLast();
        } else if (node instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                visit(item, depth + 1, path);
            }
        } else if (node instanceof Map<?, ?> map) {
            for (Object value : map.values()) {
                visit(value, depth + 1, path);
            }
        } else if (node instanceof Optional<?> optional) {
            optional.ifPresent(value -> visit(value, depth + 1, path));
        } else if (node instanceof Object[] array) {
            for (Object item : array) {
                visit(item, depth + 1, path);
            }
        }
    }

    private void report(DependencyCarrier carrier) {
        if (carrier.getPool() != null) {
            sink.onPool(carrier.getPool());
        }
        if (!carrier.getConnections().isEmpty()) {
            sink.onConnections(carrier.getConnections());
        }
        if (!carrier.getVariables().isEmpty()) {
            sink.onVariables(carrier.getVariables());
        }
        if (!carrier.getEnvVars().isEmpty()) {
            sink.onEnvVars(carrier.getEnvVars());
        }
        if (!carrier.getIncludes().isEmpty()) {
            sink.onIncludes(carrier.getIncludes());
        }
        if (!carrier.getImports().isEmpty()) {
            sink.onRequirements(carrier.getImports());
        }
    }

    private static boolean isLeaf(Object node) {
        return node instanceof CharSequence
                || node instanceof Character
                || node instanceof Number
                || node instanceof Boolean
                || node instanceof Enum<?>;
    }

    /// Collects every import declaration reachable from `root`.
    ///
    /// @param root the node to walk, may be null
    /// @param maxDepth maximum nesting depth, must be positive
    /// @return discovered requirements in discovery order, never null
    public static List<Requirement> collectImports(Object root, int maxDepth) {
        List<Requirement> imports = new ArrayList<>();
        DependencySink collector =
                new DependencySink() {
                    @Override
                    public void onRequirements(Collection<Requirement> requirements) {
                        imports.addAll(requirements);
                    }
                };
        new DependencyWalker(collector, maxDepth).walk(root);
        return imports;
    }
}
