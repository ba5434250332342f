package io.tessera.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when dependency discovery descends deeper than the configured bound,
/// which indicates a cyclic or pathologically deep entity graph.
public class StructuralException extends TesseraException {
    @Serial private static final long serialVersionUID = -1939287113845176650L;

    private final int depth;
    private final List<String> path;

    public StructuralException(int depth, List<String> path) {
        super("Dependency discovery exceeded maximum depth " + depth + " at " + String.join("/", path));
        this.depth = depth;
        this.path = List.copyOf(path);
    }

    /// Returns the depth bound that was exceeded.
    public int getDepth() {
        return depth;
    }

    /// Returns the names of the nodes walked from the root to the failing node.
    public List<String> getPath() {
        return path;
    }
}
