package io.tessera.core.project;

/// Caller-supplied sink for progress and diagnostic messages.
///
/// The aggregator and renderer report through this interface instead of a
/// process-wide logger, so callers decide where diagnostics go.
///
/// @see LoggingProjectReporter for the default, `java.util.logging` backed sink
public interface ProjectReporter {

    /// Reports progress a user would want to see, such as an artifact being written.
    void info(String message);

    /// Reports low-level detail, such as an artifact skipped because it would be empty.
    void debug(String message);

    /// Returns a reporter that discards every message.
    static ProjectReporter silent() {
        return new ProjectReporter() {
            @Override
            public void info(String message) {}

            @Override
            public void debug(String message) {}
        };
    }
}
