package io.tessera.core.project;

import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link ProjectReporter} forwarding to a `java.util.logging` logger.
///
/// `info` maps to {@link Level#INFO} and `debug` to {@link Level#FINE}.
public class LoggingProjectReporter implements ProjectReporter {

    private final Logger logger;

    /// Creates a reporter logging under the name of `owner`.
    ///
    /// @param owner class whose name is used as the logger name, not null
    public LoggingProjectReporter(Class<?> owner) {
        this(Logger.getLogger(owner.getName()));
    }

    public LoggingProjectReporter(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void info(String message) {
        logger.info(message);
    }

    @Override
    public void debug(String message) {
        logger.fine(message);
    }
}
