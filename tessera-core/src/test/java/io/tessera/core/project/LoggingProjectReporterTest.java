package io.tessera.core.project;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LoggingProjectReporterTest {

    private final Logger logger = Logger.getLogger("io.tessera.test.reporter");
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler =
            new Handler() {
                @Override
                public void publish(LogRecord record) {
                    records.add(record);
                }

                @Override
                public void flush() {}

                @Override
                public void close() {}
            };

    @BeforeEach
    void setUp() {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    void shouldMapInfoAndDebugToLevels() {
        var reporter = new LoggingProjectReporter(logger);

        reporter.info("Writing dags");
        reporter.debug("No entries for .env");

        assertThat(records).extracting(LogRecord::getLevel).containsExactly(Level.INFO, Level.FINE);
        assertThat(records)
                .extracting(LogRecord::getMessage)
                .containsExactly("Writing dags", "No entries for .env");
    }
}
