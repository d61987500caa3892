package io.csvchange.error;

import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Receives failures from a pipeline stage. Implementations must not throw.
 */
public interface FailureSink extends AutoCloseable {
    void acceptFailure(String stage, Path path, Exception e);

    @Override default void close() {}

    static FailureSink discard() { return (stage, path, e) -> {}; }

    /** Forwards every failure to each sink in order; one sink failing does not starve the rest. */
    static FailureSink fanOut(FailureSink... sinks) {
        return (stage, path, e) -> {
            for (FailureSink s : sinks) {
                try {
                    s.acceptFailure(stage, path, e);
                } catch (RuntimeException ex) {
                    LoggerFactory.getLogger(FailureSink.class).warn("Failure sink {} threw: {}", s, ex.toString());
                }
            }
        };
    }
}
