package io.csvchange.runtime;

import io.csvchange.changelog.ChangeLogEntry;
import io.csvchange.monitor.ChangeEvent;

/**
 * Downstream action run after a change has been logged.
 */
public interface RebuildHook {
    String name();

    default String description() { return name(); }

    /**
     * @param entry the change-log entry for {@code event}, or null if the log append failed
     */
    void handle(ChangeEvent event, ChangeLogEntry entry) throws Exception;

    static RebuildHook of(String name, String description, Handler handler) {
        return new RebuildHook() {
            @Override public String name() { return name; }
            @Override public String description() { return description; }
            @Override public void handle(ChangeEvent event, ChangeLogEntry entry) throws Exception {
                handler.handle(event, entry);
            }
        };
    }

    @FunctionalInterface
    interface Handler {
        void handle(ChangeEvent event, ChangeLogEntry entry) throws Exception;
    }
}
