package io.csvchange.monitor;

import java.time.Duration;

/**
 * @param debounce         quiet period after the last raw notification before a path is classified
 * @param useChecksum      compare SHA-256 digests instead of size and modification time
 * @param nativeNotifications register parent directories with the platform {@link java.nio.file.WatchService}
 */
public record MonitorOptions(Duration debounce, boolean useChecksum, boolean nativeNotifications) {

    public static MonitorOptions defaults() {
        return new MonitorOptions(Duration.ofMillis(500), true, true);
    }

    public MonitorOptions withDebounce(Duration d) { return new MonitorOptions(d, useChecksum, nativeNotifications); }
    public MonitorOptions withChecksum(boolean c) { return new MonitorOptions(debounce, c, nativeNotifications); }
    public MonitorOptions withNativeNotifications(boolean n) { return new MonitorOptions(debounce, useChecksum, n); }
}
