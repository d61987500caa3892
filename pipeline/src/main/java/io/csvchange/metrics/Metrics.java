package io.csvchange.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin facade over a Dropwizard {@link MetricRegistry} using the {@code csvchange.} name prefix.
 */
public class Metrics {
    public static final String PREFIX = "csvchange.";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public static Metrics standalone() { return new Metrics(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(PREFIX + name); }
    public Meter meter(String name) { return registry.meter(PREFIX + name); }
    public Timer timer(String name) { return registry.timer(PREFIX + name); }

    /** Flat view used by status output: counts for counters and meters, count and p50 (ms) for timers. */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        registry.getCounters().forEach((k, v) -> out.put(k, v.getCount()));
        registry.getMeters().forEach((k, v) -> out.put(k, v.getCount()));
        registry.getTimers().forEach((k, v) -> {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("count", v.getCount());
            t.put("p50Millis", v.getSnapshot().getMedian() / 1_000_000.0);
            out.put(k, t);
        });
        return out;
    }
}
