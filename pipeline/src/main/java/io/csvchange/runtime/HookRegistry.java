package io.csvchange.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named hooks in registration order, each with an enabled flag. Re-registering a name replaces the hook in place.
 */
public class HookRegistry {
    private record Slot(RebuildHook hook, boolean enabled) {}

    private final Map<String, Slot> slots = new LinkedHashMap<>();

    public synchronized void register(RebuildHook hook, boolean enabled) {
        slots.put(hook.name(), new Slot(hook, enabled));
    }

    public void register(RebuildHook hook) { register(hook, true); }

    public synchronized boolean unregister(String name) {
        return slots.remove(name) != null;
    }

    public synchronized boolean setEnabled(String name, boolean enabled) {
        Slot s = slots.get(name);
        if (s == null) return false;
        slots.put(name, new Slot(s.hook(), enabled));
        return true;
    }

    /**
     * Flips the enabled flag.
     *
     * @return the new state
     * @throws IllegalArgumentException if no hook has that name
     */
    public synchronized boolean toggle(String name) {
        Slot s = slots.get(name);
        if (s == null) throw new IllegalArgumentException("Unknown hook: " + name);
        slots.put(name, new Slot(s.hook(), !s.enabled()));
        return !s.enabled();
    }

    public synchronized boolean isEnabled(String name) {
        Slot s = slots.get(name);
        return s != null && s.enabled();
    }

    /** Snapshot of the enabled hooks in execution order. */
    public synchronized List<RebuildHook> enabled() {
        List<RebuildHook> out = new ArrayList<>();
        for (Slot s : slots.values()) if (s.enabled()) out.add(s.hook());
        return out;
    }

    /** Name to enabled flag, in registration order. */
    public synchronized Map<String, Boolean> states() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        slots.forEach((n, s) -> out.put(n, s.enabled()));
        return out;
    }

    public synchronized List<String> names() { return new ArrayList<>(slots.keySet()); }
}
