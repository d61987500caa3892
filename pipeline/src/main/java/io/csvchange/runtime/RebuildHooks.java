package io.csvchange.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The regeneration steps a host site runs after its data files change. They only log here; hosts replace them
 * with real implementations under the same names.
 */
public final class RebuildHooks {
    private static final Logger log = LoggerFactory.getLogger(RebuildHooks.class);

    private RebuildHooks() {}

    public static HookRegistry defaults() {
        HookRegistry r = new HookRegistry();
        r.register(logging("regenerate-json", "Regenerate JSON data files from the changed CSV"), true);
        r.register(logging("rebuild-static-pages", "Rebuild static pages that list the changed records"), true);
        r.register(logging("update-search-index", "Refresh the search index"), true);
        r.register(logging("notify-administrators", "Notify administrators about the change"), false);
        return r;
    }

    private static RebuildHook logging(String name, String description) {
        return RebuildHook.of(name, description, (event, entry) ->
                log.info("{}: {} {} (log entry {})", name, event.kind(), event.path(),
                        entry == null ? "-" : entry.id()));
    }
}
