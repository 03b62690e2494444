package work.lcod.ui.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action names fired on mount/unmount and route transitions; any of them may be null.
 */
public record LifecycleHooks(String onMount, String onUnmount, String onRouteEnter, String onRouteLeave) {

    /** Declared hooks in a stable order, keyed by their wire names. */
    public Map<String, String> declared() {
        var hooks = new LinkedHashMap<String, String>();
        putIfPresent(hooks, "onMount", onMount);
        putIfPresent(hooks, "onUnmount", onUnmount);
        putIfPresent(hooks, "onRouteEnter", onRouteEnter);
        putIfPresent(hooks, "onRouteLeave", onRouteLeave);
        return hooks;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
