package work.lcod.ui.ast;

import java.util.Locale;

/**
 * Where a route expression reads its value from.
 */
public enum RouteSource {
    PARAM,
    QUERY,
    PATH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RouteSource from(String value) {
        if (value == null || value.isBlank()) {
            return PARAM;
        }
        try {
            return RouteSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported route source: " + value);
        }
    }
}
