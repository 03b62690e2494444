package work.lcod.ui.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Page route declaration. {@code layout} names the layout the page is composed into.
 */
public record RouteDefinition(
    String path,
    Expression title,
    String layout,
    Map<String, Expression> layoutParams,
    Map<String, Expression> meta,
    Expression canonical
) {
    public RouteDefinition {
        Objects.requireNonNull(path, "path");
        layoutParams = JsonValues.orderedCopy(layoutParams);
        meta = JsonValues.orderedCopy(meta);
    }

    public static RouteDefinition of(String path) {
        return new RouteDefinition(path, null, null, Map.of(), Map.of(), null);
    }

    /**
     * Names of the {@code :name} segments of the path, in order.
     */
    public List<String> pathParams() {
        var params = new ArrayList<String>();
        for (String segment : path.split("/")) {
            if (segment.length() > 1 && segment.charAt(0) == ':') {
                params.add(segment.substring(1));
            }
        }
        return params;
    }
}
