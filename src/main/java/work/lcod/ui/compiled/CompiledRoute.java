package work.lcod.ui.compiled;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.JsonValues;

/**
 * Lowered route: the declared path plus the {@code :name} params extracted from it.
 */
public record CompiledRoute(
    String path,
    List<String> params,
    Expression title,
    String layout,
    Map<String, Expression> layoutParams,
    Map<String, Expression> meta,
    Expression canonical
) {
    public CompiledRoute {
        Objects.requireNonNull(path, "path");
        params = JsonValues.listCopy(params);
        layoutParams = JsonValues.orderedCopy(layoutParams);
        meta = JsonValues.orderedCopy(meta);
    }
}
