package work.lcod.ui.lowering;

import java.util.Map;
import java.util.Objects;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.JsonValues;

/**
 * What the view lowerer threads through the tree: the component table, the active frame (null outside any
 * expansion) and the current nesting depth. {@link #root} takes a read-only copy of the table that every
 * derived scope shares.
 */
public record LoweringScope(Map<String, ComponentDef> components, SubstitutionFrame frame, int depth) {
    public LoweringScope {
        Objects.requireNonNull(components, "components");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
    }

    public static LoweringScope root(Map<String, ComponentDef> components) {
        return new LoweringScope(JsonValues.orderedCopy(components), null, 1);
    }

    public LoweringScope descend() {
        return new LoweringScope(components, frame, depth + 1);
    }

    public LoweringScope enter(SubstitutionFrame expansion) {
        Objects.requireNonNull(expansion, "expansion");
        return new LoweringScope(components, expansion, depth + 1);
    }
}
