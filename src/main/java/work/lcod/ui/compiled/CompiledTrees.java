package work.lcod.ui.compiled;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers over compiled trees.
 */
public final class CompiledTrees {
    private static final CompiledTreeRewriter COPIER = new CompiledTreeRewriter();

    private CompiledTrees() {}

    /**
     * Node-by-node copy; the result shares no node instance with {@code node}.
     */
    public static CompiledNode copy(CompiledNode node) {
        return COPIER.rewrite(node);
    }

    /**
     * Slot nodes reachable from {@code node}, in document order.
     */
    public static List<CompiledNode.Slot> slots(CompiledNode node) {
        var found = new ArrayList<CompiledNode.Slot>();
        new CompiledTreeRewriter() {
            @Override
            protected CompiledNode slot(CompiledNode.Slot slot) {
                found.add(slot);
                return slot;
            }
        }.rewrite(node);
        return found;
    }
}
