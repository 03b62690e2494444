package work.lcod.ui.compose;

import java.util.Map;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.compiled.CompiledTreeRewriter;
import work.lcod.ui.compiled.CompiledTrees;

/**
 * Replaces slot nodes with content. Every splice is a fresh copy, so one piece of content used at several
 * sites, or across several compositions, never shares nodes.
 *
 * <p>With {@code defaultContent} null the splicer runs restricted: only named slots are filled and default
 * slots are left in place.</p>
 */
final class SlotSplicer extends CompiledTreeRewriter {
    private final Map<String, CompiledNode> namedContent;
    private final CompiledNode defaultContent;
    private final UnmatchedSlotPolicy policy;

    SlotSplicer(Map<String, CompiledNode> namedContent, CompiledNode defaultContent, UnmatchedSlotPolicy policy) {
        this.namedContent = namedContent;
        this.defaultContent = defaultContent;
        this.policy = policy;
    }

    static SlotSplicer namedOnly(Map<String, CompiledNode> namedContent, UnmatchedSlotPolicy policy) {
        return new SlotSplicer(namedContent, null, policy);
    }

    @Override
    protected CompiledNode slot(CompiledNode.Slot slot) {
        if (slot.isDefault()) {
            if (defaultContent == null) {
                return new CompiledNode.Slot(slot.name());
            }
            var page = CompiledTrees.copy(defaultContent);
            return namedOnly(namedContent, policy).rewrite(page);
        }
        var content = namedContent.get(slot.name());
        if (content != null) {
            return CompiledTrees.copy(content);
        }
        if (policy == UnmatchedSlotPolicy.KEEP) {
            return new CompiledNode.Slot(slot.name());
        }
        return CompiledNode.Text.empty();
    }
}
