package work.lcod.ui.analysis;

import java.util.Set;

/**
 * Layout analysis result: the shared name sets plus the layout's slot names.
 */
public record LayoutAnalysisContext(AnalysisContext names, Set<String> slotNames, boolean hasDefaultSlot) {
    public LayoutAnalysisContext {
        slotNames = Set.copyOf(slotNames);
    }
}
