package work.lcod.ui.analysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.ViewNode;

/**
 * Validates a layout: slot structure first, then the same name resolution as pages.
 *
 * <p>Slot errors short-circuit the analysis so they are reported independently of unrelated reference
 * errors. Slots are looked up in the layout view only, including slots passed as children to component
 * calls; slots inside component definitions belong to those components.</p>
 */
public final class LayoutAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(LayoutAnalyzer.class);

    private final int maxDepth;

    public LayoutAnalyzer() {
        this(SemanticAnalyzer.DEFAULT_MAX_DEPTH);
    }

    public LayoutAnalyzer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public AnalysisResult<LayoutAnalysisContext> analyze(LayoutProgram layout) {
        var slotErrors = new ArrayList<CompileError>();
        var slotNames = new LinkedHashSet<String>();
        boolean[] defaultSeen = {false};
        int[] slotCount = {0};
        boolean[] truncated = {false};
        var viewPath = ErrorPath.root().child("view");

        ViewWalker.walk(layout.view(), viewPath, maxDepth, (node, path, inLoop) -> {
            if (!(node instanceof ViewNode.Slot slot)) {
                return;
            }
            slotCount[0]++;
            if (inLoop) {
                slotErrors.add(CompileErrors.slotInLoop(path));
            }
            if (slot.isDefault()) {
                if (defaultSeen[0]) {
                    slotErrors.add(CompileErrors.duplicateDefaultSlot(path));
                }
                defaultSeen[0] = true;
            } else if (!slotNames.add(slot.name())) {
                slotErrors.add(CompileErrors.duplicateSlotName(slot.name(), path));
            }
        }, path -> {
            truncated[0] = true;
            slotErrors.add(CompileErrors.maxDepthExceeded(maxDepth, path));
        });
        // a truncated walk cannot prove the layout has no slot
        if (slotCount[0] == 0 && !truncated[0]) {
            slotErrors.add(CompileErrors.layoutMissingSlot(viewPath));
        }
        if (!slotErrors.isEmpty()) {
            LOG.debug("Layout slot validation found {} error(s)", slotErrors.size());
            return AnalysisResult.failure(slotErrors);
        }

        var declarations = new ReferenceValidator.Declarations(
            ReferenceValidator.stateNames(layout.state()),
            ReferenceValidator.actionNames(layout.actions()),
            layout.components(),
            null,
            new HashSet<>(layout.importData().keySet())
        );
        var validator = new ReferenceValidator(declarations, true, maxDepth);
        validator.validate(layout.actions(), layout.view());
        List<CompileError> errors = validator.errors();
        if (!errors.isEmpty()) {
            LOG.debug("Layout analysis found {} error(s)", errors.size());
            return AnalysisResult.failure(errors);
        }
        var names = new AnalysisContext(
            declarations.state(),
            declarations.actions(),
            layout.components().keySet(),
            Set.of(),
            declarations.imports()
        );
        return AnalysisResult.success(new LayoutAnalysisContext(names, slotNames, defaultSeen[0]));
    }
}
