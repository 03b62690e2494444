package work.lcod.ui.compose;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.compiled.CompiledTrees;
import work.lcod.ui.io.AstMapper;
import work.lcod.ui.io.ProgramFormatException;
import work.lcod.ui.lowering.LoweringScope;
import work.lcod.ui.lowering.ProgramLowerer;
import work.lcod.ui.lowering.SubstitutionFrame;

/**
 * Merges a lowered layout and a lowered page into one page program.
 *
 * <p>The cached layout is never modified: its view is copied before parameters are resolved, and every spliced
 * piece of content is copied again. One layout instance can therefore be composed with many pages, also
 * concurrently. Composition never fails; missing parameters resolve to null and slots without content follow
 * the configured {@link UnmatchedSlotPolicy}.</p>
 */
public final class LayoutComposer {
    public static final String LAYOUT_PREFIX = "$layout.";
    public static final String MDX_CONTENT_SLOT = "mdx-content";

    private static final Logger LOG = LoggerFactory.getLogger(LayoutComposer.class);

    private final ProgramLowerer lowerer;
    private final UnmatchedSlotPolicy unmatchedSlotPolicy;

    public LayoutComposer(ProgramLowerer lowerer, UnmatchedSlotPolicy unmatchedSlotPolicy) {
        this.lowerer = lowerer;
        this.unmatchedSlotPolicy = unmatchedSlotPolicy;
    }

    /**
     * Composes with the layout params declared by the page route, and named slots derived from import data.
     */
    public CompiledProgram compose(CompiledLayoutProgram layout, CompiledProgram page) {
        Map<String, Expression> params = page.route() == null ? Map.of() : page.route().layoutParams();
        return compose(layout, page, params, null);
    }

    /**
     * @param layoutParams source expressions bound to the layout's params; null means none
     * @param namedSlots   source content per slot name; null derives {@value #MDX_CONTENT_SLOT} from import data
     */
    public CompiledProgram compose(
        CompiledLayoutProgram layout,
        CompiledProgram page,
        Map<String, Expression> layoutParams,
        Map<String, ViewNode> namedSlots
    ) {
        var components = new LinkedHashMap<String, ComponentDef>(layout.components());
        components.putAll(page.components());

        var frame = paramFrame(layoutParams);
        var resolver = new LayoutParamResolver(lowerer.expressions(), lowerer.actions(), frame);
        var layoutView = resolver.rewrite(CompiledTrees.copy(layout.view()));

        var namedContent = new LinkedHashMap<String, CompiledNode>();
        var sources = namedSlots != null ? namedSlots : importedContent(page.importData());
        for (var entry : sources.entrySet()) {
            var lowered = lowerer.views().lower(entry.getValue(), LoweringScope.root(components));
            namedContent.put(entry.getKey(), resolver.rewrite(lowered));
        }

        var view = new SlotSplicer(namedContent, page.view(), unmatchedSlotPolicy).rewrite(layoutView);

        var importData = new LinkedHashMap<String, Object>(layout.importData());
        importData.putAll(page.importData());

        return new CompiledProgram(
            page.version(),
            page.route(),
            page.lifecycle(),
            mergeState(resolveState(layout.state(), frame), page.state()),
            mergeActions(lowerer.actions().lowerAll(layout.actions(), frame), page.actions()),
            view,
            importData,
            components
        );
    }

    private SubstitutionFrame paramFrame(Map<String, Expression> layoutParams) {
        var bound = new LinkedHashMap<String, PropValue>();
        if (layoutParams != null) {
            for (var entry : layoutParams.entrySet()) {
                bound.put(entry.getKey(), lowerer.expressions().lower(entry.getValue(), SubstitutionFrame.EMPTY));
            }
        }
        return SubstitutionFrame.of(bound);
    }

    /** Resolves layout params in expression initials; plain values pass through. */
    private Map<String, StateField> resolveState(Map<String, StateField> state, SubstitutionFrame frame) {
        var resolved = new LinkedHashMap<String, StateField>();
        for (var entry : state.entrySet()) {
            var field = entry.getValue();
            if (field.initial() instanceof Expression initial) {
                resolved.put(entry.getKey(), new StateField(field.type(), lowerer.expressions().lower(initial, frame)));
            } else {
                resolved.put(entry.getKey(), field);
            }
        }
        return resolved;
    }

    /**
     * The first array entry in import data carrying an object {@code content} member, read as a view.
     */
    private static Map<String, ViewNode> importedContent(Map<String, Object> importData) {
        for (var source : importData.values()) {
            if (!(source instanceof List<?> entries)) {
                continue;
            }
            for (var entry : entries) {
                if (entry instanceof Map<?, ?> item && item.get("content") instanceof Map<?, ?> content) {
                    try {
                        return Map.of(MDX_CONTENT_SLOT, AstMapper.view(content, "/importData"));
                    } catch (ProgramFormatException ex) {
                        LOG.debug("Ignoring imported content that is not a view: {}", ex.getMessage());
                        return Map.of();
                    }
                }
            }
        }
        return Map.of();
    }

    static Map<String, StateField> mergeState(Map<String, StateField> layout, Map<String, StateField> page) {
        var merged = new LinkedHashMap<String, StateField>(page);
        for (var entry : layout.entrySet()) {
            String name = page.containsKey(entry.getKey()) ? LAYOUT_PREFIX + entry.getKey() : entry.getKey();
            merged.put(name, entry.getValue());
        }
        return merged;
    }

    static Map<String, ActionDefinition> mergeActions(
        List<ActionDefinition> layout,
        Map<String, ActionDefinition> page
    ) {
        var merged = new LinkedHashMap<String, ActionDefinition>(page);
        for (var action : layout) {
            if (page.containsKey(action.name())) {
                var renamed = action.withName(LAYOUT_PREFIX + action.name());
                merged.put(renamed.name(), renamed);
            } else {
                merged.put(action.name(), action);
            }
        }
        return merged;
    }
}
