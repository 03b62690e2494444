package work.lcod.ui.lowering;

import java.util.List;
import java.util.Map;
import work.lcod.ui.ast.JsonValues;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.compiled.CompiledNode;

/**
 * Bindings of one component expansion: param name to already-lowered prop value, plus the lowered children
 * that fill the component's slots. Frames are never shared between expansions.
 */
public record SubstitutionFrame(Map<String, PropValue> params, List<CompiledNode> slotContent) {
    public static final SubstitutionFrame EMPTY = new SubstitutionFrame(Map.of(), List.of());

    public SubstitutionFrame {
        params = JsonValues.orderedCopy(params);
        slotContent = JsonValues.listCopy(slotContent);
    }

    public static SubstitutionFrame of(Map<String, ? extends PropValue> params) {
        return new SubstitutionFrame(JsonValues.orderedCopy(params), List.of());
    }
}
