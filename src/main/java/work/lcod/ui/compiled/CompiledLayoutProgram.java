package work.lcod.ui.compiled;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.JsonValues;
import work.lcod.ui.ast.StateField;

/**
 * Lowered layout awaiting composition. Its view may still hold slot nodes and layout-level param refs.
 */
public record CompiledLayoutProgram(
    String version,
    Map<String, StateField> state,
    List<ActionDefinition> actions,
    CompiledNode view,
    Map<String, ComponentDef> components,
    Map<String, Object> importData
) {
    public static final String TYPE = "layout";

    public CompiledLayoutProgram {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(view, "view");
        state = JsonValues.orderedCopy(state);
        actions = JsonValues.listCopy(actions);
        components = JsonValues.orderedCopy(components);
        importData = JsonValues.immutableObject(importData);
    }

    public String type() {
        return TYPE;
    }
}
