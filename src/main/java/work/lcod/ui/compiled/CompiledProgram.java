package work.lcod.ui.compiled;

import java.util.Map;
import java.util.Objects;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.JsonValues;
import work.lcod.ui.ast.LifecycleHooks;
import work.lcod.ui.ast.StateField;

/**
 * Execution-ready page. Actions are keyed by name; the component table is kept for compose-time expansion.
 */
public record CompiledProgram(
    String version,
    CompiledRoute route,
    LifecycleHooks lifecycle,
    Map<String, StateField> state,
    Map<String, ActionDefinition> actions,
    CompiledNode view,
    Map<String, Object> importData,
    Map<String, ComponentDef> components
) {
    public CompiledProgram {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(view, "view");
        state = JsonValues.orderedCopy(state);
        actions = JsonValues.orderedCopy(actions);
        importData = JsonValues.immutableObject(importData);
        components = JsonValues.orderedCopy(components);
    }
}
