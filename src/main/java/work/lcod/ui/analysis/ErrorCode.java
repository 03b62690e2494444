package work.lcod.ui.analysis;

/**
 * Diagnostic codes reported by the analyzers.
 */
public enum ErrorCode {
    LAYOUT_MISSING_SLOT,
    DUPLICATE_SLOT_NAME,
    DUPLICATE_DEFAULT_SLOT,
    SLOT_IN_LOOP,
    UNDEFINED_STATE,
    UNDEFINED_ACTION,
    DUPLICATE_ACTION,
    VAR_UNDEFINED,
    COMPONENT_NOT_FOUND,
    COMPONENT_PROP_MISSING,
    COMPONENT_CYCLE,
    PARAM_UNDEFINED,
    SLOT_OUTSIDE_COMPONENT,
    UNDEFINED_ROUTE_PARAM,
    UNDEFINED_IMPORT,
    UNDEFINED_REF,
    DUPLICATE_REF,
    DUPLICATE_ISLAND_ID,
    MAX_DEPTH_EXCEEDED
}
