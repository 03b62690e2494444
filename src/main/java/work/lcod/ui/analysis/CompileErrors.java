package work.lcod.ui.analysis;

import java.util.List;

/**
 * Factory methods for {@link CompileError}, one per code.
 */
public final class CompileErrors {
    private CompileErrors() {}

    public static CompileError layoutMissingSlot(ErrorPath path) {
        return error(ErrorCode.LAYOUT_MISSING_SLOT, "Layout must contain at least one slot", path);
    }

    public static CompileError duplicateSlotName(String name, ErrorPath path) {
        return error(ErrorCode.DUPLICATE_SLOT_NAME, "Duplicate slot name '" + name + "'", path);
    }

    public static CompileError duplicateDefaultSlot(ErrorPath path) {
        return error(ErrorCode.DUPLICATE_DEFAULT_SLOT, "Layout has more than one default slot", path);
    }

    public static CompileError slotInLoop(ErrorPath path) {
        return error(ErrorCode.SLOT_IN_LOOP, "Slot cannot be placed inside an each loop", path);
    }

    public static CompileError undefinedState(String name, ErrorPath path) {
        return error(ErrorCode.UNDEFINED_STATE, "Undefined state: " + name, path);
    }

    public static CompileError undefinedAction(String name, ErrorPath path) {
        return error(ErrorCode.UNDEFINED_ACTION, "Undefined action: " + name, path);
    }

    public static CompileError duplicateAction(String name, ErrorPath path) {
        return error(ErrorCode.DUPLICATE_ACTION, "Duplicate action name: " + name, path);
    }

    public static CompileError undefinedVar(String name, ErrorPath path) {
        return error(ErrorCode.VAR_UNDEFINED, "Undefined variable: " + name, path);
    }

    public static CompileError componentNotFound(String name, ErrorPath path) {
        return error(ErrorCode.COMPONENT_NOT_FOUND, "Component '" + name + "' is not defined", path);
    }

    public static CompileError componentPropMissing(String component, String param, ErrorPath path) {
        return error(
            ErrorCode.COMPONENT_PROP_MISSING,
            "Component '" + component + "' requires prop '" + param + "'",
            path
        );
    }

    public static CompileError componentCycle(List<String> cycle, ErrorPath path) {
        return error(ErrorCode.COMPONENT_CYCLE, "Component cycle detected: " + String.join(" -> ", cycle), path);
    }

    public static CompileError paramUndefined(String name, ErrorPath path) {
        return error(ErrorCode.PARAM_UNDEFINED, "Undefined param: " + name, path);
    }

    public static CompileError slotOutsideComponent(ErrorPath path) {
        return error(ErrorCode.SLOT_OUTSIDE_COMPONENT, "Slot can only be used inside a component or layout", path);
    }

    public static CompileError undefinedRouteParam(String name, ErrorPath path) {
        return error(ErrorCode.UNDEFINED_ROUTE_PARAM, "Undefined route param: " + name, path);
    }

    public static CompileError undefinedImport(String name, ErrorPath path) {
        return error(ErrorCode.UNDEFINED_IMPORT, "Undefined import: " + name, path);
    }

    public static CompileError undefinedRef(String name, ErrorPath path) {
        return error(ErrorCode.UNDEFINED_REF, "Undefined element ref: " + name, path);
    }

    public static CompileError duplicateRef(String name, ErrorPath path) {
        return error(ErrorCode.DUPLICATE_REF, "Duplicate element ref: " + name, path);
    }

    public static CompileError duplicateIslandId(String id, ErrorPath path) {
        return error(ErrorCode.DUPLICATE_ISLAND_ID, "Duplicate island id: " + id, path);
    }

    public static CompileError maxDepthExceeded(int maxDepth, ErrorPath path) {
        return error(ErrorCode.MAX_DEPTH_EXCEEDED, "View nesting exceeds maximum depth of " + maxDepth, path);
    }

    private static CompileError error(ErrorCode code, String message, ErrorPath path) {
        return new CompileError(code, message, path.toString());
    }
}
