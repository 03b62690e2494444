package work.lcod.ui.ast;

/**
 * Value of an element or component prop: either an expression or an event handler.
 */
public sealed interface PropValue permits Expression, EventHandler {}
