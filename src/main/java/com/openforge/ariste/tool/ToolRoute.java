package com.openforge.ariste.tool;

/**
 * How a requested tool name is handled by the dispatcher.
 */
public enum ToolRoute {

    /** The delegation tool: routed to the subagent orchestrator, never executed generically. */
    DELEGATE,

    /** An ordinary registered tool. */
    LOCAL,

    /** No tool with this name exists. */
    UNKNOWN
}
