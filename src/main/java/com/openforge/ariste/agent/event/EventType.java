package com.openforge.ariste.agent.event;

/**
 * Classifies every event an agent emits.
 *
 * Flow for one turn:
 *   TURN_START → (ITERATION_START → REASONING* → CONTENT* → (TOOL_CALL → TOOL_RESULT | TOOL_ERROR)*)+ → FINAL_ANSWER
 *
 * A failed turn ends with ERROR instead of FINAL_ANSWER.
 */
public enum EventType {

    /** A user prompt was appended; the loop is starting. content = prompt. */
    TURN_START,

    /** A model call is about to be made. */
    ITERATION_START,

    /** One complete line of model reasoning. Display only; never stored. */
    REASONING,

    /** A fragment of final assistant text as it streams in. */
    CONTENT,

    /** A tool is about to run. payload = ToolCallPayload. */
    TOOL_CALL,

    /** A tool returned. payload = ToolResultPayload. */
    TOOL_RESULT,

    /** A tool failed or was rejected. content = error text. */
    TOOL_ERROR,

    /** A subagent was spawned. payload = SubAgentPayload. */
    SUBAGENT_START,

    /** A subagent finished (successfully or not). payload = SubAgentPayload. */
    SUBAGENT_COMPLETE,

    /** Final answer; turn complete. */
    FINAL_ANSWER,

    /** Unrecoverable error. content = message. */
    ERROR
}
