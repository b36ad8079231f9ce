package com.openforge.ariste.llm;

/**
 * Live display callbacks fired while a response is being decoded.
 *
 * The callbacks are advisory: they never influence what the decoder returns.
 * Order within one response:
 *   [onReasoningStart, onReasoningLine*, onReasoningEnd]? [onResponseStart, onContent*]? onStreamEnd
 */
public interface StreamListener {

    StreamListener NOOP = new StreamListener() {};

    default void onReasoningStart() {}

    /** One complete line of reasoning text, without its trailing newline. */
    default void onReasoningLine(String line) {}

    default void onReasoningEnd() {}

    default void onResponseStart() {}

    /** A fragment of final assistant text, exactly as received. */
    default void onContent(String fragment) {}

    default void onStreamEnd() {}
}
