package com.openforge.ariste.llm;

/**
 * How the {@link StreamDecoder} treats a line that is not valid UTF-8 or not a
 * JSON object.
 */
public enum DecodingMode {

    /** Skip the line, log it, and keep reading. A partial answer beats no answer. */
    LENIENT,

    /** Abort the call with a {@link ChatClient.ChatProtocolException}. */
    STRICT
}
