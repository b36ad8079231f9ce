package com.openforge.ariste.tool;

/**
 * Raised by a tool when it cannot produce a result. The message is what the
 * model sees when the dispatcher degrades the failure into a tool message.
 */
public class ToolExecutionException extends Exception {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
