package com.sds.phucth.assistantrelay.exceptions;

/**
 * Failure talking to the remote assistant that is not worth retrying.
 */
public class AssistantException extends RuntimeException {
    public AssistantException(String message) {
        super(message);
    }

    public AssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
