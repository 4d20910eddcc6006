package com.sds.phucth.assistantrelay.exceptions;

import lombok.Getter;

/**
 * Remote failure that the retry policy may try again: rate limits, 5xx, failed runs,
 * missing replies and anything the client could not classify.
 */
@Getter
public class TransientAssistantException extends AssistantException {
    private final Integer statusCode;

    public TransientAssistantException(String message) {
        this(message, null, null);
    }

    public TransientAssistantException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransientAssistantException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
