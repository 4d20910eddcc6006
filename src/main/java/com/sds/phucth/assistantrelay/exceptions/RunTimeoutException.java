package com.sds.phucth.assistantrelay.exceptions;

import lombok.Getter;

import java.time.Duration;

@Getter
public class RunTimeoutException extends AssistantException {
    private final String runId;
    private final Duration waited;

    public RunTimeoutException(String runId, Duration waited) {
        super("Assistant run %s did not finish within %d ms".formatted(runId, waited.toMillis()));
        this.runId = runId;
        this.waited = waited;
    }
}
