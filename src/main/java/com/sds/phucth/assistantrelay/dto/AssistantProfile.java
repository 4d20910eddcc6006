package com.sds.phucth.assistantrelay.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Which remote assistant to run and with what generation parameters. {@code functionName},
 * when set, is the single structured call expected back.
 */
@Value
@Builder
public class AssistantProfile {
    String assistantId;
    double temperature;
    int maxTokens;
    String functionName;

    public boolean expectsFunction() {
        return functionName != null && !functionName.isBlank();
    }
}
