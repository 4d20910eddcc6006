package com.sds.phucth.assistantrelay.dto;

import lombok.Value;

import java.util.Map;

@Value
public class AssistantTurn {
    String reply;
    Map<String, Object> structured; // null when no (valid) function call came back

    public boolean hasStructured() {
        return structured != null;
    }
}
