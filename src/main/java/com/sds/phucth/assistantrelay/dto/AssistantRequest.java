package com.sds.phucth.assistantrelay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantRequest {
    @NotNull(message = "Missing required field: message")
    private String message;

    @NotNull(message = "Missing required field: history")
    private List<Object> history;  // sent by the flow builder, the thread is the source of truth

    @NotBlank(message = "Missing required field: session_id")
    @JsonProperty("session_id")
    private String sessionId;

    @NotNull(message = "Missing required field: metadata")
    private Map<String, Object> metadata;
}
