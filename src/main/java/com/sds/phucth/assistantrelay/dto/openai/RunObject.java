package com.sds.phucth.assistantrelay.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunObject {
    private String id;

    @JsonProperty("thread_id")
    private String threadId;

    private RunStatus status;

    @JsonProperty("required_action")
    private RequiredAction requiredAction;

    @JsonProperty("last_error")
    private LastError lastError;

    public List<ToolCall> pendingToolCalls() {
        if (requiredAction == null || requiredAction.getSubmitToolOutputs() == null
                || requiredAction.getSubmitToolOutputs().getToolCalls() == null) {
            return Collections.emptyList();
        }
        return requiredAction.getSubmitToolOutputs().getToolCalls();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RequiredAction {
        private String type;

        @JsonProperty("submit_tool_outputs")
        private SubmitToolOutputs submitToolOutputs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubmitToolOutputs {
        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LastError {
        private String code;
        private String message;
    }
}
