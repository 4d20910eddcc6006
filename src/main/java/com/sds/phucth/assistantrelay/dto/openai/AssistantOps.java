package com.sds.phucth.assistantrelay.dto.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request bodies sent to the assistants API.
 */
public class AssistantOps {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateMessageOp {
        private String role;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CreateRunOp {
        @JsonProperty("assistant_id")
        private String assistantId;

        private Double temperature;

        @JsonProperty("max_completion_tokens")
        private Integer maxCompletionTokens;

        private List<ToolSpec> tools;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolSpec {
        private String type;
        private FunctionSpec function;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionSpec {
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubmitToolOutputsOp {
        @JsonProperty("tool_outputs")
        private List<ToolOutput> toolOutputs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolOutput {
        @JsonProperty("tool_call_id")
        private String toolCallId;

        private String output;
    }
}
