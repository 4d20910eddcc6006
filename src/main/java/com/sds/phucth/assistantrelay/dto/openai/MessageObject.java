package com.sds.phucth.assistantrelay.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageObject {
    private String id;

    private String role; // user|assistant

    @JsonProperty("created_at")
    private long createdAt;

    private List<Content> content;

    /**
     * Text of the first content part, if that part is text.
     */
    public Optional<String> firstText() {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        Content first = content.get(0);
        if (!"text".equals(first.getType()) || first.getText() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(first.getText().getValue());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        private String type;
        private Text text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Text {
        private String value;
    }
}
