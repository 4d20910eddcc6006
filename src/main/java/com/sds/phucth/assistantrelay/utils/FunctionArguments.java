package com.sds.phucth.assistantrelay.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.assistantrelay.consts.AssistantConstants;

import java.util.Map;

/**
 * Parsing of function-call arguments emitted by the assistant. The result is either a fully
 * parsed JSON object or {@code null}, never something half built.
 */
public final class FunctionArguments {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private FunctionArguments() {
    }

    public static Map<String, Object> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = M.readTree(raw);
            if (node == null || !node.isObject()) {
                return null;
            }
            return M.convertValue(node, MAP_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String toOutput(Map<String, Object> parsed) {
        if (parsed == null || parsed.isEmpty()) {
            return AssistantConstants.Function.EMPTY_OUTPUT;
        }
        try {
            return M.writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            return AssistantConstants.Function.EMPTY_OUTPUT;
        }
    }
}
