package com.sds.phucth.assistantrelay.client;

import com.sds.phucth.assistantrelay.exceptions.AssistantException;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps remote HTTP statuses to retryable or not. 429 and 5xx always retry; statuses listed in
 * {@code app.assistant.retry.non-retryable-statuses} never do; anything else retries.
 */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class RemoteErrorClassifier {

    @Getter
    @RequiredArgsConstructor
    public enum Classification {
        RATE_LIMITED(true),
        SERVER_ERROR(true),
        CLIENT_ERROR(false),
        UNKNOWN(true);

        private final boolean retryable;
    }

    Map<Integer, Classification> table = new HashMap<>();

    @Value("${app.assistant.retry.non-retryable-statuses:}")
    @NonFinal
    List<Integer> nonRetryableStatuses = Collections.emptyList();

    @PostConstruct
    public void initTable() {
        table.clear();
        table.put(429, Classification.RATE_LIMITED);
        for (Integer status : nonRetryableStatuses) {
            if (status != null && status != 429 && status < 500) {
                table.put(status, Classification.CLIENT_ERROR);
            }
        }
    }

    public Classification classify(int statusCode) {
        if (statusCode >= 500) {
            return Classification.SERVER_ERROR;
        }
        return table.getOrDefault(statusCode, Classification.UNKNOWN);
    }

    public AssistantException toException(int statusCode, String operation, Throwable cause) {
        Classification classification = classify(statusCode);
        switch (classification) {
            case RATE_LIMITED -> log.warn("Rate limit exceeded during {}", operation);
            case SERVER_ERROR -> log.error("Server error {} during {}", statusCode, operation);
            default -> log.error("Assistant API error {} during {}", statusCode, operation);
        }
        String message = switch (classification) {
            case RATE_LIMITED -> "Rate limit exceeded";
            case SERVER_ERROR -> "Server error: " + statusCode;
            default -> "OpenAI API error: " + statusCode;
        };
        if (classification.isRetryable()) {
            return new TransientAssistantException(message, statusCode, cause);
        }
        return new AssistantException(message, cause);
    }
}
