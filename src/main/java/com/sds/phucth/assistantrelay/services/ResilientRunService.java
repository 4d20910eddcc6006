package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.dto.AssistantProfile;
import com.sds.phucth.assistantrelay.dto.AssistantTurn;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Runs a whole {@link AssistantRunService} turn under bounded exponential-backoff retry.
 * Only {@link TransientAssistantException} is retried; the last failure is rethrown as is.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ResilientRunService {
    AssistantRunService assistantRunService;

    @Value("${app.assistant.retry.max-attempts:3}")
    @NonFinal
    int maxAttempts;

    @Value("${app.assistant.retry.initial-backoff:1s}")
    @NonFinal
    Duration initialBackoff;

    @Value("${app.assistant.retry.max-backoff:10s}")
    @NonFinal
    Duration maxBackoff;

    @Value("${app.assistant.retry.multiplier:2.0}")
    @NonFinal
    double multiplier;

    @Getter
    @NonFinal
    Retry retry;

    @PostConstruct
    public void initRetry() {
        retry = Retry.of("assistant-run", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff(initialBackoff, multiplier, maxBackoff))
                .retryExceptions(TransientAssistantException.class)
                .build());
        retry.getEventPublisher()
                .onRetry(e -> log.warn("Assistant call attempt {} failed, retrying in {} ms: {}",
                        e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        e.getLastThrowable() == null ? "-" : e.getLastThrowable().getMessage()))
                .onError(e -> log.error("Assistant call failed after {} attempts: {}",
                        e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() == null ? "-" : e.getLastThrowable().getMessage()));
        log.info("Assistant retry policy: {} attempts, backoff {} -> {}", maxAttempts, initialBackoff, maxBackoff);
    }

    public AssistantTurn execute(String sessionId, String message, AssistantProfile profile) {
        return Retry.decorateSupplier(retry, () -> assistantRunService.execute(sessionId, message, profile)).get();
    }

    static IntervalFunction backoff(Duration initial, double multiplier, Duration max) {
        return IntervalFunction.ofExponentialBackoff(initial, multiplier, max);
    }
}
