package com.sds.phucth.assistantrelay.config;

import com.sds.phucth.assistantrelay.consts.AssistantConstants;
import com.sds.phucth.assistantrelay.dto.AssistantProfile;
import com.sds.phucth.assistantrelay.dto.Intent;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Assistant profile used for each intent, built once from configuration.
 */
@Component
@FieldDefaults(level = AccessLevel.PRIVATE)
@Slf4j
public class IntentProfiles {

    @Value("${app.assistant.intake.assistant-id:}")
    String intakeAssistantId;

    @Value("${app.assistant.intake.temperature:0.2}")
    double intakeTemperature;

    @Value("${app.assistant.intake.max-tokens:200}")
    int intakeMaxTokens;

    @Value("${app.assistant.advice.assistant-id:}")
    String adviceAssistantId;

    @Value("${app.assistant.advice.temperature:0.7}")
    double adviceTemperature;

    @Value("${app.assistant.advice.max-tokens:250}")
    int adviceMaxTokens;

    @Value("${app.assistant.advice.function-name:}")
    String adviceFunctionName;

    final Map<Intent, AssistantProfile> profiles = new EnumMap<>(Intent.class);

    @PostConstruct
    public void init() {
        if (isBlank(intakeAssistantId) || isBlank(adviceAssistantId)) {
            log.error("Missing required configuration");
            throw new IllegalStateException(
                    "Missing required configuration: app.assistant.intake.assistant-id, app.assistant.advice.assistant-id");
        }
        profiles.put(Intent.INTAKE, AssistantProfile.builder()
                .assistantId(intakeAssistantId)
                .temperature(intakeTemperature)
                .maxTokens(intakeMaxTokens)
                .build());
        profiles.put(Intent.NEEDS_MORE_DATA, AssistantProfile.builder()
                .assistantId(intakeAssistantId)
                .temperature(intakeTemperature)
                .maxTokens(intakeMaxTokens)
                .functionName(AssistantConstants.Function.NEEDS_MORE_DATA)
                .build());
        profiles.put(Intent.GIVE_ADVICE, AssistantProfile.builder()
                .assistantId(adviceAssistantId)
                .temperature(adviceTemperature)
                .maxTokens(adviceMaxTokens)
                .functionName(isBlank(adviceFunctionName) ? null : adviceFunctionName)
                .build());
    }

    public AssistantProfile forIntent(Intent intent) {
        AssistantProfile profile = profiles.get(intent);
        if (profile == null) {
            throw new IllegalStateException("No assistant profile for " + intent);
        }
        return profile;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
