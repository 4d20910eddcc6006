package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.dto.AssistantProfile;
import com.sds.phucth.assistantrelay.dto.AssistantTurn;
import com.sds.phucth.assistantrelay.utils.SessionLocks;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of a conversational turn. Turns of the same session are serialised inside this
 * process; turns of different sessions run independently.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ConversationService {
    ResilientRunService resilientRunService;
    SessionLocks sessionLocks = new SessionLocks();

    public AssistantTurn respond(String sessionId, String message, AssistantProfile profile) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id must be a non-empty string");
        }
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (profile == null || profile.getAssistantId() == null || profile.getAssistantId().isBlank()) {
            throw new IllegalArgumentException("assistant profile must name an assistant");
        }
        return sessionLocks.withLock(sessionId,
                () -> resilientRunService.execute(sessionId, message, profile));
    }
}
