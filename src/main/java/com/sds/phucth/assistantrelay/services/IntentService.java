package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.config.IntentProfiles;
import com.sds.phucth.assistantrelay.consts.ReplyConstants;
import com.sds.phucth.assistantrelay.dto.AssistantRequest;
import com.sds.phucth.assistantrelay.dto.AssistantTurn;
import com.sds.phucth.assistantrelay.dto.Intent;
import com.sds.phucth.assistantrelay.exceptions.AssistantException;
import com.sds.phucth.assistantrelay.utils.Truthiness;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-intent reply shaping on top of {@link ConversationService}.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class IntentService {
    private static final Set<String> RESERVED = Set.of(ReplyConstants.Field.REPLY, ReplyConstants.Field.END_CHAT);

    ConversationService conversationService;
    IntentProfiles intentProfiles;

    public Map<String, Object> intake(AssistantRequest request) {
        AssistantTurn turn = respond(Intent.INTAKE, request);
        return baseReply(turn.getReply());
    }

    /**
     * Reply plus the {@code needs_more_data} call result. {@code need} is always present and
     * {@code back_to_intake} is set when it is {@code "yes"}.
     */
    public Map<String, Object> needsMoreData(AssistantRequest request) {
        AssistantTurn turn = respond(Intent.NEEDS_MORE_DATA, request);
        Map<String, Object> body = baseReply(turn.getReply());
        if (turn.hasStructured()) {
            turn.getStructured().forEach((k, v) -> {
                if (!RESERVED.contains(k)) {
                    body.put(k, v);
                }
            });
        }
        body.putIfAbsent(ReplyConstants.Field.NEED, ReplyConstants.Value.NEED_NO);
        if (ReplyConstants.Value.NEED_YES.equals(body.get(ReplyConstants.Field.NEED))) {
            body.put(ReplyConstants.Field.BACK_TO_INTAKE, true);
        }
        return body;
    }

    public Map<String, Object> giveAdvice(AssistantRequest request) {
        AssistantTurn turn = respond(Intent.GIVE_ADVICE, request);
        Map<String, Object> body = baseReply(turn.getReply());
        if (turn.hasStructured() && Truthiness.isTruthy(turn.getStructured().get(ReplyConstants.Field.NEED_INTAKE))) {
            body.put(ReplyConstants.Field.BACK_TO_INTAKE, true);
        }
        return body;
    }

    /**
     * Apology payload returned instead of a reply when the turn failed.
     */
    public Map<String, Object> fallback(Intent intent, Exception failure) {
        Map<String, Object> body = baseReply(failure instanceof AssistantException
                ? ReplyConstants.Apology.TECHNICAL
                : ReplyConstants.Apology.UNEXPECTED);
        if (intent == Intent.NEEDS_MORE_DATA) {
            body.put(ReplyConstants.Field.NEED, ReplyConstants.Value.NEED_NO);
        }
        return body;
    }

    private AssistantTurn respond(Intent intent, AssistantRequest request) {
        return conversationService.respond(request.getSessionId(), request.getMessage(),
                intentProfiles.forIntent(intent));
    }

    private static Map<String, Object> baseReply(String reply) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(ReplyConstants.Field.REPLY, reply);
        body.put(ReplyConstants.Field.END_CHAT, false);
        return body;
    }
}
