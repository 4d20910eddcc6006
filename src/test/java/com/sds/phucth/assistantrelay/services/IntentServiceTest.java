package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.config.IntentProfiles;
import com.sds.phucth.assistantrelay.consts.ReplyConstants;
import com.sds.phucth.assistantrelay.dto.AssistantProfile;
import com.sds.phucth.assistantrelay.dto.AssistantRequest;
import com.sds.phucth.assistantrelay.dto.AssistantTurn;
import com.sds.phucth.assistantrelay.dto.Intent;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentServiceTest {

    private static final AssistantProfile PROFILE = AssistantProfile.builder()
            .assistantId("asst_1")
            .temperature(0.2)
            .maxTokens(200)
            .functionName("needs_more_data")
            .build();

    @Mock
    private ConversationService conversationService;

    @Mock
    private IntentProfiles intentProfiles;

    @InjectMocks
    private IntentService intentService;

    private AssistantRequest request;

    @BeforeEach
    void setUp() {
        request = AssistantRequest.builder()
                .message("me duele la cabeza")
                .sessionId("s1")
                .history(List.of())
                .metadata(Map.of())
                .build();
    }

    @Test
    void intakeReturnsPlainReply() {
        stub(Intent.INTAKE, new AssistantTurn("¿Desde cuándo?", null));

        Map<String, Object> body = intentService.intake(request);

        assertEquals(Map.of("reply", "¿Desde cuándo?", "end_chat", false), body);
    }

    @Test
    void needYesSendsUserBackToIntake() {
        stub(Intent.NEEDS_MORE_DATA, new AssistantTurn("Necesito más datos",
                Map.of("need", "yes", "missing", List.of("duration"))));

        Map<String, Object> body = intentService.needsMoreData(request);

        assertEquals("Necesito más datos", body.get("reply"));
        assertEquals(false, body.get("end_chat"));
        assertEquals("yes", body.get("need"));
        assertEquals(List.of("duration"), body.get("missing"));
        assertEquals(true, body.get("back_to_intake"));
    }

    @Test
    void needDefaultsToNoWithoutStructuredResult() {
        stub(Intent.NEEDS_MORE_DATA, new AssistantTurn("Gracias", null));

        Map<String, Object> body = intentService.needsMoreData(request);

        assertEquals("no", body.get("need"));
        assertFalse(body.containsKey("back_to_intake"));
    }

    @Test
    void needDefaultsToNoWhenResultOmitsIt() {
        stub(Intent.NEEDS_MORE_DATA, new AssistantTurn("Gracias", Map.of("missing", List.of())));

        Map<String, Object> body = intentService.needsMoreData(request);

        assertEquals("no", body.get("need"));
        assertEquals(List.of(), body.get("missing"));
        assertFalse(body.containsKey("back_to_intake"));
    }

    @Test
    void structuredResultCannotOverrideReplyOrEndChat() {
        Map<String, Object> structured = new HashMap<>();
        structured.put("reply", "hijacked");
        structured.put("end_chat", true);
        structured.put("need", "no");
        stub(Intent.NEEDS_MORE_DATA, new AssistantTurn("real reply", structured));

        Map<String, Object> body = intentService.needsMoreData(request);

        assertEquals("real reply", body.get("reply"));
        assertEquals(false, body.get("end_chat"));
        assertEquals("no", body.get("need"));
    }

    @Test
    void adviceWithNeedIntakeGoesBackToIntake() {
        stub(Intent.GIVE_ADVICE, new AssistantTurn("Descansa", Map.of("need_intake", true)));

        assertEquals(true, intentService.giveAdvice(request).get("back_to_intake"));
    }

    @Test
    void adviceWithFalsyNeedIntakeStaysPut() {
        stub(Intent.GIVE_ADVICE, new AssistantTurn("Descansa", Map.of("need_intake", false)));

        assertFalse(intentService.giveAdvice(request).containsKey("back_to_intake"));
    }

    @Test
    void adviceWithoutFunctionResultIsPlainReply() {
        stub(Intent.GIVE_ADVICE, new AssistantTurn("Descansa", null));

        assertEquals(Map.of("reply", "Descansa", "end_chat", false), intentService.giveAdvice(request));
    }

    @Test
    void fallbackDistinguishesRemoteFromUnexpectedFailures() {
        Map<String, Object> remote = intentService.fallback(Intent.NEEDS_MORE_DATA,
                new TransientAssistantException("Rate limit exceeded"));
        assertEquals(ReplyConstants.Apology.TECHNICAL, remote.get("reply"));
        assertEquals(false, remote.get("end_chat"));
        assertEquals("no", remote.get("need"));

        Map<String, Object> unexpected = intentService.fallback(Intent.INTAKE, new IllegalStateException("boom"));
        assertEquals(ReplyConstants.Apology.UNEXPECTED, unexpected.get("reply"));
        assertFalse(unexpected.containsKey("need"));
    }

    private void stub(Intent intent, AssistantTurn turn) {
        when(intentProfiles.forIntent(intent)).thenReturn(PROFILE);
        when(conversationService.respond("s1", "me duele la cabeza", PROFILE)).thenReturn(turn);
    }
}
