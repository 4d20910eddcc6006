package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.client.AssistantClient;
import com.sds.phucth.assistantrelay.dto.openai.MessageObject;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HistoryTrimServiceTest {

    private static final String THREAD = "thread_1";

    @Mock
    private AssistantClient assistantClient;

    private HistoryTrimService historyTrimService;

    @BeforeEach
    void setUp() {
        historyTrimService = new HistoryTrimService(assistantClient);
        ReflectionTestUtils.setField(historyTrimService, "maxMessages", 25);
        ReflectionTestUtils.setField(historyTrimService, "fetchLimit", 100);
    }

    @Test
    void thirtyMessagesLoseTheSixOldest() {
        when(assistantClient.listMessages(THREAD, 100, "desc")).thenReturn(newestFirst(30));

        int deleted = historyTrimService.trim(THREAD);

        assertEquals(6, deleted);
        for (int i = 0; i < 6; i++) {
            verify(assistantClient).deleteMessage(THREAD, "msg_" + i);
        }
        verify(assistantClient, never()).deleteMessage(THREAD, "msg_6");
        verify(assistantClient, times(6)).deleteMessage(eq(THREAD), anyString());
    }

    @Test
    void evenExcessIsDeletedAsIs() {
        when(assistantClient.listMessages(THREAD, 100, "desc")).thenReturn(newestFirst(26));

        assertEquals(2, historyTrimService.trim(THREAD));
        verify(assistantClient).deleteMessage(THREAD, "msg_0");
        verify(assistantClient).deleteMessage(THREAD, "msg_1");
    }

    @Test
    void nothingDeletedAtOrBelowTheCap() {
        when(assistantClient.listMessages(THREAD, 100, "desc")).thenReturn(newestFirst(25));

        assertEquals(0, historyTrimService.trim(THREAD));
        verify(assistantClient, never()).deleteMessage(anyString(), anyString());
    }

    @Test
    void failedDeleteDoesNotStopTheRest() {
        when(assistantClient.listMessages(THREAD, 100, "desc")).thenReturn(newestFirst(30));
        lenient().doThrow(new TransientAssistantException("Server error: 500"))
                .when(assistantClient).deleteMessage(THREAD, "msg_1");

        int deleted = historyTrimService.trim(THREAD);

        assertEquals(5, deleted);
        verify(assistantClient).deleteMessage(THREAD, "msg_0");
        verify(assistantClient).deleteMessage(THREAD, "msg_1");
        verify(assistantClient).deleteMessage(THREAD, "msg_5");
    }

    @Test
    void listingFailureIsSwallowed() {
        when(assistantClient.listMessages(THREAD, 100, "desc"))
                .thenThrow(new TransientAssistantException("Rate limit exceeded"));

        assertEquals(0, assertDoesNotThrow(() -> historyTrimService.trim(THREAD)));
    }

    @Test
    void deleteCountRoundsUpToPairs() {
        assertEquals(0, HistoryTrimService.messagesToDelete(25, 25));
        assertEquals(2, HistoryTrimService.messagesToDelete(26, 25));
        assertEquals(2, HistoryTrimService.messagesToDelete(27, 25));
        assertEquals(6, HistoryTrimService.messagesToDelete(30, 25));
        assertEquals(76, HistoryTrimService.messagesToDelete(100, 25));
    }

    /**
     * msg_0 is the oldest; the list is returned newest first like the API does.
     */
    private static List<MessageObject> newestFirst(int count) {
        List<MessageObject> messages = new ArrayList<>();
        for (int i = count - 1; i >= 0; i--) {
            messages.add(MessageObject.builder()
                    .id("msg_" + i)
                    .role(i % 2 == 0 ? "user" : "assistant")
                    .createdAt(1_700_000_000L + i)
                    .build());
        }
        return messages;
    }
}
