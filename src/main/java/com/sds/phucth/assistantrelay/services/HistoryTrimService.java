package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.client.AssistantClient;
import com.sds.phucth.assistantrelay.consts.AssistantConstants;
import com.sds.phucth.assistantrelay.dto.openai.MessageObject;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps a remote thread at or below {@code maxMessages} by deleting its oldest messages in
 * user/assistant pairs. Every failure is logged and swallowed.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class HistoryTrimService {
    AssistantClient assistantClient;

    @Value("${app.assistant.history.max-messages:25}")
    @NonFinal
    int maxMessages;

    @Value("${app.assistant.history.fetch-limit:100}")
    @NonFinal
    int fetchLimit;

    /**
     * @return number of messages actually deleted
     */
    public int trim(String threadId) {
        try {
            List<MessageObject> messages = assistantClient.listMessages(threadId, fetchLimit, AssistantConstants.Order.DESC);
            if (messages.size() <= maxMessages) {
                return 0;
            }

            // listing is newest first; reverse before the stable sort so ties stay in API order
            List<MessageObject> oldestFirst = new ArrayList<>(messages);
            Collections.reverse(oldestFirst);
            oldestFirst.sort(Comparator.comparingLong(MessageObject::getCreatedAt));

            int toDelete = Math.min(messagesToDelete(oldestFirst.size(), maxMessages), oldestFirst.size());
            int deleted = 0;
            for (int i = 0; i < toDelete; i++) {
                String messageId = oldestFirst.get(i).getId();
                try {
                    assistantClient.deleteMessage(threadId, messageId);
                    deleted++;
                } catch (Exception e) {
                    log.warn("Failed to delete message {}: {}", messageId, e.getMessage());
                }
            }
            log.info("Trimmed {} of {} messages from thread {}", deleted, toDelete, threadId);
            return deleted;
        } catch (Exception e) {
            log.error("Error trimming thread history for {}: {}", threadId, e.getMessage());
            return 0;
        }
    }

    /**
     * Excess over {@code max}, rounded up to an even count.
     */
    static int messagesToDelete(int count, int max) {
        int excess = count - max;
        if (excess <= 0) {
            return 0;
        }
        return excess % 2 == 0 ? excess : excess + 1;
    }
}
