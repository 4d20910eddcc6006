package com.sds.phucth.assistantrelay.store;

import com.sds.phucth.assistantrelay.models.ThreadBinding;
import com.sds.phucth.assistantrelay.repository.ThreadBindingRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class JpaThreadStore implements ThreadStore {
    ThreadBindingRepository threadBindingRepository;
    TransactionTemplate transactionTemplate;

    @Override
    public Optional<String> get(String sessionId) {
        try {
            return threadBindingRepository.findById(sessionId).map(ThreadBinding::getThreadId);
        } catch (Exception e) {
            log.error("Error getting thread_id for session {} from database: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String sessionId, String threadId) {
        try {
            // upsert by primary key, created_at survives rebinding
            transactionTemplate.executeWithoutResult(status -> {
                OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
                ThreadBinding binding = threadBindingRepository.findById(sessionId)
                        .orElseGet(() -> ThreadBinding.builder()
                                .sessionId(sessionId)
                                .createdAt(now)
                                .build());
                binding.setThreadId(threadId);
                binding.setUpdatedAt(now);
                threadBindingRepository.save(binding);
            });
            log.info("Saved thread_id {} for session {}", threadId, sessionId);
        } catch (Exception e) {
            log.error("Error saving thread_id for session {} to database: {}", sessionId, e.getMessage());
        }
    }
}
