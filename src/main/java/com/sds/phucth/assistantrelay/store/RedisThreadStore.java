package com.sds.phucth.assistantrelay.store;

import com.sds.phucth.assistantrelay.consts.ThreadStoreConstants;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class RedisThreadStore implements ThreadStore {
    StringRedisTemplate redis;
    Duration ttl;

    @Override
    public Optional<String> get(String sessionId) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key(sessionId)));
        } catch (Exception e) {
            log.error("Error getting thread_id for session {} from redis: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String sessionId, String threadId) {
        try {
            redis.opsForValue().set(key(sessionId), threadId, ttl);
            log.info("Saved thread_id {} for session {}", threadId, sessionId);
        } catch (Exception e) {
            log.error("Error saving thread_id for session {} to redis: {}", sessionId, e.getMessage());
        }
    }

    private static String key(String sessionId) {
        return ThreadStoreConstants.KeyFormat.THREAD.formatted(sessionId);
    }
}
