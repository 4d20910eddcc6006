package com.sds.phucth.assistantrelay.store;

import java.util.Optional;

/**
 * Session id to remote thread id binding. Implementations never throw on backend trouble:
 * a failed read is a miss and a failed write is dropped.
 */
public interface ThreadStore {
    Optional<String> get(String sessionId);

    void put(String sessionId, String threadId);
}
