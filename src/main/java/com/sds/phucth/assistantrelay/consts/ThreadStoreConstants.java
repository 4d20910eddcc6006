package com.sds.phucth.assistantrelay.consts;

public interface ThreadStoreConstants {
    interface KeyFormat {
        String THREAD = "thread:%s";
    }

    interface Backend {
        String REDIS = "redis";
        String JPA = "jpa";
        String AUTO = "auto";
    }
}
