package com.sds.phucth.assistantrelay.config;

import com.sds.phucth.assistantrelay.consts.ThreadStoreConstants;
import com.sds.phucth.assistantrelay.repository.ThreadBindingRepository;
import com.sds.phucth.assistantrelay.store.JpaThreadStore;
import com.sds.phucth.assistantrelay.store.RedisThreadStore;
import com.sds.phucth.assistantrelay.store.ThreadStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Objects;

@Configuration
@Slf4j
public class ThreadStoreConfig {

    @Bean
    public ThreadStore threadStore(
            StringRedisTemplate redis,
            ThreadBindingRepository threadBindingRepository,
            PlatformTransactionManager transactionManager,
            @Value("${app.thread-store.backend:auto}") String backend,
            @Value("${app.redis.threadTtlSeconds:86400}") long threadTtlSeconds) {
        switch (backend.toLowerCase()) {
            case ThreadStoreConstants.Backend.REDIS -> {
                log.info("Using Redis for thread persistence");
                return new RedisThreadStore(redis, Duration.ofSeconds(threadTtlSeconds));
            }
            case ThreadStoreConstants.Backend.JPA -> {
                log.info("Using relational database for thread persistence");
                return new JpaThreadStore(threadBindingRepository, new TransactionTemplate(transactionManager));
            }
            case ThreadStoreConstants.Backend.AUTO -> {
                if (redisReachable(redis)) {
                    log.info("Connected to Redis for thread persistence");
                    return new RedisThreadStore(redis, Duration.ofSeconds(threadTtlSeconds));
                }
                log.info("Using relational database for thread persistence");
                return new JpaThreadStore(threadBindingRepository, new TransactionTemplate(transactionManager));
            }
            default -> throw new IllegalStateException("Unknown app.thread-store.backend: " + backend);
        }
    }

    static boolean redisReachable(StringRedisTemplate redis) {
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            conn.ping();
            return true;
        } catch (Exception e) {
            log.warn("Failed to connect to Redis: {}. Falling back to relational database.", e.getMessage());
            return false;
        }
    }
}
