package com.sds.phucth.assistantrelay.config;

import com.sds.phucth.assistantrelay.repository.ThreadBindingRepository;
import com.sds.phucth.assistantrelay.store.JpaThreadStore;
import com.sds.phucth.assistantrelay.store.RedisThreadStore;
import com.sds.phucth.assistantrelay.store.ThreadStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThreadStoreConfigTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private RedisConnectionFactory connectionFactory;

    @Mock
    private RedisConnection connection;

    @Mock
    private ThreadBindingRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final ThreadStoreConfig config = new ThreadStoreConfig();

    @Test
    void explicitRedisBackendSkipsProbe() {
        ThreadStore store = config.threadStore(redis, repository, transactionManager, "redis", 86400);

        assertInstanceOf(RedisThreadStore.class, store);
        verifyNoInteractions(redis);
    }

    @Test
    void explicitJpaBackend() {
        ThreadStore store = config.threadStore(redis, repository, transactionManager, "jpa", 86400);

        assertInstanceOf(JpaThreadStore.class, store);
    }

    @Test
    void autoUsesRedisWhenPingSucceeds() {
        when(redis.getConnectionFactory()).thenReturn(connectionFactory);
        when(connectionFactory.getConnection()).thenReturn(connection);
        when(connection.ping()).thenReturn("PONG");

        ThreadStore store = config.threadStore(redis, repository, transactionManager, "auto", 86400);

        assertInstanceOf(RedisThreadStore.class, store);
        verify(connection).close();
    }

    @Test
    void autoFallsBackToDatabaseWhenRedisIsDown() {
        when(redis.getConnectionFactory()).thenReturn(connectionFactory);
        when(connectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("connection refused"));

        ThreadStore store = config.threadStore(redis, repository, transactionManager, "AUTO", 86400);

        assertInstanceOf(JpaThreadStore.class, store);
    }

    @Test
    void unknownBackendFailsStartup() {
        assertThrows(IllegalStateException.class, () -> config.threadStore(redis, repository, transactionManager, "memcached", 86400));
    }
}
