package com.vigil.healthmonitor.infrastructure.storage;

import com.vigil.monitoring.check.StorageProbe;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * Liveness of the cache via {@code PING}.
 */
public class RedisStorageProbe implements StorageProbe {

    private final RedisConnectionFactory connectionFactory;

    public RedisStorageProbe(RedisConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public void ping() {
        String reply = reply();
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new IllegalStateException("Unexpected Redis PING reply: " + reply);
        }
    }

    String reply() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            return connection.ping();
        }
    }
}
