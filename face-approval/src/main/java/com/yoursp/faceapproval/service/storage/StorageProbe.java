package com.yoursp.faceapproval.service.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Start-up connectivity checks used to pick the storage backend.
 * A failed probe is reported as {@code false}, never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageProbe {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;
    private final RedisConnectionFactory redisConnectionFactory;

    public boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException | RuntimeException e) {
            log.warn("Database probe failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean redisReachable() {
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        } catch (RuntimeException e) {
            log.warn("Redis probe failed: {}", e.getMessage());
            return false;
        }
    }
}
