package com.example.docredact.kv;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisMetadataStore implements MetadataStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisMetadataStore.class);

    private final StringRedisTemplate redis;

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Autowired
    public RedisMetadataStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    /**
     * Refuses to let the application come up without a reachable store: every redaction
     * depends on it for PII custody.
     */
    @PostConstruct
    public void verifyConnectivity() {
        logger.info("Connecting to Redis at {}:{}", host, port);
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            String pong = conn.ping();
            logger.info("Successfully connected to Redis ({})", pong);
        } catch (RuntimeException e) {
            logger.error("FATAL: could not connect to Redis at {}:{}", host, port, e);
            throw new StoreUnavailableException("Redis is not reachable at " + host + ":" + port, e);
        }
    }

    @Override
    public Optional<String> get(String documentId) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(documentId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metadata store read failed", e);
        }
    }

    @Override
    public void put(String documentId, String payload, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Session payloads require a positive ttl");
        }
        try {
            redis.opsForValue().set(documentId, payload, ttl);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metadata store write failed", e);
        }
    }

    @Override
    public Optional<Duration> ttl(String documentId) {
        try {
            Long seconds = redis.getExpire(documentId);
            if (seconds == null || seconds < 0) return Optional.empty();
            return Optional.of(Duration.ofSeconds(seconds));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metadata store ttl lookup failed", e);
        }
    }
}
