package com.company.outages.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Snapshot shared between replicas through a single Redis key.
 * No TTL: the key is overwritten by the refresh job.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "outages.snapshot.store", havingValue = "redis")
public class RedisOutageSnapshotCache implements OutageSnapshotCache {

    private final RedisTemplate<String, OutageSnapshot> snapshotRedisTemplate;
    private final String key;

    public RedisOutageSnapshotCache(RedisTemplate<String, OutageSnapshot> snapshotRedisTemplate,
                                    @Value("${outages.snapshot.redis-key:outages:default-snapshot}") String key) {
        this.snapshotRedisTemplate = snapshotRedisTemplate;
        this.key = key;
    }

    @Override
    public Optional<OutageSnapshot> get() {
        try {
            return Optional.ofNullable(snapshotRedisTemplate.opsForValue().get(key));
        } catch (Exception e) {
            // a cache miss falls back to a live computation
            log.warn("Failed to read outage snapshot from Redis key {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void store(OutageSnapshot snapshot) {
        snapshotRedisTemplate.opsForValue().set(key, snapshot);
        log.debug("Stored outage snapshot in Redis key {} ({} outages)",
                key, snapshot.getResponse().getOutages().size());
    }
}
