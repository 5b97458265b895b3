package com.acme.taskmanager.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Tracks the list-cache fingerprints that are live for the task namespace, so a mutation can evict exactly
 * those keys instead of pattern-matching the keyspace.
 *
 * <p>The fingerprint set and the generation counter live in Redis next to the cached data and carry no TTL. A
 * missing set is an empty set and a missing counter is generation 0.
 */
@Component
public class InvalidationRegistry {
    static final String LIST_KEYS = "tasks:list-keys";
    static final String GENERATION = "tasks:generation";
    static final long POP_BATCH = 500;
    private static final Logger log = LoggerFactory.getLogger(InvalidationRegistry.class);

    private final StringRedisTemplate redis;
    private final CacheProperties properties;

    public InvalidationRegistry(StringRedisTemplate redis, CacheProperties properties) {
        this.redis = redis;
        this.properties = properties;
    }

    public void register(String fingerprint) {
        if (!properties.enabled()) return;
        try {
            redis.opsForSet().add(LIST_KEYS, fingerprint);
        } catch (DataAccessException ex) {
            log.warn("Could not register list fingerprint {}: {}", fingerprint, ex.getMessage());
        }
    }

    /**
     * Current invalidation generation, or empty when the backend cannot be read. Callers must not populate the
     * cache without a generation to compare against.
     */
    public OptionalLong generation() {
        if (!properties.enabled()) return OptionalLong.empty();
        try {
            String raw = redis.opsForValue().get(GENERATION);
            return OptionalLong.of(raw == null ? 0L : Long.parseLong(raw));
        } catch (DataAccessException ex) {
            log.warn("Could not read cache generation: {}", ex.getMessage());
            return OptionalLong.empty();
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed cache generation value: {}", ex.getMessage());
            return OptionalLong.empty();
        }
    }

    public boolean isCurrent(OptionalLong captured) {
        if (captured.isEmpty()) return false;
        OptionalLong now = generation();
        return now.isPresent() && now.getAsLong() == captured.getAsLong();
    }

    public void advanceGeneration() {
        if (!properties.enabled()) return;
        try {
            redis.opsForValue().increment(GENERATION);
        } catch (DataAccessException ex) {
            log.warn("Could not advance cache generation: {}", ex.getMessage());
        }
    }

    /**
     * Atomically removes and returns every outstanding fingerprint. Fingerprints registered while this runs are
     * either part of the result or stay registered for the next drain.
     */
    public Set<String> drain() {
        Set<String> drained = new LinkedHashSet<>();
        if (!properties.enabled()) return drained;
        try {
            while (true) {
                List<String> batch = redis.opsForSet().pop(LIST_KEYS, POP_BATCH);
                if (batch == null || batch.isEmpty()) break;
                drained.addAll(batch);
                if (batch.size() < POP_BATCH) break;
            }
        } catch (DataAccessException ex) {
            log.warn("Could not drain list fingerprints ({} collected): {}", drained.size(), ex.getMessage());
        }
        return drained;
    }
}
