package com.acme.taskmanager.cache;

import com.acme.taskmanager.task.TaskDtos;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class TaskCache {
    static final String ITEM_PREFIX = "tasks:item:";
    static final String LIST_PREFIX = "tasks:list:";
    private static final TypeReference<TaskDtos.TaskResponse> ITEM_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<TaskDtos.TaskResponse>> LIST_TYPE = new TypeReference<>() {};
    private static final Logger log = LoggerFactory.getLogger(TaskCache.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final CacheProperties properties;
    private final MeterRegistry meterRegistry;

    public TaskCache(StringRedisTemplate redis, ObjectMapper objectMapper, CacheProperties properties, MeterRegistry meterRegistry) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public static String itemKey(long id) {
        return ITEM_PREFIX + id;
    }

    public static String listKey(String fingerprint) {
        return LIST_PREFIX + fingerprint;
    }

    public Optional<TaskDtos.TaskResponse> getItem(long id) {
        return read("item", itemKey(id), ITEM_TYPE);
    }

    public boolean putItem(long id, TaskDtos.TaskResponse task) {
        return write(itemKey(id), task, properties.itemTtl());
    }

    public Optional<List<TaskDtos.TaskResponse>> getList(String fingerprint) {
        return read("list", listKey(fingerprint), LIST_TYPE);
    }

    public boolean putList(String fingerprint, List<TaskDtos.TaskResponse> tasks) {
        return write(listKey(fingerprint), tasks, properties.listTtl());
    }

    public void evict(Collection<Long> ids, Collection<String> fingerprints) {
        if (!properties.enabled()) return;
        List<String> keys = new ArrayList<>(ids.size() + fingerprints.size());
        ids.forEach(id -> keys.add(itemKey(id)));
        fingerprints.forEach(fp -> keys.add(listKey(fp)));
        if (keys.isEmpty()) return;
        try {
            redis.delete(keys);
        } catch (DataAccessException ex) {
            log.warn("Cache eviction of {} keys failed, entries expire by TTL: {}", keys.size(), ex.getMessage());
        }
    }

    private <T> Optional<T> read(String kind, String key, TypeReference<T> type) {
        if (!properties.enabled()) return Optional.empty();
        String payload;
        try {
            payload = redis.opsForValue().get(key);
        } catch (DataAccessException ex) {
            log.warn("Cache read of {} failed, falling back to store: {}", key, ex.getMessage());
            count(kind, "error");
            return Optional.empty();
        }
        if (payload == null) {
            count(kind, "miss");
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(payload, type);
            count(kind, "hit");
            return Optional.of(value);
        } catch (JsonProcessingException ex) {
            log.warn("Discarding undecodable cache entry {}: {}", key, ex.getOriginalMessage());
            count(kind, "miss");
            discard(key);
            return Optional.empty();
        }
    }

    private boolean write(String key, Object value, Duration ttl) {
        if (!properties.enabled()) return false;
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            return true;
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize cache entry {}: {}", key, ex.getOriginalMessage());
            return false;
        } catch (DataAccessException ex) {
            log.warn("Cache write of {} failed, skipping population: {}", key, ex.getMessage());
            return false;
        }
    }

    private void discard(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException ex) {
            log.warn("Could not discard cache entry {}: {}", key, ex.getMessage());
        }
    }

    private void count(String kind, String result) {
        meterRegistry.counter("tasks.cache.requests", "kind", kind, "result", result).increment();
    }
}
