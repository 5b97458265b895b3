package com.acme.taskmanager.stats;

import com.acme.taskmanager.cache.CacheProperties;
import com.acme.taskmanager.task.TaskStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

// Snapshots are not evicted by task writes and may trail the store by one stats TTL.
@Service
public class StatsService {
    static final String STATS_KEY = "tasks:stats";
    static final String LAST_GOOD_KEY = "tasks:stats:last-good";
    private static final Logger log = LoggerFactory.getLogger(StatsService.class);

    private final TaskStore store;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final CacheProperties properties;
    private final Clock clock;

    public StatsService(TaskStore store, StringRedisTemplate redis, ObjectMapper objectMapper, CacheProperties properties, Clock clock) {
        this.store = store;
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public StatsDtos.StatsResponse getStats() {
        Optional<StatsDtos.StatsResponse> cached = read(STATS_KEY);
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            return refresh();
        } catch (DataAccessException | TransactionException ex) {
            log.error("Could not compute task statistics, serving fallback", ex);
            return read(LAST_GOOD_KEY)
                    .map(StatsDtos.StatsResponse::asDegraded)
                    .orElseGet(() -> StatsDtos.StatsResponse.empty(clock.instant()));
        }
    }

    public StatsDtos.StatsResponse refresh() {
        StatsDtos.StatsResponse stats = compute();
        write(STATS_KEY, stats, true);
        write(LAST_GOOD_KEY, stats, false);
        return stats;
    }

    StatsDtos.StatsResponse compute() {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        Instant dayStart = today.atStartOfDay(zone).toInstant();
        Instant dayEnd = today.plusDays(1).atStartOfDay(zone).toInstant();

        TaskStore.TaskCounts counts = store.counts(dayStart, dayEnd);
        return new StatsDtos.StatsResponse(
                counts.total(),
                counts.completed(),
                counts.total() - counts.completed(),
                completionRate(counts.completed(), counts.total()),
                StatsDtos.breakdown(counts.byPriority()),
                counts.createdInRange(),
                clock.instant(),
                false
        );
    }

    static double completionRate(long completed, long total) {
        if (total <= 0) return 0.0;
        return BigDecimal.valueOf(completed * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private Optional<StatsDtos.StatsResponse> read(String key) {
        if (!properties.enabled()) return Optional.empty();
        try {
            String payload = redis.opsForValue().get(key);
            if (payload == null) return Optional.empty();
            return Optional.of(objectMapper.readValue(payload, StatsDtos.StatsResponse.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Stats cache read of {} failed: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, StatsDtos.StatsResponse stats, boolean expiring) {
        if (!properties.enabled()) return;
        try {
            String payload = objectMapper.writeValueAsString(stats);
            if (expiring) {
                redis.opsForValue().set(key, payload, properties.statsTtl());
            } else {
                redis.opsForValue().set(key, payload);
            }
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Stats cache write of {} failed: {}", key, ex.getMessage());
        }
    }
}
