package com.acme.taskmanager.health;

import com.acme.taskmanager.cache.CacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final JdbcTemplate jdbc;
    private final StringRedisTemplate redis;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public HealthController(JdbcTemplate jdbc, StringRedisTemplate redis, CacheProperties cacheProperties, Clock clock) {
        this.jdbc = jdbc;
        this.redis = redis;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("UP", clock.instant(), Map.of());
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthResponse> ready() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("database", databaseStatus());
        services.put("cache", cacheStatus());
        boolean ready = services.values().stream().noneMatch("DOWN"::equals);
        HealthResponse body = new HealthResponse(ready ? "UP" : "DOWN", clock.instant(), services);
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private String databaseStatus() {
        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            return "UP";
        } catch (RuntimeException ex) {
            log.error("Database readiness check failed: {}", ex.getMessage());
            return "DOWN";
        }
    }

    private String cacheStatus() {
        if (!cacheProperties.enabled()) return "DISABLED";
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong) ? "UP" : "DOWN";
        } catch (RuntimeException ex) {
            log.error("Redis readiness check failed: {}", ex.getMessage());
            return "DOWN";
        }
    }

    public record HealthResponse(String status, Instant timestamp, Map<String, String> services) {}
}
