package com.acme.taskmanager.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class RequestRateLimiter {
    static final String KEY_PREFIX = "ratelimit:";
    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    private final StringRedisTemplate redis;

    public RequestRateLimiter(StringRedisTemplate redis) {
        this.redis = redis;
    }

    public Decision admit(String clientKey, String route, int max, Duration window) {
        String redisKey = KEY_PREFIX + route + ":" + clientKey;
        try {
            Long count = redis.opsForValue().increment(redisKey);
            if (count == null) {
                return Decision.allow();
            }
            if (count == 1) {
                redis.expire(redisKey, window);
            }
            if (count > max) {
                Long ttl = redis.getExpire(redisKey);
                if (ttl == null || ttl < 0) {
                    // counter lost its expiry; restart the window rather than block forever
                    redis.expire(redisKey, window);
                    ttl = window.toSeconds();
                }
                return Decision.reject(Math.max(1L, ttl));
            }
            return Decision.allow();
        } catch (DataAccessException ex) {
            log.warn("Rate limiter unavailable, admitting {} on {}: {}", clientKey, route, ex.getMessage());
            return Decision.allow();
        }
    }

    public record Decision(boolean allowed, long retryAfterSeconds) {
        static Decision allow() {
            return new Decision(true, 0);
        }

        static Decision reject(long retryAfterSeconds) {
            return new Decision(false, retryAfterSeconds);
        }
    }
}
