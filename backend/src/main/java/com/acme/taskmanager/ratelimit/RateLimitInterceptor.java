package com.acme.taskmanager.ratelimit;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Optional;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RequestRateLimiter limiter;
    private final RateLimitProperties properties;
    private final MeterRegistry meterRegistry;

    public RateLimitInterceptor(RequestRateLimiter limiter, RateLimitProperties properties, MeterRegistry meterRegistry) {
        this.limiter = limiter;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!properties.enabled()) return true;
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern == null) return true;

        Optional<RateLimitProperties.Limit> limit = properties.limitFor(request.getMethod(), pattern.toString());
        if (limit.isEmpty()) return true;

        String route = request.getMethod() + " " + pattern;
        String client = clientKey(request);
        RequestRateLimiter.Decision decision = limiter.admit(client, route, limit.get().max(), limit.get().window());
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for {} on {}", client, route);
            meterRegistry.counter("ratelimit.rejections", "route", route).increment();
            throw new RateLimitExceededException(route, decision.retryAfterSeconds());
        }
        return true;
    }

    String clientKey(HttpServletRequest request) {
        if (properties.trustForwardedFor()) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
