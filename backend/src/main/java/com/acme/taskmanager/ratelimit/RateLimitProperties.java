package com.acme.taskmanager.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("false") boolean trustForwardedFor,
        Limit defaultLimit,
        List<Route> routes
) {
    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    public RateLimitProperties {
        if (defaultLimit == null) defaultLimit = new Limit(50, Duration.ofMinutes(1));
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public Optional<Limit> limitFor(String method, String pattern) {
        String upper = method.toUpperCase(Locale.ROOT);
        for (Route route : routes) {
            if (route.method().equalsIgnoreCase(upper) && route.pattern().equals(pattern)) {
                return Optional.of(new Limit(route.max(), route.window()));
            }
        }
        if (MUTATING_METHODS.contains(upper)) return Optional.of(defaultLimit);
        return Optional.empty();
    }

    public record Limit(int max, Duration window) {}

    public record Route(String method, String pattern, int max, Duration window) {}
}
