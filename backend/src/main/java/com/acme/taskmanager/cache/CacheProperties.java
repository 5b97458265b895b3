package com.acme.taskmanager.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.cache")
public record CacheProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("60s") Duration itemTtl,
        @DefaultValue("30s") Duration listTtl,
        @DefaultValue("30s") Duration statsTtl
) {
}
