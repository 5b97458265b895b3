package com.acme.taskmanager.config;

import com.acme.taskmanager.cache.CacheProperties;
import com.acme.taskmanager.ratelimit.RateLimitProperties;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConfigurationPropertiesScan(basePackageClasses = {CacheProperties.class, RateLimitProperties.class})
public class AppConfig {
}
