package com.acme.taskmanager.stats;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

@Component
public class TaskMetrics implements MeterBinder {
    private final StatsService statsService;

    public TaskMetrics(StatsService statsService) {
        this.statsService = statsService;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("tasks.total", statsService, s -> s.getStats().total())
                .description("Number of stored tasks")
                .register(registry);
        Gauge.builder("tasks.completed", statsService, s -> s.getStats().completed())
                .description("Number of completed tasks")
                .register(registry);
    }
}
