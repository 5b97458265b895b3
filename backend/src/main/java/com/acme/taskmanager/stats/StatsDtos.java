package com.acme.taskmanager.stats;

import com.acme.taskmanager.domain.entity.Task;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

public class StatsDtos {
    public record StatsResponse(
            long total,
            long completed,
            long pending,
            double completionRate,
            Map<Integer, Long> priorityBreakdown,
            long createdToday,
            Instant generatedAt,
            boolean degraded
    ) {
        public static StatsResponse empty(Instant at) {
            return new StatsResponse(0, 0, 0, 0.0, breakdown(Map.of()), 0, at, true);
        }

        public StatsResponse asDegraded() {
            return new StatsResponse(total, completed, pending, completionRate, priorityBreakdown, createdToday, generatedAt, true);
        }
    }

    static Map<Integer, Long> breakdown(Map<Integer, Long> counts) {
        Map<Integer, Long> breakdown = new TreeMap<>();
        for (int priority = Task.PRIORITY_LOW; priority <= Task.PRIORITY_HIGH; priority++) {
            breakdown.put(priority, counts.getOrDefault(priority, 0L));
        }
        return breakdown;
    }
}
