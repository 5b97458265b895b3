package com.acme.taskmanager.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

@Component
@ConditionalOnProperty(prefix = "app.stats", name = "refresh-enabled", havingValue = "true", matchIfMissing = true)
public class StatsRefresher {
    private static final Logger log = LoggerFactory.getLogger(StatsRefresher.class);

    private final StatsService statsService;

    public StatsRefresher(StatsService statsService) {
        this.statsService = statsService;
    }

    @Scheduled(initialDelayString = "${app.stats.refresh-interval:PT20S}", fixedDelayString = "${app.stats.refresh-interval:PT20S}")
    public void refresh() {
        try {
            StatsDtos.StatsResponse stats = statsService.refresh();
            log.debug("Refreshed task statistics: {} total, {} completed", stats.total(), stats.completed());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Scheduled stats refresh failed: {}", ex.getMessage());
        }
    }
}
