package com.acme.taskmanager.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Duration;

@Component
@ConditionalOnProperty(prefix = "app.cleanup", name = "enabled", havingValue = "true")
public class TaskCleanupJob {
    private static final Logger log = LoggerFactory.getLogger(TaskCleanupJob.class);

    private final TaskService taskService;
    private final Duration retention;

    public TaskCleanupJob(TaskService taskService, @Value("${app.cleanup.retention:P30D}") Duration retention) {
        this.taskService = taskService;
        this.retention = retention;
    }

    @Scheduled(cron = "${app.cleanup.cron:0 0 3 * * *}", zone = "${app.timezone:UTC}")
    public void run() {
        try {
            int deleted = taskService.deleteOlderThan(retention);
            log.info("Task cleanup removed {} tasks older than {}", deleted, retention);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Task cleanup failed: {}", ex.getMessage());
        }
    }
}
