package com.acme.taskmanager.task;

import com.acme.taskmanager.domain.entity.Task;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class TaskDtos {
    public static final int MAX_BATCH_SIZE = 100;

    public record TaskRequest(
            @NotBlank(message = "title is required") @Size(max = 200, message = "title must be at most 200 characters") String title,
            @Size(max = 10000, message = "description must be at most 10000 characters") String description,
            @Schema(type = "integer", allowableValues = {"1", "2", "3"}, defaultValue = "1") JsonNode priority,
            String dueDate
    ) {}

    public record TaskUpdateRequest(
            @Size(max = 200, message = "title must be at most 200 characters") String title,
            @Size(max = 10000, message = "description must be at most 10000 characters") String description,
            Boolean completed,
            @Schema(type = "integer", allowableValues = {"1", "2", "3"}) JsonNode priority,
            String dueDate
    ) {}

    public record BatchRequest(
            @NotNull(message = "tasks array is required")
            @Size(min = 1, max = MAX_BATCH_SIZE, message = "tasks must contain between 1 and 100 items")
            List<@Valid @NotNull TaskRequest> tasks
    ) {}

    public record TaskResponse(
            Long id,
            String title,
            String description,
            boolean completed,
            int priority,
            LocalDate dueDate,
            Instant createdAt,
            Instant updatedAt,
            Instant completedAt
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                    task.getId(),
                    task.getTitle(),
                    task.getDescription(),
                    task.isCompleted(),
                    task.getPriority(),
                    task.getDueDate(),
                    task.getCreatedAt(),
                    task.getUpdatedAt(),
                    task.getCompletedAt()
            );
        }
    }
}
