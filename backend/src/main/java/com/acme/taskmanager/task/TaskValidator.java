package com.acme.taskmanager.task;

import com.acme.taskmanager.common.ApiError;
import com.acme.taskmanager.domain.entity.Task;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
public class TaskValidator {

    public TaskCommands.Create toCreate(TaskDtos.TaskRequest request) {
        List<ApiError.FieldViolation> violations = new ArrayList<>();
        TaskCommands.Create command = toCreate(request, "", violations);
        if (!violations.isEmpty()) throw new TaskValidationException(violations);
        return command;
    }

    public List<TaskCommands.Create> toCreateAll(List<TaskDtos.TaskRequest> requests) {
        List<ApiError.FieldViolation> violations = new ArrayList<>();
        List<TaskCommands.Create> commands = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            commands.add(toCreate(requests.get(i), "tasks[" + i + "].", violations));
        }
        if (!violations.isEmpty()) throw new TaskValidationException(violations);
        return commands;
    }

    public TaskCommands.Update toUpdate(TaskDtos.TaskUpdateRequest request) {
        List<ApiError.FieldViolation> violations = new ArrayList<>();
        String title = null;
        if (request.title() != null) {
            title = request.title().trim();
            if (title.isEmpty()) violations.add(new ApiError.FieldViolation("title", "title must not be blank"));
        }
        String description = request.description() == null ? null : request.description().trim();
        Integer priority = request.priority() == null || request.priority().isNull() ? null : normalizePriority(request.priority());
        boolean clearDueDate = request.dueDate() != null && request.dueDate().isBlank();
        LocalDate dueDate = clearDueDate ? null : parseDueDate(request.dueDate(), "due_date", violations);
        if (!violations.isEmpty()) throw new TaskValidationException(violations);
        return new TaskCommands.Update(title, description, request.completed(), priority, dueDate, clearDueDate);
    }

    // Anything that is not a whole number in 1..3 (text like "high", booleans, fractions) falls back to low.
    static int normalizePriority(JsonNode priority) {
        if (priority == null) return Task.PRIORITY_LOW;
        if (priority.isIntegralNumber() && priority.canConvertToInt()) return normalizePriority(priority.intValue());
        if (priority.isTextual() && priority.textValue().trim().matches("[+-]?\\d{1,9}")) {
            return normalizePriority(Integer.parseInt(priority.textValue().trim()));
        }
        return Task.PRIORITY_LOW;
    }

    static int normalizePriority(int priority) {
        if (priority < Task.PRIORITY_LOW || priority > Task.PRIORITY_HIGH) return Task.PRIORITY_LOW;
        return priority;
    }

    static LocalDate parseDueDate(String raw, String field, List<ApiError.FieldViolation> violations) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeException notDate) {
            try {
                return OffsetDateTime.parse(value).toLocalDate();
            } catch (DateTimeException notOffset) {
                try {
                    return LocalDateTime.parse(value).toLocalDate();
                } catch (DateTimeException notLocal) {
                    violations.add(new ApiError.FieldViolation(field, "due_date must be an ISO-8601 date (yyyy-MM-dd)"));
                    return null;
                }
            }
        }
    }

    private TaskCommands.Create toCreate(TaskDtos.TaskRequest request, String prefix, List<ApiError.FieldViolation> violations) {
        if (request == null) {
            violations.add(new ApiError.FieldViolation(prefix.isEmpty() ? "body" : prefix.substring(0, prefix.length() - 1), "task is required"));
            return null;
        }
        String title = request.title() == null ? "" : request.title().trim();
        if (title.isEmpty()) violations.add(new ApiError.FieldViolation(prefix + "title", "title is required"));
        String description = request.description() == null ? null : request.description().trim();
        LocalDate dueDate = parseDueDate(request.dueDate(), prefix + "due_date", violations);
        return new TaskCommands.Create(title, description, normalizePriority(request.priority()), dueDate);
    }
}
