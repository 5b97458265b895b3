package com.acme.taskmanager.task;

import com.acme.taskmanager.common.ApiError;

import java.util.List;

public class TaskValidationException extends RuntimeException {
    private final List<ApiError.FieldViolation> violations;

    public TaskValidationException(List<ApiError.FieldViolation> violations) {
        super(violations.isEmpty() ? "Validation failed" : violations.get(0).message());
        this.violations = List.copyOf(violations);
    }

    public static TaskValidationException of(String field, String message) {
        return new TaskValidationException(List.of(new ApiError.FieldViolation(field, message)));
    }

    public List<ApiError.FieldViolation> getViolations() {
        return violations;
    }
}
