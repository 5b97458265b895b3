package com.acme.taskmanager.task;

import com.acme.taskmanager.domain.entity.Task;
import org.springframework.util.DigestUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.StringJoiner;

public record TaskQuery(String search, Boolean completed, Integer priority, Integer page, Integer size) {
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    public static TaskQuery all() {
        return new TaskQuery(null, null, null, null, null);
    }

    public static TaskQuery of(String search, String completed, String priority, String page, String size) {
        String normalizedSearch = search == null || search.isBlank() ? null : search.trim().toLowerCase(Locale.ROOT);
        Boolean completedFilter = parseCompleted(completed);
        Integer priorityFilter = parseInt(priority, "priority", Task.PRIORITY_LOW, Task.PRIORITY_HIGH);
        Integer pageNumber = parseInt(page, "page", 0, Integer.MAX_VALUE);
        Integer pageSize = parseInt(size, "size", 1, MAX_PAGE_SIZE);
        if (pageNumber != null || pageSize != null) {
            if (pageNumber == null) pageNumber = 0;
            if (pageSize == null) pageSize = DEFAULT_PAGE_SIZE;
        }
        return new TaskQuery(normalizedSearch, completedFilter, priorityFilter, pageNumber, pageSize);
    }

    public boolean paged() {
        return size != null;
    }

    public String canonical() {
        StringJoiner joiner = new StringJoiner("&");
        if (completed != null) joiner.add("completed=" + completed);
        if (page != null) joiner.add("page=" + page);
        if (priority != null) joiner.add("priority=" + priority);
        if (search != null) joiner.add("search=" + URLEncoder.encode(search, StandardCharsets.UTF_8));
        if (size != null) joiner.add("size=" + size);
        return joiner.toString();
    }

    public String fingerprint() {
        return DigestUtils.md5DigestAsHex(canonical().getBytes(StandardCharsets.UTF_8));
    }

    private static Boolean parseCompleted(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
        throw TaskValidationException.of("completed", "completed must be true or false");
    }

    private static Integer parseInt(String raw, String field, int min, int max) {
        if (raw == null || raw.isBlank()) return null;
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw TaskValidationException.of(field, field + " must be an integer");
        }
        if (value < min || value > max) {
            throw TaskValidationException.of(field, field + " must be between " + min + " and " + max);
        }
        return value;
    }
}
