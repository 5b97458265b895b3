package com.acme.taskmanager.domain.repo;

import com.acme.taskmanager.domain.entity.Task;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

public final class TaskSpecifications {
    private static final char ESCAPE = '\\';

    private TaskSpecifications() {
    }

    public static Specification<Task> matching(String search, Boolean completed, Integer priority) {
        return Specification.where(textContains(search))
                .and(completedIs(completed))
                .and(priorityIs(priority));
    }

    static Specification<Task> textContains(String search) {
        if (search == null || search.isBlank()) return null;
        String pattern = likePattern(search);
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern, ESCAPE),
                cb.like(cb.lower(cb.coalesce(root.<String>get("description"), "")), pattern, ESCAPE)
        );
    }

    static Specification<Task> completedIs(Boolean completed) {
        if (completed == null) return null;
        return (root, query, cb) -> cb.equal(root.get("completed"), completed);
    }

    static Specification<Task> priorityIs(Integer priority) {
        if (priority == null) return null;
        return (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }

    static String likePattern(String search) {
        return "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
    }

    static String escapeLike(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            if (c == '%' || c == '_' || c == ESCAPE) out.append(ESCAPE);
            out.append(c);
        }
        return out.toString();
    }
}
