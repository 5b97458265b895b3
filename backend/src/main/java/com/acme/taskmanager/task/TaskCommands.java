package com.acme.taskmanager.task;

import java.time.LocalDate;

public class TaskCommands {
    public record Create(String title, String description, int priority, LocalDate dueDate) {}

    // null keeps the stored value; clearDueDate removes it
    public record Update(String title, String description, Boolean completed, Integer priority, LocalDate dueDate, boolean clearDueDate) {}
}
