package com.acme.taskmanager.task;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@Tag(name = "tasks")
public class TaskController {
    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping
    @Operation(summary = "List tasks, newest first")
    public List<TaskDtos.TaskResponse> list(
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "completed", required = false) String completed,
            @RequestParam(value = "priority", required = false) String priority,
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "size", required = false) String size
    ) {
        return taskService.list(TaskQuery.of(search, completed, priority, page, size));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskDtos.TaskResponse create(@RequestBody @Valid TaskDtos.TaskRequest request) {
        return taskService.create(request);
    }

    @PostMapping("/batch")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create several tasks; nothing is stored if any item is invalid")
    public List<TaskDtos.TaskResponse> createBatch(@RequestBody @Valid TaskDtos.BatchRequest request) {
        return taskService.createAll(request);
    }

    @GetMapping("/{id}")
    public TaskDtos.TaskResponse get(@PathVariable long id) {
        return taskService.get(id);
    }

    @PutMapping("/{id}")
    public TaskDtos.TaskResponse update(@PathVariable long id, @RequestBody @Valid TaskDtos.TaskUpdateRequest request) {
        return taskService.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        taskService.delete(id);
    }
}
