package com.acme.taskmanager.task;

import com.acme.taskmanager.domain.entity.Task;
import com.acme.taskmanager.domain.repo.TaskRepository;
import com.acme.taskmanager.domain.repo.TaskSpecifications;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class TaskStore {
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final TaskRepository taskRepo;
    private final Clock clock;

    public TaskStore(TaskRepository taskRepo, Clock clock) {
        this.taskRepo = taskRepo;
        this.clock = clock;
    }

    @Transactional
    public Task create(TaskCommands.Create command) {
        return taskRepo.save(newTask(command, clock.instant()));
    }

    @Transactional
    public List<Task> createAll(List<TaskCommands.Create> commands) {
        Instant now = clock.instant();
        List<Task> tasks = new ArrayList<>(commands.size());
        for (TaskCommands.Create command : commands) {
            tasks.add(newTask(command, now));
        }
        return taskRepo.saveAll(tasks);
    }

    @Transactional(readOnly = true)
    public Task get(long id) {
        return taskRepo.findById(id).orElseThrow(() -> notFound(id));
    }

    @Transactional(readOnly = true)
    public List<Task> list(TaskQuery query) {
        Specification<Task> spec = TaskSpecifications.matching(query.search(), query.completed(), query.priority());
        if (query.paged()) {
            return taskRepo.findAll(spec, PageRequest.of(query.page(), query.size(), NEWEST_FIRST)).getContent();
        }
        return taskRepo.findAll(spec, NEWEST_FIRST);
    }

    @Transactional
    public Task update(long id, TaskCommands.Update command) {
        Task task = taskRepo.findById(id).orElseThrow(() -> notFound(id));
        Instant now = clock.instant();
        if (command.title() != null) task.setTitle(command.title());
        if (command.description() != null) task.setDescription(command.description());
        if (command.priority() != null) task.setPriority(command.priority());
        if (command.clearDueDate()) task.setDueDate(null);
        else if (command.dueDate() != null) task.setDueDate(command.dueDate());
        if (command.completed() != null) task.markCompleted(command.completed(), now);
        task.touch(now);
        return taskRepo.saveAndFlush(task);
    }

    @Transactional
    public void delete(long id) {
        Task task = taskRepo.findById(id).orElseThrow(() -> notFound(id));
        taskRepo.delete(task);
    }

    @Transactional
    public List<Long> deleteCreatedBefore(Instant cutoff) {
        List<Long> ids = taskRepo.findIdsCreatedBefore(cutoff);
        if (!ids.isEmpty()) {
            taskRepo.deleteAllByIdInBatch(ids);
        }
        return ids;
    }

    @Transactional(readOnly = true)
    public TaskCounts counts(Instant createdFrom, Instant createdUntil) {
        Map<Integer, Long> byPriority = new HashMap<>();
        taskRepo.countGroupedByPriority().forEach(row -> byPriority.put(row.getPriority(), row.getTotal()));
        return new TaskCounts(
                taskRepo.count(),
                taskRepo.countByCompletedTrue(),
                byPriority,
                taskRepo.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(createdFrom, createdUntil)
        );
    }

    public record TaskCounts(long total, long completed, Map<Integer, Long> byPriority, long createdInRange) {}

    private Task newTask(TaskCommands.Create command, Instant now) {
        Task task = new Task();
        task.setTitle(command.title());
        task.setDescription(command.description());
        task.setPriority(command.priority());
        task.setDueDate(command.dueDate());
        task.setCreatedAt(now);
        task.touch(now);
        return task;
    }

    private EntityNotFoundException notFound(long id) {
        return new EntityNotFoundException("Task not found: " + id);
    }
}
