package com.acme.taskmanager.task;

import com.acme.taskmanager.cache.InvalidationRegistry;
import com.acme.taskmanager.cache.TaskCache;
import com.acme.taskmanager.domain.entity.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

@Service
public class TaskService {
    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore store;
    private final TaskValidator validator;
    private final TaskCache cache;
    private final InvalidationRegistry registry;
    private final Clock clock;

    public TaskService(TaskStore store, TaskValidator validator, TaskCache cache, InvalidationRegistry registry, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.cache = cache;
        this.registry = registry;
        this.clock = clock;
    }

    public List<TaskDtos.TaskResponse> list(TaskQuery query) {
        String fingerprint = query.fingerprint();
        Optional<List<TaskDtos.TaskResponse>> cached = cache.getList(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }
        OptionalLong generation = registry.generation();
        List<TaskDtos.TaskResponse> tasks = store.list(query).stream().map(TaskDtos.TaskResponse::from).toList();
        if (generation.isPresent()) {
            registry.register(fingerprint);
            if (registry.isCurrent(generation)) {
                cache.putList(fingerprint, tasks);
            }
        }
        log.info("Retrieved {} tasks for [{}]", tasks.size(), query.canonical());
        return tasks;
    }

    public TaskDtos.TaskResponse get(long id) {
        Optional<TaskDtos.TaskResponse> cached = cache.getItem(id);
        if (cached.isPresent()) {
            return cached.get();
        }
        OptionalLong generation = registry.generation();
        TaskDtos.TaskResponse task = TaskDtos.TaskResponse.from(store.get(id));
        if (registry.isCurrent(generation)) {
            cache.putItem(id, task);
        }
        return task;
    }

    public TaskDtos.TaskResponse create(TaskDtos.TaskRequest request) {
        TaskCommands.Create command = validator.toCreate(request);
        Task task = store.create(command);
        invalidate(List.of());
        log.info("Task created: {} (id {})", task.getTitle(), task.getId());
        return TaskDtos.TaskResponse.from(task);
    }

    public List<TaskDtos.TaskResponse> createAll(TaskDtos.BatchRequest request) {
        List<TaskCommands.Create> commands = validator.toCreateAll(request.tasks());
        List<Task> tasks = store.createAll(commands);
        invalidate(List.of());
        log.info("Batch created {} tasks", tasks.size());
        return tasks.stream().map(TaskDtos.TaskResponse::from).toList();
    }

    public TaskDtos.TaskResponse update(long id, TaskDtos.TaskUpdateRequest request) {
        TaskCommands.Update command = validator.toUpdate(request);
        Task task = store.update(id, command);
        invalidate(List.of(id));
        log.info("Task {} updated", id);
        return TaskDtos.TaskResponse.from(task);
    }

    public void delete(long id) {
        store.delete(id);
        invalidate(List.of(id));
        log.info("Task {} deleted", id);
    }

    public int deleteOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<Long> ids = store.deleteCreatedBefore(cutoff);
        if (!ids.isEmpty()) {
            invalidate(ids);
        }
        log.info("Deleted {} tasks created before {}", ids.size(), cutoff);
        return ids.size();
    }

    private void invalidate(Collection<Long> ids) {
        registry.advanceGeneration();
        Set<String> fingerprints = registry.drain();
        cache.evict(ids, fingerprints);
        log.debug("Evicted {} item keys and {} list keys", ids.size(), fingerprints.size());
    }
}
