package com.acme.taskmanager.task;

import com.acme.taskmanager.cache.InvalidationRegistry;
import com.acme.taskmanager.cache.TaskCache;
import com.acme.taskmanager.domain.entity.Task;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TaskServiceTest {
    private final TaskStore store = mock(TaskStore.class);
    private final TaskCache cache = mock(TaskCache.class);
    private final InvalidationRegistry registry = mock(InvalidationRegistry.class);
    private static final Instant NOW = Instant.parse("2030-06-01T12:00:00Z");

    private final TaskService service = new TaskService(store, new TaskValidator(), cache, registry, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void updateInvalidatesOnlyAfterTheStoreCommits() {
        Task task = task("T");
        when(store.update(eq(5L), any())).thenReturn(task);
        when(registry.drain()).thenReturn(Set.of("fp1", "fp2"));

        service.update(5L, new TaskDtos.TaskUpdateRequest("T", null, null, null, null));

        InOrder order = inOrder(store, registry, cache);
        order.verify(store).update(eq(5L), any());
        order.verify(registry).advanceGeneration();
        order.verify(registry).drain();
        order.verify(cache).evict(List.of(5L), Set.of("fp1", "fp2"));
    }

    @Test
    void failedWriteLeavesCacheAlone() {
        when(store.update(eq(5L), any())).thenThrow(new EntityNotFoundException("Task not found: 5"));
        when(store.create(any())).thenThrow(new DataIntegrityViolationException("boom"));

        assertThatThrownBy(() -> service.update(5L, new TaskDtos.TaskUpdateRequest(null, null, true, null, null)))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> service.create(new TaskDtos.TaskRequest("x", null, null, null)))
                .isInstanceOf(DataIntegrityViolationException.class);

        verifyNoInteractions(registry, cache);
    }

    @Test
    void invalidInputNeverReachesTheStore() {
        assertThatThrownBy(() -> service.create(new TaskDtos.TaskRequest(" ", null, null, null)))
                .isInstanceOf(TaskValidationException.class);

        verifyNoInteractions(store, registry, cache);
    }

    @Test
    void createInvalidatesListsButNoItems() {
        when(store.create(any())).thenReturn(task("new"));
        when(registry.drain()).thenReturn(Set.of("fp"));

        service.create(new TaskDtos.TaskRequest("new", null, null, null));

        verify(cache).evict(List.of(), Set.of("fp"));
    }

    @Test
    void cacheHitSkipsTheStore() {
        TaskDtos.TaskResponse cached = TaskDtos.TaskResponse.from(task("cached"));
        when(cache.getList(anyString())).thenReturn(Optional.of(List.of(cached)));

        assertThat(service.list(TaskQuery.all())).containsExactly(cached);
        verifyNoInteractions(store);
    }

    @Test
    void missRegistersFingerprintBeforePopulating() {
        TaskQuery query = TaskQuery.of("report", null, null, null, null);
        when(cache.getList(anyString())).thenReturn(Optional.empty());
        when(registry.generation()).thenReturn(OptionalLong.of(3));
        when(registry.isCurrent(OptionalLong.of(3))).thenReturn(true);
        when(store.list(query)).thenReturn(List.of(task("report")));

        assertThat(service.list(query)).hasSize(1);

        InOrder order = inOrder(registry, cache);
        order.verify(registry).register(query.fingerprint());
        order.verify(cache).putList(eq(query.fingerprint()), anyList());
    }

    @Test
    void missDuringConcurrentInvalidationIsNotCached() {
        when(cache.getList(anyString())).thenReturn(Optional.empty());
        when(registry.generation()).thenReturn(OptionalLong.of(3));
        when(registry.isCurrent(any())).thenReturn(false);
        when(store.list(any())).thenReturn(List.of());
        when(cache.getItem(anyLong())).thenReturn(Optional.empty());
        when(store.get(9L)).thenReturn(task("x"));

        service.list(TaskQuery.all());
        service.get(9L);

        verify(cache, never()).putList(anyString(), anyList());
        verify(cache, never()).putItem(anyLong(), any());
    }

    @Test
    void unreadableGenerationSkipsPopulation() {
        when(cache.getList(anyString())).thenReturn(Optional.empty());
        when(registry.generation()).thenReturn(OptionalLong.empty());
        when(store.list(any())).thenReturn(List.of(task("a")));

        assertThat(service.list(TaskQuery.all())).hasSize(1);

        verify(registry, never()).register(anyString());
        verify(cache, never()).putList(anyString(), anyList());
    }

    @Test
    void deleteEvictsTheItemKey() {
        when(registry.drain()).thenReturn(Set.of());

        service.delete(12L);

        verify(store).delete(12L);
        verify(cache).evict(eq(List.of(12L)), anyCollection());
    }

    @Test
    void cleanupDeletesBeforeRetentionCutoffThenInvalidates() {
        when(store.deleteCreatedBefore(any())).thenReturn(List.of(3L, 4L));
        when(registry.drain()).thenReturn(Set.of("fp"));

        assertThat(service.deleteOlderThan(Duration.ofDays(30))).isEqualTo(2);

        InOrder order = inOrder(store, registry, cache);
        order.verify(store).deleteCreatedBefore(Instant.parse("2030-05-02T12:00:00Z"));
        order.verify(registry).advanceGeneration();
        order.verify(cache).evict(List.of(3L, 4L), Set.of("fp"));
    }

    @Test
    void cleanupWithNothingToDeleteLeavesCacheAlone() {
        when(store.deleteCreatedBefore(any())).thenReturn(List.of());

        assertThat(service.deleteOlderThan(Duration.ofDays(30))).isZero();

        verifyNoInteractions(registry, cache);
    }

    private static Task task(String title) {
        Task task = new Task();
        task.setTitle(title);
        return task;
    }
}
