package com.acme.taskmanager.cache;

import com.acme.taskmanager.support.FakeRedis;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InvalidationRegistryTest {
    private final FakeRedis fakeRedis = new FakeRedis();
    private final InvalidationRegistry registry = new InvalidationRegistry(fakeRedis.template(), TaskCacheTest.properties(true));

    @Test
    void drainReturnsAndClearsRegisteredFingerprints() {
        registry.register("a");
        registry.register("b");
        registry.register("a");

        assertThat(registry.drain()).containsExactlyInAnyOrder("a", "b");
        assertThat(fakeRedis.contains(InvalidationRegistry.LIST_KEYS)).isFalse();
        assertThat(registry.drain()).isEmpty();
    }

    @Test
    void drainCollectsMoreThanOneBatch() {
        Set<String> expected = IntStream.range(0, 1234).mapToObj(i -> "fp" + i).collect(Collectors.toSet());
        expected.forEach(registry::register);

        assertThat(registry.drain()).hasSize(1234).containsAll(expected);
        assertThat(fakeRedis.commands()).filteredOn("SPOP"::equals).hasSize(3);
    }

    @Test
    void generationStartsAtZeroAndAdvances() {
        OptionalLong before = registry.generation();
        assertThat(before).hasValue(0);
        assertThat(registry.isCurrent(before)).isTrue();

        registry.advanceGeneration();

        assertThat(registry.generation()).hasValue(1);
        assertThat(registry.isCurrent(before)).isFalse();
    }

    @Test
    void unreachableBackendNeverReportsCurrent() {
        OptionalLong captured = registry.generation();
        fakeRedis.setDown(true);

        assertThat(registry.generation()).isEmpty();
        assertThat(registry.isCurrent(captured)).isFalse();
        assertThat(registry.isCurrent(OptionalLong.empty())).isFalse();
        registry.register("x");
        registry.advanceGeneration();
        assertThat(registry.drain()).isEmpty();
    }

    @Test
    void disabledRegistryIsInert() {
        InvalidationRegistry disabled = new InvalidationRegistry(fakeRedis.template(), TaskCacheTest.properties(false));

        disabled.register("a");
        disabled.advanceGeneration();

        assertThat(disabled.generation()).isEmpty();
        assertThat(disabled.drain()).isEmpty();
        assertThat(fakeRedis.commands()).isEmpty();
    }
}
