package com.acme.taskmanager.task;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskQueryTest {

    @Test
    void equivalentFiltersShareAFingerprint() {
        TaskQuery a = TaskQuery.of("  Milk ", "TRUE", "2", null, null);
        TaskQuery b = TaskQuery.of("milk", "true", " 2", "", " ");

        assertThat(a).isEqualTo(b);
        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
        assertThat(a.canonical()).isEqualTo("completed=true&priority=2&search=milk");
    }

    @Test
    void differentFiltersDoNotCollide() {
        assertThat(TaskQuery.of("milk", null, null, null, null).fingerprint())
                .isNotEqualTo(TaskQuery.of("milk", "false", null, null, null).fingerprint())
                .isNotEqualTo(TaskQuery.all().fingerprint());
        assertThat(TaskQuery.of(null, null, null, "0", null).fingerprint())
                .isNotEqualTo(TaskQuery.all().fingerprint());
    }

    @Test
    void blankSearchIsNoFilter() {
        TaskQuery query = TaskQuery.of("   ", null, null, null, null);

        assertThat(query.search()).isNull();
        assertThat(query).isEqualTo(TaskQuery.all());
        assertThat(query.canonical()).isEmpty();
        assertThat(query.fingerprint()).hasSize(32);
    }

    @Test
    void searchIsEncodedInCanonicalForm() {
        assertThat(TaskQuery.of("a&b=c d", null, null, null, null).canonical()).isEqualTo("search=a%26b%3Dc+d");
    }

    @Test
    void pagingDefaultsApplyWhenEitherParameterIsGiven() {
        TaskQuery pageOnly = TaskQuery.of(null, null, null, "3", null);
        assertThat(pageOnly.page()).isEqualTo(3);
        assertThat(pageOnly.size()).isEqualTo(TaskQuery.DEFAULT_PAGE_SIZE);
        assertThat(pageOnly.paged()).isTrue();

        TaskQuery sizeOnly = TaskQuery.of(null, null, null, null, "5");
        assertThat(sizeOnly.page()).isZero();
        assertThat(sizeOnly.size()).isEqualTo(5);

        assertThat(TaskQuery.all().paged()).isFalse();
    }

    @Test
    void rejectsMalformedFilters() {
        assertThatThrownBy(() -> TaskQuery.of(null, "yes", null, null, null))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageContaining("completed");
        assertThatThrownBy(() -> TaskQuery.of(null, null, "4", null, null))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageContaining("priority");
        assertThatThrownBy(() -> TaskQuery.of(null, null, "high", null, null))
                .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> TaskQuery.of(null, null, null, "-1", null))
                .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> TaskQuery.of(null, null, null, null, "101"))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageContaining("size");
    }
}
