package com.upgradeguard.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LegacyExceptionSet")
class LegacyExceptionSetTest {

    @Test
    @DisplayName("flattens groups and collapses duplicates")
    void flattensGroups() {
        var exceptions =
                LegacyExceptionSet.fromGroups(
                        List.of(
                                new LegacyExceptionGroup(
                                        "removed", "social_django", List.of("0001", "0002")),
                                new LegacyExceptionGroup(
                                        "overlap", "social_django", List.of("0002"))));

        assertThat(exceptions.size()).isEqualTo(2);
        assertThat(exceptions.groups()).hasSize(2);
        assertThat(exceptions.contains(MigrationId.of("social_django", "0002"))).isTrue();
    }

    @Test
    @DisplayName("merge combines groups and ids")
    void mergeCombines() {
        var first = LegacyExceptionSet.of(MigrationId.of("a", "0001"));
        var second =
                LegacyExceptionSet.fromGroups(
                        List.of(new LegacyExceptionGroup(null, "b", List.of("0001"))));

        var merged = first.merge(second);

        assertThat(merged.ids())
                .containsExactlyInAnyOrder(MigrationId.of("a", "0001"), MigrationId.of("b", "0001"));
        assertThat(merged.groups()).hasSize(1);
        assertThat(first.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("empty set exempts nothing")
    void emptyExemptsNothing() {
        assertThat(LegacyExceptionSet.empty().isEmpty()).isTrue();
        assertThat(LegacyExceptionSet.empty().contains(MigrationId.of("a", "0001"))).isFalse();
    }

    @Test
    @DisplayName("groups reject blank names")
    void groupsRejectBlankNames() {
        assertThatThrownBy(() -> new LegacyExceptionGroup("r", "a", List.of("0001", " ")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
