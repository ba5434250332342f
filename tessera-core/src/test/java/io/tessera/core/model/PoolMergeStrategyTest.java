package io.tessera.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import io.tessera.core.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class PoolMergeStrategyTest {

    @Test
    void shouldSumSlots() {
        var merged = PoolMergeStrategy.SUM.merge(new Pool("p1", 2), new Pool("p1", 3));

        assertThat(merged).isEqualTo(new Pool("p1", 5));
    }

    @Test
    void shouldKeepLargerSlotCount() {
        var merged = PoolMergeStrategy.MAX.merge(new Pool("p1", 4), new Pool("p1", 3));

        assertThat(merged.slots()).isEqualTo(4);
    }

    @Test
    void shouldReplaceSlotCount() {
        var merged = PoolMergeStrategy.REPLACE.merge(new Pool("p1", 4), new Pool("p1", 1));

        assertThat(merged.slots()).isEqualTo(1);
    }

    @ParameterizedTest
    @EnumSource(PoolMergeStrategy.class)
    void shouldReturnExistingPoolWhenEqual(PoolMergeStrategy strategy) {
        var existing = new Pool("p1", 2, "etl");

        assertThat(strategy.merge(existing, new Pool("p1", 2, "etl"))).isSameAs(existing);
    }

    @Test
    void shouldKeepExistingDescriptionUnlessBlank() {
        var kept =
                PoolMergeStrategy.SUM.merge(new Pool("p1", 1, "first"), new Pool("p1", 1, "second"));
        var filled = PoolMergeStrategy.SUM.merge(new Pool("p1", 1), new Pool("p1", 1, "second"));

        assertThat(kept.description()).isEqualTo("first");
        assertThat(filled.description()).isEqualTo("second");
    }

    @Test
    void shouldRejectDifferentNames() {
        assertThatThrownBy(() -> PoolMergeStrategy.SUM.merge(new Pool("a", 1), new Pool("b", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cannot merge pool 'b' into 'a'");
    }

    @Test
    void shouldRejectNegativeSlots() {
        assertThatThrownBy(() -> new Pool("p1", -1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("must not be negative");
    }

    @Test
    void shouldExposeSettingsRecord() {
        assertThat(new Pool("p1", 5, "etl").toSettings())
                .containsExactly(
                        entry("pool_name", "p1"),
                        entry("pool_slot", 5),
                        entry("pool_description", "etl"));
    }
}
