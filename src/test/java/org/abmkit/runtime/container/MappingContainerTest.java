package org.abmkit.runtime.container;

import org.abmkit.runtime.api.DuplicateIdException;
import org.abmkit.runtime.testing.TestAgents.Plain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MappingContainerTest {

    private MappingContainer<Plain> container;

    @BeforeEach
    void setUp() {
        container = new MappingContainer<>();
    }

    @Test
    void keepsInsertionOrderForArbitraryIds() {
        container.add(new Plain(7));
        container.add(new Plain(2));
        container.add(new Plain(5));

        assertThat(container.ids().toIntArray()).containsExactly(7, 2, 5);
        assertThat(container.agents()).extracting(Plain::getId).containsExactly(7, 2, 5);
    }

    @Test
    void duplicateIdIsRejectedWithoutChange() {
        Plain original = new Plain(3);
        container.add(original);

        assertThatThrownBy(() -> container.add(new Plain(3)))
                .isInstanceOf(DuplicateIdException.class)
                .hasMessageContaining("id=3");
        assertThat(container.size()).isEqualTo(1);
        assertThat(container.get(3)).isSameAs(original);
    }

    @Test
    void nonPositiveIdsAreRejected() {
        assertThatThrownBy(() -> container.add(new Plain(0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> container.add(new Plain(-4))).isInstanceOf(IllegalArgumentException.class);
        assertThat(container.size()).isZero();
    }

    @Test
    void nextIdStaysAboveRemovedIds() {
        Plain a = new Plain(1);
        Plain b = new Plain(9);
        container.add(a);
        container.add(b);
        container.remove(b);

        assertThat(container.nextId()).isEqualTo(10);
        assertThat(container.getMaxId()).isEqualTo(9);
        assertThat(container.contains(9)).isFalse();
    }

    @Test
    void manuallyRecycledIdIsNotPrevented() {
        // Documents current behaviour; reusing ids is discouraged.
        Plain b = new Plain(2);
        container.add(b);
        container.remove(b);
        container.add(new Plain(2));

        assertThat(container.contains(2)).isTrue();
    }
}
