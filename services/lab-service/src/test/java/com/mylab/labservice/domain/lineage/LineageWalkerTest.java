package com.mylab.labservice.domain.lineage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.sample.SampleMetadata;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LineageWalker")
class LineageWalkerTest {

    private final Map<UUID, DerivedSample> store = new HashMap<>();

    private DerivedSample node(UUID id, UUID supersedesId) {
        DerivedSample sample = new DerivedSample(id, UUID.randomUUID(), UUID.randomUUID(), "D-" + id, "node",
                null, ExecutionMode.PLATFORM, null, null, supersedesId, null, SampleMetadata.empty(),
                Lifecycle.ACTIVE, null, Instant.now());
        store.put(id, sample);
        return sample;
    }

    private Optional<DerivedSample> lookup(UUID id) {
        return Optional.ofNullable(store.get(id));
    }

    @Test
    @DisplayName("walks from the head back to the root")
    void walksToRoot() {
        DerivedSample root = node(UUID.randomUUID(), null);
        DerivedSample middle = node(UUID.randomUUID(), root.id());
        DerivedSample head = node(UUID.randomUUID(), middle.id());

        assertThat(LineageWalker.walkBack(head, this::lookup))
                .extracting(DerivedSample::id)
                .containsExactly(head.id(), middle.id(), root.id());
    }

    @Test
    @DisplayName("a root alone is its own lineage")
    void singleNode() {
        DerivedSample root = node(UUID.randomUUID(), null);

        assertThat(LineageWalker.walkBack(root, this::lookup)).containsExactly(root);
    }

    @Test
    @DisplayName("detects a revisited node")
    void detectsCycle() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        node(a, b);
        DerivedSample start = node(b, a);

        assertThatThrownBy(() -> LineageWalker.walkBack(start, this::lookup))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    @DisplayName("fails on a dangling predecessor pointer")
    void danglingPointer() {
        DerivedSample start = node(UUID.randomUUID(), UUID.randomUUID());

        assertThatThrownBy(() -> LineageWalker.walkBack(start, this::lookup))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing predecessor");
    }
}
