package com.arbor.hierarchy.domain.services;

import static org.assertj.core.api.Assertions.assertThat;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.testing.HierarchyTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CycleGuard")
class CycleGuardTest {

    private HierarchyTestFixture fx;
    private CycleGuard guard;
    private Node root;
    private Node a;
    private Node b;
    private Node c;
    private Node sibling;

    @BeforeEach
    void setUp() {
        fx = new HierarchyTestFixture();
        guard = new CycleGuard(fx.store);
        root = fx.root("R");
        a = fx.child(root, "A");
        b = fx.child(a, "B");
        c = fx.child(b, "C");
        sibling = fx.child(root, "S");
    }

    @Test
    @DisplayName("the node itself would be a cycle")
    void selfIsCycle() {
        assertThat(guard.wouldCycle(root.tenantId(), a.id(), a.id())).isTrue();
    }

    @Test
    @DisplayName("any descendant would be a cycle")
    void descendantsAreCycles() {
        assertThat(guard.wouldCycle(root.tenantId(), b.id(), a.id())).isTrue();
        assertThat(guard.wouldCycle(root.tenantId(), c.id(), a.id())).isTrue();
    }

    @Test
    @DisplayName("ancestors and unrelated nodes are safe")
    void othersAreSafe() {
        assertThat(guard.wouldCycle(root.tenantId(), sibling.id(), a.id())).isFalse();
        assertThat(guard.wouldCycle(root.tenantId(), root.id(), c.id())).isFalse();
        assertThat(guard.wouldCycle(root.tenantId(), a.id(), c.id())).isFalse();
    }

    @Test
    @DisplayName("ignores retired descendants")
    void ignoresRetired() {
        fx.engine.delete(root.tenantId(), c.id(), HierarchyTestFixture.ACTOR);

        assertThat(guard.wouldCycle(root.tenantId(), c.id(), a.id())).isFalse();
    }

    @Test
    @DisplayName("terminates on a parent loop already present in the data")
    void terminatesOnCorruptLoop() {
        // a -> b -> c and, corrupted, c -> a
        fx.store.update(a.withPosition(c.id(), a.position(), "corruptor", HierarchyTestFixture.NOW));

        assertThat(guard.wouldCycle(root.tenantId(), sibling.id(), a.id())).isFalse();
        assertThat(guard.wouldCycle(root.tenantId(), c.id(), a.id())).isTrue();
    }
}
