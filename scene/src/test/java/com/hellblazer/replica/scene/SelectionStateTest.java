/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Replica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.replica.scene;

import com.hellblazer.replica.scene.entity.EntityRegistry;
import com.hellblazer.replica.scene.entity.PoseReconciler;
import com.hellblazer.replica.scene.msg.SelectionMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SelectionState - lazy resolution of the selected visual.
 *
 * @author hal.hildebrand
 */
public class SelectionStateTest {

    private EntityRegistry registry;
    private SelectionState selection;

    @BeforeEach
    public void setup() {
        registry = new EntityRegistry(new PoseReconciler());
        selection = new SelectionState();
        registry.upsertVisual("a", null, null);
        registry.upsertVisual("b", null, null);
    }

    @Test
    public void testNothingPendingIsNoChange() {
        assertFalse(selection.resolve(registry));
        assertTrue(selection.current().isEmpty());
    }

    @Test
    public void testSelectKnownVisual() {
        selection.offer(SelectionMessage.of("a"));
        assertTrue(selection.hasPending());

        assertTrue(selection.resolve(registry));
        assertEquals("a", selection.current().orElseThrow());
        assertFalse(selection.hasPending(), "Pending selection is consumed");
    }

    @Test
    public void testReselectingSameVisualIsNoChange() {
        selection.offer(SelectionMessage.of("a"));
        selection.resolve(registry);
        selection.offer(SelectionMessage.of("a"));

        assertFalse(selection.resolve(registry));
        assertEquals("a", selection.current().orElseThrow());
    }

    @Test
    public void testUnknownTargetDeselects() {
        selection.offer(SelectionMessage.of("a"));
        selection.resolve(registry);

        selection.offer(SelectionMessage.of("missing"));

        assertTrue(selection.resolve(registry));
        assertTrue(selection.current().isEmpty());
    }

    @Test
    public void testSelectNone() {
        selection.offer(SelectionMessage.of("b"));
        selection.resolve(registry);
        selection.offer(SelectionMessage.none());

        assertTrue(selection.resolve(registry));
        assertTrue(selection.current().isEmpty());
    }

    @Test
    public void testLatestOfferWins() {
        selection.offer(SelectionMessage.of("a"));
        selection.offer(SelectionMessage.of("b"));

        selection.resolve(registry);

        assertEquals("b", selection.current().orElseThrow());
    }

    @Test
    public void testRemovedVisualDeselected() {
        selection.offer(SelectionMessage.of("a"));
        selection.resolve(registry);
        registry.removeVisual("a");

        assertTrue(selection.resolve(registry));
        assertTrue(selection.current().isEmpty());
    }

    @Test
    public void testClear() {
        selection.offer(SelectionMessage.of("a"));
        selection.resolve(registry);
        selection.offer(SelectionMessage.of("b"));

        selection.clear();

        assertTrue(selection.current().isEmpty());
        assertFalse(selection.hasPending());
    }
}
