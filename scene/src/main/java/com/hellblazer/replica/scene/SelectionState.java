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
import com.hellblazer.replica.scene.msg.SelectionMessage;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single selected visual, if any.
 * <p>
 * Selection messages are not queued: {@link #offer(SelectionMessage)} keeps only the latest one until the next
 * {@link #resolve(EntityRegistry)}. Resolving selects the target if it is registered and selects nothing otherwise,
 * so an unknown target never leaves a stale selection behind. A selected visual that has since been removed is
 * deselected by the next resolve as well.
 *
 * @author hal.hildebrand
 */
public class SelectionState {

    private final AtomicReference<SelectionMessage> pending = new AtomicReference<>();
    private volatile String                         selected;

    /**
     * Record the latest selection request. Safe to call from any thread.
     */
    public void offer(SelectionMessage message) {
        pending.set(message);
    }

    /**
     * Fold the pending selection into the current one. Called by the reconciling thread.
     *
     * @param registry registry to resolve the target against
     * @return true if the selected visual changed
     */
    public boolean resolve(EntityRegistry registry) {
        var previous = selected;
        var message = pending.getAndSet(null);
        String next;
        if (message != null) {
            next = message.target().filter(registry::containsVisual).orElse(null);
        } else if (previous != null && !registry.containsVisual(previous)) {
            next = null;
        } else {
            return false;
        }
        selected = next;
        return previous == null ? next != null : !previous.equals(next);
    }

    public Optional<String> current() {
        return Optional.ofNullable(selected);
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    public void clear() {
        pending.set(null);
        selected = null;
    }
}
