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
package com.hellblazer.replica.scene.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds poses that arrived before the visual they target.
 * <p>
 * At most one pose is staged per identifier: staging again replaces the earlier pose. Each call to
 * {@link #tryResolve(EntityRegistry)} is one resolve pass; staged poses whose visual now exists are applied and
 * unstaged, the rest stay staged. With a TTL of zero a staged pose is retried forever, otherwise it is evicted once
 * it has survived {@code ttlPasses} passes without resolving.
 * <p>
 * Not thread-safe; owned by the reconciling thread.
 *
 * @author hal.hildebrand
 */
public class PoseReconciler {
    private static final Logger log = LoggerFactory.getLogger(PoseReconciler.class);

    /**
     * Outcome of one resolve pass.
     *
     * @param resolved poses applied to a now-registered visual
     * @param evicted  poses dropped for exceeding the TTL
     */
    public record Resolution(int resolved, int evicted) {
        public static final Resolution NONE = new Resolution(0, 0);
    }

    private record StagedPose(Pose pose, long stagedAtPass) {
    }

    private final Map<String, StagedPose> staged = new LinkedHashMap<>();
    private final int                     ttlPasses;
    private       long                    passes;

    /**
     * Staged poses are retried forever.
     */
    public PoseReconciler() {
        this(0);
    }

    /**
     * @param ttlPasses number of resolve passes a staged pose survives, 0 for no expiry
     */
    public PoseReconciler(int ttlPasses) {
        if (ttlPasses < 0) {
            throw new IllegalArgumentException("TTL must be non-negative: " + ttlPasses);
        }
        this.ttlPasses = ttlPasses;
    }

    /**
     * Stage a pose for a visual that is not registered yet, superseding any pose already staged for it.
     *
     * @param visualId target visual
     * @param pose     pose to apply once the visual appears
     */
    public void stage(String visualId, Pose pose) {
        // remove first so iteration order follows the most recent write
        staged.remove(visualId);
        staged.put(visualId, new StagedPose(pose, passes));
    }

    /**
     * Drop the pose staged for a visual, if any.
     *
     * @param visualId target visual
     * @return true if a pose was staged
     */
    public boolean unstage(String visualId) {
        return staged.remove(visualId) != null;
    }

    /**
     * Apply every staged pose whose visual is now registered.
     *
     * @param registry registry to resolve against
     * @return counts of resolved and evicted poses
     */
    public Resolution tryResolve(EntityRegistry registry) {
        passes++;
        if (staged.isEmpty()) {
            return Resolution.NONE;
        }
        int resolved = 0;
        int evicted = 0;
        var iterator = staged.entrySet().iterator();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            if (registry.setPoseIfPresent(entry.getKey(), entry.getValue().pose())) {
                iterator.remove();
                resolved++;
            } else if (ttlPasses > 0 && passes - entry.getValue().stagedAtPass() >= ttlPasses) {
                log.debug("Evicting staged pose for {} after {} passes", entry.getKey(), ttlPasses);
                iterator.remove();
                evicted++;
            }
        }
        return new Resolution(resolved, evicted);
    }

    /**
     * @return the pose staged for the visual, if any
     */
    public Optional<Pose> staged(String visualId) {
        var entry = staged.get(visualId);
        return entry == null ? Optional.empty() : Optional.of(entry.pose());
    }

    public int size() {
        return staged.size();
    }

    public void clear() {
        staged.clear();
    }
}
