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

/**
 * Observer for visual lifecycle changes applied by the registry.
 * <p>
 * Callbacks run on the reconciling thread while the apply phase holds the scene's write lock; keep them short.
 *
 * @author hal.hildebrand
 */
public interface SceneChangeListener {

    /**
     * Called when a visual is created.
     *
     * @param visual snapshot of the new visual
     */
    default void onVisualAdded(Visual visual) {
    }

    /**
     * Called when a visual is deleted.
     *
     * @param visualId identifier of the removed visual
     */
    default void onVisualRemoved(String visualId) {
    }

    /**
     * Called when a pose is applied to a visual, whether directly or from staging.
     *
     * @param visualId identifier of the visual
     * @param oldPose  pose before the update
     * @param newPose  pose after the update
     */
    default void onVisualMoved(String visualId, Pose oldPose, Pose newPose) {
    }
}
