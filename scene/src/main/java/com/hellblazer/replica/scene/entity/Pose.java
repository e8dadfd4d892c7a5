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

import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import java.util.Objects;

/**
 * Position and orientation of a visual relative to its parent.
 * <p>
 * The vecmath tuples are mutable, so both are copied on the way in and on the way out.
 *
 * @param position    translation
 * @param orientation rotation quaternion (x, y, z, w)
 * @author hal.hildebrand
 */
public record Pose(Point3f position, Quat4f orientation) {

    /**
     * Origin, no rotation. Newly created visuals start here until a pose arrives.
     */
    public static final Pose IDENTITY = new Pose(new Point3f(0f, 0f, 0f), new Quat4f(0f, 0f, 0f, 1f));

    public Pose {
        Objects.requireNonNull(position, "position cannot be null");
        Objects.requireNonNull(orientation, "orientation cannot be null");
        position = new Point3f(position);
        orientation = new Quat4f(orientation);
    }

    /**
     * Pose at the given position with no rotation.
     */
    public static Pose at(float x, float y, float z) {
        return new Pose(new Point3f(x, y, z), new Quat4f(0f, 0f, 0f, 1f));
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    @Override
    public Quat4f orientation() {
        return new Quat4f(orientation);
    }

    /**
     * @return true if every component is a finite number
     */
    public boolean isFinite() {
        return Float.isFinite(position.x) && Float.isFinite(position.y) && Float.isFinite(position.z)
               && Float.isFinite(orientation.x) && Float.isFinite(orientation.y) && Float.isFinite(orientation.z)
               && Float.isFinite(orientation.w);
    }

    @Override
    public String toString() {
        return String.format("Pose{pos=(%.3f, %.3f, %.3f), rot=(%.3f, %.3f, %.3f, %.3f)}", position.x, position.y,
                             position.z, orientation.x, orientation.y, orientation.z, orientation.w);
    }
}
