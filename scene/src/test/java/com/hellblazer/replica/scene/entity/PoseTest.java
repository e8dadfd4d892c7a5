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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Pose value semantics.
 *
 * @author hal.hildebrand
 */
public class PoseTest {

    @Test
    public void testCopiesAreIsolated() {
        var position = new Point3f(1, 2, 3);
        var pose = new Pose(position, new Quat4f(0, 0, 0, 1));

        position.x = 99;
        pose.position().y = 99;

        assertEquals(new Point3f(1, 2, 3), pose.position());
    }

    @Test
    public void testFiniteCheck() {
        assertTrue(Pose.at(1, 2, 3).isFinite());
        assertFalse(Pose.at(Float.NaN, 0, 0).isFinite());
        assertFalse(new Pose(new Point3f(), new Quat4f(0, 0, Float.POSITIVE_INFINITY, 1)).isFinite());
    }

    @Test
    public void testEquality() {
        assertEquals(Pose.at(0, 0, 0), Pose.IDENTITY);
        assertNotEquals(Pose.at(0, 0, 1), Pose.IDENTITY);
    }
}
