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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SceneConfig defaults and builder validation.
 *
 * @author hal.hildebrand
 */
public class SceneConfigTest {

    @Test
    public void testDefaults() {
        var config = SceneConfig.defaults();

        assertEquals(0, config.getStagedPoseTtlCycles(), "Staged poses retried forever by default");
        assertFalse(config.isMergeLightUpdates(), "Lights are create-only by default");
        assertTrue(config.isRequestStateOnInitialize());
        assertEquals(16, config.getCyclePeriodMs());
    }

    @Test
    public void testBuilder() {
        var config = SceneConfig.builder()
                                .withStagedPoseTtlCycles(30)
                                .withMergeLightUpdates(true)
                                .withRequestStateOnInitialize(false)
                                .withCyclePeriodMs(5)
                                .build();

        assertEquals(30, config.getStagedPoseTtlCycles());
        assertTrue(config.isMergeLightUpdates());
        assertFalse(config.isRequestStateOnInitialize());
        assertEquals(5, config.getCyclePeriodMs());
    }

    @Test
    public void testValidation() {
        var builder = SceneConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withStagedPoseTtlCycles(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withCyclePeriodMs(0));
    }
}
