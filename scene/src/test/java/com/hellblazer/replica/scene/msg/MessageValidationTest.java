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
package com.hellblazer.replica.scene.msg;

import com.hellblazer.replica.scene.entity.LightParameters;
import com.hellblazer.replica.scene.entity.Pose;
import com.hellblazer.replica.scene.entity.VisualAttributes;
import org.junit.jupiter.api.Test;

import javax.vecmath.Color4f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for inbound message validation and defaults.
 *
 * @author hal.hildebrand
 */
public class MessageValidationTest {

    @Test
    public void testVisualDefaults() {
        var message = new VisualMessage("v", null, null, null);

        assertEquals(VisualMessage.Action.UPDATE, message.action());
        assertEquals(VisualAttributes.EMPTY, message.attributes());
        assertFalse(message.isDelete());
        assertDoesNotThrow(message::validate);
    }

    @Test
    public void testVisualWithoutIdentifier() {
        assertThrows(MalformedMessageException.class, () -> VisualMessage.update(null).validate());
        assertThrows(MalformedMessageException.class, () -> VisualMessage.delete("  ").validate());
    }

    @Test
    public void testVisualCannotParentItself() {
        assertThrows(MalformedMessageException.class,
                     () -> VisualMessage.update("v", "v", VisualAttributes.EMPTY).validate());
    }

    @Test
    public void testPoseValidation() {
        assertDoesNotThrow(() -> new PoseMessage("v", Pose.at(1, 2, 3)).validate());
        assertThrows(MalformedMessageException.class, () -> new PoseMessage("v", null).validate());
        assertThrows(MalformedMessageException.class, () -> new PoseMessage("", Pose.IDENTITY).validate());
        assertThrows(MalformedMessageException.class,
                     () -> new PoseMessage("v", Pose.at(Float.NaN, 0, 0)).validate());
    }

    @Test
    public void testLightValidation() {
        var point = LightParameters.of(LightParameters.LightType.POINT, null);
        assertDoesNotThrow(() -> new LightMessage("l", point).validate());
        assertThrows(MalformedMessageException.class, () -> new LightMessage("l", null).validate());
        assertThrows(MalformedMessageException.class,
                     () -> new LightMessage("l", new LightParameters(null, null, null, false)).validate());
    }

    @Test
    public void testSelectionTarget() {
        assertEquals("v", SelectionMessage.of("v").target().orElseThrow());
        assertTrue(SelectionMessage.none().target().isEmpty());
        assertTrue(SelectionMessage.of(" ").target().isEmpty());
        assertDoesNotThrow(() -> SelectionMessage.of(null).validate());
    }

    @Test
    public void testSceneMessageAmbient() {
        var scene = new SceneMessage(null, null, null, new Color4f(0.2f, 0.2f, 0.2f, 1f));
        assertTrue(scene.visuals().isEmpty());
        assertDoesNotThrow(scene::validate);

        var bad = new SceneMessage(List.of(), List.of(), List.of(), new Color4f(Float.NaN, 0, 0, 1));
        assertThrows(MalformedMessageException.class, bad::validate);
    }

    @Test
    public void testMalformedIsIllegalArgument() {
        assertInstanceOf(IllegalArgumentException.class, new MalformedMessageException("x"));
    }
}
