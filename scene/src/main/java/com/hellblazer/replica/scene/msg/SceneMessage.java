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

import javax.vecmath.Color4f;
import java.util.List;

/**
 * Full or partial scene state in one message, typically the answer to a {@link PublishRequest}. Its parts are
 * fanned out to the visual, pose and light mailboxes on receipt.
 *
 * @param visuals visual messages in application order
 * @param poses   pose messages in application order
 * @param lights  light messages in application order
 * @param ambient ambient light color, or null to leave it unchanged
 * @author hal.hildebrand
 */
public record SceneMessage(List<VisualMessage> visuals, List<PoseMessage> poses, List<LightMessage> lights,
                           Color4f ambient) implements InboundMessage {

    public SceneMessage {
        visuals = visuals == null ? List.of() : List.copyOf(visuals);
        poses = poses == null ? List.of() : List.copyOf(poses);
        lights = lights == null ? List.of() : List.copyOf(lights);
        ambient = ambient == null ? null : new Color4f(ambient);
    }

    @Override
    public Color4f ambient() {
        return ambient == null ? null : new Color4f(ambient);
    }

    @Override
    public void validate() {
        if (ambient != null && !(Float.isFinite(ambient.x) && Float.isFinite(ambient.y) && Float.isFinite(ambient.z)
                                 && Float.isFinite(ambient.w))) {
            throw new MalformedMessageException("Scene message with non-finite ambient color");
        }
    }
}
