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

import java.util.Objects;

/**
 * Named, typed channel of the scene transport. Names starting with {@code ~/} are relative to the scene's
 * namespace.
 *
 * @param name    topic name
 * @param type    payload type
 * @param <M>     payload type
 * @author hal.hildebrand
 */
public record Topic<M>(String name, Class<M> type) {

    public static final Topic<SceneMessage>     SCENE         = new Topic<>("~/scene", SceneMessage.class);
    public static final Topic<VisualMessage>    VISUAL        = new Topic<>("~/visual", VisualMessage.class);
    public static final Topic<LightMessage>     LIGHT         = new Topic<>("~/light", LightMessage.class);
    public static final Topic<PoseMessage>      POSE          = new Topic<>("~/pose", PoseMessage.class);
    public static final Topic<SelectionMessage> SELECTION     = new Topic<>("~/selection", SelectionMessage.class);
    public static final Topic<PublishRequest>   PUBLISH_SCENE = new Topic<>("~/publish_scene", PublishRequest.class);

    public Topic {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
