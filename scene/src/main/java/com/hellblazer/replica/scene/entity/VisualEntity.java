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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live, mutable visual owned by the {@link EntityRegistry}. Children are held by identifier only; the registry is
 * the sole owner of every entity.
 *
 * @author hal.hildebrand
 */
final class VisualEntity {
    private final String           id;
    private final String           parentId;
    private final Set<String>      children = new LinkedHashSet<>();
    private       Pose             pose     = Pose.IDENTITY;
    private       VisualAttributes attributes;

    VisualEntity(String id, String parentId, VisualAttributes attributes) {
        this.id = id;
        this.parentId = parentId;
        this.attributes = attributes == null ? VisualAttributes.EMPTY : attributes;
    }

    String id() {
        return id;
    }

    String parentId() {
        return parentId;
    }

    Set<String> children() {
        return children;
    }

    Pose pose() {
        return pose;
    }

    void setPose(Pose pose) {
        this.pose = pose;
    }

    VisualAttributes attributes() {
        return attributes;
    }

    void merge(VisualAttributes update) {
        attributes = attributes.mergedWith(update);
    }

    Visual snapshot() {
        return new Visual(id, parentId, new ArrayList<>(children), pose, attributes);
    }
}
