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

import java.util.List;

/**
 * Immutable snapshot of a visual, safe to hold after the read that produced it.
 *
 * @param id         visual identifier
 * @param parentId   identifier of the parent the visual was attached to, or null for the scene root
 * @param children   child identifiers in attachment order
 * @param pose       pose at the time of the snapshot
 * @param attributes renderable attributes
 * @author hal.hildebrand
 */
public record Visual(String id, String parentId, List<String> children, Pose pose, VisualAttributes attributes) {

    public Visual {
        children = List.copyOf(children);
    }
}
