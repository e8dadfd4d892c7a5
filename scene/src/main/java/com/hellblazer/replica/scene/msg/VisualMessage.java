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

import com.hellblazer.replica.scene.entity.VisualAttributes;

/**
 * Create, update or delete a visual.
 *
 * @param id         visual identifier
 * @param parentId   requested parent, null for the scene root
 * @param action     what to do with the visual; null is read as {@link Action#UPDATE}
 * @param attributes renderable attributes; null is read as empty
 * @author hal.hildebrand
 */
public record VisualMessage(String id, String parentId, Action action, VisualAttributes attributes)
implements InboundMessage {

    public enum Action {
        UPDATE, DELETE
    }

    public VisualMessage {
        action = action == null ? Action.UPDATE : action;
        attributes = attributes == null ? VisualAttributes.EMPTY : attributes;
    }

    public static VisualMessage update(String id, String parentId, VisualAttributes attributes) {
        return new VisualMessage(id, parentId, Action.UPDATE, attributes);
    }

    public static VisualMessage update(String id) {
        return new VisualMessage(id, null, Action.UPDATE, VisualAttributes.EMPTY);
    }

    public static VisualMessage delete(String id) {
        return new VisualMessage(id, null, Action.DELETE, VisualAttributes.EMPTY);
    }

    public boolean isDelete() {
        return action == Action.DELETE;
    }

    @Override
    public void validate() {
        InboundMessage.requireId(id, "Visual");
        if (id.equals(parentId)) {
            throw new MalformedMessageException("Visual " + id + " cannot be its own parent");
        }
    }
}
