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
 * Live, mutable light owned by the {@link EntityRegistry}.
 *
 * @author hal.hildebrand
 */
final class LightEntity {
    private final String          id;
    private       LightParameters parameters;

    LightEntity(String id, LightParameters parameters) {
        this.id = id;
        this.parameters = parameters;
    }

    LightParameters parameters() {
        return parameters;
    }

    void merge(LightParameters update) {
        parameters = parameters.mergedWith(update);
    }

    Light snapshot() {
        return new Light(id, parameters);
    }
}
