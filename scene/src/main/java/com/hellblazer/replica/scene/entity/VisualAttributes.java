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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renderable attributes of a visual. The replica does not interpret them; it only stores and merges them for the
 * renderer.
 * <p>
 * Every field is optional. A {@code null} mesh, material or visibility in an update leaves the current value in
 * place; properties are merged key by key.
 *
 * @param mesh       mesh resource reference, or null
 * @param material   material resource reference, or null
 * @param visible    visibility flag, or null when unspecified
 * @param properties free-form renderer properties
 * @author hal.hildebrand
 */
public record VisualAttributes(String mesh, String material, Boolean visible, Map<String, String> properties) {

    public static final VisualAttributes EMPTY = new VisualAttributes(null, null, null, Map.of());

    public VisualAttributes {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static VisualAttributes ofMesh(String mesh) {
        return new VisualAttributes(mesh, null, null, Map.of());
    }

    /**
     * Fold an update into these attributes.
     *
     * @param update newer attributes
     * @return the merged attributes
     */
    public VisualAttributes mergedWith(VisualAttributes update) {
        if (update == null) {
            return this;
        }
        var mergedProperties = new LinkedHashMap<>(properties);
        mergedProperties.putAll(update.properties);
        return new VisualAttributes(update.mesh != null ? update.mesh : mesh,
                                    update.material != null ? update.material : material,
                                    update.visible != null ? update.visible : visible, mergedProperties);
    }

    /**
     * @return the visibility flag, visible when never specified
     */
    public boolean isVisible() {
        return visible == null || visible;
    }
}
