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

import javax.vecmath.Color4f;

/**
 * Parameters of a light source, carried through to the renderer unchanged.
 *
 * @param type        kind of light
 * @param diffuse     diffuse color, or null for the renderer default
 * @param attenuation distance falloff, or null for the renderer default
 * @param castShadows whether the light casts shadows
 * @author hal.hildebrand
 */
public record LightParameters(LightType type, Color4f diffuse, Attenuation attenuation, boolean castShadows) {

    public enum LightType {
        POINT, SPOT, DIRECTIONAL
    }

    /**
     * Constant, linear and quadratic falloff terms, clipped at {@code range}.
     */
    public record Attenuation(float range, float constant, float linear, float quadratic) {
    }

    public LightParameters {
        diffuse = diffuse == null ? null : new Color4f(diffuse);
    }

    public static LightParameters of(LightType type, Color4f diffuse) {
        return new LightParameters(type, diffuse, null, false);
    }

    @Override
    public Color4f diffuse() {
        return diffuse == null ? null : new Color4f(diffuse);
    }

    /**
     * Fold an update into these parameters. Type and shadow flag are taken from the update; color and attenuation
     * are only replaced when the update carries them.
     */
    public LightParameters mergedWith(LightParameters update) {
        if (update == null) {
            return this;
        }
        return new LightParameters(update.type != null ? update.type : type,
                                   update.diffuse != null ? update.diffuse : diffuse,
                                   update.attenuation != null ? update.attenuation : attenuation, update.castShadows);
    }
}
