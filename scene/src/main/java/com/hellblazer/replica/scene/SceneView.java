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

import com.hellblazer.replica.scene.entity.Light;
import com.hellblazer.replica.scene.entity.Visual;

import javax.vecmath.Color4f;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the reconciled scene. Every result is an immutable snapshot.
 *
 * @author hal.hildebrand
 */
public interface SceneView {

    Optional<Visual> lookupVisual(String visualId);

    Optional<Light> lookupLight(String lightId);

    /**
     * @return identifier of the selected visual, empty when nothing is selected
     */
    Optional<String> currentSelection();

    /**
     * @return visuals with no registered parent, in creation order
     */
    List<Visual> enumerateRoots();

    /**
     * @return registered children of the visual, empty if it is unknown
     */
    List<Visual> children(String visualId);

    /**
     * @return the ambient color last received, if any
     */
    Optional<Color4f> ambientColor();

    int visualCount();

    int lightCount();
}
