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

import java.util.Optional;

/**
 * Select a visual, or select nothing when the identifier is null or blank.
 *
 * @author hal.hildebrand
 */
public record SelectionMessage(String id) implements InboundMessage {

    private static final SelectionMessage NONE = new SelectionMessage(null);

    public static SelectionMessage none() {
        return NONE;
    }

    public static SelectionMessage of(String id) {
        return new SelectionMessage(id);
    }

    /**
     * @return the visual to select, empty for select-none
     */
    public Optional<String> target() {
        return id == null || id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    @Override
    public void validate() {
        // every selection is applicable; an unknown target deselects
    }
}
