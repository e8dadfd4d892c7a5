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

/**
 * What one reconciliation cycle did.
 *
 * @param cycle            cycle number, starting at 1
 * @param visualsCreated   visuals created
 * @param visualsUpdated   existing visuals whose attributes were merged
 * @param visualsRemoved   visuals deleted
 * @param lightsCreated    lights created
 * @param lightsUpdated    existing lights whose parameters were merged
 * @param lightsIgnored    light messages for known lights left unapplied
 * @param posesApplied     poses applied directly
 * @param posesStaged      poses staged because their visual was unknown
 * @param posesResolved    staged poses applied this cycle
 * @param posesEvicted     staged poses dropped for exceeding their TTL
 * @param pendingPoses     poses still staged after the cycle
 * @param rejected         malformed messages dropped
 * @param selectionChanged whether the selected visual changed
 * @author hal.hildebrand
 */
public record CycleReport(long cycle, int visualsCreated, int visualsUpdated, int visualsRemoved, int lightsCreated,
                          int lightsUpdated, int lightsIgnored, int posesApplied, int posesStaged, int posesResolved,
                          int posesEvicted, int pendingPoses, int rejected, boolean selectionChanged) {

    /**
     * @return true if the cycle applied, staged or dropped anything
     */
    public boolean hasActivity() {
        return visualsCreated + visualsUpdated + visualsRemoved + lightsCreated + lightsUpdated + lightsIgnored
               + posesApplied + posesStaged + posesResolved + posesEvicted + rejected > 0 || selectionChanged;
    }

    static final class Tally {
        int     visualsCreated;
        int     visualsUpdated;
        int     visualsRemoved;
        int     lightsCreated;
        int     lightsUpdated;
        int     lightsIgnored;
        int     posesApplied;
        int     posesStaged;
        int     posesResolved;
        int     posesEvicted;
        int     rejected;
        boolean selectionChanged;

        CycleReport toReport(long cycle, int pendingPoses) {
            return new CycleReport(cycle, visualsCreated, visualsUpdated, visualsRemoved, lightsCreated,
                                   lightsUpdated, lightsIgnored, posesApplied, posesStaged, posesResolved,
                                   posesEvicted, pendingPoses, rejected, selectionChanged);
        }
    }
}
