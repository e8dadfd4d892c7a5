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
 * Construction-time configuration of a {@link SceneReplica}.
 *
 * @author hal.hildebrand
 */
public class SceneConfig {

    private final int     stagedPoseTtlCycles;
    private final boolean mergeLightUpdates;
    private final boolean requestStateOnInitialize;
    private final long    cyclePeriodMs;

    private SceneConfig(Builder builder) {
        this.stagedPoseTtlCycles = builder.stagedPoseTtlCycles;
        this.mergeLightUpdates = builder.mergeLightUpdates;
        this.requestStateOnInitialize = builder.requestStateOnInitialize;
        this.cyclePeriodMs = builder.cyclePeriodMs;
    }

    /**
     * @return configuration with every default
     */
    public static SceneConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of cycles a pose for an unknown visual stays staged, 0 meaning it is retried until the visual appears
     * or the scene shuts down.
     *
     * @return staged pose TTL in cycles
     */
    public int getStagedPoseTtlCycles() {
        return stagedPoseTtlCycles;
    }

    /**
     * Whether a light message for a known light merges its parameters. When false the first message for a light
     * wins and later ones are ignored.
     *
     * @return true if light updates are merged
     */
    public boolean isMergeLightUpdates() {
        return mergeLightUpdates;
    }

    /**
     * @return true if {@link SceneReplica#initialize(String)} asks the authority to publish the current state
     */
    public boolean isRequestStateOnInitialize() {
        return requestStateOnInitialize;
    }

    /**
     * @return period of the {@link CycleDriver} tick in milliseconds
     */
    public long getCyclePeriodMs() {
        return cyclePeriodMs;
    }

    @Override
    public String toString() {
        return String.format("SceneConfig{stagedPoseTtlCycles=%d, mergeLightUpdates=%s, requestState=%s, period=%dms}",
                             stagedPoseTtlCycles, mergeLightUpdates, requestStateOnInitialize, cyclePeriodMs);
    }

    public static class Builder {
        private int     stagedPoseTtlCycles      = 0;
        private boolean mergeLightUpdates        = false;
        private boolean requestStateOnInitialize = true;
        private long    cyclePeriodMs            = 16;

        private Builder() {
        }

        /**
         * @param cycles cycles a staged pose survives, 0 for no expiry
         * @return this builder instance
         * @throws IllegalArgumentException if cycles is negative
         */
        public Builder withStagedPoseTtlCycles(int cycles) {
            if (cycles < 0) {
                throw new IllegalArgumentException("Staged pose TTL must be non-negative");
            }
            this.stagedPoseTtlCycles = cycles;
            return this;
        }

        public Builder withMergeLightUpdates(boolean merge) {
            this.mergeLightUpdates = merge;
            return this;
        }

        public Builder withRequestStateOnInitialize(boolean request) {
            this.requestStateOnInitialize = request;
            return this;
        }

        /**
         * @param periodMs tick period in milliseconds
         * @return this builder instance
         * @throws IllegalArgumentException if the period is not positive
         */
        public Builder withCyclePeriodMs(long periodMs) {
            if (periodMs <= 0) {
                throw new IllegalArgumentException("Cycle period must be positive");
            }
            this.cyclePeriodMs = periodMs;
            return this;
        }

        public SceneConfig build() {
            return new SceneConfig(this);
        }
    }
}
