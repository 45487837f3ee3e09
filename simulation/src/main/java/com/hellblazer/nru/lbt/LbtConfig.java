/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the NR-U BWP Manager.
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
package com.hellblazer.nru.lbt;

import com.hellblazer.nru.common.SimTime;

/**
 * Listen-Before-Talk parameters. Durations other than the slot length are expressed in slots.
 *
 * @author hal.hildebrand
 */
public class LbtConfig {

    private final int  cwMin;
    private final int  cwMax;
    private final int  iccaDuration;
    private final int  mcotDuration;
    private final long slotDuration;

    private LbtConfig(Builder builder) {
        this.cwMin = builder.cwMin;
        this.cwMax = builder.cwMax;
        this.iccaDuration = builder.iccaDuration;
        this.mcotDuration = builder.mcotDuration;
        this.slotDuration = builder.slotDuration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 3GPP category 4 defaults: CW 8..128, 1 slot ICCA, 5 slot MCOT, 0.5 ms slots.
     */
    public static LbtConfig defaultConfig() {
        return builder().build();
    }

    /**
     * @return minimum contention window in slots
     */
    public int getCwMin() {
        return cwMin;
    }

    /**
     * @return maximum contention window in slots
     */
    public int getCwMax() {
        return cwMax;
    }

    /**
     * @return initial clear channel assessment defer duration in slots
     */
    public int getIccaDuration() {
        return iccaDuration;
    }

    /**
     * @return maximum channel occupancy time in slots
     */
    public int getMcotDuration() {
        return mcotDuration;
    }

    /**
     * @return slot length in nanoseconds
     */
    public long getSlotDuration() {
        return slotDuration;
    }

    public static class Builder {
        private int  cwMin        = 8;
        private int  cwMax        = 128;
        private int  iccaDuration = 1;
        private int  mcotDuration = 5;
        private long slotDuration = SimTime.millis(0.5);

        private Builder() {
        }

        public Builder withContentionWindow(int min, int max) {
            if (min < 1) {
                throw new IllegalArgumentException("Minimum contention window must be positive: " + min);
            }
            if (max < min) {
                throw new IllegalArgumentException("Maximum contention window " + max + " below minimum " + min);
            }
            this.cwMin = min;
            this.cwMax = max;
            return this;
        }

        public Builder withIccaDuration(int slots) {
            if (slots < 0) {
                throw new IllegalArgumentException("ICCA duration must be non-negative: " + slots);
            }
            this.iccaDuration = slots;
            return this;
        }

        public Builder withMcotDuration(int slots) {
            if (slots < 1) {
                throw new IllegalArgumentException("MCOT duration must be positive: " + slots);
            }
            this.mcotDuration = slots;
            return this;
        }

        public Builder withSlotDuration(long nanos) {
            if (nanos <= 0) {
                throw new IllegalArgumentException("Slot duration must be positive: " + nanos);
            }
            this.slotDuration = nanos;
            return this;
        }

        public LbtConfig build() {
            return new LbtConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("LbtConfig[cw=%d..%d, icca=%d, mcot=%d, slot=%dns]", cwMin, cwMax, iccaDuration,
                             mcotDuration, slotDuration);
    }
}
