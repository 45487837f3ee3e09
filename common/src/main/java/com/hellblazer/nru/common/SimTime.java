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
package com.hellblazer.nru.common;

/**
 * Simulated time units. All simulated timestamps are nanoseconds held in a {@code long}.
 *
 * @author hal.hildebrand
 */
public final class SimTime {

    public static final long NANOS_PER_MICRO  = 1_000L;
    public static final long NANOS_PER_MILLI  = 1_000_000L;
    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private SimTime() {
    }

    public static long millis(double ms) {
        return Math.round(ms * NANOS_PER_MILLI);
    }

    public static long seconds(double s) {
        return Math.round(s * NANOS_PER_SECOND);
    }

    /**
     * Duration of a number of slots.
     *
     * @param slots        slot count
     * @param slotDuration duration of one slot in nanoseconds
     * @return total duration in nanoseconds
     */
    public static long slots(long slots, long slotDuration) {
        return Math.multiplyExact(slots, slotDuration);
    }

    public static double toSeconds(long nanos) {
        return nanos / (double) NANOS_PER_SECOND;
    }

    public static double toMillis(long nanos) {
        return nanos / (double) NANOS_PER_MILLI;
    }
}
