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
package com.hellblazer.nru.scheduler;

/**
 * Per sub-band statistics for one decision window.
 *
 * @param subbandId        sub-band id
 * @param capacity         resource blocks
 * @param activeCount      devices assigned
 * @param failureRate      smoothed LBT failure rate
 * @param occupancy        smoothed interference occupancy
 * @param contentionWindow current contention window in slots
 * @param avgBitsPerRb     bits per RB, smoothed across windows
 * @param windowBits       bits served during the window
 * @param windowCollisions LBT denials during the window
 * @author hal.hildebrand
 */
public record BwpStats(int subbandId, int capacity, int activeCount, double failureRate, double occupancy,
                       int contentionWindow, double avgBitsPerRb, double windowBits, long windowCollisions) {

    /**
     * Least-collision score: expected bits per slot the sub-band delivers once LBT failures are discounted.
     */
    public double score() {
        return (1.0 - failureRate) * avgBitsPerRb * capacity;
    }
}
