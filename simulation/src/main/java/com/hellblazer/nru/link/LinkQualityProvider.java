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
package com.hellblazer.nru.link;

/**
 * Per-device and per-sub-band link metrics supplied by the resource allocator and link quality estimator.
 * Unknown ids yield zero.
 *
 * @author hal.hildebrand
 */
public interface LinkQualityProvider {

    /**
     * @return packets waiting in the device's queue
     */
    int queueDepth(int ueId);

    /**
     * @return age of the head-of-line packet in milliseconds
     */
    double holDelay(int ueId);

    /**
     * @return throughput served to the device over the current window in Mbps
     */
    double throughput(int ueId);

    /**
     * @return the device's current achievable bits per resource block per slot
     */
    double bitsPerRb(int ueId);

    /**
     * @return smoothed packet delay of the device in milliseconds
     */
    double averageDelay(int ueId);

    /**
     * @return average bits per resource block per slot achievable on the sub-band
     */
    double subbandBitsPerRb(int subbandId);

    /**
     * Called once per decision window after the assignment decision. Window-scoped metrics restart from zero.
     *
     * @param now simulated time in nanoseconds
     */
    default void windowElapsed(long now) {
    }
}
