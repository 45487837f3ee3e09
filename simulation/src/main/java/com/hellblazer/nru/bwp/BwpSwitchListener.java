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
package com.hellblazer.nru.bwp;

/**
 * Link layer notification of a completed BWP switch, delivered after the configured switch latency.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface BwpSwitchListener {

    BwpSwitchListener NONE = (ueId, subbandId, time) -> {
    };

    /**
     * @param ueId      device that switched
     * @param subbandId sub-band the device now uses
     * @param time      simulated time of the notification in nanoseconds
     */
    void bwpSwitched(int ueId, int subbandId, long time);
}
