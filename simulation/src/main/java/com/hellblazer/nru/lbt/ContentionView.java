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

/**
 * Read-only statistics of the per-sub-band contention state. Unknown ids yield defaults, never errors.
 *
 * @author hal.hildebrand
 */
public interface ContentionView {

    /**
     * @return smoothed LBT failure rate in [0, 1], or 0 if the sub-band is unknown
     */
    double failureRate(int subbandId);

    /**
     * @return smoothed fraction of time the channel is held by competing traffic, or 0 if unknown
     */
    double occupancy(int subbandId);

    /**
     * @return current contention window in slots, or the configured minimum if unknown
     */
    int contentionWindow(int subbandId);
}
