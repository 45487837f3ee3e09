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

import java.util.NavigableSet;
import java.util.SortedMap;

/**
 * Read-only view of device to sub-band membership.
 *
 * @author hal.hildebrand
 */
public interface MembershipView {

    /**
     * @return registered sub-band ids in ascending order
     */
    NavigableSet<Integer> subbandIds();

    /**
     * @return device id to current sub-band id, ordered by device id
     */
    SortedMap<Integer, Integer> devices();

    /**
     * @return the device's sub-band, or the default sub-band if the device is unknown
     */
    int subbandOf(int ueId);

    /**
     * @return number of devices on the sub-band, or 0 if unknown
     */
    int activeCount(int subbandId);

    /**
     * @return resource block capacity of the sub-band, or 0 if unknown
     */
    int capacity(int subbandId);
}
