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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable statistics taken at the end of a decision window. Sub-bands and devices are ordered by id.
 *
 * @author hal.hildebrand
 */
public record StatisticsSnapshot(long time, SortedMap<Integer, BwpStats> subbands,
                                 SortedMap<Integer, UeStats> devices) {

    public StatisticsSnapshot {
        subbands = Collections.unmodifiableSortedMap(new TreeMap<>(subbands));
        devices = Collections.unmodifiableSortedMap(new TreeMap<>(devices));
    }

    public static StatisticsSnapshot of(long time, List<BwpStats> subbands, List<UeStats> devices) {
        var bwps = new TreeMap<Integer, BwpStats>();
        subbands.forEach(s -> bwps.put(s.subbandId(), s));
        var ues = new TreeMap<Integer, UeStats>();
        devices.forEach(u -> ues.put(u.ueId(), u));
        return new StatisticsSnapshot(time, bwps, ues);
    }

    public int numSubbands() {
        return subbands.size();
    }

    public int numDevices() {
        return devices.size();
    }

    /**
     * @return sub-band ids in ascending order; an action index addresses this list
     */
    public List<Integer> subbandIds() {
        return List.copyOf(subbands.keySet());
    }

    public List<Integer> deviceIds() {
        return List.copyOf(devices.keySet());
    }

    /**
     * @return mean head-of-line delay over all devices, 0 with no devices
     */
    public double meanHolDelay() {
        if (devices.isEmpty()) {
            return 0.0;
        }
        return devices.values().stream().mapToDouble(UeStats::holDelay).sum() / devices.size();
    }

    public double totalThroughput() {
        return devices.values().stream().mapToDouble(UeStats::throughput).sum();
    }

    public long totalCollisions() {
        return subbands.values().stream().mapToLong(BwpStats::windowCollisions).sum();
    }

    /**
     * @return scores in ascending sub-band order
     */
    public List<Double> scores() {
        var scores = new ArrayList<Double>(subbands.size());
        subbands.values().forEach(s -> scores.add(s.score()));
        return scores;
    }
}
