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

import java.util.TreeMap;

/**
 * Per sub-band throughput and collision counters for the current decision window. Reset after every decision.
 *
 * @author hal.hildebrand
 */
public class WindowCounters {
    private final TreeMap<Integer, Double> bits       = new TreeMap<>();
    private final TreeMap<Integer, Long>   collisions = new TreeMap<>();

    public void recordThroughput(int subbandId, double servedBits) {
        if (servedBits > 0) {
            bits.merge(subbandId, servedBits, Double::sum);
        }
    }

    public void recordCollision(int subbandId) {
        collisions.merge(subbandId, 1L, Long::sum);
    }

    public double bits(int subbandId) {
        return bits.getOrDefault(subbandId, 0.0);
    }

    public long collisions(int subbandId) {
        return collisions.getOrDefault(subbandId, 0L);
    }

    public double totalBits() {
        return bits.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public long totalCollisions() {
        return collisions.values().stream().mapToLong(Long::longValue).sum();
    }

    public void reset() {
        bits.clear();
        collisions.clear();
    }
}
