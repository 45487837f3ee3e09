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
 * BWP assignment algorithms.
 *
 * @author hal.hildebrand
 */
public enum Algorithm {
    /** Least-Collision Assignment: score sub-bands by expected clean capacity */
    LCA,
    /** Reinforcement-Learning Assignment: epsilon-greedy over a policy oracle */
    RLA;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if the name is not an algorithm
     */
    public static Algorithm parse(String name) {
        for (var algorithm : values()) {
            if (algorithm.name().equalsIgnoreCase(name.trim())) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + name);
    }
}
