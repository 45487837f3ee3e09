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
package com.hellblazer.nru.gym;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GreedyOracle.
 *
 * @author hal.hildebrand
 */
class GreedyOracleTest {

    private static Observation subbands(double... occupancyFailureCw) {
        int m = occupancyFailureCw.length / 3;
        return new Observation(occupancyFailureCw, 0, m);
    }

    @Test
    void testBestActionPrefersLowestFailureRate() {
        var oracle = new GreedyOracle(new Random(1));
        assertEquals(2, oracle.bestAction(subbands(0.0, 0.3, 8, 0.0, 0.2, 8, 0.9, 0.1, 64)));
    }

    @Test
    void testTiesBrokenByOccupancyThenIndex() {
        var oracle = new GreedyOracle(new Random(1));
        assertEquals(1, oracle.bestAction(subbands(0.4, 0.1, 8, 0.2, 0.1, 8, 0.2, 0.1, 8)));
        assertEquals(0, oracle.bestAction(subbands(0.0, 0.0, 8, 0.0, 0.0, 8)));
    }

    @Test
    void testBestActionWeighsResourceBlocks() {
        var oracle = new GreedyOracle(new Random(1), List.of(50, 100));
        // one UE at 800 bits per RB: scores 0.9 * 800 * 50 = 36000 and 0.88 * 800 * 100 = 70400
        var observation = new Observation(new double[] { 0, 0, 800, 0, 0, 1, 0, 0.1, 0.1, 8, 0.3, 0.12, 16 }, 1, 2);
        assertEquals(1, oracle.bestAction(observation));

        // fewer RBs than sub-bands weigh the rest as 1
        var partial = new GreedyOracle(new Random(1), List.of(2));
        assertEquals(0, partial.bestAction(subbands(0.0, 0.6, 8, 0.0, 0.3, 8, 0.0, 0.25, 8)));
        assertEquals(2, partial.bestAction(subbands(0.0, 0.6, 8, 0.0, 0.3, 8, 0.0, 0.19, 8)));
    }

    @Test
    void testSampleStaysInSpace() {
        var oracle = new GreedyOracle(new Random(11));
        var space = new ActionSpace(4);
        for (int i = 0; i < 500; i++) {
            assertTrue(space.contains(oracle.sampleAction(space)));
        }
        assertThrows(IllegalArgumentException.class, () -> new ActionSpace(0));
    }
}
