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

import java.util.List;
import java.util.Random;

/**
 * Reference oracle for runs without a trained agent. Explores uniformly and exploits with the least collision
 * score {@code (1 - failureRate) * numRbs}, breaking ties by the lowest interference occupancy, then the lowest
 * index. Achievable bits per RB is frequency flat and scales every score alike, so it is left out. Without RB
 * counts every sub-band weighs 1 and the lowest failure rate wins.
 *
 * @author hal.hildebrand
 */
public class GreedyOracle implements PolicyOracle {
    private static final int OCCUPANCY    = 0;
    private static final int FAILURE_RATE = 1;

    private final Random        random;
    private final List<Integer> subbandRbs;

    public GreedyOracle(Random random) {
        this(random, List.of());
    }

    /**
     * @param subbandRbs resource blocks of each sub-band, in action index order
     */
    public GreedyOracle(Random random, List<Integer> subbandRbs) {
        this.random = random;
        this.subbandRbs = List.copyOf(subbandRbs);
    }

    @Override
    public int sampleAction(ActionSpace space) {
        return space.sample(random);
    }

    @Override
    public int bestAction(Observation observation) {
        int best = 0;
        double bestScore = score(observation, 0);
        for (int i = 1; i < observation.numSubbands(); i++) {
            double score = score(observation, i);
            if (score > bestScore) {
                best = i;
                bestScore = score;
            } else if (score == bestScore
                       && observation.subbandMetric(i, OCCUPANCY) < observation.subbandMetric(best, OCCUPANCY)) {
                best = i;
            }
        }
        return best;
    }

    private double score(Observation observation, int index) {
        int rbs = index < subbandRbs.size() ? subbandRbs.get(index) : 1;
        return (1.0 - observation.subbandMetric(index, FAILURE_RATE)) * rbs;
    }
}
