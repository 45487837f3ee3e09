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

import com.hellblazer.nru.gym.BwpGymEnvironment;
import com.hellblazer.nru.gym.GymConfig;
import com.hellblazer.nru.gym.PolicyOracle;

import java.util.Map;
import java.util.Random;

/**
 * BWP assignment policy run once per decision window.
 *
 * @author hal.hildebrand
 */
public sealed interface DecisionPolicy permits LeastCollisionPolicy, LearnedPolicy {

    /**
     * Build the policy selected by the configuration.
     *
     * @param oracle learning agent, required for {@link Algorithm#RLA}
     * @throws com.hellblazer.nru.ConfigurationException if RLA is selected without an oracle
     */
    static DecisionPolicy create(SchedulerConfig config, GymConfig gymConfig, PolicyOracle oracle, Random random) {
        return switch (config.getAlgorithm()) {
            case LCA -> new LeastCollisionPolicy(config.getMaxScheduledUes());
            case RLA -> new LearnedPolicy(config, new BwpGymEnvironment(gymConfig), oracle, random);
        };
    }

    /**
     * Decide the target sub-band of devices for the coming window. Devices absent from the result keep their
     * sub-band.
     *
     * @return device id to target sub-band, in the order the moves are applied
     */
    Map<Integer, Integer> decide(StatisticsSnapshot snapshot);

    Algorithm algorithm();
}
