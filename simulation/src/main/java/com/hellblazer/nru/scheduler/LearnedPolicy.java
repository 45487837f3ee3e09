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

import com.hellblazer.nru.ConfigurationException;
import com.hellblazer.nru.gym.BwpGymEnvironment;
import com.hellblazer.nru.gym.PolicyOracle;
import com.hellblazer.nru.gym.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Reinforcement-Learning Assignment.
 * <p>
 * Epsilon-greedy over a {@link PolicyOracle}: with probability epsilon the oracle's sampled action is taken,
 * otherwise its best action for the current observation. The step, with the reward for the window just ended,
 * is reported back to the oracle. Epsilon decays to {@code max(epsilon * decay, epsilonMin)} once per window.
 *
 * @author hal.hildebrand
 */
public final class LearnedPolicy implements DecisionPolicy {
    private static final Logger log = LoggerFactory.getLogger(LearnedPolicy.class);

    private final BwpGymEnvironment environment;
    private final PolicyOracle      oracle;
    private final Random            random;
    private final double            epsilonMin;
    private final double            epsilonDecay;
    private       double            epsilon;
    private       StepResult        lastStep;

    /**
     * @throws ConfigurationException if no oracle is given
     */
    public LearnedPolicy(SchedulerConfig config, BwpGymEnvironment environment, PolicyOracle oracle, Random random) {
        if (oracle == null) {
            throw new ConfigurationException("RLA requires a policy oracle");
        }
        this.environment = environment;
        this.oracle = oracle;
        this.random = random;
        this.epsilon = config.getEpsilon();
        this.epsilonMin = config.getEpsilonMin();
        this.epsilonDecay = config.getEpsilonDecay();
    }

    @Override
    public Map<Integer, Integer> decide(StatisticsSnapshot snapshot) {
        if (snapshot.numSubbands() == 0) {
            decay();
            return new LinkedHashMap<>();
        }
        boolean explore = random.nextDouble() < epsilon;
        int action = explore ? oracle.sampleAction(environment.actionSpace(snapshot))
                             : oracle.bestAction(environment.observe(snapshot));
        var assignment = environment.assignment(action, snapshot);

        lastStep = environment.step(snapshot, action);
        oracle.report(lastStep);
        log.debug("RLA: {} action {}, reward {}, epsilon {}", explore ? "explore" : "exploit", action,
                  lastStep.reward(), epsilon);
        decay();
        return assignment;
    }

    private void decay() {
        epsilon = Math.max(epsilon * epsilonDecay, epsilonMin);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.RLA;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public double getEpsilonMin() {
        return epsilonMin;
    }

    public double getEpsilonDecay() {
        return epsilonDecay;
    }

    public BwpGymEnvironment getEnvironment() {
        return environment;
    }

    /**
     * @return the last step reported to the oracle, or null before the first decision
     */
    public StepResult getLastStep() {
        return lastStep;
    }
}
