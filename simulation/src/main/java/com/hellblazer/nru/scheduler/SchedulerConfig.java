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
 * Decision engine parameters.
 *
 * @author hal.hildebrand
 */
public class SchedulerConfig {

    private final Algorithm algorithm;
    private final int       timeWindowSize;
    private final int       maxScheduledUes;
    private final double    epsilon;
    private final double    epsilonMin;
    private final double    epsilonDecay;

    private SchedulerConfig(Builder builder) {
        this.algorithm = builder.algorithm;
        this.timeWindowSize = builder.timeWindowSize;
        this.maxScheduledUes = builder.maxScheduledUes;
        this.epsilon = builder.epsilon;
        this.epsilonMin = builder.epsilonMin;
        this.epsilonDecay = builder.epsilonDecay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SchedulerConfig defaultConfig() {
        return builder().build();
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return decision window length in slots
     */
    public int getTimeWindowSize() {
        return timeWindowSize;
    }

    /**
     * @return device count up to which LCA moves every device to the single best sub-band
     */
    public int getMaxScheduledUes() {
        return maxScheduledUes;
    }

    /**
     * @return initial exploration probability
     */
    public double getEpsilon() {
        return epsilon;
    }

    public double getEpsilonMin() {
        return epsilonMin;
    }

    public double getEpsilonDecay() {
        return epsilonDecay;
    }

    public static class Builder {
        private Algorithm algorithm       = Algorithm.RLA;
        private int       timeWindowSize  = 500;
        private int       maxScheduledUes = 16;
        private double    epsilon         = 1.0;
        private double    epsilonMin      = 0.01;
        private double    epsilonDecay    = 0.995;

        private Builder() {
        }

        public Builder withAlgorithm(Algorithm algorithm) {
            if (algorithm == null) {
                throw new IllegalArgumentException("Algorithm must not be null");
            }
            this.algorithm = algorithm;
            return this;
        }

        public Builder withTimeWindowSize(int slots) {
            if (slots < 1) {
                throw new IllegalArgumentException("Time window must be at least one slot: " + slots);
            }
            this.timeWindowSize = slots;
            return this;
        }

        public Builder withMaxScheduledUes(int maxScheduledUes) {
            if (maxScheduledUes < 1) {
                throw new IllegalArgumentException("Max scheduled UEs must be positive: " + maxScheduledUes);
            }
            this.maxScheduledUes = maxScheduledUes;
            return this;
        }

        /**
         * @param epsilon initial exploration probability in [0, 1]
         * @param min     floor for the decayed probability in [0, epsilon]
         * @param decay   multiplicative decay per window in (0, 1]
         */
        public Builder withExploration(double epsilon, double min, double decay) {
            if (!(epsilon >= 0.0 && epsilon <= 1.0)) {
                throw new IllegalArgumentException("Epsilon must be in [0, 1]: " + epsilon);
            }
            if (!(min >= 0.0 && min <= epsilon)) {
                throw new IllegalArgumentException("Epsilon floor must be in [0, " + epsilon + "]: " + min);
            }
            if (!(decay > 0.0 && decay <= 1.0)) {
                throw new IllegalArgumentException("Epsilon decay must be in (0, 1]: " + decay);
            }
            this.epsilon = epsilon;
            this.epsilonMin = min;
            this.epsilonDecay = decay;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("SchedulerConfig[%s, window=%d slots, maxUes=%d, epsilon=%.3f/%.3f/%.4f]", algorithm,
                             timeWindowSize, maxScheduledUes, epsilon, epsilonMin, epsilonDecay);
    }
}
