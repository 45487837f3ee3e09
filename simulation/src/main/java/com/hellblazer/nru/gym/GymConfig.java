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

/**
 * Reward weights and episode length.
 *
 * @author hal.hildebrand
 */
public class GymConfig {

    private final double alpha;
    private final double beta;
    private final double maxThroughput;
    private final int    episodeLength;

    private GymConfig(Builder builder) {
        this.alpha = builder.alpha;
        this.beta = builder.beta;
        this.maxThroughput = builder.maxThroughput;
        this.episodeLength = builder.episodeLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GymConfig defaultConfig() {
        return builder().build();
    }

    /**
     * @return weight of the mean HoL delay penalty
     */
    public double getAlpha() {
        return alpha;
    }

    /**
     * @return weight of the throughput shortfall penalty
     */
    public double getBeta() {
        return beta;
    }

    /**
     * @return throughput target in Mbps the shortfall is measured against
     */
    public double getMaxThroughput() {
        return maxThroughput;
    }

    public int getEpisodeLength() {
        return episodeLength;
    }

    public static class Builder {
        private double alpha         = 1.0;
        private double beta          = 1.0;
        private double maxThroughput = 1000.0;
        private int    episodeLength = 1000;

        private Builder() {
        }

        public Builder withRewardWeights(double alpha, double beta) {
            if (!(alpha >= 0.0) || !(beta >= 0.0)) {
                throw new IllegalArgumentException("Reward weights must be non-negative: " + alpha + ", " + beta);
            }
            this.alpha = alpha;
            this.beta = beta;
            return this;
        }

        public Builder withMaxThroughput(double mbps) {
            if (!(mbps >= 0.0)) {
                throw new IllegalArgumentException("Max throughput must be non-negative: " + mbps);
            }
            this.maxThroughput = mbps;
            return this;
        }

        public Builder withEpisodeLength(int steps) {
            if (steps < 1) {
                throw new IllegalArgumentException("Episode length must be positive: " + steps);
            }
            this.episodeLength = steps;
            return this;
        }

        public GymConfig build() {
            return new GymConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("GymConfig[alpha=%.2f, beta=%.2f, maxThroughput=%.1f, episode=%d]", alpha, beta,
                             maxThroughput, episodeLength);
    }
}
