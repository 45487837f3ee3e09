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
package com.hellblazer.nru.config;

import com.hellblazer.nru.common.SimTime;
import com.hellblazer.nru.gym.GymConfig;
import com.hellblazer.nru.lbt.LbtConfig;
import com.hellblazer.nru.scheduler.SchedulerConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Complete configuration of a simulation run.
 *
 * @author hal.hildebrand
 */
public class SimulationConfig {

    /**
     * A sub-band to create at startup.
     *
     * @param id               sub-band id
     * @param numRbs           resource blocks
     * @param interferenceRate mean interference arrivals per second
     */
    public record BwpSpec(int id, int numRbs, double interferenceRate) {
        public BwpSpec {
            if (numRbs <= 0) {
                throw new IllegalArgumentException("Sub-band " + id + " needs a positive RB count: " + numRbs);
            }
            if (!(interferenceRate >= 0.0)) {
                throw new IllegalArgumentException(
                "Sub-band " + id + " needs a non-negative interference rate: " + interferenceRate);
            }
        }
    }

    public static final List<BwpSpec> DEFAULT_SUBBANDS = List.of(new BwpSpec(0, 50, 200.0), new BwpSpec(1, 70, 400.0),
                                                                 new BwpSpec(2, 100, 600.0));

    private final LbtConfig       lbt;
    private final SchedulerConfig scheduler;
    private final GymConfig       gym;
    private final List<BwpSpec>   subbands;
    private final int             defaultSubbandId;
    private final long            switchLatency;
    private final int             numUes;
    private final long            duration;
    private final long            seed;
    private final double          minArrivalRate;
    private final double          maxArrivalRate;
    private final Path            metricsFile;

    private SimulationConfig(Builder builder) {
        this.lbt = builder.lbt;
        this.scheduler = builder.scheduler;
        this.gym = builder.gym;
        this.subbands = List.copyOf(builder.subbands);
        this.defaultSubbandId = builder.defaultSubbandId;
        this.switchLatency = builder.switchLatency;
        this.numUes = builder.numUes;
        this.duration = builder.duration;
        this.seed = builder.seed;
        this.minArrivalRate = builder.minArrivalRate;
        this.maxArrivalRate = builder.maxArrivalRate;
        this.metricsFile = builder.metricsFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaultConfig() {
        return builder().build();
    }

    public LbtConfig getLbt() {
        return lbt;
    }

    public SchedulerConfig getScheduler() {
        return scheduler;
    }

    public GymConfig getGym() {
        return gym;
    }

    public List<BwpSpec> getSubbands() {
        return subbands;
    }

    public int getDefaultSubbandId() {
        return defaultSubbandId;
    }

    /**
     * @return delay before the link layer learns of a BWP switch, in nanoseconds
     */
    public long getSwitchLatency() {
        return switchLatency;
    }

    public int getNumUes() {
        return numUes;
    }

    /**
     * @return simulated run time in nanoseconds
     */
    public long getDuration() {
        return duration;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return lower bound of per-UE packet arrivals per slot
     */
    public double getMinArrivalRate() {
        return minArrivalRate;
    }

    public double getMaxArrivalRate() {
        return maxArrivalRate;
    }

    /**
     * @return CSV file receiving one row per decision window, if configured
     */
    public Optional<Path> getMetricsFile() {
        return Optional.ofNullable(metricsFile);
    }

    public static class Builder {
        private LbtConfig       lbt              = LbtConfig.defaultConfig();
        private SchedulerConfig scheduler        = SchedulerConfig.defaultConfig();
        private GymConfig       gym              = GymConfig.defaultConfig();
        private List<BwpSpec>   subbands         = DEFAULT_SUBBANDS;
        private int             defaultSubbandId = 0;
        private long            switchLatency    = SimTime.millis(1);
        private int             numUes           = 24;
        private long            duration         = SimTime.seconds(10);
        private long            seed             = 42L;
        private double          minArrivalRate   = 0.1;
        private double          maxArrivalRate   = 0.3;
        private Path            metricsFile;

        private Builder() {
        }

        public Builder withLbt(LbtConfig lbt) {
            this.lbt = require(lbt, "LBT config");
            return this;
        }

        public Builder withScheduler(SchedulerConfig scheduler) {
            this.scheduler = require(scheduler, "Scheduler config");
            return this;
        }

        public Builder withGym(GymConfig gym) {
            this.gym = require(gym, "Gym config");
            return this;
        }

        public Builder withSubbands(List<BwpSpec> subbands) {
            if (subbands == null || subbands.isEmpty()) {
                throw new IllegalArgumentException("At least one sub-band is required");
            }
            if (subbands.stream().map(BwpSpec::id).distinct().count() != subbands.size()) {
                throw new IllegalArgumentException("Duplicate sub-band ids: " + subbands);
            }
            this.subbands = List.copyOf(subbands);
            return this;
        }

        public Builder withDefaultSubbandId(int id) {
            this.defaultSubbandId = id;
            return this;
        }

        public Builder withSwitchLatency(long nanos) {
            if (nanos < 0) {
                throw new IllegalArgumentException("Switch latency must be non-negative: " + nanos);
            }
            this.switchLatency = nanos;
            return this;
        }

        public Builder withNumUes(int numUes) {
            if (numUes < 0) {
                throw new IllegalArgumentException("UE count must be non-negative: " + numUes);
            }
            this.numUes = numUes;
            return this;
        }

        public Builder withDuration(long nanos) {
            if (nanos <= 0) {
                throw new IllegalArgumentException("Duration must be positive: " + nanos);
            }
            this.duration = nanos;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder withArrivalRate(double min, double max) {
            if (!(min >= 0.0) || !(max >= min)) {
                throw new IllegalArgumentException("Invalid arrival rate range [" + min + ", " + max + "]");
            }
            this.minArrivalRate = min;
            this.maxArrivalRate = max;
            return this;
        }

        /**
         * @param path CSV file for per-window metrics, null to disable the export
         */
        public Builder withMetricsFile(Path path) {
            this.metricsFile = path;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the default sub-band is not among the configured sub-bands
         */
        public SimulationConfig build() {
            if (subbands.stream().noneMatch(s -> s.id() == defaultSubbandId)) {
                throw new IllegalArgumentException("Default sub-band " + defaultSubbandId + " is not configured");
            }
            return new SimulationConfig(this);
        }

        private static <T> T require(T value, String what) {
            if (value == null) {
                throw new IllegalArgumentException(what + " must not be null");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig[%d UEs, %d sub-bands, default=%d, %.1f s, seed=%d]", numUes,
                             subbands.size(), defaultSubbandId, SimTime.toSeconds(duration), seed);
    }
}
