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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.nru.scheduler.StatisticsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment side of the policy oracle protocol. Turns decision window snapshots into observations and rewards,
 * maps actions to device assignments and keeps episode bookkeeping.
 * <p>
 * Reward is {@code -(alpha * meanHolDelay + beta * (maxThroughput - totalThroughput))}. An episode closes after
 * {@link GymConfig#getEpisodeLength()} steps; the following step opens the next one.
 *
 * @author hal.hildebrand
 */
public class BwpGymEnvironment {
    private static final Logger log = LoggerFactory.getLogger(BwpGymEnvironment.class);

    private final GymConfig    config;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private       int          episode;
    private       int          step;
    private       double       totalReward;
    private       boolean      done;

    public BwpGymEnvironment(GymConfig config) {
        this.config = config;
    }

    public ActionSpace actionSpace(StatisticsSnapshot snapshot) {
        return new ActionSpace(snapshot.numSubbands());
    }

    public Observation observe(StatisticsSnapshot snapshot) {
        int numDevices = snapshot.numDevices();
        int numSubbands = snapshot.numSubbands();
        var subbandIds = snapshot.subbandIds();
        var values = new double[Observation.length(numDevices, numSubbands)];

        int i = 0;
        for (var ue : snapshot.devices().values()) {
            values[i++] = ue.queueDepth();
            values[i++] = ue.holDelay();
            values[i++] = ue.bitsPerRb();
            values[i++] = ue.throughput();
            values[i++] = ue.averageDelay();
            int current = subbandIds.indexOf(ue.subbandId());
            if (current >= 0) {
                values[i + current] = 1.0;
            }
            i += numSubbands;
        }
        for (var bwp : snapshot.subbands().values()) {
            values[i++] = bwp.occupancy();
            values[i++] = bwp.failureRate();
            values[i++] = bwp.contentionWindow();
        }
        return new Observation(values, numDevices, numSubbands);
    }

    public double reward(StatisticsSnapshot snapshot) {
        double shortfall = config.getMaxThroughput() - snapshot.totalThroughput();
        return -(config.getAlpha() * snapshot.meanHolDelay() + config.getBeta() * shortfall);
    }

    /**
     * Device assignment for an action: every device moves to the sub-band at the action's index. Actions outside
     * the action space wrap modulo the sub-band count.
     *
     * @return device id to target sub-band, in device id order
     */
    public Map<Integer, Integer> assignment(int action, StatisticsSnapshot snapshot) {
        int index = action;
        if (!actionSpace(snapshot).contains(action)) {
            index = Math.floorMod(action, snapshot.numSubbands());
            log.warn("Action {} outside [0, {}), using {}", action, snapshot.numSubbands(), index);
        }
        int target = snapshot.subbandIds().get(index);
        var assignment = new LinkedHashMap<Integer, Integer>();
        for (var ueId : snapshot.devices().keySet()) {
            assignment.put(ueId, target);
        }
        return assignment;
    }

    /**
     * Record a step for the window summarized by the snapshot.
     *
     * @param action action taken for the coming window
     */
    public StepResult step(StatisticsSnapshot snapshot, int action) {
        if (done) {
            reset();
        }
        double reward = reward(snapshot);
        step++;
        totalReward += reward;
        done = step >= config.getEpisodeLength();
        var info = new StepInfo(episode, step, totalReward);
        if (done) {
            log.info("Episode {} finished after {} steps, total reward {}", episode, step, totalReward);
        }
        return new StepResult(observe(snapshot), action, reward, done, info);
    }

    /**
     * Start a new episode.
     */
    public void reset() {
        if (step > 0) {
            episode++;
        }
        step = 0;
        totalReward = 0.0;
        done = false;
    }

    public StepInfo info() {
        return new StepInfo(episode, step, totalReward);
    }

    /**
     * @return the current episode bookkeeping as JSON
     */
    public String extraInfo() {
        try {
            return objectMapper.writeValueAsString(info());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize step info", e);
        }
    }

    public int getEpisode() {
        return episode;
    }

    public int getStep() {
        return step;
    }

    public double getTotalReward() {
        return totalReward;
    }

    public boolean isDone() {
        return done;
    }

    public GymConfig getConfig() {
        return config;
    }
}
