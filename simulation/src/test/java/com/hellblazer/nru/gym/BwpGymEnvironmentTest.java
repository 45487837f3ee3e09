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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.nru.scheduler.BwpStats;
import com.hellblazer.nru.scheduler.StatisticsSnapshot;
import com.hellblazer.nru.scheduler.UeStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BwpGymEnvironment - observation layout, reward, action mapping and episode bookkeeping.
 *
 * @author hal.hildebrand
 */
class BwpGymEnvironmentTest {

    private StatisticsSnapshot snapshot;

    @BeforeEach
    void setup() {
        snapshot = StatisticsSnapshot.of(0, List.of(new BwpStats(3, 50, 1, 0.2, 0.1, 16, 500.0, 0.0, 0),
                                                     new BwpStats(8, 100, 2, 0.05, 0.3, 8, 700.0, 0.0, 0)),
                                         List.of(new UeStats(1, 4, 1.0, 10.0, 600.0, 0.5, 8),
                                                 new UeStats(2, 0, 3.0, 20.0, 650.0, 1.5, 3),
                                                 new UeStats(5, 7, 2.0, 0.0, 300.0, 2.5, 8)));
    }

    @Test
    void testObservationLayout() {
        var environment = new BwpGymEnvironment(GymConfig.defaultConfig());
        var observation = environment.observe(snapshot);

        // 3 * (5 + 2) + 2 * 3
        assertEquals(27, observation.length());
        assertArrayEquals(new double[] { 4, 1.0, 600.0, 10.0, 0.5, 0, 1 },
                          Arrays.copyOfRange(observation.values(), 0, 7));
        assertArrayEquals(new double[] { 0, 3.0, 650.0, 20.0, 1.5, 1, 0 },
                          Arrays.copyOfRange(observation.values(), 7, 14));
        assertEquals(21, observation.subbandOffset());
        assertArrayEquals(new double[] { 0.1, 0.2, 16, 0.3, 0.05, 8 },
                          Arrays.copyOfRange(observation.values(), 21, 27));
        assertEquals(0.05, observation.subbandMetric(1, 1));
    }

    @Test
    void testObservationRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new Observation(new double[5], 1, 1));
        assertEquals(Observation.length(1, 1), new Observation(new double[9], 1, 1).length());
    }

    @Test
    void testReward() {
        var config = GymConfig.builder().withRewardWeights(2.0, 0.5).withMaxThroughput(100.0).build();
        var environment = new BwpGymEnvironment(config);

        // mean HoL 2.0, total throughput 30.0
        assertEquals(-(2.0 * 2.0 + 0.5 * 70.0), environment.reward(snapshot), 1e-9);

        var empty = StatisticsSnapshot.of(0, snapshot.subbands().values().stream().toList(), List.of());
        assertEquals(-(0.5 * 100.0), environment.reward(empty), 1e-9);
    }

    @Test
    void testAssignment() {
        var environment = new BwpGymEnvironment(GymConfig.defaultConfig());

        assertEquals(Map.of(1, 8, 2, 8, 5, 8), environment.assignment(1, snapshot));
        assertEquals(Map.of(1, 3, 2, 3, 5, 3), environment.assignment(0, snapshot));
        // out of range actions wrap around the sub-band count
        assertEquals(Map.of(1, 3, 2, 3, 5, 3), environment.assignment(2, snapshot));
        assertEquals(Map.of(1, 8, 2, 8, 5, 8), environment.assignment(-1, snapshot));
        assertEquals(Map.of(1, 8, 2, 8, 5, 8), environment.assignment(7, snapshot));
        assertEquals(new ActionSpace(2), environment.actionSpace(snapshot));
    }

    @Test
    void testEpisodeBoundary() {
        var environment = new BwpGymEnvironment(GymConfig.builder().withEpisodeLength(3).build());
        double reward = environment.reward(snapshot);

        assertFalse(environment.step(snapshot, 0).done());
        assertFalse(environment.step(snapshot, 0).done());
        var last = environment.step(snapshot, 1);
        assertTrue(last.done());
        assertEquals(new StepInfo(0, 3, 3 * reward), last.info());

        var next = environment.step(snapshot, 1);
        assertFalse(next.done());
        assertEquals(1, next.info().episode());
        assertEquals(1, next.info().step());
        assertEquals(reward, next.info().totalReward(), 1e-9);
    }

    @Test
    void testDefaultEpisodeLength() {
        var environment = new BwpGymEnvironment(GymConfig.defaultConfig());
        StepResult result = null;
        for (int i = 0; i < 1000; i++) {
            assertFalse(environment.isDone());
            result = environment.step(snapshot, 0);
        }
        assertTrue(result.done());
        assertEquals(1000, environment.getStep());
    }

    @Test
    void testExtraInfoJson() throws Exception {
        var environment = new BwpGymEnvironment(GymConfig.defaultConfig());
        environment.step(snapshot, 0);
        environment.step(snapshot, 0);

        var json = new ObjectMapper().readTree(environment.extraInfo());
        assertEquals(0, json.get("episode").asInt());
        assertEquals(2, json.get("step").asInt());
        assertEquals(environment.getTotalReward(), json.get("total_reward").asDouble(), 1e-9);
        assertEquals(3, json.size());
    }

    @Test
    void testResetStartsNextEpisode() {
        var environment = new BwpGymEnvironment(GymConfig.defaultConfig());
        environment.reset();
        assertEquals(0, environment.getEpisode());

        environment.step(snapshot, 0);
        environment.reset();
        assertEquals(1, environment.getEpisode());
        assertEquals(0, environment.getStep());
        assertEquals(0.0, environment.getTotalReward());
    }
}
