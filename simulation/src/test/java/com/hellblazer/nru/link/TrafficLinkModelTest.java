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
package com.hellblazer.nru.link;

import com.hellblazer.nru.bwp.BwpRegistry;
import com.hellblazer.nru.common.Ewma;
import com.hellblazer.nru.common.EventScheduler;
import com.hellblazer.nru.common.SimTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TrafficLinkModel - queueing, RB allocation, windowed throughput and link layer switch tracking.
 *
 * @author hal.hildebrand
 */
class TrafficLinkModelTest {

    private static final long SLOT = SimTime.millis(0.5);

    private EventScheduler scheduler;

    @BeforeEach
    void setup() {
        scheduler = new EventScheduler();
    }

    private TrafficLinkModel model(double arrivalRate) {
        var model = new TrafficLinkModel(scheduler, new Random(7), SLOT, arrivalRate, arrivalRate, 0);
        model.configureSubband(0, 50);
        model.configureSubband(1, 100);
        return model;
    }

    @Test
    void testInvalidArrivalRange() {
        assertThrows(IllegalArgumentException.class, () -> new TrafficLinkModel(scheduler, new Random(), SLOT, 0.3,
                                                                                0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> new TrafficLinkModel(scheduler, new Random(), SLOT, -1.0,
                                                                                0.1, 0));
    }

    @Test
    void testAllocateResourcesSplitsEqually() {
        var model = model(0.2);
        model.attachUe(1);
        model.attachUe(2);
        model.attachUe(3);

        var allocation = model.allocateResources(0, List.of(3, 1, 2, 99));
        // 50 RBs over four requested UEs, the unknown one gets nothing
        assertEquals(List.of(3, 1, 2), List.copyOf(allocation.keySet()));
        allocation.values().forEach(rbs -> assertEquals(12, rbs));

        assertTrue(model.allocateResources(7, List.of(1)).isEmpty());
        assertEquals(100, model.allocateResources(1, List.of(2)).get(2));
    }

    @Test
    void testQueueOverflowCountsDrops() {
        var model = model(50.0);
        model.attachUe(1);
        for (long slot = 0; slot < 10; slot++) {
            model.generateTraffic(slot);
        }

        assertEquals(TrafficLinkModel.MAX_QUEUE_SIZE, model.queueDepth(1));
        assertTrue(model.dropped(1) > 0);
        assertEquals(model.dropped(1), model.totalDropped());
        assertEquals(model.dropped(1), model.windowDropped());

        model.windowElapsed(scheduler.now());
        assertEquals(0, model.windowDropped());
        assertEquals(model.dropped(1), model.totalDropped());
    }

    @Test
    void testHolDelayAndAverageDelay() {
        var model = model(20.0);
        model.attachUe(1);

        double expectedAverage = 0.0;
        for (long slot = 0; slot < 5; slot++) {
            model.generateTraffic(slot);
            expectedAverage = Ewma.smooth(expectedAverage, slot, 0.05);
        }

        // head packet arrived in slot 0 and nothing was served
        assertEquals(2.0, model.holDelay(1), 1e-9);
        assertEquals(SimTime.toMillis(Math.round(expectedAverage * SLOT)), model.averageDelay(1), 1e-9);
    }

    @Test
    void testServeDrainsQueueAndReportsWindowThroughput() {
        var model = model(20.0);
        model.attachUe(1);
        model.generateTraffic(0);
        assertTrue(model.hasBacklog(1));

        double delivered = model.serve(1, 10_000, 0);
        assertTrue(delivered > 0);
        assertFalse(model.hasBacklog(1));
        assertEquals(0, model.queueDepth(1));
        assertEquals(0.0, model.holDelay(1));

        scheduler.runUntil(SimTime.millis(1));
        assertEquals(delivered / 0.001 / 1e6, model.throughput(1), 1e-9);

        model.windowElapsed(scheduler.now());
        assertEquals(0.0, model.throughput(1));
    }

    @Test
    void testServeIsBoundedByCapacity() {
        var model = model(20.0);
        model.attachUe(1);
        model.generateTraffic(0);
        int before = model.queueDepth(1);

        double delivered = model.serve(1, 1, 0);
        assertTrue(delivered <= model.bitsPerRb(1) + 1e-9);
        assertTrue(model.queueDepth(1) >= before - 1);
        assertEquals(0.0, model.serve(1, 0, 0));
        assertEquals(0.0, model.serve(42, 10, 0));
    }

    @Test
    void testBitsPerRbStaysBounded() {
        var model = model(0.1);
        for (int ue = 0; ue < 8; ue++) {
            model.attachUe(ue);
        }
        for (long slot = 0; slot < 5_000; slot++) {
            model.generateTraffic(slot);
            for (int ue = 0; ue < 8; ue++) {
                double bits = model.bitsPerRb(ue);
                assertTrue(bits >= TrafficLinkModel.MIN_BITS_PER_RB && bits <= TrafficLinkModel.MAX_BITS_PER_RB);
            }
        }
    }

    @Test
    void testSubbandBitsPerRbIsMeanUeCapacity() {
        var model = model(0.1);
        assertEquals(0.0, model.subbandBitsPerRb(0));

        model.attachUe(1);
        model.attachUe(2);
        double mean = (model.bitsPerRb(1) + model.bitsPerRb(2)) / 2.0;

        assertEquals(mean, model.subbandBitsPerRb(0), 1e-9);
        assertEquals(mean, model.subbandBitsPerRb(1), 1e-9);
        assertEquals(0.0, model.subbandBitsPerRb(9));
    }

    @Test
    void testUnknownUeDefaults() {
        var model = model(0.1);
        assertEquals(0, model.queueDepth(5));
        assertEquals(0.0, model.holDelay(5));
        assertEquals(0.0, model.throughput(5));
        assertEquals(0.0, model.bitsPerRb(5));
        assertEquals(0.0, model.averageDelay(5));
        assertEquals(0, model.dropped(5));
    }

    @Test
    void testTracksRegistrySwitches() {
        var model = model(0.1);
        var registry = new BwpRegistry(0, SimTime.millis(1), scheduler, model);
        registry.addSubband(0, 50);
        registry.addSubband(1, 100);
        model.attachUe(1);
        registry.addDevice(1);

        registry.switchDevice(1, 1);
        assertEquals(0, model.linkSubband(1));

        scheduler.runAll();
        assertEquals(1, model.linkSubband(1));

        model.bwpSwitched(99, 1, scheduler.now());
        assertEquals(0, model.linkSubband(99));
        assertFalse(model.ueIds().contains(99));
    }
}
