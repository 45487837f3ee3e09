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
package com.hellblazer.nru.common;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventScheduler - ordering, FIFO tie break and clock advancement.
 *
 * @author hal.hildebrand
 */
class EventSchedulerTest {

    private EventScheduler scheduler;
    private List<String>   fired;

    @BeforeEach
    void setup() {
        scheduler = new EventScheduler();
        fired = new ArrayList<>();
    }

    @Test
    void testEventsRunInTimeOrder() {
        scheduler.schedule(300, () -> fired.add("c"));
        scheduler.schedule(100, () -> fired.add("a"));
        scheduler.schedule(200, () -> fired.add("b"));

        assertEquals(3, scheduler.runAll());
        assertEquals(List.of("a", "b", "c"), fired);
        assertEquals(300, scheduler.now());
    }

    @Test
    void testSimultaneousEventsAreFifo() {
        for (int i = 0; i < 10; i++) {
            int n = i;
            scheduler.schedule(50, () -> fired.add("e" + n));
        }
        scheduler.runAll();

        for (int i = 0; i < 10; i++) {
            assertEquals("e" + i, fired.get(i));
        }
    }

    @Test
    void testHandlersCanScheduleAtCurrentInstant() {
        scheduler.schedule(10, () -> {
            fired.add("first");
            scheduler.schedule(0, () -> fired.add("nested"));
        });
        scheduler.schedule(10, () -> fired.add("second"));

        scheduler.runAll();

        // nested was scheduled after "second", so it runs after it
        assertEquals(List.of("first", "second", "nested"), fired);
    }

    @Test
    void testRunUntilStopsAtBoundaryAndAdvancesClock() {
        scheduler.schedule(100, () -> fired.add("in"));
        scheduler.schedule(1000, () -> fired.add("boundary"));
        scheduler.schedule(1001, () -> fired.add("out"));

        assertEquals(2, scheduler.runUntil(1000));
        assertEquals(List.of("in", "boundary"), fired);
        assertEquals(1000, scheduler.now());
        assertEquals(1, scheduler.pending());
        assertEquals(1001, scheduler.nextEventTime());
    }

    @Test
    void testRunUntilWithEmptyQueueStillAdvances() {
        assertEquals(0, scheduler.runUntil(5_000));
        assertEquals(5_000, scheduler.now());
        assertEquals(Long.MAX_VALUE, scheduler.nextEventTime());
    }

    @Test
    void testRecurringProcess() {
        var count = new int[1];
        Runnable[] tick = new Runnable[1];
        tick[0] = () -> {
            count[0]++;
            scheduler.schedule(SimTime.millis(1), "tick", tick[0]);
        };
        scheduler.schedule(0, "tick", tick[0]);

        scheduler.runUntil(SimTime.millis(10));

        // fires at 0, 1, ..., 10 ms
        assertEquals(11, count[0]);
    }

    @Test
    void testRejectsPastScheduling() {
        scheduler.runUntil(100);
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(-1, () -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAt(99, "late", () -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> scheduler.runUntil(50));
    }

    @Test
    void testHandlerExceptionPropagates() {
        scheduler.schedule(1, () -> {
            throw new IllegalStateException("boom");
        });
        assertThrows(IllegalStateException.class, scheduler::runAll);
    }

    @Test
    void testEwmaSmoothing() {
        assertEquals(0.1, Ewma.smooth(0.0, 1.0), 1e-12);
        assertEquals(0.9, Ewma.smooth(1.0, 0.0), 1e-12);
        assertEquals(0.5, Ewma.smooth(0.0, 1.0, 0.5), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> Ewma.smooth(0.0, 1.0, 1.5));

        assertEquals(0.0, Ewma.clampUnit(Double.NaN));
        assertEquals(0.0, Ewma.clampUnit(-0.2));
        assertEquals(1.0, Ewma.clampUnit(3.0));
        assertEquals(0.25, Ewma.clampUnit(0.25));
    }
}
