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
package com.hellblazer.nru.lbt;

import com.hellblazer.nru.ConfigurationException;
import com.hellblazer.nru.ScriptedRandom;
import com.hellblazer.nru.common.EventScheduler;
import com.hellblazer.nru.common.SimTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChannelAccess - ICCA/ECCA contention, window bounds, failure rate smoothing and the interference
 * process.
 *
 * @author hal.hildebrand
 */
class ChannelAccessTest {

    private static final long   SLOT     = SimTime.millis(0.5);
    // u such that -ln(1 - u) == 1, i.e. an inter-arrival of exactly 1 / rate
    private static final double ONE_MEAN = 1.0 - Math.exp(-1.0);

    private EventScheduler scheduler;
    private LbtConfig      config;

    @BeforeEach
    void setup() {
        scheduler = new EventScheduler();
        config = LbtConfig.defaultConfig();
    }

    @Test
    void testRegistrationDefaults() {
        var lbt = new ChannelAccess(config, scheduler, new Random(1));
        lbt.registerSubband(0, 200.0);

        assertEquals(0.0, lbt.failureRate(0));
        assertEquals(0.0, lbt.occupancy(0));
        assertEquals(config.getCwMin(), lbt.contentionWindow(0));
        assertEquals(0, lbt.attempts(0));
        assertEquals(0, lbt.failures(0));
        assertTrue(lbt.isRegistered(0));
    }

    @Test
    void testUnknownSubbandDefaults() {
        var lbt = new ChannelAccess(config, scheduler, new Random(1));

        assertEquals(0.0, lbt.failureRate(42));
        assertEquals(0.0, lbt.occupancy(42));
        assertEquals(config.getCwMin(), lbt.contentionWindow(42));
        assertEquals(Long.MAX_VALUE, lbt.nextInterference(42));
        assertFalse(lbt.isRegistered(42));
    }

    @Test
    void testDuplicateRegistrationIsConfigurationError() {
        var lbt = new ChannelAccess(config, scheduler, new Random(1));
        lbt.registerSubband(1, 100.0);

        assertThrows(ConfigurationException.class, () -> lbt.registerSubband(1, 50.0));
        assertEquals(100.0, lbt.interferenceRate(1));
    }

    @Test
    void testAccessOnUnregisteredSubbandIsConfigurationError() {
        var lbt = new ChannelAccess(config, scheduler, new Random(1));
        assertThrows(ConfigurationException.class, () -> lbt.requestAccess(7));
    }

    @Test
    void testCleanChannelAlwaysGranted() {
        var lbt = new ChannelAccess(config, scheduler, new Random(3));
        lbt.registerSubband(0, 0.0);

        for (int i = 0; i < 20; i++) {
            scheduler.runUntil(scheduler.now() + SLOT);
            var result = lbt.requestAccess(0);
            assertEquals(AccessResult.GRANTED, result);
            assertEquals(config.getCwMin(), lbt.contentionWindow(0));
            assertEquals(scheduler.now() + 5 * SLOT, lbt.occupiedUntil(0));
        }
        assertEquals(20, lbt.attempts(0));
        assertEquals(0, lbt.failures(0));
        assertEquals(0.0, lbt.failureRate(0));
    }

    @Test
    void testIccaDeniesWhileChannelBusy() {
        var lbt = new ChannelAccess(config, scheduler, new Random(11));
        lbt.registerSubband(0, 1000.0);

        // run exactly up to the first interference burst
        scheduler.runUntil(lbt.nextInterference(0));
        assertTrue(lbt.busyUntil(0) > scheduler.now());

        int cw = lbt.contentionWindow(0);
        double expectedRate = 0.0;
        for (int i = 1; i <= 3; i++) {
            assertEquals(AccessResult.ICCA_BUSY, lbt.requestAccess(0));
            assertEquals(i, lbt.failures(0), "exactly one failure per denied request");
            assertEquals(i, lbt.attempts(0));
            expectedRate = 0.9 * expectedRate + 0.1 * 1.0;
            assertEquals(expectedRate, lbt.failureRate(0), 1e-12);
            assertEquals(cw, lbt.contentionWindow(0), "ICCA failure leaves the window unchanged");
        }
    }

    @Test
    void testEccaInterruptionDoublesWindowUpToMax() {
        var random = new ScriptedRandom(0.5).scriptDoubles(ONE_MEAN);
        var lbt = new ChannelAccess(config, scheduler, random);
        lbt.registerSubband(0, 1000.0);
        assertEquals(SimTime.millis(1), lbt.nextInterference(0));

        // maximal backoff always ends after the burst at 1 ms
        int expectedCw = config.getCwMin();
        for (int i = 0; i < 8; i++) {
            assertEquals(AccessResult.ECCA_INTERRUPTED, lbt.requestAccess(0));
            expectedCw = Math.min(expectedCw * 2, config.getCwMax());
            assertEquals(expectedCw, lbt.contentionWindow(0));
            assertTrue(lbt.contentionWindow(0) <= config.getCwMax());
        }
        assertEquals(config.getCwMax(), lbt.contentionWindow(0));

        // zero backoff completes after the single ICCA slot, before the burst
        random.scriptInts(0);
        assertEquals(AccessResult.GRANTED, lbt.requestAccess(0));
        assertEquals(config.getCwMin(), lbt.contentionWindow(0));
        assertEquals(9, lbt.attempts(0));
        assertEquals(8, lbt.failures(0));
    }

    @Test
    void testFailureRateUsesCumulativeCounters() {
        var random = new ScriptedRandom(0.5).scriptDoubles(ONE_MEAN);
        var lbt = new ChannelAccess(config, scheduler, random);
        lbt.registerSubband(0, 1000.0);

        random.scriptInts(0);
        assertTrue(lbt.requestAccess(0).isGranted());
        assertEquals(0.0, lbt.failureRate(0), "no failure observed yet");

        assertFalse(lbt.requestAccess(0).isGranted());
        // 1 failure out of 2 attempts
        assertEquals(0.1 * 0.5, lbt.failureRate(0), 1e-12);

        random.scriptInts(0);
        assertTrue(lbt.requestAccess(0).isGranted());
        assertEquals(0.05, lbt.failureRate(0), 1e-12, "success does not reset the smoothed rate");
    }

    @Test
    void testWindowDoublingSaturatesAtLargeMaximum() {
        var wide = LbtConfig.builder().withContentionWindow(1 << 30, Integer.MAX_VALUE).build();
        var random = new ScriptedRandom(0.5).scriptDoubles(ONE_MEAN);
        var lbt = new ChannelAccess(wide, scheduler, random);
        lbt.registerSubband(0, 1000.0);

        assertEquals(AccessResult.ECCA_INTERRUPTED, lbt.requestAccess(0));
        assertEquals(Integer.MAX_VALUE, lbt.contentionWindow(0));
        assertEquals(AccessResult.ECCA_INTERRUPTED, lbt.requestAccess(0));
        assertEquals(Integer.MAX_VALUE, lbt.contentionWindow(0));

        random.scriptInts(0);
        assertEquals(AccessResult.GRANTED, lbt.requestAccess(0));
        assertEquals(1 << 30, lbt.contentionWindow(0));
    }

    @ParameterizedTest
    @CsvSource({ "0, GRANTED", "2, GRANTED", "3, ECCA_INTERRUPTED" })
    void testIccaDeferCountsTowardBackoffCompletion(int iccaSlots, AccessResult expected) {
        var deferred = LbtConfig.builder().withIccaDuration(iccaSlots).build();
        var random = new ScriptedRandom(0.5).scriptDoubles(ONE_MEAN).scriptInts(0);
        var lbt = new ChannelAccess(deferred, scheduler, random);
        lbt.registerSubband(0, 1000.0);

        // burst at 1 ms, zero backoff completes after the defer period alone
        assertEquals(SimTime.millis(1), lbt.nextInterference(0));
        assertEquals(expected, lbt.requestAccess(0));
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 7L, 42L, 1234L })
    void testContentionInvariantsUnderRandomInterference(long seed) {
        var lbt = new ChannelAccess(config, scheduler, new Random(seed));
        lbt.registerSubband(0, 400.0);

        boolean failed = false;
        for (int i = 0; i < 2_000; i++) {
            scheduler.runUntil(scheduler.now() + SLOT);
            var result = lbt.requestAccess(0);
            int cw = lbt.contentionWindow(0);
            assertTrue(cw >= config.getCwMin() && cw <= config.getCwMax(), "cw out of bounds: " + cw);
            if (result.isGranted()) {
                assertEquals(config.getCwMin(), cw);
            } else {
                failed = true;
            }
            double rate = lbt.failureRate(0);
            assertTrue(rate >= 0.0 && rate <= 1.0, "failure rate out of bounds: " + rate);
            if (failed) {
                assertTrue(rate > 0.0, "failure rate never returns to zero once a failure was seen");
            }
        }
        assertTrue(failed, "interference at 400/s must cause failures");
        double occupancy = lbt.occupancy(0);
        assertTrue(occupancy > 0.0 && occupancy <= 1.0, "occupancy out of bounds: " + occupancy);
    }

    @Test
    void testUnregisteredSubbandInterferenceIsStale() {
        var lbt = new ChannelAccess(config, scheduler, new Random(5));
        lbt.registerSubband(0, 1000.0);
        long firstBurst = lbt.nextInterference(0);

        assertTrue(lbt.unregisterSubband(0));
        assertFalse(lbt.unregisterSubband(0));
        lbt.registerSubband(0, 0.0);

        // the old process fires but must not touch the new state
        scheduler.runUntil(firstBurst + SimTime.millis(10));
        assertEquals(0, lbt.busyUntil(0));
        assertEquals(0.0, lbt.occupancy(0));
        assertEquals(0, scheduler.pending());
    }

    @Test
    void testSetInterferenceRateRearmsDormantProcess() {
        var lbt = new ChannelAccess(config, scheduler, new Random(9));
        lbt.registerSubband(2, 0.0);
        assertEquals(Long.MAX_VALUE, lbt.nextInterference(2));
        assertEquals(0, scheduler.pending());

        lbt.setInterferenceRate(2, 100.0);
        assertTrue(lbt.nextInterference(2) < Long.MAX_VALUE);
        assertEquals(1, scheduler.pending());

        // already armed: only the rate changes
        lbt.setInterferenceRate(2, 50.0);
        assertEquals(1, scheduler.pending());
        assertEquals(50.0, lbt.interferenceRate(2));

        // unknown ids are ignored
        lbt.setInterferenceRate(99, 10.0);
        assertFalse(lbt.isRegistered(99));
        assertThrows(IllegalArgumentException.class, () -> lbt.setInterferenceRate(2, -1.0));
    }
}
