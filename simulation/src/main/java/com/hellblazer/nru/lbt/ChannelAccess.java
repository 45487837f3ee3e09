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
import com.hellblazer.nru.common.EventScheduler;
import com.hellblazer.nru.common.Ewma;
import com.hellblazer.nru.common.SimTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.Random;
import java.util.TreeMap;

/**
 * Per-sub-band Listen-Before-Talk state machine for NR-U channel access.
 * <p>
 * Each registered sub-band carries its own contention state. An access request runs the two phases of a
 * category 4 LBT procedure:
 * <ol>
 *   <li>ICCA: if competing traffic currently holds the channel, the request fails immediately and the
 *   contention window is left unchanged</li>
 *   <li>ECCA: a backoff of {@code [0, cw)} slots is drawn after the ICCA defer period; if competing traffic
 *   arrives before the backoff completes, the request fails and the window doubles up to the maximum</li>
 *   <li>Otherwise the channel is granted for the maximum channel occupancy time and the window resets</li>
 * </ol>
 * Every failure updates the smoothed failure rate {@code 0.9 * rate + 0.1 * failures / attempts} from the
 * cumulative counters.
 * <p>
 * Competing WiFi traffic is modeled by a self-rescheduling interference process per sub-band with
 * exponential inter-arrival times. Each firing holds the channel for 1-5 slots and folds the busy fraction
 * into the smoothed occupancy estimate.
 * <p>
 * This object is the only writer of contention state. It is not thread-safe; all calls happen on the
 * {@link EventScheduler} thread.
 *
 * @author hal.hildebrand
 */
public class ChannelAccess implements ContentionView {
    private static final Logger log = LoggerFactory.getLogger(ChannelAccess.class);

    private static final int MIN_BUSY_SLOTS = 1;
    private static final int MAX_BUSY_SLOTS = 5;
    // keeps now + delay from overflowing for vanishing rates
    private static final long MAX_INTERARRIVAL = SimTime.seconds(1_000_000);

    private static final class ContentionState {
        private final int     subbandId;
        private       int     currentCw;
        private       double  interferenceRate;
        private       double  occupancy;
        private       double  failureRate;
        private       long    attempts;
        private       long    failures;
        private       long    busyUntil;
        private       long    occupiedUntil;
        private       long    lastUpdate;
        private       long    nextInterference = Long.MAX_VALUE;
        private       boolean interferenceArmed;

        private ContentionState(int subbandId, int cw, double interferenceRate, long now) {
            this.subbandId = subbandId;
            this.currentCw = cw;
            this.interferenceRate = interferenceRate;
            this.busyUntil = now;
            this.occupiedUntil = now;
            this.lastUpdate = now;
        }
    }

    private final LbtConfig                         config;
    private final EventScheduler                    scheduler;
    private final Random                            random;
    private final TreeMap<Integer, ContentionState> states = new TreeMap<>();

    public ChannelAccess(LbtConfig config, EventScheduler scheduler, Random random) {
        this.config = config;
        this.scheduler = scheduler;
        this.random = random;
        log.debug("Created ChannelAccess with {}", config);
    }

    /**
     * Register a sub-band and start its interference process.
     *
     * @param subbandId        sub-band identifier
     * @param interferenceRate mean arrival rate of competing traffic bursts per second, 0 for a clean channel
     * @throws ConfigurationException if the sub-band is already registered
     */
    public void registerSubband(int subbandId, double interferenceRate) {
        if (states.containsKey(subbandId)) {
            throw new ConfigurationException("Sub-band " + subbandId + " is already registered for LBT");
        }
        checkRate(interferenceRate);
        var state = new ContentionState(subbandId, config.getCwMin(), interferenceRate, scheduler.now());
        states.put(subbandId, state);
        scheduleInterference(state);
        log.info("Registered sub-band {} for LBT, interference rate {}/s", subbandId, interferenceRate);
    }

    /**
     * Drop the contention state of a sub-band. Its pending interference event becomes stale and does nothing.
     *
     * @return true if the sub-band was registered
     */
    public boolean unregisterSubband(int subbandId) {
        var removed = states.remove(subbandId);
        if (removed != null) {
            log.info("Unregistered sub-band {} from LBT", subbandId);
        }
        return removed != null;
    }

    /**
     * Perform the LBT procedure on a sub-band at the current simulated instant.
     *
     * @param subbandId registered sub-band
     * @return the access outcome
     * @throws ConfigurationException if the sub-band was never registered
     */
    public AccessResult requestAccess(int subbandId) {
        var state = states.get(subbandId);
        if (state == null) {
            throw new ConfigurationException("Channel access requested on unregistered sub-band " + subbandId);
        }
        long now = scheduler.now();
        state.attempts++;

        if (now < state.busyUntil) {
            state.failures++;
            updateFailureRate(state);
            log.debug("ICCA failed for sub-band {}, busy until {}", subbandId, state.busyUntil);
            return AccessResult.ICCA_BUSY;
        }

        int backoffSlots = random.nextInt(state.currentCw);
        long backoffEnd = now + SimTime.slots((long) config.getIccaDuration() + backoffSlots,
                                              config.getSlotDuration());
        log.debug("ECCA backoff for sub-band {}: {} slots", subbandId, backoffSlots);

        if (state.nextInterference < backoffEnd) {
            state.failures++;
            updateFailureRate(state);
            state.currentCw = (int) Math.min(2L * state.currentCw, config.getCwMax());
            log.debug("ECCA interrupted for sub-band {}, cw now {}", subbandId, state.currentCw);
            return AccessResult.ECCA_INTERRUPTED;
        }

        state.currentCw = config.getCwMin();
        state.occupiedUntil = now + SimTime.slots(config.getMcotDuration(), config.getSlotDuration());
        log.debug("Channel access granted for sub-band {} for {} slots", subbandId, config.getMcotDuration());
        return AccessResult.GRANTED;
    }

    /**
     * Change the mean arrival rate of competing traffic. Only future inter-arrival draws are affected; a dormant
     * process is re-armed when the rate becomes positive.
     */
    public void setInterferenceRate(int subbandId, double interferenceRate) {
        checkRate(interferenceRate);
        var state = states.get(subbandId);
        if (state == null) {
            log.warn("Ignoring interference rate for unknown sub-band {}", subbandId);
            return;
        }
        state.interferenceRate = interferenceRate;
        if (!state.interferenceArmed) {
            scheduleInterference(state);
        }
    }

    @Override
    public double failureRate(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0.0 : state.failureRate;
    }

    @Override
    public double occupancy(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0.0 : state.occupancy;
    }

    @Override
    public int contentionWindow(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? config.getCwMin() : state.currentCw;
    }

    public long attempts(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0 : state.attempts;
    }

    public long failures(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0 : state.failures;
    }

    public double interferenceRate(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0.0 : state.interferenceRate;
    }

    /**
     * @return time until which competing traffic holds the channel, or 0 if unknown
     */
    public long busyUntil(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0 : state.busyUntil;
    }

    /**
     * @return end of our own current channel occupancy, or 0 if unknown
     */
    public long occupiedUntil(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? 0 : state.occupiedUntil;
    }

    /**
     * @return firing time of the next competing traffic burst, {@link Long#MAX_VALUE} if none is pending
     */
    public long nextInterference(int subbandId) {
        var state = states.get(subbandId);
        return state == null ? Long.MAX_VALUE : state.nextInterference;
    }

    public boolean isRegistered(int subbandId) {
        return states.containsKey(subbandId);
    }

    public NavigableSet<Integer> subbandIds() {
        return Collections.unmodifiableNavigableSet(states.navigableKeySet());
    }

    public LbtConfig getConfig() {
        return config;
    }

    private void scheduleInterference(ContentionState state) {
        if (state.interferenceRate <= 0.0) {
            state.interferenceArmed = false;
            state.nextInterference = Long.MAX_VALUE;
            return;
        }
        double interval = -Math.log(1.0 - random.nextDouble()) / state.interferenceRate;
        long delay = Math.min(SimTime.seconds(interval), MAX_INTERARRIVAL);
        state.interferenceArmed = true;
        state.nextInterference = scheduler.schedule(delay, "interference-" + state.subbandId,
                                                    () -> handleInterference(state));
    }

    private void handleInterference(ContentionState state) {
        if (states.get(state.subbandId) != state) {
            log.debug("Dropping stale interference event for sub-band {}", state.subbandId);
            return;
        }
        long now = scheduler.now();
        int busySlots = MIN_BUSY_SLOTS + random.nextInt(MAX_BUSY_SLOTS - MIN_BUSY_SLOTS + 1);
        long busyDuration = SimTime.slots(busySlots, config.getSlotDuration());
        state.busyUntil = Math.max(state.busyUntil, now + busyDuration);

        long elapsed = now - state.lastUpdate;
        if (elapsed > 0) {
            state.occupancy = Ewma.smooth(state.occupancy, Ewma.clampUnit(busyDuration / (double) elapsed));
            state.lastUpdate = now;
        }
        log.debug("Interference on sub-band {} for {} slots, occupancy {}", state.subbandId, busySlots,
                  state.occupancy);

        scheduleInterference(state);
    }

    private void updateFailureRate(ContentionState state) {
        double observed = state.failures / (double) state.attempts;
        state.failureRate = Ewma.smooth(state.failureRate, observed);
        log.debug("Updated LBT failure rate for sub-band {}: {}", state.subbandId, state.failureRate);
    }

    private static void checkRate(double interferenceRate) {
        if (Double.isNaN(interferenceRate) || interferenceRate < 0.0) {
            throw new IllegalArgumentException("Interference rate must be non-negative: " + interferenceRate);
        }
    }

    @Override
    public String toString() {
        return String.format("ChannelAccess{subbands=%s, %s}", states.keySet(), config);
    }
}
