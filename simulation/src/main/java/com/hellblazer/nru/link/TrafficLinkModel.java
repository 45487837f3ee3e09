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

import com.hellblazer.nru.bwp.BwpSwitchListener;
import com.hellblazer.nru.common.Ewma;
import com.hellblazer.nru.common.SimClock;
import com.hellblazer.nru.common.SimTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Random;
import java.util.TreeMap;

/**
 * Traffic driven link model standing in for the PHY/MAC collaborator.
 * <p>
 * Each UE receives Poisson packet arrivals into a bounded queue. Its achievable bits per resource block follow
 * a bounded random walk, standing in for CQI reports. Resources on a sub-band are split equally among the
 * UEs served in a slot. The model tracks head-of-line delay, a smoothed packet delay, packets dropped on
 * queue overflow and the bits served in the current decision window.
 * <p>
 * The model also acts as the link layer end of BWP switching: it records the sub-band each UE was last told
 * to use.
 *
 * @author hal.hildebrand
 */
public class TrafficLinkModel implements LinkQualityProvider, BwpSwitchListener {
    private static final Logger log = LoggerFactory.getLogger(TrafficLinkModel.class);

    public static final int    MAX_QUEUE_SIZE   = 200;
    public static final double MIN_BITS_PER_RB  = 200.0;
    // 12 subcarriers x 14 symbols x 8 bits
    public static final double MAX_BITS_PER_RB  = 1344.0;
    public static final int    MAX_PACKET_UNITS = 30;
    public static final double BITS_PER_UNIT    = 1000.0;

    private static final double CAPACITY_STEP = 50.0;
    private static final double DELAY_WEIGHT  = 0.05;

    private record Packet(long arrivalSlot, double bits) {
    }

    private static final class UeTraffic {
        private final double             arrivalRate;
        private final double             meanPacketUnits;
        private final ArrayDeque<Packet> queue = new ArrayDeque<>();
        private       double             headRemaining;
        private       double             bitsPerRb;
        private       long               holSlots;
        private       double             averageDelaySlots;
        private       double             windowBits;
        private       long               dropped;
        private       long               windowDropped;

        private UeTraffic(double arrivalRate, double meanPacketUnits, double bitsPerRb) {
            this.arrivalRate = arrivalRate;
            this.meanPacketUnits = meanPacketUnits;
            this.bitsPerRb = bitsPerRb;
        }
    }

    private final SimClock                    clock;
    private final Random                      random;
    private final long                        slotDuration;
    private final double                      minArrivalRate;
    private final double                      maxArrivalRate;
    private final int                         defaultSubbandId;
    private final TreeMap<Integer, UeTraffic> ues         = new TreeMap<>();
    private final TreeMap<Integer, Integer>   subbandRbs  = new TreeMap<>();
    private final TreeMap<Integer, Integer>   linkSubband = new TreeMap<>();
    private       long                        windowStart;

    /**
     * @param clock            simulated clock
     * @param random           random source for arrivals and channel variation
     * @param slotDuration     slot length in nanoseconds
     * @param minArrivalRate   lower bound of per-UE packet arrival rate, packets per slot
     * @param maxArrivalRate   upper bound of per-UE packet arrival rate, packets per slot
     * @param defaultSubbandId sub-band UEs start on at the link layer
     */
    public TrafficLinkModel(SimClock clock, Random random, long slotDuration, double minArrivalRate,
                            double maxArrivalRate, int defaultSubbandId) {
        if (minArrivalRate < 0 || maxArrivalRate < minArrivalRate) {
            throw new IllegalArgumentException(
            "Invalid arrival rate range [" + minArrivalRate + ", " + maxArrivalRate + "]");
        }
        this.clock = clock;
        this.random = random;
        this.slotDuration = slotDuration;
        this.minArrivalRate = minArrivalRate;
        this.maxArrivalRate = maxArrivalRate;
        this.defaultSubbandId = defaultSubbandId;
        this.windowStart = clock.now();
    }

    /**
     * Configure the resource blocks of a sub-band.
     */
    public void configureSubband(int subbandId, int numRbs) {
        if (numRbs <= 0) {
            throw new IllegalArgumentException("Resource block count must be positive: " + numRbs);
        }
        subbandRbs.put(subbandId, numRbs);
        log.debug("Configured sub-band {} with {} RBs", subbandId, numRbs);
    }

    /**
     * Attach a UE with randomly drawn traffic parameters. Re-attaching a known UE has no effect.
     */
    public void attachUe(int ueId) {
        if (ues.containsKey(ueId)) {
            return;
        }
        double rate = minArrivalRate + random.nextDouble() * (maxArrivalRate - minArrivalRate);
        double meanUnits = 8.0 + random.nextDouble() * 12.0;
        double bitsPerRb = MIN_BITS_PER_RB + random.nextDouble() * (MAX_BITS_PER_RB - MIN_BITS_PER_RB);
        ues.put(ueId, new UeTraffic(rate, meanUnits, bitsPerRb));
        linkSubband.put(ueId, defaultSubbandId);
        log.debug("Attached UE {}: {} packets/slot, {} units mean size", ueId, rate, meanUnits);
    }

    public void detachUe(int ueId) {
        ues.remove(ueId);
        linkSubband.remove(ueId);
    }

    /**
     * Advance traffic by one slot: Poisson arrivals, channel variation and delay bookkeeping.
     *
     * @param slot current slot index
     */
    public void generateTraffic(long slot) {
        for (var ue : ues.values()) {
            int arrivals = poisson(ue.arrivalRate);
            for (int i = 0; i < arrivals; i++) {
                int units = Math.max(1, Math.min(MAX_PACKET_UNITS, poisson(ue.meanPacketUnits)));
                if (ue.queue.size() < MAX_QUEUE_SIZE) {
                    if (ue.queue.isEmpty()) {
                        ue.headRemaining = units * BITS_PER_UNIT;
                    }
                    ue.queue.add(new Packet(slot, units * BITS_PER_UNIT));
                } else {
                    ue.dropped++;
                    ue.windowDropped++;
                }
            }
            ue.bitsPerRb = Math.max(MIN_BITS_PER_RB,
                                    Math.min(MAX_BITS_PER_RB, ue.bitsPerRb + random.nextGaussian() * CAPACITY_STEP));
            var head = ue.queue.peek();
            ue.holSlots = head == null ? 0 : slot - head.arrivalSlot();
            ue.averageDelaySlots = Ewma.smooth(ue.averageDelaySlots, ue.holSlots, DELAY_WEIGHT);
        }
    }

    /**
     * Split a sub-band's resource blocks equally among UEs.
     *
     * @param subbandId sub-band to allocate on
     * @param ueIds     UEs to serve, in priority order
     * @return resource blocks granted per UE, in the given order; empty if the sub-band is unknown
     */
    public Map<Integer, Integer> allocateResources(int subbandId, List<Integer> ueIds) {
        var allocation = new LinkedHashMap<Integer, Integer>();
        var numRbs = subbandRbs.get(subbandId);
        if (numRbs == null) {
            log.warn("Invalid sub-band {} or no RBs configured", subbandId);
            return allocation;
        }
        int rbPerUe = numRbs / Math.max(1, ueIds.size());
        for (var ueId : ueIds) {
            if (ues.containsKey(ueId) && rbPerUe > 0) {
                allocation.put(ueId, rbPerUe);
            }
        }
        return allocation;
    }

    /**
     * Transmit from a UE's queue over the granted resource blocks.
     *
     * @return bits delivered
     */
    public double serve(int ueId, int rbs, long slot) {
        var ue = ues.get(ueId);
        if (ue == null || rbs <= 0) {
            return 0.0;
        }
        double capacity = ue.bitsPerRb * rbs;
        double delivered = 0.0;
        while (capacity > 0 && !ue.queue.isEmpty()) {
            double sent = Math.min(capacity, ue.headRemaining);
            capacity -= sent;
            delivered += sent;
            ue.headRemaining -= sent;
            if (ue.headRemaining <= 0) {
                ue.queue.poll();
                var next = ue.queue.peek();
                ue.headRemaining = next == null ? 0.0 : next.bits();
            }
        }
        var head = ue.queue.peek();
        ue.holSlots = head == null ? 0 : slot - head.arrivalSlot();
        ue.windowBits += delivered;
        return delivered;
    }

    public boolean hasBacklog(int ueId) {
        var ue = ues.get(ueId);
        return ue != null && !ue.queue.isEmpty();
    }

    @Override
    public void bwpSwitched(int ueId, int subbandId, long time) {
        if (ues.containsKey(ueId)) {
            linkSubband.put(ueId, subbandId);
            log.debug("Link layer moved UE {} to sub-band {} at {}", ueId, subbandId, time);
        }
    }

    /**
     * @return the sub-band the link layer was last told the UE uses, or the default
     */
    public int linkSubband(int ueId) {
        return linkSubband.getOrDefault(ueId, defaultSubbandId);
    }

    @Override
    public int queueDepth(int ueId) {
        var ue = ues.get(ueId);
        return ue == null ? 0 : ue.queue.size();
    }

    @Override
    public double holDelay(int ueId) {
        var ue = ues.get(ueId);
        return ue == null ? 0.0 : SimTime.toMillis(ue.holSlots * slotDuration);
    }

    @Override
    public double throughput(int ueId) {
        var ue = ues.get(ueId);
        if (ue == null) {
            return 0.0;
        }
        long elapsed = clock.now() - windowStart;
        if (elapsed <= 0) {
            return 0.0;
        }
        return ue.windowBits / SimTime.toSeconds(elapsed) / 1e6;
    }

    @Override
    public double bitsPerRb(int ueId) {
        var ue = ues.get(ueId);
        return ue == null ? 0.0 : ue.bitsPerRb;
    }

    @Override
    public double averageDelay(int ueId) {
        var ue = ues.get(ueId);
        return ue == null ? 0.0 : SimTime.toMillis(Math.round(ue.averageDelaySlots * slotDuration));
    }

    /**
     * The channel is frequency flat in this model, so every configured sub-band offers the mean UE capacity.
     */
    @Override
    public double subbandBitsPerRb(int subbandId) {
        if (!subbandRbs.containsKey(subbandId) || ues.isEmpty()) {
            return 0.0;
        }
        return ues.values().stream().mapToDouble(ue -> ue.bitsPerRb).average().orElse(0.0);
    }

    @Override
    public void windowElapsed(long now) {
        for (var ue : ues.values()) {
            ue.windowBits = 0.0;
            ue.windowDropped = 0;
        }
        windowStart = now;
    }

    public long dropped(int ueId) {
        var ue = ues.get(ueId);
        return ue == null ? 0 : ue.dropped;
    }

    public long windowDropped() {
        return ues.values().stream().mapToLong(ue -> ue.windowDropped).sum();
    }

    public long totalDropped() {
        return ues.values().stream().mapToLong(ue -> ue.dropped).sum();
    }

    public NavigableSet<Integer> ueIds() {
        return Collections.unmodifiableNavigableSet(ues.navigableKeySet());
    }

    public int subbandRbs(int subbandId) {
        return subbandRbs.getOrDefault(subbandId, 0);
    }

    private int poisson(double mean) {
        if (mean <= 0.0) {
            return 0;
        }
        double limit = Math.exp(-mean);
        double product = random.nextDouble();
        int count = 0;
        while (product > limit) {
            count++;
            product *= random.nextDouble();
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("TrafficLinkModel{ues=%d, subbands=%s}", ues.size(), subbandRbs.keySet());
    }
}
