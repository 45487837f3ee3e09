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

import com.hellblazer.nru.bwp.MembershipView;
import com.hellblazer.nru.common.Ewma;
import com.hellblazer.nru.lbt.ContentionView;
import com.hellblazer.nru.link.LinkQualityProvider;

import java.util.ArrayList;
import java.util.TreeMap;

/**
 * Builds a {@link StatisticsSnapshot} from the contention state, the membership registry, the link quality
 * provider and the window counters.
 * <p>
 * The device list is rebuilt on every collection. Sub-band bits per RB is smoothed across windows with
 * {@link Ewma#DEFAULT_WEIGHT}, seeded with the first observation.
 *
 * @author hal.hildebrand
 */
public class StatisticsCollector {

    private final ContentionView           contention;
    private final MembershipView           membership;
    private final LinkQualityProvider      link;
    private final WindowCounters           counters;
    private final TreeMap<Integer, Double> avgBitsPerRb = new TreeMap<>();

    public StatisticsCollector(ContentionView contention, MembershipView membership, LinkQualityProvider link,
                               WindowCounters counters) {
        this.contention = contention;
        this.membership = membership;
        this.link = link;
        this.counters = counters;
    }

    public StatisticsSnapshot collect(long now) {
        var subbands = new ArrayList<BwpStats>();
        for (var id : membership.subbandIds()) {
            double sample = link.subbandBitsPerRb(id);
            double smoothed = avgBitsPerRb.containsKey(id) ? Ewma.smooth(avgBitsPerRb.get(id), sample) : sample;
            avgBitsPerRb.put(id, smoothed);
            subbands.add(new BwpStats(id, membership.capacity(id), membership.activeCount(id),
                                      contention.failureRate(id), contention.occupancy(id),
                                      contention.contentionWindow(id), smoothed, counters.bits(id),
                                      counters.collisions(id)));
        }
        avgBitsPerRb.keySet().retainAll(membership.subbandIds());

        var devices = new ArrayList<UeStats>();
        for (var entry : membership.devices().entrySet()) {
            int ue = entry.getKey();
            devices.add(new UeStats(ue, link.queueDepth(ue), link.holDelay(ue), link.throughput(ue),
                                    link.bitsPerRb(ue), link.averageDelay(ue), entry.getValue()));
        }
        return StatisticsSnapshot.of(now, subbands, devices);
    }

    /**
     * @return the smoothed bits per RB of the sub-band, or 0 before its first collection
     */
    public double avgBitsPerRb(int subbandId) {
        return avgBitsPerRb.getOrDefault(subbandId, 0.0);
    }
}
