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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-Collision Assignment.
 * <p>
 * Each sub-band is scored by {@link BwpStats#score()}. With at most {@code maxScheduledUes} devices every device
 * goes to the best scoring sub-band (ties to the lowest id). With more devices, each sub-band receives a quota of
 * {@code round(n * score / totalScore)} devices, filled in ascending sub-band order from the devices in id order;
 * devices left once the quotas are filled keep their sub-band. A total score of zero leaves every device in place.
 *
 * @author hal.hildebrand
 */
public final class LeastCollisionPolicy implements DecisionPolicy {
    private static final Logger log = LoggerFactory.getLogger(LeastCollisionPolicy.class);

    private final int maxScheduledUes;

    public LeastCollisionPolicy(int maxScheduledUes) {
        if (maxScheduledUes < 1) {
            throw new IllegalArgumentException("Max scheduled UEs must be positive: " + maxScheduledUes);
        }
        this.maxScheduledUes = maxScheduledUes;
    }

    /**
     * @return the sub-band id with the highest score, ties to the lowest id, or -1 with no sub-bands
     */
    public static int bestSubband(StatisticsSnapshot snapshot) {
        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (var bwp : snapshot.subbands().values()) {
            if (bwp.score() > bestScore) {
                bestScore = bwp.score();
                best = bwp.subbandId();
            }
        }
        return best;
    }

    /**
     * @return sub-band id to device quota, in ascending sub-band order; empty when the total score is zero
     */
    public static Map<Integer, Integer> quotas(StatisticsSnapshot snapshot) {
        double total = snapshot.subbands().values().stream().mapToDouble(BwpStats::score).sum();
        if (total <= 0.0) {
            return Collections.emptyMap();
        }
        int n = snapshot.numDevices();
        var quotas = new LinkedHashMap<Integer, Integer>();
        for (var bwp : snapshot.subbands().values()) {
            quotas.put(bwp.subbandId(), (int) Math.round(n * bwp.score() / total));
        }
        return quotas;
    }

    @Override
    public Map<Integer, Integer> decide(StatisticsSnapshot snapshot) {
        var assignment = new LinkedHashMap<Integer, Integer>();
        if (snapshot.numSubbands() == 0 || snapshot.numDevices() == 0) {
            return assignment;
        }
        if (snapshot.numDevices() <= maxScheduledUes) {
            int best = bestSubband(snapshot);
            snapshot.devices().keySet().forEach(ue -> assignment.put(ue, best));
            log.debug("LCA: all {} devices to sub-band {}", snapshot.numDevices(), best);
            return assignment;
        }

        var quotas = quotas(snapshot);
        if (quotas.isEmpty()) {
            log.debug("LCA: total score is zero, leaving assignments unchanged");
            return assignment;
        }
        Iterator<Integer> devices = snapshot.devices().keySet().iterator();
        for (var quota : quotas.entrySet()) {
            for (int i = 0; i < quota.getValue() && devices.hasNext(); i++) {
                assignment.put(devices.next(), quota.getKey());
            }
        }
        log.debug("LCA: proportional quotas {}", quotas);
        return assignment;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.LCA;
    }

    public int getMaxScheduledUes() {
        return maxScheduledUes;
    }
}
