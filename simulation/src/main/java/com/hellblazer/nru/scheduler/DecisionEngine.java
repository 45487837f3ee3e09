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

import com.hellblazer.nru.bwp.BwpRegistry;
import com.hellblazer.nru.common.EventScheduler;
import com.hellblazer.nru.common.SimTime;
import com.hellblazer.nru.lbt.ContentionView;
import com.hellblazer.nru.link.LinkQualityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Periodic BWP assignment.
 * <p>
 * Every {@code timeWindowSize} slots the engine takes a statistics snapshot, asks its policy for device moves,
 * applies them through the registry and then resets its window counters. The engine owns the counters; the
 * traffic process reports served bits and LBT denials into them through {@link #recordThroughput} and
 * {@link #recordCollision}.
 *
 * @author hal.hildebrand
 */
public class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final SchedulerConfig              config;
    private final EventScheduler               scheduler;
    private final BwpRegistry                  registry;
    private final LinkQualityProvider          link;
    private final DecisionPolicy               policy;
    private final WindowCounters               counters  = new WindowCounters();
    private final StatisticsCollector          collector;
    private final long                         windowDuration;
    private final List<Consumer<WindowReport>> listeners = new ArrayList<>();
    private       boolean                      running;
    private       long                         generation;
    private       long                         windowsCompleted;
    private       long                         windowStart;
    private       StatisticsSnapshot           lastSnapshot;
    private       WindowReport                 lastReport;

    /**
     * @param slotDuration slot length in nanoseconds
     */
    public DecisionEngine(SchedulerConfig config, long slotDuration, EventScheduler scheduler,
                          ContentionView contention, BwpRegistry registry, LinkQualityProvider link,
                          DecisionPolicy policy) {
        this.config = config;
        this.scheduler = scheduler;
        this.registry = registry;
        this.link = link;
        this.policy = policy;
        this.collector = new StatisticsCollector(contention, registry, link, counters);
        this.windowDuration = SimTime.slots(config.getTimeWindowSize(), slotDuration);
        this.windowStart = scheduler.now();
    }

    /**
     * Begin deciding every window. Starting a running engine has no effect.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        generation++;
        windowStart = scheduler.now();
        counters.reset();
        scheduleWindow(generation);
        log.info("Decision engine started: {} every {} ms", policy.algorithm(), SimTime.toMillis(windowDuration));
    }

    /**
     * Stop deciding. A pending window event finds the engine stopped and does nothing.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Decision engine stopped after {} windows", windowsCompleted);
    }

    /**
     * Run one decision cycle now.
     */
    public WindowReport runWindow() {
        long now = scheduler.now();
        var snapshot = collector.collect(now);
        var assignment = policy.decide(snapshot);

        int switched = 0;
        for (var move : assignment.entrySet()) {
            if (registry.switchDevice(move.getKey(), move.getValue())) {
                switched++;
            }
        }

        long elapsed = now - windowStart;
        double mbps = elapsed > 0 ? counters.totalBits() / SimTime.toSeconds(elapsed) / 1e6 : 0.0;
        windowsCompleted++;
        var report = new WindowReport(windowsCompleted, now, policy.algorithm(), switched, mbps,
                                      snapshot.meanHolDelay(), counters.totalCollisions());
        if (log.isInfoEnabled()) {
            log.info("Window {} ({}): switched {} UEs, {} Mbps, mean HoL {} ms, {} collisions", report.window(),
                     report.algorithm(), switched, String.format("%.2f", mbps),
                     String.format("%.3f", report.meanHolDelay()), report.collisions());
        }

        counters.reset();
        link.windowElapsed(now);
        windowStart = now;
        lastSnapshot = snapshot;
        lastReport = report;
        listeners.forEach(l -> l.accept(report));
        return report;
    }

    public void recordThroughput(int subbandId, double servedBits) {
        counters.recordThroughput(subbandId, servedBits);
    }

    public void recordCollision(int subbandId) {
        counters.recordCollision(subbandId);
    }

    public void addListener(Consumer<WindowReport> listener) {
        listeners.add(listener);
    }

    public boolean isRunning() {
        return running;
    }

    public long getWindowsCompleted() {
        return windowsCompleted;
    }

    /**
     * @return window length in nanoseconds
     */
    public long getWindowDuration() {
        return windowDuration;
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public WindowCounters getCounters() {
        return counters;
    }

    public StatisticsCollector getCollector() {
        return collector;
    }

    /**
     * @return the snapshot of the most recent window, or null before the first
     */
    public StatisticsSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public WindowReport getLastReport() {
        return lastReport;
    }

    private void scheduleWindow(long gen) {
        scheduler.schedule(windowDuration, "decision-window", () -> onWindow(gen));
    }

    private void onWindow(long gen) {
        if (!running || gen != generation) {
            return;
        }
        runWindow();
        scheduleWindow(gen);
    }
}
