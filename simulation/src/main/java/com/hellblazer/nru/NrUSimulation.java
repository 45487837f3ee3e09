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
package com.hellblazer.nru;

import com.hellblazer.nru.bwp.BwpRegistry;
import com.hellblazer.nru.common.EventScheduler;
import com.hellblazer.nru.common.SimTime;
import com.hellblazer.nru.config.SimulationConfig;
import com.hellblazer.nru.config.SimulationConfigLoader;
import com.hellblazer.nru.gym.BwpGymEnvironment;
import com.hellblazer.nru.gym.GreedyOracle;
import com.hellblazer.nru.gym.PolicyOracle;
import com.hellblazer.nru.lbt.ChannelAccess;
import com.hellblazer.nru.link.TrafficLinkModel;
import com.hellblazer.nru.metrics.WindowMetrics;
import com.hellblazer.nru.metrics.WindowMetricsWriter;
import com.hellblazer.nru.scheduler.Algorithm;
import com.hellblazer.nru.scheduler.DecisionEngine;
import com.hellblazer.nru.scheduler.DecisionPolicy;
import com.hellblazer.nru.scheduler.WindowReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;

/**
 * NR-U BWP management simulation.
 * <p>
 * Wires the channel access state machine, the membership registry, the traffic link model and the decision
 * engine onto one event scheduler. A per-slot process generates traffic and, for each sub-band with backlogged
 * UEs at the link layer, performs one LBT attempt. A grant splits the sub-band's resource blocks among up to
 * {@code maxScheduledUes} of those UEs, rotating the starting UE every slot; a denial is counted as a collision.
 * <p>
 * When a metrics file is configured, every decision window appends a {@link WindowMetrics} row to it.
 *
 * @author hal.hildebrand
 */
public class NrUSimulation {
    private static final Logger log = LoggerFactory.getLogger(NrUSimulation.class);

    private final SimulationConfig    config;
    private final EventScheduler      scheduler;
    private final ChannelAccess       channelAccess;
    private final BwpRegistry         registry;
    private final TrafficLinkModel    link;
    private final DecisionEngine      engine;
    private final BwpGymEnvironment   rewardModel;
    private final long                slotDuration;
    private final int                 maxScheduledUes;
    private       long                slot;
    private       double              servedBits;
    private       long                grants;
    private       long                collisions;
    private       long                switches;
    private       double              holDelaySum;
    private       long                lastDropped;
    private       WindowMetricsWriter metrics;

    /**
     * Build a simulation. RLA runs without a trained agent use the {@link GreedyOracle}.
     */
    public NrUSimulation(SimulationConfig config) {
        this(config, referenceOracle(config));
    }

    /**
     * @param oracle learning agent for RLA, ignored for LCA
     * @throws ConfigurationException if RLA is configured and the oracle is null
     */
    public NrUSimulation(SimulationConfig config, PolicyOracle oracle) {
        this.config = config;
        var random = new Random(config.getSeed());
        this.scheduler = new EventScheduler();
        this.slotDuration = config.getLbt().getSlotDuration();
        this.maxScheduledUes = config.getScheduler().getMaxScheduledUes();
        this.link = new TrafficLinkModel(scheduler, new Random(random.nextLong()), slotDuration,
                                         config.getMinArrivalRate(), config.getMaxArrivalRate(),
                                         config.getDefaultSubbandId());
        this.registry = new BwpRegistry(config.getDefaultSubbandId(), config.getSwitchLatency(), scheduler, link);
        this.channelAccess = new ChannelAccess(config.getLbt(), scheduler, new Random(random.nextLong()));

        for (var bwp : config.getSubbands()) {
            registry.addSubband(bwp.id(), bwp.numRbs());
            channelAccess.registerSubband(bwp.id(), bwp.interferenceRate());
            link.configureSubband(bwp.id(), bwp.numRbs());
        }
        for (int ue = 0; ue < config.getNumUes(); ue++) {
            link.attachUe(ue);
            registry.addDevice(ue);
        }

        var policy = DecisionPolicy.create(config.getScheduler(), config.getGym(), oracle,
                                           new Random(random.nextLong()));
        this.engine = new DecisionEngine(config.getScheduler(), slotDuration, scheduler, channelAccess, registry,
                                         link, policy);
        this.rewardModel = new BwpGymEnvironment(config.getGym());
        engine.addListener(this::windowCompleted);
    }

    private static PolicyOracle referenceOracle(SimulationConfig config) {
        if (config.getScheduler().getAlgorithm() != Algorithm.RLA) {
            return null;
        }
        log.info("No policy oracle attached, using the greedy reference oracle");
        var rbs = config.getSubbands()
                        .stream()
                        .sorted(Comparator.comparingInt(SimulationConfig.BwpSpec::id))
                        .map(SimulationConfig.BwpSpec::numRbs)
                        .toList();
        return new GreedyOracle(new Random(config.getSeed() + 1), rbs);
    }

    public static void main(String[] args) {
        var loader = new SimulationConfigLoader();
        var config = args.length > 0 ? loader.loadFile(Path.of(args[0]))
                                     : loader.loadResource(SimulationConfigLoader.DEFAULT_RESOURCE);
        var result = new NrUSimulation(config).run();
        log.info("Simulation complete: {}", result);
    }

    /**
     * Run for the configured duration.
     *
     * @throws UncheckedIOException if the metrics file cannot be written
     */
    public SimulationResult run() {
        log.info("Starting simulation: {}", config);
        try (var writer = openMetrics()) {
            metrics = writer;
            engine.start();
            scheduler.schedule(0, "slot", this::onSlot);
            scheduler.runUntil(config.getDuration());
            engine.stop();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write window metrics", e);
        } finally {
            metrics = null;
        }

        double seconds = SimTime.toSeconds(scheduler.now());
        long windows = engine.getWindowsCompleted();
        return new SimulationResult(slot, windows, seconds > 0 ? servedBits / seconds / 1e6 : 0.0,
                                    windows > 0 ? holDelaySum / windows : 0.0, grants, collisions,
                                    link.totalDropped(), switches);
    }

    /**
     * Simulate one slot at the current time.
     */
    public void runSlot() {
        link.generateTraffic(slot);

        var backlogged = new TreeMap<Integer, List<Integer>>();
        for (var ue : link.ueIds()) {
            if (link.hasBacklog(ue)) {
                backlogged.computeIfAbsent(link.linkSubband(ue), k -> new ArrayList<>()).add(ue);
            }
        }
        for (var entry : backlogged.entrySet()) {
            int subbandId = entry.getKey();
            if (!channelAccess.isRegistered(subbandId)) {
                continue;
            }
            if (channelAccess.requestAccess(subbandId).isGranted()) {
                grants++;
                double bits = 0.0;
                var allocation = link.allocateResources(subbandId, select(entry.getValue()));
                for (var grant : allocation.entrySet()) {
                    bits += link.serve(grant.getKey(), grant.getValue(), slot);
                }
                servedBits += bits;
                engine.recordThroughput(subbandId, bits);
            } else {
                collisions++;
                engine.recordCollision(subbandId);
            }
        }
        slot++;
    }

    private List<Integer> select(List<Integer> ues) {
        if (ues.size() <= maxScheduledUes) {
            return ues;
        }
        var selected = new ArrayList<Integer>(maxScheduledUes);
        int start = (int) (slot % ues.size());
        for (int i = 0; i < maxScheduledUes; i++) {
            selected.add(ues.get((start + i) % ues.size()));
        }
        return selected;
    }

    private void onSlot() {
        runSlot();
        if (scheduler.now() + slotDuration < config.getDuration()) {
            scheduler.schedule(slotDuration, "slot", this::onSlot);
        }
    }

    private WindowMetricsWriter openMetrics() throws IOException {
        var file = config.getMetricsFile();
        return file.isPresent() ? new WindowMetricsWriter(file.get()) : null;
    }

    private void windowCompleted(WindowReport report) {
        holDelaySum += report.meanHolDelay();
        switches += report.switched();
        long dropped = link.totalDropped();
        long windowDropped = dropped - lastDropped;
        log.info("Window {}: {} packets dropped", report.window(), windowDropped);
        lastDropped = dropped;
        if (metrics != null) {
            metrics.write(new WindowMetrics(report.window(), SimTime.toSeconds(report.time()),
                                            report.algorithm().name(), report.throughputMbps(),
                                            report.meanHolDelay() / 1000.0, windowDropped, report.collisions(),
                                            report.switched(), rewardModel.reward(engine.getLastSnapshot())));
        }
    }

    public EventScheduler getScheduler() {
        return scheduler;
    }

    public ChannelAccess getChannelAccess() {
        return channelAccess;
    }

    public BwpRegistry getRegistry() {
        return registry;
    }

    public TrafficLinkModel getLink() {
        return link;
    }

    public DecisionEngine getEngine() {
        return engine;
    }

    public long getSlot() {
        return slot;
    }
}
