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
package com.hellblazer.nru.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.nru.ConfigurationException;
import com.hellblazer.nru.common.SimTime;
import com.hellblazer.nru.gym.GymConfig;
import com.hellblazer.nru.lbt.LbtConfig;
import com.hellblazer.nru.scheduler.Algorithm;
import com.hellblazer.nru.scheduler.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Loads a {@link SimulationConfig} from JSON. Every key is optional; missing keys keep their defaults.
 * <p>
 * Format:
 * <pre>
 * {
 *   "lbt":        { "cwMin": 8, "cwMax": 128, "iccaDuration": 1, "mcotDuration": 5, "slotDurationMs": 0.5 },
 *   "scheduler":  { "algorithm": "RLA", "timeWindowSize": 500, "maxScheduledUes": 16,
 *                   "epsilon": 1.0, "epsilonMin": 0.01, "epsilonDecay": 0.995 },
 *   "gym":        { "alpha": 1.0, "beta": 1.0, "maxThroughput": 1000.0, "episodeLength": 1000 },
 *   "subbands":   [ { "id": 0, "numRbs": 50, "interferenceRate": 200.0 } ],
 *   "defaultSubbandId": 0,
 *   "switchLatencyMs": 1.0,
 *   "numUes": 24,
 *   "durationSeconds": 10.0,
 *   "seed": 42,
 *   "traffic":    { "minArrivalRate": 0.1, "maxArrivalRate": 0.3 },
 *   "metricsFile": "nru-window-metrics.csv"
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SimulationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SimulationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/nru-simulation.json";

    private final ObjectMapper objectMapper;

    public SimulationConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load from a classpath resource.
     *
     * @throws ConfigurationException if the resource is missing, unreadable or invalid
     */
    public SimulationConfig loadResource(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            var config = parse(objectMapper.readTree(is));
            log.info("Loaded configuration from resource {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource " + resource, e);
        }
    }

    /**
     * Load from a file.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public SimulationConfig loadFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            var config = parse(objectMapper.readTree(is));
            log.info("Loaded configuration from {}: {}", path, config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file " + path, e);
        }
    }

    /**
     * Parse a JSON document.
     *
     * @throws ConfigurationException if the JSON is malformed or a value is invalid
     */
    public SimulationConfig parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration JSON", e);
        }
    }

    private SimulationConfig parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        try {
            var builder = SimulationConfig.builder();
            builder.withLbt(parseLbt(root.path("lbt")));
            builder.withScheduler(parseScheduler(root.path("scheduler")));
            builder.withGym(parseGym(root.path("gym")));

            var subbands = root.path("subbands");
            if (subbands.isArray()) {
                var specs = new ArrayList<SimulationConfig.BwpSpec>();
                for (var node : subbands) {
                    specs.add(new SimulationConfig.BwpSpec(required(node, "id").asInt(),
                                                           required(node, "numRbs").asInt(),
                                                           node.path("interferenceRate").asDouble(0.0)));
                }
                builder.withSubbands(specs);
            }
            if (root.has("defaultSubbandId")) {
                builder.withDefaultSubbandId(root.get("defaultSubbandId").asInt());
            }
            if (root.has("switchLatencyMs")) {
                builder.withSwitchLatency(SimTime.millis(root.get("switchLatencyMs").asDouble()));
            }
            if (root.has("numUes")) {
                builder.withNumUes(root.get("numUes").asInt());
            }
            if (root.has("durationSeconds")) {
                builder.withDuration(SimTime.seconds(root.get("durationSeconds").asDouble()));
            }
            if (root.has("seed")) {
                builder.withSeed(root.get("seed").asLong());
            }
            var traffic = root.path("traffic");
            if (traffic.isObject()) {
                builder.withArrivalRate(traffic.path("minArrivalRate").asDouble(0.1),
                                        traffic.path("maxArrivalRate").asDouble(0.3));
            }
            var metricsFile = root.path("metricsFile");
            if (metricsFile.isTextual() && !metricsFile.asText().isBlank()) {
                builder.withMetricsFile(Path.of(metricsFile.asText()));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private LbtConfig parseLbt(JsonNode node) {
        var defaults = LbtConfig.defaultConfig();
        if (!node.isObject()) {
            return defaults;
        }
        var builder = LbtConfig.builder();
        builder.withContentionWindow(node.path("cwMin").asInt(defaults.getCwMin()),
                                     node.path("cwMax").asInt(defaults.getCwMax()));
        builder.withIccaDuration(node.path("iccaDuration").asInt(defaults.getIccaDuration()));
        builder.withMcotDuration(node.path("mcotDuration").asInt(defaults.getMcotDuration()));
        if (node.has("slotDurationMs")) {
            builder.withSlotDuration(SimTime.millis(node.get("slotDurationMs").asDouble()));
        }
        return builder.build();
    }

    private SchedulerConfig parseScheduler(JsonNode node) {
        var defaults = SchedulerConfig.defaultConfig();
        if (!node.isObject()) {
            return defaults;
        }
        var builder = SchedulerConfig.builder();
        if (node.has("algorithm")) {
            builder.withAlgorithm(Algorithm.parse(node.get("algorithm").asText()));
        }
        builder.withTimeWindowSize(node.path("timeWindowSize").asInt(defaults.getTimeWindowSize()));
        builder.withMaxScheduledUes(node.path("maxScheduledUes").asInt(defaults.getMaxScheduledUes()));
        builder.withExploration(node.path("epsilon").asDouble(defaults.getEpsilon()),
                                node.path("epsilonMin").asDouble(defaults.getEpsilonMin()),
                                node.path("epsilonDecay").asDouble(defaults.getEpsilonDecay()));
        return builder.build();
    }

    private GymConfig parseGym(JsonNode node) {
        var defaults = GymConfig.defaultConfig();
        if (!node.isObject()) {
            return defaults;
        }
        return GymConfig.builder()
                        .withRewardWeights(node.path("alpha").asDouble(defaults.getAlpha()),
                                           node.path("beta").asDouble(defaults.getBeta()))
                        .withMaxThroughput(node.path("maxThroughput").asDouble(defaults.getMaxThroughput()))
                        .withEpisodeLength(node.path("episodeLength").asInt(defaults.getEpisodeLength()))
                        .build();
    }

    private static JsonNode required(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("Sub-band entry is missing '" + field + "': " + node);
        }
        return value;
    }
}
