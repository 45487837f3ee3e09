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
package com.hellblazer.nru.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the per-window metrics export.
 *
 * @param window             window sequence number, starting at 1
 * @param timeSeconds        simulated time of the decision
 * @param algorithm          policy that decided
 * @param throughputMbps     bits served across all sub-bands during the window, in Mbps
 * @param avgHolDelaySeconds mean device HoL delay
 * @param dropped            packets dropped on queue overflow during the window
 * @param collisions         LBT denials during the window
 * @param switched           devices moved by the decision
 * @param reward             reward of the window's statistics under the configured weights
 * @author hal.hildebrand
 */
@JsonPropertyOrder({ "Window", "Time_s", "Algorithm", "Throughput_Mbps", "Avg_HoL_Delay_s", "Dropped", "Collisions",
                     "Switched", "Reward" })
public record WindowMetrics(@JsonProperty("Window") long window, @JsonProperty("Time_s") double timeSeconds,
                            @JsonProperty("Algorithm") String algorithm,
                            @JsonProperty("Throughput_Mbps") double throughputMbps,
                            @JsonProperty("Avg_HoL_Delay_s") double avgHolDelaySeconds,
                            @JsonProperty("Dropped") long dropped, @JsonProperty("Collisions") long collisions,
                            @JsonProperty("Switched") int switched, @JsonProperty("Reward") double reward) {
}
