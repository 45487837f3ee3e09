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

/**
 * Summary of one decision window.
 *
 * @param window         window sequence number, starting at 1
 * @param time           simulated time of the decision in nanoseconds
 * @param algorithm      policy that decided
 * @param switched       devices moved by the decision
 * @param throughputMbps bits served across all sub-bands during the window, in Mbps
 * @param meanHolDelay   mean device HoL delay in milliseconds
 * @param collisions     LBT denials during the window
 * @author hal.hildebrand
 */
public record WindowReport(long window, long time, Algorithm algorithm, int switched, double throughputMbps,
                           double meanHolDelay, long collisions) {
}
