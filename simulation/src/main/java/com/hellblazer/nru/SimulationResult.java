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

/**
 * Totals of a completed simulation run.
 *
 * @param slots             slots simulated
 * @param windows           decision windows completed
 * @param throughputMbps    bits served over the whole run, in Mbps
 * @param meanHolDelay      mean of the per-window mean HoL delays, in milliseconds
 * @param grants            LBT grants
 * @param collisions        LBT denials
 * @param dropped           packets dropped on queue overflow
 * @param switches          BWP switches applied by the decision engine
 * @author hal.hildebrand
 */
public record SimulationResult(long slots, long windows, double throughputMbps, double meanHolDelay, long grants,
                               long collisions, long dropped, long switches) {

    @Override
    public String toString() {
        return String.format(
        "SimulationResult[slots=%d, windows=%d, throughput=%.2f Mbps, meanHol=%.3f ms, grants=%d, collisions=%d, "
        + "dropped=%d, switches=%d]", slots, windows, throughputMbps, meanHolDelay, grants, collisions, dropped,
        switches);
    }
}
