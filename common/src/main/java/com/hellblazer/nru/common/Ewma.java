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
package com.hellblazer.nru.common;

/**
 * Exponentially weighted moving average helpers.
 * <p>
 * Every smoothed statistic in the simulation follows {@code value = (1 - w) * previous + w * sample}. The
 * conventional weight used for channel statistics is {@link #DEFAULT_WEIGHT} (0.9 history, 0.1 sample).
 *
 * @author hal.hildebrand
 */
public final class Ewma {

    /**
     * Weight given to the fresh sample.
     */
    public static final double DEFAULT_WEIGHT = 0.1;

    private Ewma() {
    }

    /**
     * Blend a fresh sample into a previous value.
     *
     * @param previous previous smoothed value
     * @param sample   fresh observation
     * @param weight   weight of the sample in [0, 1]
     * @return smoothed value
     */
    public static double smooth(double previous, double sample, double weight) {
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Weight must be within [0, 1]: " + weight);
        }
        return (1.0 - weight) * previous + weight * sample;
    }

    public static double smooth(double previous, double sample) {
        return smooth(previous, sample, DEFAULT_WEIGHT);
    }

    /**
     * Clamp a ratio into [0, 1]. NaN collapses to 0.
     */
    public static double clampUnit(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
