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
package com.hellblazer.nru.gym;

import java.util.Arrays;

/**
 * Flat observation vector of length {@code numDevices * (5 + numSubbands) + numSubbands * 3}.
 * <p>
 * Device block, per device in id order: queue depth, HoL delay (ms), bits per RB, throughput (Mbps), average
 * packet delay (ms), then a one-hot encoding of its current sub-band. Sub-band block, per sub-band in id
 * order: occupancy, failure rate, contention window.
 *
 * @author hal.hildebrand
 */
public record Observation(double[] values, int numDevices, int numSubbands) {

    public static final int DEVICE_METRICS  = 5;
    public static final int SUBBAND_METRICS = 3;

    public Observation {
        if (values.length != length(numDevices, numSubbands)) {
            throw new IllegalArgumentException(
            "Observation length " + values.length + " does not match " + numDevices + " devices and " + numSubbands
            + " sub-bands");
        }
        values = values.clone();
    }

    public static int length(int numDevices, int numSubbands) {
        return numDevices * (DEVICE_METRICS + numSubbands) + numSubbands * SUBBAND_METRICS;
    }

    public double get(int index) {
        return values[index];
    }

    public int length() {
        return values.length;
    }

    /**
     * @return offset of the sub-band block
     */
    public int subbandOffset() {
        return numDevices * (DEVICE_METRICS + numSubbands);
    }

    /**
     * @param index sub-band index in ascending id order
     * @param metric 0 occupancy, 1 failure rate, 2 contention window
     */
    public double subbandMetric(int index, int metric) {
        return values[subbandOffset() + index * SUBBAND_METRICS + metric];
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Observation other && numDevices == other.numDevices && numSubbands == other.numSubbands
        && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(values) + numDevices) + numSubbands;
    }

    @Override
    public String toString() {
        return "Observation[devices=" + numDevices + ", subbands=" + numSubbands + ", values=" + Arrays.toString(
        values) + "]";
    }
}
