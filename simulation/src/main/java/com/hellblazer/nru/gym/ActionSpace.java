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

import java.util.Random;

/**
 * Discrete action space {@code [0, n)}. Action {@code i} assigns every device to the sub-band at index {@code i}
 * of the ascending sub-band id list.
 *
 * @author hal.hildebrand
 */
public record ActionSpace(int n) {

    public ActionSpace {
        if (n < 1) {
            throw new IllegalArgumentException("Action space needs at least one action: " + n);
        }
    }

    public int sample(Random random) {
        return random.nextInt(n);
    }

    public boolean contains(int action) {
        return action >= 0 && action < n;
    }
}
