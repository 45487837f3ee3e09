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

/**
 * Outcome of one environment step.
 *
 * @param observation state after the step
 * @param action      action that was applied
 * @param reward      reward for the window that ended at this step
 * @param done        true when the step closed the episode
 * @param info        episode bookkeeping
 * @author hal.hildebrand
 */
public record StepResult(Observation observation, int action, double reward, boolean done, StepInfo info) {
}
