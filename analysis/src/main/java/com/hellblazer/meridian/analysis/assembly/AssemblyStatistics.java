/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Meridian.
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
package com.hellblazer.meridian.analysis.assembly;

/**
 * Snapshot of an assembler's counters.
 *
 * @param pointCount             points consumed from the source
 * @param validTrajectoryCount   trajectories emitted
 * @param invalidTrajectoryCount completed point runs discarded for being too short
 * @param openBuffers            objects with a trajectory still in progress
 * @author hal.hildebrand
 */
public record AssemblyStatistics(long pointCount, long validTrajectoryCount, long invalidTrajectoryCount,
                                 int openBuffers) {
}
