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

import java.time.Duration;

/**
 * Configuration for trajectory assembly. The defaults split trajectories at gaps longer than 30 minutes, never split
 * on distance, drop trajectories with fewer than 2 points and sweep stale buffers every 10000 points.
 *
 * @author hal.hildebrand
 */
public class AssemblyConfig {

    private int              cleanupInterval         = 10_000;
    private int              minimumTrajectoryLength = 2;
    private OutOfOrderPolicy outOfOrderPolicy        = OutOfOrderPolicy.BREAK;
    private double           separationDistance      = Double.POSITIVE_INFINITY;
    private Duration         separationTime          = Duration.ofMinutes(30);
    private StalenessPolicy  stalenessPolicy;

    /**
     * Number of points between sweeps for stale buffers; 0 disables the sweep.
     */
    public int getCleanupInterval() {
        return cleanupInterval;
    }

    /**
     * Trajectories with fewer points are discarded.
     */
    public int getMinimumTrajectoryLength() {
        return minimumTrajectoryLength;
    }

    public OutOfOrderPolicy getOutOfOrderPolicy() {
        return outOfOrderPolicy;
    }

    /**
     * Largest distance, in the coordinate system's unit, allowed between consecutive points of one trajectory.
     */
    public double getSeparationDistance() {
        return separationDistance;
    }

    /**
     * Longest time allowed between consecutive points of one trajectory.
     */
    public Duration getSeparationTime() {
        return separationTime;
    }

    /**
     * The policy for the cleanup sweep. Unless one was set, a buffer is stale once its last point is older than the
     * separation time.
     */
    public StalenessPolicy getStalenessPolicy() {
        return stalenessPolicy != null ? stalenessPolicy : StalenessPolicy.olderThan(separationTime);
    }

    public AssemblyConfig withCleanupInterval(int interval) {
        if (interval < 0) {
            throw new IllegalArgumentException("Cleanup interval cannot be negative: " + interval);
        }
        this.cleanupInterval = interval;
        return this;
    }

    public AssemblyConfig withMinimumTrajectoryLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Minimum trajectory length cannot be negative: " + length);
        }
        this.minimumTrajectoryLength = length;
        return this;
    }

    public AssemblyConfig withOutOfOrderPolicy(OutOfOrderPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Out of order policy cannot be null");
        }
        this.outOfOrderPolicy = policy;
        return this;
    }

    public AssemblyConfig withSeparationDistance(double distance) {
        if (Double.isNaN(distance) || distance < 0.0) {
            throw new IllegalArgumentException("Separation distance must be non-negative: " + distance);
        }
        this.separationDistance = distance;
        return this;
    }

    public AssemblyConfig withSeparationTime(Duration time) {
        if (time == null || time.isNegative()) {
            throw new IllegalArgumentException("Separation time must be non-negative: " + time);
        }
        this.separationTime = time;
        return this;
    }

    public AssemblyConfig withStalenessPolicy(StalenessPolicy policy) {
        this.stalenessPolicy = policy;
        return this;
    }

    @Override
    public String toString() {
        return String.format(
        "AssemblyConfig{separationTime=%s, separationDistance=%s, minimumTrajectoryLength=%d, cleanupInterval=%d, "
        + "outOfOrderPolicy=%s}", separationTime, separationDistance, minimumTrajectoryLength, cleanupInterval,
        outOfOrderPolicy);
    }
}
