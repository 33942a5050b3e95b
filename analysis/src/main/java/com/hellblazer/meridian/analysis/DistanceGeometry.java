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
package com.hellblazer.meridian.analysis;

import com.hellblazer.meridian.common.Trajectory;
import com.hellblazer.meridian.common.TrajectoryPoint;
import com.hellblazer.meridian.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Multiscale shape signature of a trajectory.
 * <p>
 * At level d, for d from 1 to depth, d + 1 control points divide the trajectory into d equal parts, by travelled
 * distance or by elapsed time. Each of the d chords between consecutive control points is divided by the length of
 * an equal share of the whole trajectory, totalLength / d, so a straight trajectory scores 1 everywhere and the
 * signature does not depend on scale. Levels are concatenated in order, giving depth * (depth + 1) / 2 values.
 *
 * @author hal.hildebrand
 */
public final class DistanceGeometry {
    private static final Logger log = LoggerFactory.getLogger(DistanceGeometry.class);

    public static <P extends Point> double[] byDistance(Trajectory<P> trajectory, int depth) {
        return compute(trajectory, depth, SamplingMode.BY_DISTANCE);
    }

    public static <P extends Point> double[] byTime(Trajectory<P> trajectory, int depth) {
        return compute(trajectory, depth, SamplingMode.BY_TIME);
    }

    /**
     * @throws IllegalArgumentException if depth is less than 1
     */
    public static <P extends Point> double[] compute(Trajectory<P> trajectory, int depth, SamplingMode mode) {
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1: " + depth);
        }
        var signature = new double[signatureLength(depth)];
        double totalLength = trajectory.totalLength();
        if (totalLength == 0.0 || (mode == SamplingMode.BY_TIME && trajectory.duration().isZero())) {
            log.warn("Trajectory {} has no {}; distance geometry defaults to all ones", trajectory.trajectoryId(),
                     totalLength == 0.0 ? "length" : "duration");
            Arrays.fill(signature, 1.0);
            return signature;
        }

        var system = trajectory.coordinateSystem();
        int next = 0;
        for (int level = 1; level <= depth; level++) {
            double share = totalLength / level;
            TrajectoryPoint<P> previous = controlPoint(trajectory, 0.0, mode);
            for (int i = 1; i <= level; i++) {
                var current = controlPoint(trajectory, (double) i / level, mode);
                signature[next++] = system.distance(previous.point(), current.point()) / share;
                previous = current;
            }
        }
        return signature;
    }

    public static int signatureLength(int depth) {
        return depth * (depth + 1) / 2;
    }

    private static <P extends Point> TrajectoryPoint<P> controlPoint(Trajectory<P> trajectory, double fraction,
                                                                     SamplingMode mode) {
        return switch (mode) {
            case BY_DISTANCE -> trajectory.pointAtLengthFraction(fraction);
            case BY_TIME -> trajectory.pointAtTimeFraction(fraction);
        };
    }

    private DistanceGeometry() {
    }
}
