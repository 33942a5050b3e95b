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
import com.hellblazer.meridian.geometry.Cartesian;
import com.hellblazer.meridian.geometry.CartesianPoint;
import com.hellblazer.meridian.geometry.Terrestrial;
import com.hellblazer.meridian.geometry.TerrestrialPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DistanceGeometryTest {
    private static final double  EPSILON = 1e-5;
    private static final Instant START   = Instant.parse("2024-03-01T00:00:00Z");

    private static Trajectory<CartesianPoint> planar(long[] seconds, double... xy) {
        var points = new ArrayList<TrajectoryPoint<CartesianPoint>>();
        for (int i = 0; i < seconds.length; i++) {
            points.add(new TrajectoryPoint<>(CartesianPoint.of(xy[2 * i], xy[2 * i + 1]), "t",
                                             START.plusSeconds(seconds[i])));
        }
        return new Trajectory<>(Cartesian.PLANE, points);
    }

    private static Trajectory<CartesianPoint> square() {
        return planar(new long[] { 0, 10, 20, 30, 40 }, 0, 0, 100, 0, 100, 100, 0, 100, 0, 0);
    }

    @Test
    void testClosedSquare() {
        var expected = new double[] { 0, 0.707107, 0.707107, 0.790569, 0.707107, 0.790569, 1, 1, 1, 1 };
        assertArrayEquals(expected, DistanceGeometry.byDistance(square(), 4), EPSILON);
        // uniform speed, so time sampling lands on the same control points
        assertArrayEquals(expected, DistanceGeometry.byTime(square(), 4), EPSILON);
    }

    @ParameterizedTest
    @EnumSource(SamplingMode.class)
    void testDepthOne(SamplingMode mode) {
        var signature = DistanceGeometry.compute(square(), 1, mode);
        assertArrayEquals(new double[] { 0 }, signature, EPSILON);
    }

    @ParameterizedTest
    @EnumSource(SamplingMode.class)
    void testStationaryTrajectory(SamplingMode mode) {
        var stationary = planar(new long[] { 0, 60, 120 }, 5, 5, 5, 5, 5, 5);
        var signature = DistanceGeometry.compute(stationary, 3, mode);
        assertEquals(6, signature.length);
        assertTrue(Arrays.stream(signature).allMatch(v -> v == 1.0));
    }

    @ParameterizedTest
    @EnumSource(SamplingMode.class)
    void testSinglePointTrajectory(SamplingMode mode) {
        var single = planar(new long[] { 0 }, 7, -3);
        var signature = DistanceGeometry.compute(single, 3, mode);
        assertEquals(DistanceGeometry.signatureLength(3), signature.length);
        assertTrue(Arrays.stream(signature).allMatch(v -> v == 1.0));
    }

    @Test
    void testInstantaneousTrajectory() {
        var instant = planar(new long[] { 0, 0, 0 }, 0, 0, 3, 4, 6, 8);
        assertArrayEquals(new double[] { 1, 1, 1 }, DistanceGeometry.byTime(instant, 2));
        assertArrayEquals(new double[] { 1, 1, 1 }, DistanceGeometry.byDistance(instant, 2), EPSILON);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    void testInvalidDepth(int depth) {
        assertThrows(IllegalArgumentException.class, () -> DistanceGeometry.byDistance(square(), depth));
    }

    @Test
    void testSignatureLength() {
        assertEquals(1, DistanceGeometry.signatureLength(1));
        assertEquals(10, DistanceGeometry.signatureLength(4));
        assertEquals(55, DistanceGeometry.signatureLength(10));
        assertEquals(DistanceGeometry.signatureLength(6), DistanceGeometry.byDistance(square(), 6).length);
    }

    @Test
    void testStraightEquatorialTrack() {
        var points = new ArrayList<TrajectoryPoint<TerrestrialPoint>>();
        for (int i = 0; i <= 4; i++) {
            points.add(new TrajectoryPoint<>(new TerrestrialPoint(i * 0.5, 0), "ship", START.plusSeconds(i * 300L)));
        }
        var signature = DistanceGeometry.byDistance(new Trajectory<>(Terrestrial.INSTANCE, points), 5);
        for (double value : signature) {
            assertEquals(1.0, value, 1e-9);
        }
    }

    @Test
    void testTimeSamplingFollowsSpeed() {
        // ten units in the first ten seconds, ninety in the next ten
        var uneven = planar(new long[] { 0, 10, 20 }, 0, 0, 10, 0, 100, 0);
        assertArrayEquals(new double[] { 1, 1, 1 }, DistanceGeometry.byDistance(uneven, 2), EPSILON);
        assertArrayEquals(new double[] { 1, 0.2, 1.8 }, DistanceGeometry.byTime(uneven, 2), EPSILON);
    }
}
