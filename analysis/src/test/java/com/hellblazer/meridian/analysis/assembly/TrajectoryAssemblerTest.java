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

import com.hellblazer.meridian.common.Trajectory;
import com.hellblazer.meridian.common.TrajectoryPoint;
import com.hellblazer.meridian.geometry.Cartesian;
import com.hellblazer.meridian.geometry.CartesianPoint;
import com.hellblazer.meridian.geometry.InvalidInputException;
import com.hellblazer.meridian.geometry.Terrestrial;
import com.hellblazer.meridian.geometry.TerrestrialPoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TrajectoryAssemblerTest {
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private static TrajectoryPoint<CartesianPoint> point(String id, double x, double y, long seconds) {
        return new TrajectoryPoint<>(CartesianPoint.of(x, y), id, START.plusSeconds(seconds));
    }

    /**
     * Objects report once a minute while moving one unit per report. Legs of each object are split by an hour of
     * silence or, for bravo, by a 500 unit jump.
     */
    private static List<TrajectoryPoint<CartesianPoint>> regressionStream() {
        var points = new ArrayList<TrajectoryPoint<CartesianPoint>>();
        addLegs(points, "alpha", 0, new int[] { 10, 2, 7 }, false);
        addLegs(points, "bravo", 1, new int[] { 5, 5 }, true);
        addLegs(points, "charlie", 2, new int[] { 1, 12 }, false);
        addLegs(points, "delta", 3, new int[] { 4 }, false);
        points.sort(Comparator.comparing((TrajectoryPoint<CartesianPoint> p) -> p.timestamp())
                              .thenComparing(TrajectoryPoint::objectId));
        return points;
    }

    private static void addLegs(List<TrajectoryPoint<CartesianPoint>> into, String id, int offsetSeconds, int[] legs,
                                boolean jump) {
        long seconds = offsetSeconds;
        double x = 0;
        for (int leg : legs) {
            for (int i = 0; i < leg; i++) {
                into.add(point(id, x, 0, seconds));
                seconds += 60;
                x += 1;
            }
            if (jump) {
                x += 500;
            } else {
                seconds += 3600;
            }
        }
    }

    private static void assertWellFormed(Trajectory<CartesianPoint> trajectory, AssemblyConfig config) {
        var previous = trajectory.get(0);
        assertTrue(trajectory.size() >= config.getMinimumTrajectoryLength());
        for (var current : trajectory) {
            assertEquals(previous.objectId(), current.objectId());
            assertFalse(current.timestamp().isBefore(previous.timestamp()));
            assertTrue(Duration.between(previous.timestamp(), current.timestamp())
                               .compareTo(config.getSeparationTime()) <= 0);
            assertTrue(previous.point().distance(current.point()) <= config.getSeparationDistance());
            previous = current;
        }
    }

    @Test
    void testBoundaryGapsDoNotBreak() {
        var config = new AssemblyConfig().withSeparationTime(Duration.ofMinutes(5))
                                         .withSeparationDistance(10.0)
                                         .withMinimumTrajectoryLength(1);
        var points = List.of(point("a", 0, 0, 0), point("a", 10, 0, 300), point("a", 20.5, 0, 400),
                             point("a", 21, 0, 701));
        var trajectories = TrajectoryAssembler.assemble(Cartesian.PLANE, points, config);
        assertEquals(List.of(2, 1, 1), trajectories.stream().map(Trajectory::size).toList());
    }

    @Test
    void testCleanupFlushesStaleObjectsLazily() {
        var points = new ArrayList<TrajectoryPoint<CartesianPoint>>();
        for (int i = 0; i < 3; i++) {
            points.add(point("early", i, 0, i * 60L));
        }
        for (int i = 0; i < 6; i++) {
            points.add(point("late", i, 5, 1800 + i * 60L));
        }
        var config = new AssemblyConfig().withSeparationTime(Duration.ofMinutes(10)).withCleanupInterval(1);
        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE, points.iterator(), config);

        var first = assembler.next();
        assertEquals("early", first.objectId());
        assertEquals(4, assembler.pointCount(), "emitted as soon as the sweep found it stale");
        assertEquals(1, assembler.statistics().openBuffers());

        var second = assembler.next();
        assertEquals("late", second.objectId());
        assertEquals(6, second.size());
        assertFalse(assembler.hasNext());
        assertThrows(NoSuchElementException.class, assembler::next);
    }

    @Test
    void testCustomStalenessPolicy() {
        var points = new ArrayList<TrajectoryPoint<CartesianPoint>>();
        for (int i = 0; i < 3; i++) {
            points.add(point("early", i, 0, i * 60L));
        }
        for (int i = 0; i < 6; i++) {
            points.add(point("late", i, 5, 1800 + i * 60L));
        }
        var config = new AssemblyConfig().withSeparationTime(Duration.ofMinutes(10))
                                         .withCleanupInterval(1)
                                         .withStalenessPolicy((lastSeen, now) -> false);
        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE, points.iterator(), config);
        assembler.next();
        assertEquals(9, assembler.pointCount(), "nothing is stale, so output waits for the end of the stream");
    }

    @Test
    void testDisabledCleanupWaitsForEndOfStream() {
        var points = List.of(point("early", 0, 0, 0), point("early", 1, 0, 60), point("late", 0, 0, 7200),
                             point("late", 1, 0, 7260));
        var config = new AssemblyConfig().withCleanupInterval(0);
        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE, points.iterator(), config);
        assertTrue(assembler.hasNext());
        assertEquals(4, assembler.pointCount());
    }

    @Test
    void testEmptySource() {
        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE,
                                                  List.<TrajectoryPoint<CartesianPoint>>of().iterator(),
                                                  new AssemblyConfig());
        assertFalse(assembler.hasNext());
        assertEquals(new AssemblyStatistics(0, 0, 0, 0), assembler.statistics());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new AssemblyConfig().withCleanupInterval(-1));
        assertThrows(IllegalArgumentException.class, () -> new AssemblyConfig().withMinimumTrajectoryLength(-1));
        assertThrows(IllegalArgumentException.class, () -> new AssemblyConfig().withSeparationDistance(-0.5));
        assertThrows(IllegalArgumentException.class, () -> new AssemblyConfig().withSeparationDistance(Double.NaN));
        assertThrows(IllegalArgumentException.class,
                     () -> new AssemblyConfig().withSeparationTime(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> new AssemblyConfig().withOutOfOrderPolicy(null));
    }

    @Test
    void testOutOfOrderBreaks() {
        var points = List.of(point("a", 0, 0, 600), point("a", 1, 0, 660), point("a", 2, 0, 300),
                             point("a", 3, 0, 360));
        var trajectories = TrajectoryAssembler.assemble(Cartesian.PLANE, points, new AssemblyConfig());
        assertEquals(2, trajectories.size());
        assertEquals(START.plusSeconds(600), trajectories.get(0).startTime());
        assertEquals(START.plusSeconds(300), trajectories.get(1).startTime());
    }

    @Test
    void testOutOfOrderRejected() {
        var points = List.of(point("a", 0, 0, 600), point("a", 1, 0, 660), point("a", 2, 0, 300));
        var config = new AssemblyConfig().withOutOfOrderPolicy(OutOfOrderPolicy.REJECT);
        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE, points.iterator(), config);
        var e = assertThrows(InvalidInputException.class, assembler::hasNext);
        assertTrue(e.getMessage().contains("'a'"));
    }

    @Test
    void testRegressionStream() {
        var config = new AssemblyConfig().withSeparationTime(Duration.ofMinutes(20))
                                         .withSeparationDistance(100.0)
                                         .withMinimumTrajectoryLength(3)
                                         .withCleanupInterval(7);
        var points = regressionStream();
        assertEquals(46, points.size());

        var assembler = new TrajectoryAssembler<>(Cartesian.PLANE, points.iterator(), config);
        var trajectories = new ArrayList<Trajectory<CartesianPoint>>();
        assembler.forEachRemaining(trajectories::add);

        assertEquals(46, assembler.pointCount());
        assertEquals(6, assembler.validTrajectoryCount());
        assertEquals(2, assembler.invalidTrajectoryCount());
        assertEquals(new AssemblyStatistics(46, 6, 2, 0), assembler.statistics());
        assertEquals(List.of(4, 5, 5, 7, 10, 12), trajectories.stream().map(Trajectory::size).sorted().toList());
        for (var trajectory : trajectories) {
            assertWellFormed(trajectory, config);
        }
    }

    @Test
    void testShortRunsKeptWithoutMinimum() {
        var config = new AssemblyConfig().withMinimumTrajectoryLength(0);
        var trajectories = TrajectoryAssembler.assemble(Cartesian.PLANE, regressionStream(), config);
        // with no distance limit bravo's jump does not split it
        assertEquals(List.of(1, 2, 4, 7, 10, 10, 12), trajectories.stream().map(Trajectory::size).sorted().toList());
        assertEquals(46, trajectories.stream().mapToInt(Trajectory::size).sum());
    }

    @Test
    void testTerrestrialDistanceInKilometres() {
        var points = new ArrayList<TrajectoryPoint<TerrestrialPoint>>();
        for (int i = 0; i < 6; i++) {
            // one degree of longitude on the equator is about 111 km
            points.add(new TrajectoryPoint<>(new TerrestrialPoint(i < 3 ? i * 0.5 : 10 + i * 0.5, 0), "ship",
                                             START.plusSeconds(i * 600L)));
        }
        var config = new AssemblyConfig().withSeparationDistance(100.0);
        var trajectories = TrajectoryAssembler.assemble(Terrestrial.INSTANCE, points, config);
        assertEquals(2, trajectories.size());
        assertEquals(3, trajectories.get(0).size());
        assertEquals(3, trajectories.get(1).size());
        assertEquals(111.19, trajectories.get(0).totalLength(), 0.01);
    }
}
