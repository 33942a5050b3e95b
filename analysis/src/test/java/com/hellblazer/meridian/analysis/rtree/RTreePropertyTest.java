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
package com.hellblazer.meridian.analysis.rtree;

import com.hellblazer.meridian.geometry.Box;
import com.hellblazer.meridian.geometry.Cartesian;
import com.hellblazer.meridian.geometry.CartesianPoint;
import com.hellblazer.meridian.geometry.PointPair;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The tree must answer exactly what a linear scan answers, in the same order.
 *
 * @author hal.hildebrand
 */
class RTreePropertyTest {

    @Property(tries = 200)
    @Label("Box queries match a linear scan in insertion order")
    void boxQueriesMatchScan(@ForAll("clouds") List<PointPair<CartesianPoint, Integer>> values,
                             @ForAll("corners") CartesianPoint a, @ForAll("corners") CartesianPoint b,
                             @ForAll @IntRange(min = 4, max = 16) int capacity) {
        var tree = new RTree<PointPair<CartesianPoint, Integer>, CartesianPoint>(Cartesian.PLANE, values, capacity);
        var box = Box.of(CartesianPoint.of(Math.min(a.get(0), b.get(0)), Math.min(a.get(1), b.get(1))),
                         CartesianPoint.of(Math.max(a.get(0), b.get(0)), Math.max(a.get(1), b.get(1))));

        var inclusive = values.stream().filter(v -> box.contains(v.point())).toList();
        var strict = values.stream().filter(v -> box.strictlyContains(v.point())).toList();
        assertEquals(inclusive, tree.findPointsInsideBox(box));
        assertEquals(strict, tree.findPointsStrictlyInsideBox(box));
    }

    @Provide
    Arbitrary<List<PointPair<CartesianPoint, Integer>>> clouds() {
        // a coarse lattice so that duplicate points and distance ties are common
        var coordinate = Arbitraries.integers().between(-20, 20);
        return Combinators.combine(coordinate, coordinate)
                          .as((x, y) -> CartesianPoint.of(x.doubleValue(), y.doubleValue()))
                          .list()
                          .ofMaxSize(300)
                          .map(points -> {
                              var values = new ArrayList<PointPair<CartesianPoint, Integer>>();
                              for (int i = 0; i < points.size(); i++) {
                                  values.add(PointPair.of(points.get(i), i));
                              }
                              return values;
                          });
    }

    @Provide
    Arbitrary<CartesianPoint> corners() {
        var coordinate = Arbitraries.integers().between(-25, 25).map(i -> i / 1.0);
        return Combinators.combine(coordinate, coordinate).as((x, y) -> CartesianPoint.of(x, y));
    }

    @Property(tries = 200)
    @Label("Nearest neighbors match a sorted scan, ties broken by insertion order")
    void nearestNeighborsMatchScan(@ForAll("clouds") List<PointPair<CartesianPoint, Integer>> values,
                                   @ForAll("corners") CartesianPoint query,
                                   @ForAll @IntRange(min = 0, max = 40) int k,
                                   @ForAll @IntRange(min = 4, max = 16) int capacity) {
        var tree = new RTree<PointPair<CartesianPoint, Integer>, CartesianPoint>(Cartesian.PLANE, values, capacity);
        var expected = values.stream()
                             .sorted(Comparator.comparingDouble(
                             (PointPair<CartesianPoint, Integer> v) -> Cartesian.PLANE.distance(query, v.point()))
                                               .thenComparing(PointPair::payload))
                             .limit(k)
                             .toList();
        assertEquals(expected, tree.findNearestNeighbors(query, k));
    }

    @Property(tries = 100)
    @Label("Incremental inserts and removals agree with bulk loading")
    void incrementalAgreesWithBulk(@ForAll("clouds") List<PointPair<CartesianPoint, Integer>> values,
                                   @ForAll("corners") CartesianPoint query) {
        var bulk = new RTree<PointPair<CartesianPoint, Integer>, CartesianPoint>(Cartesian.PLANE, values, 4);
        var incremental = new RTree<PointPair<CartesianPoint, Integer>, CartesianPoint>(Cartesian.PLANE, List.of(),
                                                                                         4);
        incremental.insertAll(values);
        assertEquals(bulk.values(), incremental.values());
        assertEquals(bulk.findNearestNeighbors(query, 10), incremental.findNearestNeighbors(query, 10));

        var kept = new ArrayList<PointPair<CartesianPoint, Integer>>();
        for (var value : values) {
            if (value.payload() % 3 == 0) {
                assertTrue(incremental.remove(value));
            } else {
                kept.add(value);
            }
        }
        assertEquals(kept, incremental.values());
        var box = Box.of(CartesianPoint.of(-10, -10), CartesianPoint.of(10, 10));
        assertEquals(kept.stream().filter(v -> box.contains(v.point())).toList(),
                     incremental.findPointsInsideBox(box));
    }
}
