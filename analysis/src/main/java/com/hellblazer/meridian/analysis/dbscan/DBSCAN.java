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
package com.hellblazer.meridian.analysis.dbscan;

import com.hellblazer.meridian.analysis.rtree.RTree;
import com.hellblazer.meridian.geometry.Box;
import com.hellblazer.meridian.geometry.CoordinateSystem;
import com.hellblazer.meridian.geometry.HasPoint;
import com.hellblazer.meridian.geometry.InvalidInputException;
import com.hellblazer.meridian.geometry.Point;
import com.hellblazer.meridian.geometry.PointConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Density based clustering (DBSCAN) with an axis aligned half-span neighborhood.
 * <p>
 * Each value's point is converted into the clustering coordinate system, so terrestrial points may be clustered in a
 * Cartesian space of the same dimension, and feature vectors may carry any payload through {@link HasPoint}. A point
 * whose neighborhood, itself included, holds at least the minimum cluster size is a core point. Core points grow a
 * cluster through their neighbors; neighbors that are not core join as border points; everything else is noise.
 * <p>
 * Instances hold only configuration and may be shared between threads.
 *
 * @param <C> the point type of the clustering space
 * @author hal.hildebrand
 */
public class DBSCAN<C extends Point> {
    public static final int NOISE = 0;

    private static final Logger log = LoggerFactory.getLogger(DBSCAN.class);

    /**
     * Group labeled values by cluster id. Entry c of the result lists, in input order, the values labeled c; entries
     * run from 0 to the largest id present, empty where no value carries the id.
     */
    public static <T> List<List<T>> buildMembershipLists(Collection<Labeled<T>> labels) {
        int largest = -1;
        for (var label : labels) {
            largest = Math.max(largest, label.clusterId());
        }
        var lists = new ArrayList<List<T>>(largest + 1);
        for (int c = 0; c <= largest; c++) {
            lists.add(new ArrayList<>());
        }
        for (var label : labels) {
            lists.get(label.clusterId()).add(label.value());
        }
        return lists;
    }

    private final CoordinateSystem<C> clusteringSystem;
    private final Point               halfSpan;
    private final int                 minimumClusterSize;
    private final Neighborhood        neighborhood;

    /**
     * @throws IllegalArgumentException if the configuration has no half-span
     * @throws InvalidInputException    if the half-span does not match the clustering system's dimensions
     */
    public DBSCAN(CoordinateSystem<C> clusteringSystem, ClusteringConfig config) {
        this.clusteringSystem = Objects.requireNonNull(clusteringSystem, "Clustering system cannot be null");
        if (config.getHalfSpan() == null) {
            throw new IllegalArgumentException("Clustering requires a half-span");
        }
        if (config.getHalfSpan().dimensions() != clusteringSystem.dimensions()) {
            throw new InvalidInputException(
            String.format("Half-span has %d dimensions, %s has %d", config.getHalfSpan().dimensions(),
                          clusteringSystem.name(), clusteringSystem.dimensions()));
        }
        this.halfSpan = config.getHalfSpan();
        this.minimumClusterSize = config.getMinimumClusterSize();
        this.neighborhood = config.getNeighborhood();
    }

    public <V extends HasPoint<?>> ClusteringResult<V> cluster(List<V> values) {
        var points = new ArrayList<IndexedPoint<C>>(values.size());
        for (int i = 0; i < values.size(); i++) {
            points.add(new IndexedPoint<>(PointConverter.convert(values.get(i).point(), clusteringSystem), i));
        }
        var index = new RTree<IndexedPoint<C>, C>(clusteringSystem, points);

        var labels = new int[points.size()];
        var visited = new boolean[points.size()];
        var core = new boolean[points.size()];
        int clusters = 0;
        for (var seed : points) {
            if (labels[seed.index()] != NOISE || visited[seed.index()]) {
                continue;
            }
            if (expand(seed, clusters + 1, index, labels, visited, core)) {
                clusters++;
            }
        }

        var result = new ClusteringResult<>(values, labels, core, clusters);
        log.debug("Clustered {} points in {} with {}: {} clusters, {} core points, {} noise", values.size(),
                  clusteringSystem.name(), halfSpan, clusters, result.corePointCount(), result.noiseCount());
        return result;
    }

    public CoordinateSystem<C> clusteringSystem() {
        return clusteringSystem;
    }

    private boolean expand(IndexedPoint<C> seed, int clusterId, RTree<IndexedPoint<C>, C> index, int[] labels,
                           boolean[] visited, boolean[] core) {
        var queue = new ArrayDeque<IndexedPoint<C>>();
        queue.add(seed);
        int corePoints = 0;
        long neighborTotal = 0;
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (visited[current.index()]) {
                continue;
            }
            visited[current.index()] = true;
            var neighbors = neighborsOf(current.point(), index);
            if (neighbors.size() < minimumClusterSize) {
                continue;
            }
            core[current.index()] = true;
            corePoints++;
            neighborTotal += neighbors.size();
            for (var neighbor : neighbors) {
                if (labels[neighbor.index()] == NOISE) {
                    labels[neighbor.index()] = clusterId;
                    queue.add(neighbor);
                }
            }
        }
        if (corePoints > 0 && log.isDebugEnabled()) {
            log.debug("Cluster {}: {} core points, {} neighbors per core point on average", clusterId, corePoints,
                      String.format("%.2f", (double) neighborTotal / corePoints));
        }
        return corePoints > 0;
    }

    /**
     * Squared norm of the offset scaled by the half-span. A zero half-span admits only an exact match.
     */
    private double normalizedDistanceSquared(C center, C other) {
        double sum = 0.0;
        for (int i = 0; i < center.dimensions(); i++) {
            double offset = other.get(i) - center.get(i);
            double span = halfSpan.get(i);
            if (span == 0.0) {
                if (offset != 0.0) {
                    return Double.POSITIVE_INFINITY;
                }
                continue;
            }
            sum += (offset / span) * (offset / span);
        }
        return sum;
    }

    private List<IndexedPoint<C>> neighborsOf(C center, RTree<IndexedPoint<C>, C> index) {
        var neighbors = index.findPointsInsideBox(Box.centered(center, halfSpan));
        if (neighborhood == Neighborhood.ELLIPSOID) {
            neighbors.removeIf(candidate -> normalizedDistanceSquared(center, candidate.point()) > 1.0);
        }
        return neighbors;
    }
}
