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

import com.hellblazer.meridian.geometry.CartesianPoint;
import com.hellblazer.meridian.geometry.Point;

/**
 * Configuration for density based clustering.
 *
 * @author hal.hildebrand
 */
public class ClusteringConfig {

    private Point        halfSpan;
    private int          minimumClusterSize = 10;
    private Neighborhood neighborhood       = Neighborhood.BOX;

    /**
     * Distance either side of a point, per dimension of the clustering space, within which other points count as
     * neighbors. Must be set before clustering.
     */
    public Point getHalfSpan() {
        return halfSpan;
    }

    /**
     * Number of points, the point itself included, a neighborhood needs for its center to be a core point.
     */
    public int getMinimumClusterSize() {
        return minimumClusterSize;
    }

    public Neighborhood getNeighborhood() {
        return neighborhood;
    }

    public ClusteringConfig withHalfSpan(Point span) {
        if (span == null) {
            throw new IllegalArgumentException("Half-span cannot be null");
        }
        for (int i = 0; i < span.dimensions(); i++) {
            if (!(span.get(i) >= 0.0) || Double.isInfinite(span.get(i))) {
                throw new IllegalArgumentException("Half-span must be finite and non-negative: " + span);
            }
        }
        this.halfSpan = span;
        return this;
    }

    public ClusteringConfig withHalfSpan(double... span) {
        return withHalfSpan(CartesianPoint.of(span));
    }

    public ClusteringConfig withMinimumClusterSize(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Minimum cluster size must be at least 1: " + size);
        }
        this.minimumClusterSize = size;
        return this;
    }

    public ClusteringConfig withNeighborhood(Neighborhood shape) {
        if (shape == null) {
            throw new IllegalArgumentException("Neighborhood cannot be null");
        }
        this.neighborhood = shape;
        return this;
    }

    @Override
    public String toString() {
        return String.format("ClusteringConfig{halfSpan=%s, minimumClusterSize=%d, neighborhood=%s}", halfSpan,
                             minimumClusterSize, neighborhood);
    }
}
