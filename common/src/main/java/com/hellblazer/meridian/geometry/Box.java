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
package com.hellblazer.meridian.geometry;

import java.util.Objects;

/**
 * Immutable axis aligned box, closed interval [lower, upper] in each dimension. Boxes describe query regions for the
 * R-tree, node bounds inside it and the half-span neighborhoods of DBSCAN. The corners are stored as plain coordinate
 * tuples: a box over terrestrial points has longitude/latitude corners.
 *
 * @author hal.hildebrand
 */
public record Box(CartesianPoint lowerBound, CartesianPoint upperBound) {

    public Box {
        Objects.requireNonNull(lowerBound, "Lower bound cannot be null");
        Objects.requireNonNull(upperBound, "Upper bound cannot be null");

        if (lowerBound.dimensions() != upperBound.dimensions()) {
            throw new InvalidInputException(
            String.format("Bounds must have same dimensions: %d vs %d", lowerBound.dimensions(),
                          upperBound.dimensions()));
        }
        for (int i = 0; i < lowerBound.dimensions(); i++) {
            if (!(lowerBound.get(i) <= upperBound.get(i))) {
                throw new InvalidInputException(
                String.format("Lower bound %f > upper bound %f at dimension %d", lowerBound.get(i),
                              upperBound.get(i), i));
            }
        }
    }

    /**
     * The smallest box holding all the supplied points
     *
     * @throws IllegalArgumentException if there are no points
     */
    public static Box around(Iterable<? extends Point> points) {
        double[] lower = null;
        double[] upper = null;
        for (var p : points) {
            if (lower == null) {
                lower = p.coordinates();
                upper = p.coordinates();
                continue;
            }
            if (p.dimensions() != lower.length) {
                throw new InvalidInputException(
                String.format("Point dimensions %d != box dimensions %d", p.dimensions(), lower.length));
            }
            for (int i = 0; i < lower.length; i++) {
                lower[i] = Math.min(lower[i], p.get(i));
                upper[i] = Math.max(upper[i], p.get(i));
            }
        }
        if (lower == null) {
            throw new IllegalArgumentException("Cannot bound an empty set of points");
        }
        return new Box(new CartesianPoint(lower), new CartesianPoint(upper));
    }

    /**
     * Creates a box centered around a point with the specified half-span in each dimension. A half-span of zero
     * collapses that dimension to the center coordinate.
     */
    public static Box centered(Point center, Point halfSpan) {
        if (halfSpan.dimensions() != center.dimensions()) {
            throw new InvalidInputException(
            String.format("Half-span dimensions %d != center dimensions %d", halfSpan.dimensions(),
                          center.dimensions()));
        }
        var lower = new double[center.dimensions()];
        var upper = new double[center.dimensions()];
        for (int i = 0; i < center.dimensions(); i++) {
            if (halfSpan.get(i) < 0.0) {
                throw new InvalidInputException("Half-span cannot be negative: " + halfSpan.get(i));
            }
            lower[i] = center.get(i) - halfSpan.get(i);
            upper[i] = center.get(i) + halfSpan.get(i);
        }
        return new Box(new CartesianPoint(lower), new CartesianPoint(upper));
    }

    /**
     * Creates a box from two corners of any point type
     */
    public static Box of(Point minCorner, Point maxCorner) {
        return new Box(new CartesianPoint(minCorner.coordinates()), new CartesianPoint(maxCorner.coordinates()));
    }

    /**
     * Creates the degenerate box holding exactly one point
     */
    public static Box of(Point point) {
        var corner = new CartesianPoint(point.coordinates());
        return new Box(corner, corner);
    }

    public CartesianPoint center() {
        return lowerBound.add(upperBound).divide(2.0);
    }

    /**
     * Returns true if the box contains the specified point. Uses closed interval semantics: [lower, upper].
     */
    public boolean contains(Point point) {
        checkDimensions(point);
        for (int i = 0; i < dimensions(); i++) {
            double coord = point.get(i);
            if (coord < lowerBound.get(i) || coord > upperBound.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if this box lies entirely within the other box
     */
    public boolean containedBy(Box other) {
        return other.contains(lowerBound) && other.contains(upperBound);
    }

    public int dimensions() {
        return lowerBound.dimensions();
    }

    /**
     * Returns the Euclidean distance from a point to this box (0 if the point is inside).
     */
    public double distanceToPoint(Point point) {
        checkDimensions(point);
        double distanceSquared = 0.0;
        for (int i = 0; i < dimensions(); i++) {
            double coord = point.get(i);
            double lower = lowerBound.get(i);
            double upper = upperBound.get(i);

            if (coord < lower) {
                double diff = lower - coord;
                distanceSquared += diff * diff;
            } else if (coord > upper) {
                double diff = coord - upper;
                distanceSquared += diff * diff;
            }
        }
        return Math.sqrt(distanceSquared);
    }

    /**
     * Returns the box grown just enough to hold the point
     */
    public Box include(Point point) {
        return union(of(point));
    }

    /**
     * Returns true if this box overlaps the other box. Touching boundaries overlap.
     */
    public boolean intersects(Box other) {
        checkDimensions(other);
        for (int i = 0; i < dimensions(); i++) {
            if (upperBound.get(i) < other.lowerBound.get(i) || lowerBound.get(i) > other.upperBound.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The product of the extents. Zero for degenerate boxes.
     */
    public double volume() {
        double volume = 1.0;
        for (int i = 0; i < dimensions(); i++) {
            volume *= upperBound.get(i) - lowerBound.get(i);
        }
        return volume;
    }

    /**
     * Sum of the extents, used as a tie breaker when volumes are degenerate
     */
    public double margin() {
        double margin = 0.0;
        for (int i = 0; i < dimensions(); i++) {
            margin += upperBound.get(i) - lowerBound.get(i);
        }
        return margin;
    }

    /**
     * Returns true if the box strictly contains the point (open interval semantics).
     */
    public boolean strictlyContains(Point point) {
        checkDimensions(point);
        for (int i = 0; i < dimensions(); i++) {
            double coord = point.get(i);
            if (coord <= lowerBound.get(i) || coord >= upperBound.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("Box{%s, %s}", lowerBound, upperBound);
    }

    /**
     * Returns the bounding box of this box and the other box.
     */
    public Box union(Box other) {
        checkDimensions(other);
        var newLower = new double[dimensions()];
        var newUpper = new double[dimensions()];
        for (int i = 0; i < dimensions(); i++) {
            newLower[i] = Math.min(lowerBound.get(i), other.lowerBound.get(i));
            newUpper[i] = Math.max(upperBound.get(i), other.upperBound.get(i));
        }
        return new Box(CartesianPoint.of(newLower), CartesianPoint.of(newUpper));
    }

    private void checkDimensions(Box other) {
        if (other.dimensions() != dimensions()) {
            throw new InvalidInputException(
            String.format("Box dimensions %d != %d", other.dimensions(), dimensions()));
        }
    }

    private void checkDimensions(Point point) {
        if (point.dimensions() != dimensions()) {
            throw new InvalidInputException(
            String.format("Point dimensions %d != box dimensions %d", point.dimensions(), dimensions()));
        }
    }
}
