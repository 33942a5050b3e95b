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

import java.util.Arrays;

/**
 * Immutable point in N-dimensional Cartesian space. Two and three dimensional positions as well as feature vectors
 * are all Cartesian points; they differ only in their {@link Cartesian} coordinate system.
 *
 * @author hal.hildebrand
 */
public record CartesianPoint(double[] values) implements Point, HasPoint<CartesianPoint> {

    public CartesianPoint {
        if (values == null) {
            throw new IllegalArgumentException("Coordinate values cannot be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("Point must have at least one dimension");
        }
        values = values.clone();
    }

    public static CartesianPoint of(double... values) {
        return new CartesianPoint(values);
    }

    /**
     * Creates a point at the origin with the specified dimensions.
     */
    public static CartesianPoint origin(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + dimensions);
        }
        return new CartesianPoint(new double[dimensions]);
    }

    /**
     * Creates a point with all values set to the specified value.
     */
    public static CartesianPoint uniform(int dimensions, double value) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + dimensions);
        }
        var coords = new double[dimensions];
        Arrays.fill(coords, value);
        return new CartesianPoint(coords);
    }

    public CartesianPoint add(CartesianPoint other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + other.values[i];
        }
        return new CartesianPoint(result);
    }

    @Override
    public double[] coordinates() {
        return values.clone();
    }

    @Override
    public int dimensions() {
        return values.length;
    }

    /**
     * Euclidean distance between this point and the other point.
     */
    public double distance(CartesianPoint other) {
        return Math.sqrt(distanceSquared(other));
    }

    /**
     * Squared Euclidean distance (avoids square root computation).
     */
    public double distanceSquared(CartesianPoint other) {
        checkSameDimensions(other);
        double sumSquares = 0.0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sumSquares += diff * diff;
        }
        return sumSquares;
    }

    public CartesianPoint divide(double scalar) {
        if (!Double.isFinite(scalar) || scalar == 0.0) {
            throw new IllegalArgumentException("Scalar must be finite and non-zero: " + scalar);
        }
        return multiply(1.0 / scalar);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CartesianPoint other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public double get(int dimension) {
        checkDimension(dimension);
        return values[dimension];
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    /**
     * Linear interpolation between this point and the other point.
     *
     * @param other the target point
     * @param t     interpolation parameter (0.0 = this, 1.0 = other)
     */
    public CartesianPoint lerp(CartesianPoint other, double t) {
        checkSameDimensions(other);
        if (!Double.isFinite(t)) {
            throw new IllegalArgumentException("Interpolation parameter must be finite: " + t);
        }
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + t * (other.values[i] - values[i]);
        }
        return new CartesianPoint(result);
    }

    public CartesianPoint multiply(double scalar) {
        if (!Double.isFinite(scalar)) {
            throw new IllegalArgumentException("Scalar must be finite: " + scalar);
        }
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * scalar;
        }
        return new CartesianPoint(result);
    }

    @Override
    public CartesianPoint point() {
        return this;
    }

    public CartesianPoint subtract(CartesianPoint other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] - other.values[i];
        }
        return new CartesianPoint(result);
    }

    @Override
    public String toString() {
        return "CartesianPoint" + Arrays.toString(values);
    }

    /**
     * Returns a new point with the specified dimension set to the given value.
     */
    public CartesianPoint with(int dimension, double value) {
        checkDimension(dimension);
        var newValues = values.clone();
        newValues[dimension] = value;
        return new CartesianPoint(newValues);
    }

    private void checkDimension(int dimension) {
        if (dimension < 0 || dimension >= values.length) {
            throw new IllegalArgumentException(
            String.format("Dimension %d out of range [0, %d)", dimension, values.length));
        }
    }

    private void checkSameDimensions(CartesianPoint other) {
        if (values.length != other.values.length) {
            throw new InvalidInputException(
            String.format("Points must have same dimensions: %d vs %d", values.length, other.values.length));
        }
    }
}
