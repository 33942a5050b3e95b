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

/**
 * Euclidean coordinate systems. {@link #PLANE} and {@link #SPACE} cover the common two and three dimensional cases,
 * {@link #ofDimension(int)} supplies feature vector spaces of any size.
 *
 * @author hal.hildebrand
 */
public final class Cartesian implements CoordinateSystem<CartesianPoint> {
    public static final Cartesian PLANE = new Cartesian(2);
    public static final Cartesian SPACE = new Cartesian(3);

    public static Cartesian ofDimension(int dimensions) {
        return switch (dimensions) {
            case 2 -> PLANE;
            case 3 -> SPACE;
            default -> new Cartesian(dimensions);
        };
    }

    private final int dimensions;

    private Cartesian(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
    }

    @Override
    public CartesianPoint create(double... coordinates) {
        if (coordinates.length != dimensions) {
            throw new InvalidInputException(
            String.format("%s expects %d coordinates, got %d", name(), dimensions, coordinates.length));
        }
        return new CartesianPoint(coordinates);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public double distance(CartesianPoint a, CartesianPoint b) {
        return a.distance(b);
    }

    @Override
    public double distanceToBox(CartesianPoint point, Box box) {
        return box.distanceToPoint(point);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Cartesian other && other.dimensions == dimensions;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(dimensions);
    }

    @Override
    public CartesianPoint interpolate(CartesianPoint a, CartesianPoint b, double t) {
        return a.lerp(b, t);
    }

    @Override
    public String name() {
        return "cartesian" + dimensions + "d";
    }

    @Override
    public String toString() {
        return name();
    }
}
