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
 * The capabilities every analysis algorithm needs from a family of points: coordinate access, construction by
 * coordinate-wise assignment from any other point, a distance metric and interpolation. Implementations exist for
 * Cartesian spaces of any dimension ({@link Cartesian}) and for longitude/latitude on the sphere
 * ({@link Terrestrial}).
 *
 * @param <P> the point type of this coordinate system
 * @author hal.hildebrand
 */
public interface CoordinateSystem<P extends Point> {

    /**
     * Construct a point of this system by coordinate-wise assignment from any other point with the same number of
     * dimensions.
     *
     * @throws InvalidInputException if the dimensions differ
     */
    default P assign(Point other) {
        checkDimensions(other);
        return create(other.coordinates());
    }

    /**
     * Verify that the point has the dimensions of this coordinate system
     *
     * @throws InvalidInputException if the dimensions differ
     */
    default void checkDimensions(Point point) {
        if (point.dimensions() != dimensions()) {
            throw new InvalidInputException(
            String.format("%s expects %d dimensions, point has %d: %s", name(), dimensions(), point.dimensions(),
                          point));
        }
    }

    /**
     * Construct a point from raw coordinates
     */
    P create(double... coordinates);

    int dimensions();

    /**
     * The distance between two points, in the native unit of the coordinate system
     */
    double distance(P a, P b);

    /**
     * A lower bound on the distance from the point to any point inside the box, in the same unit as
     * {@link #distance(Point, Point)}. Zero when the point lies inside the box.
     */
    double distanceToBox(P point, Box box);

    /**
     * The point a fraction t of the way from a to b along the shortest path between them.
     */
    P interpolate(P a, P b, double t);

    String name();
}
