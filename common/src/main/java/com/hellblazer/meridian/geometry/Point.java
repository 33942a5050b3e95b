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
 * A fixed-dimension coordinate tuple. Points have no identity beyond their coordinates; distance and interpolation
 * are the business of the {@link CoordinateSystem} the point belongs to.
 *
 * @author hal.hildebrand
 */
public interface Point {

    /**
     * Returns a copy of all coordinates
     */
    default double[] coordinates() {
        var result = new double[dimensions()];
        for (int i = 0; i < result.length; i++) {
            result[i] = get(i);
        }
        return result;
    }

    /**
     * The number of coordinates in this point
     */
    int dimensions();

    /**
     * Returns the coordinate value for the specified dimension
     *
     * @param dimension zero based dimension index
     * @return the coordinate
     * @throws IllegalArgumentException if the dimension is out of range
     */
    double get(int dimension);
}
