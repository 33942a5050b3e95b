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

import java.util.ArrayList;
import java.util.List;

/**
 * Converts points between coordinate systems by coordinate-wise assignment. No projection is performed: a
 * longitude/latitude point converted to {@link Cartesian#PLANE} becomes (longitude, latitude) in a flat plane, which
 * is a useful local approximation for points well away from the poles and the antimeridian.
 *
 * @author hal.hildebrand
 */
public final class PointConverter {

    /**
     * Convert every point of the source into the target system, preserving order
     */
    public static <T extends Point> List<T> convertAll(Iterable<? extends HasPoint<?>> source,
                                                       CoordinateSystem<T> target) {
        var result = new ArrayList<T>();
        for (var value : source) {
            result.add(convert(value.point(), target));
        }
        return result;
    }

    /**
     * Convert one point into the target system
     *
     * @throws InvalidInputException if the point does not have the dimensions of the target system
     */
    public static <T extends Point> T convert(Point source, CoordinateSystem<T> target) {
        return target.assign(source);
    }

    private PointConverter() {
    }
}
