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
package com.hellblazer.meridian.common;

import com.hellblazer.meridian.geometry.HasPoint;
import com.hellblazer.meridian.geometry.Point;

import java.time.Instant;
import java.util.Objects;

/**
 * A point observed for one moving object at one instant. The point is the value compared by the spatial algorithms;
 * the object id, timestamp and properties ride along.
 *
 * @param point      the location
 * @param objectId   identifier of the moving object
 * @param timestamp  when the object was at the location, sub-second resolution
 * @param properties auxiliary named values (speed, heading, status...)
 * @author hal.hildebrand
 */
public record TrajectoryPoint<P extends Point>(P point, String objectId, Instant timestamp, PropertyMap properties)
implements HasPoint<P> {

    public TrajectoryPoint {
        Objects.requireNonNull(point, "Point cannot be null");
        Objects.requireNonNull(objectId, "Object id cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (properties == null) {
            properties = PropertyMap.EMPTY;
        }
    }

    public TrajectoryPoint(P point, String objectId, Instant timestamp) {
        this(point, objectId, timestamp, PropertyMap.EMPTY);
    }

    public TrajectoryPoint<P> withPoint(P newPoint) {
        return new TrajectoryPoint<>(newPoint, objectId, timestamp, properties);
    }

    public TrajectoryPoint<P> withProperty(String key, PropertyValue value) {
        return new TrajectoryPoint<>(point, objectId, timestamp, properties.with(key, value));
    }

    public TrajectoryPoint<P> withProperty(String key, double value) {
        return withProperty(key, PropertyValue.of(value));
    }

    public TrajectoryPoint<P> withProperty(String key, String value) {
        return withProperty(key, PropertyValue.of(value));
    }

    @Override
    public String toString() {
        return String.format("TrajectoryPoint{%s @ %s: %s}", objectId, timestamp, point);
    }
}
