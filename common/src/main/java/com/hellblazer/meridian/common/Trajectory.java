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

import com.hellblazer.meridian.geometry.CoordinateSystem;
import com.hellblazer.meridian.geometry.InvalidInputException;
import com.hellblazer.meridian.geometry.Point;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable, time ordered sequence of {@link TrajectoryPoint}s for a single moving object.
 * <p>
 * Cumulative travel distance is computed once at construction through the trajectory's {@link CoordinateSystem}, so
 * length queries are constant time and fractional lookups are logarithmic.
 *
 * @author hal.hildebrand
 */
public final class Trajectory<P extends Point> implements Iterable<TrajectoryPoint<P>> {

    private final CoordinateSystem<P>      coordinateSystem;
    private final double[]                 cumulativeLength;
    private final List<TrajectoryPoint<P>> points;
    private final PropertyMap              properties;
    private final UUID                     uuid;

    public Trajectory(CoordinateSystem<P> coordinateSystem, List<TrajectoryPoint<P>> points) {
        this(coordinateSystem, points, PropertyMap.EMPTY);
    }

    /**
     * @throws InvalidInputException if the points are empty, belong to more than one object, have decreasing
     *                               timestamps or do not match the dimensions of the coordinate system
     */
    public Trajectory(CoordinateSystem<P> coordinateSystem, List<TrajectoryPoint<P>> points, PropertyMap properties) {
        this.coordinateSystem = Objects.requireNonNull(coordinateSystem, "Coordinate system cannot be null");
        Objects.requireNonNull(points, "Points cannot be null");
        if (points.isEmpty()) {
            throw new InvalidInputException("A trajectory needs at least one point");
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.properties = properties == null ? PropertyMap.EMPTY : properties;
        this.uuid = UUID.randomUUID();

        var first = this.points.get(0);
        coordinateSystem.checkDimensions(first.point());
        cumulativeLength = new double[this.points.size()];
        for (int i = 1; i < this.points.size(); i++) {
            var previous = this.points.get(i - 1);
            var current = this.points.get(i);
            coordinateSystem.checkDimensions(current.point());
            if (!current.objectId().equals(first.objectId())) {
                throw new InvalidInputException(
                String.format("Trajectory mixes object ids '%s' and '%s' at index %d", first.objectId(),
                              current.objectId(), i));
            }
            if (current.timestamp().isBefore(previous.timestamp())) {
                throw new InvalidInputException(
                String.format("Timestamps of '%s' decrease at index %d: %s -> %s", first.objectId(), i,
                              previous.timestamp(), current.timestamp()));
            }
            cumulativeLength[i] = cumulativeLength[i - 1] + coordinateSystem.distance(previous.point(),
                                                                                      current.point());
        }
    }

    public CoordinateSystem<P> coordinateSystem() {
        return coordinateSystem;
    }

    public Duration duration() {
        return Duration.between(startTime(), endTime());
    }

    public Instant endTime() {
        return points.get(points.size() - 1).timestamp();
    }

    public TrajectoryPoint<P> get(int index) {
        return points.get(index);
    }

    @Override
    public Iterator<TrajectoryPoint<P>> iterator() {
        return points.iterator();
    }

    /**
     * Distance travelled from the first point to the point at the index
     */
    public double lengthAt(int index) {
        return cumulativeLength[index];
    }

    public String objectId() {
        return points.get(0).objectId();
    }

    /**
     * The point a fraction of the way along the travelled distance. Fractions at or below 0 give the first point, at
     * or above 1 the last.
     */
    public TrajectoryPoint<P> pointAtLengthFraction(double fraction) {
        if (fraction <= 0.0 || totalLength() == 0.0) {
            return points.get(0);
        }
        if (fraction >= 1.0) {
            return points.get(points.size() - 1);
        }
        double target = fraction * totalLength();
        int upper = firstIndexAtLeast(target);
        if (cumulativeLength[upper] == target) {
            return points.get(upper);
        }
        double start = cumulativeLength[upper - 1];
        return interpolate(upper - 1, (target - start) / (cumulativeLength[upper] - start));
    }

    /**
     * The point where the object was at the given instant. Instants outside the trajectory clamp to its endpoints.
     */
    public TrajectoryPoint<P> pointAtTime(Instant time) {
        if (!time.isAfter(startTime())) {
            return points.get(0);
        }
        if (!time.isBefore(endTime())) {
            return points.get(points.size() - 1);
        }
        int low = 0;
        int high = points.size() - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (points.get(mid).timestamp().isBefore(time)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        var after = points.get(low);
        if (after.timestamp().equals(time)) {
            return after;
        }
        var before = points.get(low - 1);
        double span = Duration.between(before.timestamp(), after.timestamp()).toNanos();
        double offset = Duration.between(before.timestamp(), time).toNanos();
        return interpolate(low - 1, offset / span);
    }

    /**
     * The point a fraction of the way through the trajectory's duration
     */
    public TrajectoryPoint<P> pointAtTimeFraction(double fraction) {
        if (fraction <= 0.0) {
            return points.get(0);
        }
        if (fraction >= 1.0) {
            return points.get(points.size() - 1);
        }
        return pointAtTime(startTime().plusNanos(Math.round(duration().toNanos() * fraction)));
    }

    public List<TrajectoryPoint<P>> points() {
        return points;
    }

    public PropertyMap properties() {
        return properties;
    }

    public int size() {
        return points.size();
    }

    public Instant startTime() {
        return points.get(0).timestamp();
    }

    /**
     * The trajectory made of the points in [from, to)
     */
    public Trajectory<P> subset(int from, int to) {
        return new Trajectory<>(coordinateSystem, points.subList(from, to), properties);
    }

    public double totalLength() {
        return cumulativeLength[cumulativeLength.length - 1];
    }

    @Override
    public String toString() {
        return String.format("Trajectory{%s, %d points, %.3f length}", trajectoryId(), points.size(), totalLength());
    }

    /**
     * Human readable identifier: {@code objectId_startTime_endTime}
     */
    public String trajectoryId() {
        return objectId() + "_" + startTime() + "_" + endTime();
    }

    public UUID uuid() {
        return uuid;
    }

    public Trajectory<P> withProperty(String key, PropertyValue value) {
        return new Trajectory<>(coordinateSystem, points, properties.with(key, value));
    }

    private int firstIndexAtLeast(double length) {
        int low = 0;
        int high = cumulativeLength.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulativeLength[mid] < length) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private TrajectoryPoint<P> interpolate(int index, double t) {
        var a = points.get(index);
        var b = points.get(index + 1);
        var span = Duration.between(a.timestamp(), b.timestamp()).toNanos();
        return new TrajectoryPoint<>(coordinateSystem.interpolate(a.point(), b.point(), t), a.objectId(),
                                     a.timestamp().plusNanos(Math.round(span * t)),
                                     PropertyMap.interpolate(a.properties(), b.properties(), t));
    }
}
