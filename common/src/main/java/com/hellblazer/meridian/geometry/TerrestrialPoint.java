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

import javax.vecmath.Vector3d;

/**
 * Immutable longitude/latitude position on the surface of the earth, both in degrees. Dimension 0 is longitude,
 * dimension 1 is latitude.
 *
 * @author hal.hildebrand
 */
public record TerrestrialPoint(double longitude, double latitude) implements Point, HasPoint<TerrestrialPoint> {

    public TerrestrialPoint {
        if (!Double.isFinite(longitude) || !Double.isFinite(latitude)) {
            throw new IllegalArgumentException(
            String.format("Longitude and latitude must be finite: (%f, %f)", longitude, latitude));
        }
    }

    /**
     * The position of a unit vector from the center of the earth
     */
    public static TerrestrialPoint fromUnitVector(Vector3d v) {
        double theta = Math.sqrt(v.x * v.x + v.y * v.y);
        double latitude = Math.toDegrees(Math.atan2(v.z, theta));
        double longitude = Math.toDegrees(Math.atan2(v.y, v.x));
        return new TerrestrialPoint(longitude, latitude);
    }

    @Override
    public int dimensions() {
        return 2;
    }

    @Override
    public double get(int dimension) {
        return switch (dimension) {
            case 0 -> longitude;
            case 1 -> latitude;
            default -> throw new IllegalArgumentException(
            String.format("Dimension %d out of range [0, 2)", dimension));
        };
    }

    /**
     * Central angle between this point and the other, in radians. Haversine formulation so that nearby points keep
     * their precision.
     */
    public double centralAngle(TerrestrialPoint other) {
        double lat1 = Math.toRadians(latitude);
        double lat2 = Math.toRadians(other.latitude);
        double sinHalfLat = Math.sin((lat2 - lat1) / 2.0);
        double sinHalfLon = Math.sin(Math.toRadians(other.longitude - longitude) / 2.0);
        double a = sinHalfLat * sinHalfLat + Math.cos(lat1) * Math.cos(lat2) * sinHalfLon * sinHalfLon;
        a = Math.min(1.0, Math.max(0.0, a));
        return 2.0 * Math.atan2(Math.sqrt(a), Math.sqrt(1.0 - a));
    }

    @Override
    public TerrestrialPoint point() {
        return this;
    }

    /**
     * The unit vector from the center of the earth through this position
     */
    public Vector3d toUnitVector() {
        double lon = Math.toRadians(longitude);
        double lat = Math.toRadians(latitude);
        return new Vector3d(Math.cos(lat) * Math.cos(lon), Math.cos(lat) * Math.sin(lon), Math.sin(lat));
    }

    @Override
    public String toString() {
        return String.format("TerrestrialPoint(%.6f, %.6f)", longitude, latitude);
    }
}
