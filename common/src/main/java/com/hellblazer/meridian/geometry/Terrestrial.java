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
 * Longitude/latitude on a spherical earth. Distances are great-circle distances in kilometers, interpolation follows
 * the shorter great-circle arc between two points.
 *
 * @author hal.hildebrand
 */
public final class Terrestrial implements CoordinateSystem<TerrestrialPoint> {
    public static final double      EARTH_RADIUS_KM = 6371.0;
    public static final Terrestrial INSTANCE        = new Terrestrial();

    private static final double EPSILON = 1e-12;

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private Terrestrial() {
    }

    @Override
    public TerrestrialPoint create(double... coordinates) {
        if (coordinates.length != 2) {
            throw new InvalidInputException(
            String.format("%s expects 2 coordinates, got %d", name(), coordinates.length));
        }
        return new TerrestrialPoint(coordinates[0], coordinates[1]);
    }

    @Override
    public int dimensions() {
        return 2;
    }

    @Override
    public double distance(TerrestrialPoint a, TerrestrialPoint b) {
        return a.centralAngle(b) * EARTH_RADIUS_KM;
    }

    /**
     * Exact great-circle distance to the closest point of a longitude/latitude box whose longitudes do not wrap the
     * antimeridian. The closest point lies either on the query meridian (when the longitude falls inside the box) or
     * on one of the two bounding meridian arcs.
     */
    @Override
    public double distanceToBox(TerrestrialPoint point, Box box) {
        if (box.contains(point)) {
            return 0.0;
        }
        double minLon = box.lowerBound().get(0);
        double maxLon = box.upperBound().get(0);
        double minLat = box.lowerBound().get(1);
        double maxLat = box.upperBound().get(1);
        if (point.longitude() >= minLon && point.longitude() <= maxLon) {
            return distance(point, new TerrestrialPoint(point.longitude(), clamp(point.latitude(), minLat, maxLat)));
        }
        return Math.min(distanceToMeridianArc(point, minLon, minLat, maxLat),
                        distanceToMeridianArc(point, maxLon, minLat, maxLat));
    }

    /**
     * Spherical linear interpolation. Coincident points interpolate to themselves; exact antipodes lie on infinitely
     * many great circles, so one through the point's own pole axis is chosen.
     */
    @Override
    public TerrestrialPoint interpolate(TerrestrialPoint a, TerrestrialPoint b, double t) {
        if (t <= 0.0) {
            return a;
        }
        if (t >= 1.0) {
            return b;
        }
        var va = a.toUnitVector();
        var vb = b.toUnitVector();
        double omega = va.angle(vb);
        if (omega < EPSILON) {
            return a;
        }
        var result = new Vector3d();
        if (Math.PI - omega < 1e-9) {
            var axis = new Vector3d();
            axis.cross(va, new Vector3d(0, 0, 1));
            if (axis.length() < EPSILON) {
                axis.cross(va, new Vector3d(1, 0, 0));
            }
            axis.normalize();
            var tangent = new Vector3d();
            tangent.cross(axis, va);
            double theta = t * Math.PI;
            result.scaleAdd(Math.cos(theta), va, new Vector3d());
            result.scaleAdd(Math.sin(theta), tangent, result);
        } else {
            double sinOmega = Math.sin(omega);
            result.scale(Math.sin((1.0 - t) * omega) / sinOmega, va);
            result.scaleAdd(Math.sin(t * omega) / sinOmega, vb, result);
        }
        return TerrestrialPoint.fromUnitVector(result);
    }

    @Override
    public String name() {
        return "terrestrial";
    }

    @Override
    public String toString() {
        return name();
    }

    private double distanceToMeridianArc(TerrestrialPoint point, double meridian, double minLat, double maxLat) {
        double dLon = Math.toRadians(point.longitude() - meridian);
        double phi = Math.toRadians(point.latitude());
        // latitude of the foot of the perpendicular from the point onto the meridian's great circle
        double foot = Math.toDegrees(Math.atan2(Math.sin(phi), Math.cos(phi) * Math.cos(dLon)));
        double nearest = distance(point, new TerrestrialPoint(meridian, clamp(foot, minLat, maxLat)));
        // the foot is a maximum rather than a minimum for equatorial points more than 90 degrees away
        nearest = Math.min(nearest, distance(point, new TerrestrialPoint(meridian, minLat)));
        return Math.min(nearest, distance(point, new TerrestrialPoint(meridian, maxLat)));
    }
}
