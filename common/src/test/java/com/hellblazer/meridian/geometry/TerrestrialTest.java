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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TerrestrialTest {
    private static final double ONE_DEGREE_KM = Terrestrial.EARTH_RADIUS_KM * Math.PI / 180.0;

    private final Terrestrial terrestrial = Terrestrial.INSTANCE;

    @Test
    void testAntipodalInterpolationStaysOnSphere() {
        var a = new TerrestrialPoint(0, 0);
        var b = new TerrestrialPoint(180, 0);
        var mid = terrestrial.interpolate(a, b, 0.5);
        double quarter = Math.PI / 2.0 * Terrestrial.EARTH_RADIUS_KM;
        assertEquals(quarter, terrestrial.distance(a, mid), 1e-6);
        assertEquals(quarter, terrestrial.distance(mid, b), 1e-6);
    }

    @Test
    void testCreateAndAssign() {
        var p = terrestrial.create(12.5, -33.0);
        assertEquals(12.5, p.longitude());
        assertEquals(-33.0, p.latitude());
        assertEquals(p, terrestrial.assign(CartesianPoint.of(12.5, -33.0)));
        assertThrows(InvalidInputException.class, () -> terrestrial.create(1, 2, 3));
        assertThrows(InvalidInputException.class, () -> terrestrial.assign(CartesianPoint.of(1, 2, 3)));
    }

    @Test
    void testDistance() {
        assertEquals(ONE_DEGREE_KM, terrestrial.distance(new TerrestrialPoint(0, 0), new TerrestrialPoint(1, 0)),
                     1e-9);
        assertEquals(ONE_DEGREE_KM, terrestrial.distance(new TerrestrialPoint(30, 10), new TerrestrialPoint(30, 11)),
                     1e-9);
        assertEquals(Math.PI * Terrestrial.EARTH_RADIUS_KM,
                     terrestrial.distance(new TerrestrialPoint(0, 90), new TerrestrialPoint(0, -90)), 1e-6);
        // across the antimeridian
        assertEquals(2 * ONE_DEGREE_KM,
                     terrestrial.distance(new TerrestrialPoint(179, 0), new TerrestrialPoint(-179, 0)), 1e-9);
        assertEquals(0.0, terrestrial.distance(new TerrestrialPoint(45, 45), new TerrestrialPoint(45, 45)));
    }

    @Test
    void testDistanceToBox() {
        var box = Box.of(new TerrestrialPoint(-10, 40), new TerrestrialPoint(10, 50));
        assertEquals(0.0, terrestrial.distanceToBox(new TerrestrialPoint(0, 45), box));
        // due south of the box along the same meridian
        assertEquals(10 * ONE_DEGREE_KM, terrestrial.distanceToBox(new TerrestrialPoint(0, 30), box), 1e-6);
        // due west on the equator side of the box is never farther than the corner
        var west = new TerrestrialPoint(-20, 45);
        assertTrue(terrestrial.distanceToBox(west, box) <= terrestrial.distance(west, new TerrestrialPoint(-10,
                                                                                                           45)));
        // equatorial point on the far side of the globe
        var far = new TerrestrialPoint(150, 0);
        var skewed = Box.of(new TerrestrialPoint(-30, -60), new TerrestrialPoint(-20, 10));
        assertTrue(terrestrial.distanceToBox(far, skewed) <= terrestrial.distance(far,
                                                                                  new TerrestrialPoint(-30, -60)));
    }

    @Test
    void testInterpolation() {
        var a = new TerrestrialPoint(0, 0);
        var b = new TerrestrialPoint(90, 0);
        var mid = terrestrial.interpolate(a, b, 0.5);
        assertEquals(45.0, mid.longitude(), 1e-9);
        assertEquals(0.0, mid.latitude(), 1e-9);
        assertSame(a, terrestrial.interpolate(a, b, 0.0));
        assertSame(b, terrestrial.interpolate(a, b, 1.0));

        // great circle routes bow towards the pole
        var west = new TerrestrialPoint(-60, 45);
        var east = new TerrestrialPoint(60, 45);
        var top = terrestrial.interpolate(west, east, 0.5);
        assertEquals(0.0, top.longitude(), 1e-9);
        assertTrue(top.latitude() > 45.0);
        assertEquals(terrestrial.distance(west, top), terrestrial.distance(top, east), 1e-6);
    }

    @Test
    void testUnitVectorRoundTrip() {
        var p = new TerrestrialPoint(-122.4, 37.8);
        var back = TerrestrialPoint.fromUnitVector(p.toUnitVector());
        assertEquals(p.longitude(), back.longitude(), 1e-9);
        assertEquals(p.latitude(), back.latitude(), 1e-9);
    }
}
