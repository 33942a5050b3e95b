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
package com.hellblazer.meridian.analysis.dbscan;

/**
 * Shape of the region searched around each point.
 *
 * @author hal.hildebrand
 */
public enum Neighborhood {
    /**
     * The axis aligned box extending the half-span either side of the point
     */
    BOX,
    /**
     * The ellipsoid inscribed in that box; with equal half-spans this is the classical DBSCAN epsilon ball
     */
    ELLIPSOID
}
