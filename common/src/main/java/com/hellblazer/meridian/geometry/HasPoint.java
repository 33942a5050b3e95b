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
 * Anything that carries a point which spatial algorithms may compare. Bare points answer themselves, decorated values
 * ({@link PointPair}, {@link PointTuple}, trajectory points) answer their geometric component and keep their payload
 * out of every comparison.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface HasPoint<P extends Point> {

    /**
     * The comparable point of this value
     */
    P point();
}
