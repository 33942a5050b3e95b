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

import java.util.Objects;

/**
 * A point decorated with one payload value. Only the point takes part in spatial comparisons; the payload travels
 * along untouched, typically an index or identifier into some external collection.
 *
 * @param <P> the point type
 * @param <A> the payload type
 * @author hal.hildebrand
 */
public record PointPair<P extends Point, A>(P point, A payload) implements HasPoint<P> {

    public PointPair {
        Objects.requireNonNull(point, "Point cannot be null");
    }

    public static <P extends Point, A> PointPair<P, A> of(P point, A payload) {
        return new PointPair<>(point, payload);
    }
}
