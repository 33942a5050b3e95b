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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A point followed by any number of payload values. The tuple counterpart of {@link PointPair}: the point is the
 * first element and the only one that spatial algorithms look at.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public record PointTuple<P extends Point>(P point, List<Object> payload) implements HasPoint<P> {

    public PointTuple {
        Objects.requireNonNull(point, "Point cannot be null");
        payload = Collections.unmodifiableList(Arrays.asList(payload.toArray()));
    }

    public static <P extends Point> PointTuple<P> of(P point, Object... payload) {
        return new PointTuple<>(point, Arrays.asList(payload));
    }

    /**
     * Returns the payload element at the given position, zero being the first element after the point
     */
    @SuppressWarnings("unchecked")
    public <T> T get(int index) {
        return (T) payload.get(index);
    }

    public int size() {
        return payload.size() + 1;
    }
}
