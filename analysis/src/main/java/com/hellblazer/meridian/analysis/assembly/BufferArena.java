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
package com.hellblazer.meridian.analysis.assembly;

import com.hellblazer.meridian.common.TrajectoryPoint;
import com.hellblazer.meridian.geometry.Point;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-object point buffers for trajectories under construction. Buffers are kept in the order their objects first
 * appeared so flushes are deterministic.
 *
 * @author hal.hildebrand
 */
public class BufferArena<P extends Point> {

    private final Map<String, List<TrajectoryPoint<P>>> buffers = new LinkedHashMap<>();

    /**
     * The buffer for the object, created empty on first use
     */
    public List<TrajectoryPoint<P>> buffer(String objectId) {
        return buffers.computeIfAbsent(objectId, id -> new ArrayList<>());
    }

    /**
     * Remove and return every non-empty buffer
     */
    public List<List<TrajectoryPoint<P>>> flushAll() {
        var flushed = new ArrayList<List<TrajectoryPoint<P>>>(buffers.size());
        for (var buffer : buffers.values()) {
            if (!buffer.isEmpty()) {
                flushed.add(buffer);
            }
        }
        buffers.clear();
        return flushed;
    }

    /**
     * Remove and return the buffers whose newest point is stale at the given time
     */
    public List<List<TrajectoryPoint<P>>> flushStale(Instant now, StalenessPolicy policy) {
        var flushed = new ArrayList<List<TrajectoryPoint<P>>>();
        for (Iterator<List<TrajectoryPoint<P>>> i = buffers.values().iterator(); i.hasNext(); ) {
            var buffer = i.next();
            if (buffer.isEmpty()) {
                i.remove();
            } else if (policy.isStale(buffer.get(buffer.size() - 1).timestamp(), now)) {
                flushed.add(buffer);
                i.remove();
            }
        }
        return flushed;
    }

    public boolean isEmpty() {
        return buffers.isEmpty();
    }

    public int size() {
        return buffers.size();
    }
}
