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

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether an object that has gone quiet can no longer extend its trajectory, so its buffer may be flushed
 * during periodic cleanup.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface StalenessPolicy {

    /**
     * Stale once more than the given time has passed since the object was last seen
     */
    static StalenessPolicy olderThan(Duration age) {
        return (lastSeen, now) -> Duration.between(lastSeen, now).compareTo(age) > 0;
    }

    /**
     * @param lastSeen timestamp of the newest point buffered for the object
     * @param now      timestamp of the point being processed when cleanup runs
     */
    boolean isStale(Instant lastSeen, Instant now);
}
