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

import com.hellblazer.meridian.common.Trajectory;
import com.hellblazer.meridian.common.TrajectoryPoint;
import com.hellblazer.meridian.geometry.CoordinateSystem;
import com.hellblazer.meridian.geometry.InvalidInputException;
import com.hellblazer.meridian.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Groups a time ordered stream of points from many objects into trajectories, lazily.
 * <p>
 * Points for one object accumulate until the gap to the next point exceeds the separation time or the separation
 * distance; the accumulated run is then complete and is emitted if it holds at least the minimum number of points,
 * otherwise discarded. Every cleanup interval points the buffers of objects that have gone stale are completed the
 * same way, and when the source runs dry every remaining buffer is.
 * <p>
 * The source must be sorted by non-decreasing timestamp across all objects. An assembler owns its buffers and is not
 * thread safe.
 *
 * @author hal.hildebrand
 */
public class TrajectoryAssembler<P extends Point> implements Iterator<Trajectory<P>> {
    private static final Logger log = LoggerFactory.getLogger(TrajectoryAssembler.class);

    /**
     * Assemble the whole stream eagerly
     */
    public static <P extends Point> List<Trajectory<P>> assemble(CoordinateSystem<P> coordinateSystem,
                                                                 Iterable<? extends TrajectoryPoint<P>> points,
                                                                 AssemblyConfig config) {
        var assembler = new TrajectoryAssembler<>(coordinateSystem, points.iterator(), config);
        var result = new ArrayList<Trajectory<P>>();
        assembler.forEachRemaining(result::add);
        return result;
    }

    private final BufferArena<P>                         arena = new BufferArena<>();
    private final long                                   cleanupInterval;
    private final CoordinateSystem<P>                    coordinateSystem;
    private final int                                    minimumTrajectoryLength;
    private final OutOfOrderPolicy                       outOfOrderPolicy;
    private final ArrayDeque<Trajectory<P>>              ready = new ArrayDeque<>();
    private final double                                 separationDistance;
    private final Duration                               separationTime;
    private final Iterator<? extends TrajectoryPoint<P>> source;
    private final StalenessPolicy                        stalenessPolicy;
    private       boolean                                exhausted;
    private       long                                   invalidTrajectoryCount;
    private       long                                   pointCount;
    private       long                                   validTrajectoryCount;

    public TrajectoryAssembler(CoordinateSystem<P> coordinateSystem, Iterator<? extends TrajectoryPoint<P>> source,
                               AssemblyConfig config) {
        this.coordinateSystem = Objects.requireNonNull(coordinateSystem, "Coordinate system cannot be null");
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.cleanupInterval = config.getCleanupInterval();
        this.minimumTrajectoryLength = config.getMinimumTrajectoryLength();
        this.outOfOrderPolicy = config.getOutOfOrderPolicy();
        this.separationDistance = config.getSeparationDistance();
        this.separationTime = config.getSeparationTime();
        this.stalenessPolicy = config.getStalenessPolicy();
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !exhausted) {
            if (source.hasNext()) {
                accept(source.next());
            } else {
                exhausted = true;
                var remaining = arena.flushAll();
                log.debug("Source exhausted after {} points, flushing {} buffers", pointCount, remaining.size());
                remaining.forEach(this::complete);
            }
        }
        return !ready.isEmpty();
    }

    /**
     * Trajectory runs discarded for holding fewer than the minimum number of points
     */
    public long invalidTrajectoryCount() {
        return invalidTrajectoryCount;
    }

    /**
     * @throws InvalidInputException if the source delivers an out of order point under {@link OutOfOrderPolicy#REJECT}
     */
    @Override
    public Trajectory<P> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    public long pointCount() {
        return pointCount;
    }

    public AssemblyStatistics statistics() {
        return new AssemblyStatistics(pointCount, validTrajectoryCount, invalidTrajectoryCount, arena.size());
    }

    public long validTrajectoryCount() {
        return validTrajectoryCount;
    }

    private void accept(TrajectoryPoint<P> point) {
        pointCount++;
        var buffer = arena.buffer(point.objectId());
        if (!buffer.isEmpty()) {
            var last = buffer.get(buffer.size() - 1);
            if (point.timestamp().isBefore(last.timestamp())) {
                if (outOfOrderPolicy == OutOfOrderPolicy.REJECT) {
                    throw new InvalidInputException(
                    String.format("Point for '%s' at %s precedes previous point at %s", point.objectId(),
                                  point.timestamp(), last.timestamp()));
                }
                log.debug("Out of order point for '{}' at {} after {}, breaking trajectory", point.objectId(),
                          point.timestamp(), last.timestamp());
                completeAndReset(buffer);
            } else if (separated(last, point)) {
                completeAndReset(buffer);
            }
        }
        buffer.add(point);

        if (cleanupInterval > 0 && pointCount % cleanupInterval == 0) {
            var stale = arena.flushStale(point.timestamp(), stalenessPolicy);
            if (!stale.isEmpty()) {
                log.debug("Cleanup at {} after {} points flushed {} stale buffers, {} remain", point.timestamp(),
                          pointCount, stale.size(), arena.size());
            }
            stale.forEach(this::complete);
        }
    }

    private void complete(List<TrajectoryPoint<P>> points) {
        if (points.size() >= minimumTrajectoryLength && !points.isEmpty()) {
            ready.add(new Trajectory<>(coordinateSystem, points));
            validTrajectoryCount++;
        } else {
            invalidTrajectoryCount++;
        }
    }

    private void completeAndReset(List<TrajectoryPoint<P>> buffer) {
        complete(buffer);
        buffer.clear();
    }

    private boolean separated(TrajectoryPoint<P> last, TrajectoryPoint<P> point) {
        return Duration.between(last.timestamp(), point.timestamp()).compareTo(separationTime) > 0
               || coordinateSystem.distance(last.point(), point.point()) > separationDistance;
    }
}
