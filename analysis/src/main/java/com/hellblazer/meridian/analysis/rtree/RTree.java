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
package com.hellblazer.meridian.analysis.rtree;

import com.hellblazer.meridian.geometry.Box;
import com.hellblazer.meridian.geometry.CoordinateSystem;
import com.hellblazer.meridian.geometry.HasPoint;
import com.hellblazer.meridian.geometry.InvalidInputException;
import com.hellblazer.meridian.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.BiPredicate;

/**
 * An R-tree over values that carry a point. Values may be bare points, {@link com.hellblazer.meridian.geometry.PointPair
 * pairs}, {@link com.hellblazer.meridian.geometry.PointTuple tuples} or anything else implementing {@link HasPoint};
 * only the point takes part in the queries, and the payload comes back untouched.
 * <p>
 * The tree is bulk loaded with sort-tile-recursive packing. Incremental inserts descend by least enlargement and split
 * overfull nodes at the median of their widest axis. Box queries report matches in insertion order, so the same data
 * indexed with and without payload produces element-wise identical results. Nearest neighbor queries run best-first
 * over the coordinate system's distance, with ties resolved by insertion order.
 * <p>
 * Queries do not mutate the tree and may run concurrently; insert, remove and clear need external synchronization.
 *
 * @param <V> the indexed value type
 * @param <P> the point type of the values
 * @author hal.hildebrand
 */
public class RTree<V extends HasPoint<P>, P extends Point> {
    public static final int DEFAULT_NODE_CAPACITY = 16;

    private static final Logger log = LoggerFactory.getLogger(RTree.class);

    private static int ceilDiv(int numerator, int denominator) {
        return (numerator + denominator - 1) / denominator;
    }

    private final int                 capacity;
    private final CoordinateSystem<P> coordinateSystem;
    private       long                nextSequence;
    private       Node<V>             root;
    private       int                 size;

    public RTree(CoordinateSystem<P> coordinateSystem) {
        this(coordinateSystem, Collections.emptyList());
    }

    public RTree(CoordinateSystem<P> coordinateSystem, Collection<? extends V> values) {
        this(coordinateSystem, values, DEFAULT_NODE_CAPACITY);
    }

    /**
     * Bulk load a tree
     *
     * @param coordinateSystem the system supplying distance for nearest neighbor search
     * @param values           the initial contents, in insertion order
     * @param nodeCapacity     maximum number of entries or children per node, at least 4
     */
    public RTree(CoordinateSystem<P> coordinateSystem, Collection<? extends V> values, int nodeCapacity) {
        if (nodeCapacity < 4) {
            throw new IllegalArgumentException("Node capacity must be at least 4: " + nodeCapacity);
        }
        this.coordinateSystem = Objects.requireNonNull(coordinateSystem, "Coordinate system cannot be null");
        this.capacity = nodeCapacity;
        this.root = bulkLoad(values);
        if (log.isDebugEnabled()) {
            log.debug("Built {} R-tree of {} values, height {}", coordinateSystem.name(), size, height());
        }
    }

    public void clear() {
        root = Node.leaf(List.of());
        size = 0;
    }

    public CoordinateSystem<P> coordinateSystem() {
        return coordinateSystem;
    }

    /**
     * The k values closest to the query point, nearest first. Fewer than k values come back when the tree holds
     * fewer; none when k is not positive.
     */
    public List<V> findNearestNeighbors(HasPoint<? extends P> query, int k) {
        P target = query.point();
        coordinateSystem.checkDimensions(target);
        if (k <= 0 || size == 0) {
            return Collections.emptyList();
        }
        var frontier = new PriorityQueue<Candidate<V>>();
        frontier.add(new Candidate<>(coordinateSystem.distanceToBox(target, root.bounds()), root, null));
        var result = new ArrayList<V>(Math.min(k, size));
        while (!frontier.isEmpty() && result.size() < k) {
            var next = frontier.poll();
            if (next.entry != null) {
                result.add(next.entry.value());
                continue;
            }
            if (next.node.isLeaf()) {
                for (var entry : next.node.entries()) {
                    frontier.add(new Candidate<>(coordinateSystem.distance(target, entry.value().point()), null, entry));
                }
            } else {
                for (var child : next.node.children()) {
                    frontier.add(new Candidate<>(coordinateSystem.distanceToBox(target, child.bounds()), child, null));
                }
            }
        }
        return result;
    }

    /**
     * Values whose points lie inside or on the border of the box. Only the points of the corners are used.
     */
    public List<V> findPointsInsideBox(HasPoint<?> minCorner, HasPoint<?> maxCorner) {
        return findPointsInsideBox(Box.of(minCorner.point(), maxCorner.point()));
    }

    public List<V> findPointsInsideBox(Box box) {
        return search(box, Box::contains);
    }

    /**
     * Values whose points lie inside the box and not on its border. Only the points of the corners are used.
     */
    public List<V> findPointsStrictlyInsideBox(HasPoint<?> minCorner, HasPoint<?> maxCorner) {
        return findPointsStrictlyInsideBox(Box.of(minCorner.point(), maxCorner.point()));
    }

    public List<V> findPointsStrictlyInsideBox(Box box) {
        return search(box, Box::strictlyContains);
    }

    /**
     * Number of levels, 1 for a tree that is a single leaf
     */
    public int height() {
        int height = 1;
        for (var node = root; !node.isLeaf(); node = node.children().get(0)) {
            height++;
        }
        return height;
    }

    public void insert(V value) {
        var entry = entry(value);
        var leaf = chooseLeaf(entry.bounds());
        leaf.add(entry);
        size++;
        adjust(leaf);
    }

    public void insertAll(Iterable<? extends V> values) {
        for (V value : values) {
            insert(value);
        }
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Remove the earliest inserted value equal to the given one
     *
     * @return true if a value was removed
     */
    public boolean remove(V value) {
        P point = value.point();
        coordinateSystem.checkDimensions(point);
        if (size == 0) {
            return false;
        }
        Node<V> holder = null;
        Entry<V> found = null;
        var pending = new ArrayDeque<Node<V>>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (!node.bounds().contains(point)) {
                continue;
            }
            if (node.isLeaf()) {
                for (var entry : node.entries()) {
                    if (entry.value().equals(value) && (found == null || entry.sequence() < found.sequence())) {
                        found = entry;
                        holder = node;
                    }
                }
            } else {
                node.children().forEach(pending::push);
            }
        }
        if (found == null) {
            return false;
        }
        holder.entries().remove(found);
        size--;
        condense(holder);
        return true;
    }

    public int size() {
        return size;
    }

    /**
     * All values in insertion order
     */
    public List<V> values() {
        var entries = new ArrayList<Entry<V>>(size);
        collect(root, entries);
        return sorted(entries);
    }

    private void adjust(Node<V> node) {
        while (node != null) {
            var parent = node.parent();
            if (node.size() > capacity) {
                var sibling = node.split();
                if (parent == null) {
                    root = Node.branch(List.of(node, sibling));
                    return;
                }
                parent.addChild(sibling);
            } else {
                node.recomputeBounds();
            }
            node = parent;
        }
    }

    private Node<V> bulkLoad(Collection<? extends V> values) {
        var entries = new ArrayList<Entry<V>>(values.size());
        for (V value : values) {
            entries.add(entry(value));
        }
        size = entries.size();
        if (entries.isEmpty()) {
            return Node.leaf(List.of());
        }
        var level = new ArrayList<Node<V>>();
        for (var group : pack(entries)) {
            level.add(Node.leaf(group));
        }
        while (level.size() > 1) {
            var parents = new ArrayList<Node<V>>();
            for (var group : pack(level)) {
                parents.add(Node.branch(group));
            }
            level = parents;
        }
        return level.get(0);
    }

    private Node<V> chooseLeaf(Box bounds) {
        var node = root;
        while (!node.isLeaf()) {
            Node<V> best = null;
            double bestEnlargement = 0.0;
            double bestMarginGrowth = 0.0;
            for (var child : node.children()) {
                var grown = child.bounds().union(bounds);
                double enlargement = grown.volume() - child.bounds().volume();
                double marginGrowth = grown.margin() - child.bounds().margin();
                if (best == null || enlargement < bestEnlargement || (enlargement == bestEnlargement
                                                                      && marginGrowth < bestMarginGrowth)) {
                    best = child;
                    bestEnlargement = enlargement;
                    bestMarginGrowth = marginGrowth;
                }
            }
            node = best;
        }
        return node;
    }

    private void collect(Node<V> node, List<Entry<V>> into) {
        if (node.isLeaf()) {
            into.addAll(node.entries());
        } else {
            for (var child : node.children()) {
                collect(child, into);
            }
        }
    }

    private void condense(Node<V> leaf) {
        var node = leaf;
        while (node != root && node.size() == 0) {
            var parent = node.parent();
            parent.removeChild(node);
            node = parent;
        }
        for (var n = node; n != null; n = n.parent()) {
            n.recomputeBounds();
        }
        while (!root.isLeaf() && root.size() == 1) {
            root = root.children().get(0);
            root.detach();
        }
        if (root.size() == 0) {
            root = Node.leaf(List.of());
        }
    }

    private Entry<V> entry(V value) {
        Objects.requireNonNull(value, "Value cannot be null");
        P point = value.point();
        coordinateSystem.checkDimensions(point);
        return new Entry<>(value, Box.of(point), nextSequence++);
    }

    private <T extends Bounded> List<List<T>> pack(List<T> items) {
        var groups = new ArrayList<List<T>>();
        tile(items, 0, groups);
        return groups;
    }

    private List<V> search(Box box, BiPredicate<Box, Point> accept) {
        if (box.dimensions() != coordinateSystem.dimensions()) {
            throw new InvalidInputException(
            String.format("Query box has %d dimensions, %s index has %d", box.dimensions(), coordinateSystem.name(),
                          coordinateSystem.dimensions()));
        }
        if (size == 0) {
            return Collections.emptyList();
        }
        var matches = new ArrayList<Entry<V>>();
        var pending = new ArrayDeque<Node<V>>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (!node.bounds().intersects(box)) {
                continue;
            }
            if (node.isLeaf()) {
                for (var entry : node.entries()) {
                    if (accept.test(box, entry.value().point())) {
                        matches.add(entry);
                    }
                }
            } else {
                node.children().forEach(pending::push);
            }
        }
        return sorted(matches);
    }

    private List<V> sorted(List<Entry<V>> entries) {
        entries.sort(Comparator.comparingLong(Entry::sequence));
        var result = new ArrayList<V>(entries.size());
        for (var entry : entries) {
            result.add(entry.value());
        }
        return result;
    }

    /**
     * Sort-tile-recursive grouping: slice along one axis into slabs, recurse into each slab on the next axis, and cut
     * the last axis into runs of node capacity.
     */
    private <T extends Bounded> void tile(List<T> items, int axis, List<List<T>> groups) {
        if (items.size() <= capacity) {
            groups.add(new ArrayList<>(items));
            return;
        }
        var sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(item -> item.center(axis)));
        int dimensions = coordinateSystem.dimensions();
        if (axis >= dimensions - 1) {
            for (int i = 0; i < sorted.size(); i += capacity) {
                groups.add(new ArrayList<>(sorted.subList(i, Math.min(i + capacity, sorted.size()))));
            }
            return;
        }
        int pages = ceilDiv(sorted.size(), capacity);
        int slices = (int) Math.ceil(Math.pow(pages, 1.0 / (dimensions - axis)));
        int sliceSize = capacity * ceilDiv(pages, slices);
        for (int i = 0; i < sorted.size(); i += sliceSize) {
            tile(sorted.subList(i, Math.min(i + sliceSize, sorted.size())), axis + 1, groups);
        }
    }

    /**
     * Best-first search frontier element: either a node keyed by its lower bound distance or an entry keyed by its
     * exact distance. At equal distance nodes expand before entries are reported, and entries report in insertion
     * order.
     */
    private record Candidate<V>(double distance, Node<V> node, Entry<V> entry) implements Comparable<Candidate<V>> {
        @Override
        public int compareTo(Candidate<V> other) {
            int result = Double.compare(distance, other.distance);
            if (result != 0) {
                return result;
            }
            if (entry == null || other.entry == null) {
                return Boolean.compare(entry != null, other.entry != null);
            }
            return Long.compare(entry.sequence(), other.entry.sequence());
        }
    }
}
