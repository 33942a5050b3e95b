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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * R-tree node. Leaves hold entries, branches hold child nodes; a node is one or the other for its whole life.
 *
 * @author hal.hildebrand
 */
final class Node<V> implements Bounded {

    static <V> Node<V> branch(List<Node<V>> children) {
        var node = new Node<V>(new ArrayList<>(children), null);
        for (var child : node.children) {
            child.parent = node;
        }
        node.recomputeBounds();
        return node;
    }

    static <V> Node<V> leaf(List<Entry<V>> entries) {
        var node = new Node<V>(null, new ArrayList<>(entries));
        node.recomputeBounds();
        return node;
    }

    private static Box extend(Box box, Box other) {
        return box == null ? other : box.union(other);
    }

    private final List<Node<V>>  children;
    private final List<Entry<V>> entries;
    private       Box            bounds;
    private       Node<V>        parent;

    private Node(List<Node<V>> children, List<Entry<V>> entries) {
        this.children = children;
        this.entries = entries;
    }

    @Override
    public Box bounds() {
        return bounds;
    }

    void add(Entry<V> entry) {
        entries.add(entry);
        bounds = extend(bounds, entry.bounds());
    }

    void addChild(Node<V> child) {
        children.add(child);
        child.parent = this;
        bounds = extend(bounds, child.bounds());
    }

    List<Node<V>> children() {
        return children;
    }

    void detach() {
        parent = null;
    }

    List<Entry<V>> entries() {
        return entries;
    }

    boolean isLeaf() {
        return entries != null;
    }

    Node<V> parent() {
        return parent;
    }

    void recomputeBounds() {
        Box result = null;
        for (Bounded item : items()) {
            result = extend(result, item.bounds());
        }
        bounds = result;
    }

    void removeChild(Node<V> child) {
        children.remove(child);
        child.parent = null;
    }

    int size() {
        return isLeaf() ? entries.size() : children.size();
    }

    /**
     * Split an overfull node at the median along the axis where its members spread the most. This node keeps the
     * lower half; the upper half moves to the returned sibling.
     */
    Node<V> split() {
        int axis = widestAxis();
        Comparator<Bounded> byCenter = Comparator.comparingDouble(item -> item.center(axis));
        int half = size() / 2;
        Node<V> sibling;
        if (isLeaf()) {
            entries.sort(byCenter);
            var upper = new ArrayList<>(entries.subList(half, entries.size()));
            entries.subList(half, entries.size()).clear();
            sibling = leaf(upper);
        } else {
            children.sort(byCenter);
            var upper = new ArrayList<>(children.subList(half, children.size()));
            children.subList(half, children.size()).clear();
            sibling = branch(upper);
        }
        recomputeBounds();
        return sibling;
    }

    @Override
    public String toString() {
        return String.format("Node{%s, %d %s}", bounds, size(), isLeaf() ? "entries" : "children");
    }

    private List<? extends Bounded> items() {
        return isLeaf() ? entries : children;
    }

    private int widestAxis() {
        int dimensions = bounds.dimensions();
        int best = 0;
        double bestSpread = -1.0;
        for (int axis = 0; axis < dimensions; axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (Bounded item : items()) {
                double c = item.center(axis);
                min = Math.min(min, c);
                max = Math.max(max, c);
            }
            if (max - min > bestSpread) {
                bestSpread = max - min;
                best = axis;
            }
        }
        return best;
    }
}
