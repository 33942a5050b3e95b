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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one clustering run. Values keep their input order and payload; cluster ids run from 1 to
 * {@link #clusterCount()} in discovery order, with 0 marking noise.
 *
 * @author hal.hildebrand
 */
public final class ClusteringResult<V> {

    private final int       clusterCount;
    private final boolean[] core;
    private final int[]     labels;
    private final List<V>   values;

    ClusteringResult(List<V> values, int[] labels, boolean[] core, int clusterCount) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.labels = labels.clone();
        this.core = core.clone();
        this.clusterCount = clusterCount;
    }

    /**
     * Number of clusters found, noise not counted
     */
    public int clusterCount() {
        return clusterCount;
    }

    public int corePointCount() {
        int count = 0;
        for (boolean isCore : core) {
            if (isCore) {
                count++;
            }
        }
        return count;
    }

    /**
     * True if the value's neighborhood held enough points to grow its cluster; border members and noise are not core
     */
    public boolean isCore(int index) {
        return core[index];
    }

    public int labelOf(int index) {
        return labels[index];
    }

    public List<Labeled<V>> labeledValues() {
        var result = new ArrayList<Labeled<V>>(values.size());
        for (int i = 0; i < values.size(); i++) {
            result.add(new Labeled<>(values.get(i), labels[i]));
        }
        return result;
    }

    /**
     * Cluster id per input value, 0 for noise
     */
    public int[] labels() {
        return labels.clone();
    }

    /**
     * The values assigned to the cluster, in input order
     */
    public List<V> members(int clusterId) {
        if (clusterId < 0 || clusterId > clusterCount) {
            throw new IllegalArgumentException(
            String.format("No cluster %d, clusters run from 0 (noise) to %d", clusterId, clusterCount));
        }
        var result = new ArrayList<V>();
        for (int i = 0; i < values.size(); i++) {
            if (labels[i] == clusterId) {
                result.add(values.get(i));
            }
        }
        return result;
    }

    /**
     * Input indices grouped by cluster. Entry 0 lists the noise points, entry c the members of cluster c, so the list
     * always holds clusterCount() + 1 entries.
     */
    public List<List<Integer>> membershipLists() {
        var lists = new ArrayList<List<Integer>>(clusterCount + 1);
        for (int c = 0; c <= clusterCount; c++) {
            lists.add(new ArrayList<>());
        }
        for (int i = 0; i < labels.length; i++) {
            lists.get(labels[i]).add(i);
        }
        return lists;
    }

    public int noiseCount() {
        return (int) Arrays.stream(labels).filter(label -> label == DBSCAN.NOISE).count();
    }

    /**
     * Like {@link #membershipLists()}, listing the values themselves
     */
    public List<List<V>> payloadMembershipLists() {
        var lists = DBSCAN.buildMembershipLists(labeledValues());
        while (lists.size() <= clusterCount) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return String.format("ClusteringResult{%d values, %d clusters, %d noise}", values.size(), clusterCount,
                             noiseCount());
    }

    public List<V> values() {
        return values;
    }
}
