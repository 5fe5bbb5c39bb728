/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of NetGraph.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.netgraph.graph;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only structural metrics of one netlist graph.
 */
public final class GraphMetrics {

    /** Value of {@link #getMaxDepth()} when a combinational loop makes depth undefined */
    public static final int DEPTH_UNAVAILABLE = -1;

    public static final GraphMetrics EMPTY = new GraphMetrics(new TreeMap<>(), 0, 0, 0, null);

    private final SortedMap<String, Integer> gateBreakdown;

    private final int totalGates;

    private final int maxDepth;

    private final int maxFanout;

    private final int wireCount;

    private final CombinationalCycle depthError;

    GraphMetrics(SortedMap<String, Integer> gateBreakdown, int maxDepth, int maxFanout, int wireCount,
                 CombinationalCycle depthError) {
        this.gateBreakdown = Collections.unmodifiableSortedMap(new TreeMap<>(gateBreakdown));
        int total = 0;
        for (int count : gateBreakdown.values()) {
            total += count;
        }
        this.totalGates = total;
        this.maxDepth = depthError == null ? maxDepth : DEPTH_UNAVAILABLE;
        this.maxFanout = maxFanout;
        this.wireCount = wireCount;
        this.depthError = depthError;
    }

    public int getTotalGates() {
        return totalGates;
    }

    /**
     * @return Gate type label to number of nodes of that type, sorted by label.
     * Port nodes are not gates.
     */
    public SortedMap<String, Integer> getGateBreakdown() {
        return gateBreakdown;
    }

    public int getGateCount(String type) {
        return gateBreakdown.getOrDefault(type, 0);
    }

    /**
     * @return Length in nodes of the longest combinational path, 0 if there are no
     * combinational nodes, or {@link #DEPTH_UNAVAILABLE} if a loop was found.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean hasMaxDepth() {
        return depthError == null;
    }

    /**
     * @return The loop that made the depth undefined, or null.
     */
    public CombinationalCycle getDepthError() {
        return depthError;
    }

    public int getMaxFanout() {
        return maxFanout;
    }

    public int getWireCount() {
        return wireCount;
    }

    @Override
    public int hashCode() {
        return (((gateBreakdown.hashCode() * 31 + maxDepth) * 31 + maxFanout) * 31 + wireCount) * 31
                + Objects.hashCode(depthError);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GraphMetrics)) return false;
        GraphMetrics other = (GraphMetrics) obj;
        return gateBreakdown.equals(other.gateBreakdown) && maxDepth == other.maxDepth
                && maxFanout == other.maxFanout && wireCount == other.wireCount
                && Objects.equals(depthError, other.depthError);
    }

    @Override
    public String toString() {
        return "{totalGates=" + totalGates + ", gateBreakdown=" + gateBreakdown
                + ", maxDepth=" + (hasMaxDepth() ? Integer.toString(maxDepth) : "n/a")
                + ", maxFanout=" + maxFanout + ", wireCount=" + wireCount + "}";
    }
}
