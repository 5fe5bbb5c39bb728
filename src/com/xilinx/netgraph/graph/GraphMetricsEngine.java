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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes {@link GraphMetrics} from a node list and its net resolution.
 *
 * Combinational depth only counts nodes outside the boundary set (ports and
 * registers, see {@link GateTypes#isBoundary(String)}). A node with no
 * combinational predecessor has depth 1; any other node is one deeper than its
 * deepest combinational predecessor. The traversal is an explicit depth-first
 * walk with a memo table and an in-progress set, so large designs do not grow the
 * call stack and a loop is reported instead of followed.
 */
public class GraphMetricsEngine {

    /**
     * Per-node state of the depth-first walk: the node, what is left of its
     * predecessors and the deepest predecessor seen so far.
     */
    private static final class Frame {
        final NodeId node;
        final Iterator<NodeId> preds;
        int maxPredDepth;

        Frame(NodeId node, List<NodeId> preds) {
            this.node = node;
            this.preds = preds.iterator();
        }
    }

    public GraphMetrics compute(List<GraphNode> nodes, NetResolver.Resolution resolution) {
        SortedMap<String, Integer> breakdown = computeGateBreakdown(nodes);
        int maxFanout = computeMaxFanout(resolution);
        int wireCount = resolution.getWires().size();
        try {
            int maxDepth = computeMaxDepth(nodes, resolution);
            return new GraphMetrics(breakdown, maxDepth, maxFanout, wireCount, null);
        } catch (CombinationalLoopException e) {
            return new GraphMetrics(breakdown, GraphMetrics.DEPTH_UNAVAILABLE, maxFanout, wireCount, e.getCycle());
        }
    }

    public SortedMap<String, Integer> computeGateBreakdown(List<GraphNode> nodes) {
        SortedMap<String, Integer> breakdown = new TreeMap<>();
        for (GraphNode node : nodes) {
            if (node.isGate()) {
                breakdown.merge(node.getType(), 1, Integer::sum);
            }
        }
        return breakdown;
    }

    /**
     * @return Net to number of distinct consumers, for every consumed net
     * (including floating ones) in bit order.
     */
    public SortedMap<NetKey, Integer> computeFanout(NetResolver.Resolution resolution) {
        SortedMap<NetKey, Integer> fanout = new TreeMap<>();
        for (Map.Entry<NetKey, List<NodeId>> e : resolution.getConsumers().entrySet()) {
            fanout.put(e.getKey(), e.getValue().size());
        }
        return fanout;
    }

    public int computeMaxFanout(NetResolver.Resolution resolution) {
        int max = 0;
        for (List<NodeId> consumers : resolution.getConsumers().values()) {
            max = Math.max(max, consumers.size());
        }
        return max;
    }

    public int computeMaxDepth(List<GraphNode> nodes, NetResolver.Resolution resolution) {
        int max = 0;
        for (int depth : computeDepths(nodes, resolution).values()) {
            max = Math.max(max, depth);
        }
        return max;
    }

    /**
     * Computes the combinational depth of every non-boundary node.
     * @param nodes The graph nodes.
     * @param resolution Net resolution of the same nodes.
     * @return Node to depth, in node order. Boundary nodes are absent.
     * @throws CombinationalLoopException if the combinational nodes form a loop.
     */
    public Map<NodeId, Integer> computeDepths(List<GraphNode> nodes, NetResolver.Resolution resolution) {
        Map<NodeId, List<NodeId>> preds = getCombinationalPredecessors(nodes, resolution);
        Map<NodeId, Integer> depths = new HashMap<>();
        Set<NodeId> inProgress = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (NodeId start : preds.keySet()) {
            if (depths.containsKey(start)) continue;
            inProgress.add(start);
            stack.push(new Frame(start, preds.get(start)));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.preds.hasNext()) {
                    NodeId pred = top.preds.next();
                    Integer known = depths.get(pred);
                    if (known != null) {
                        top.maxPredDepth = Math.max(top.maxPredDepth, known);
                    } else if (inProgress.contains(pred)) {
                        throw new CombinationalLoopException(extractCycle(stack, pred));
                    } else {
                        inProgress.add(pred);
                        stack.push(new Frame(pred, preds.get(pred)));
                    }
                } else {
                    stack.pop();
                    int depth = top.maxPredDepth + 1;
                    depths.put(top.node, depth);
                    inProgress.remove(top.node);
                    Frame parent = stack.peek();
                    if (parent != null) {
                        parent.maxPredDepth = Math.max(parent.maxPredDepth, depth);
                    }
                }
            }
        }

        Map<NodeId, Integer> ordered = new LinkedHashMap<>();
        for (NodeId id : preds.keySet()) {
            ordered.put(id, depths.get(id));
        }
        return ordered;
    }

    /**
     * Gets, for every non-boundary node, the non-boundary nodes driving its inputs.
     * @return Node to its distinct combinational predecessors, in node order.
     */
    public Map<NodeId, List<NodeId>> getCombinationalPredecessors(List<GraphNode> nodes,
                                                                  NetResolver.Resolution resolution) {
        Set<NodeId> boundary = new HashSet<>();
        for (GraphNode node : nodes) {
            if (GateTypes.isBoundary(node.getType())) {
                boundary.add(node.getId());
            }
        }
        Map<NodeId, List<NodeId>> preds = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (boundary.contains(node.getId())) continue;
            Set<NodeId> nodePreds = new LinkedHashSet<>();
            for (NetKey net : node.getInputs()) {
                NodeId driver = resolution.getDriver(net);
                if (driver != null && !boundary.contains(driver)) {
                    nodePreds.add(driver);
                }
            }
            preds.put(node.getId(), new ArrayList<>(nodePreds));
        }
        return preds;
    }

    /**
     * The stack holds a chain where each frame's node is consumed by the frame
     * below it. Walking from the top down to the repeated node therefore lists the
     * loop in driving order. The result is rotated to start at its smallest id.
     */
    private static CombinationalCycle extractCycle(Deque<Frame> stack, NodeId repeated) {
        List<NodeId> cycle = new ArrayList<>();
        for (Frame frame : stack) {
            cycle.add(frame.node);
            if (frame.node.equals(repeated)) break;
        }
        int smallest = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(smallest)) < 0) {
                smallest = i;
            }
        }
        List<NodeId> rotated = new ArrayList<>(cycle.subList(smallest, cycle.size()));
        rotated.addAll(cycle.subList(0, smallest));
        return new CombinationalCycle(rotated);
    }
}
