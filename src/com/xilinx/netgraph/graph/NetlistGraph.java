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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of transforming one netlist document: the nodes, the wires between them,
 * their metrics and any structural errors found on the way.
 */
public class NetlistGraph {

    private final String moduleName;

    private final List<GraphNode> nodes;

    private final Map<NodeId, GraphNode> nodeMap;

    private final List<Wire> wires;

    private final GraphMetrics metrics;

    private final List<StructuralError> errors;

    public NetlistGraph(String moduleName, List<GraphNode> nodes, List<Wire> wires, GraphMetrics metrics,
                        List<StructuralError> errors) {
        this.moduleName = moduleName;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        Map<NodeId, GraphNode> map = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (map.put(node.getId(), node) != null) {
                throw new IllegalArgumentException("ERROR: Duplicate node id " + node.getId());
            }
        }
        this.nodeMap = Collections.unmodifiableMap(map);
        this.wires = Collections.unmodifiableList(new ArrayList<>(wires));
        this.metrics = metrics;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * @return A graph with no nodes, wires or errors and zero-valued metrics.
     */
    public static NetlistGraph empty() {
        return new NetlistGraph(null, Collections.emptyList(), Collections.emptyList(), GraphMetrics.EMPTY,
                Collections.emptyList());
    }

    /**
     * @return Name of the module the graph was built from, or null for an empty
     * document.
     */
    public String getModuleName() {
        return moduleName;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public GraphNode getNode(NodeId id) {
        return nodeMap.get(id);
    }

    public List<Wire> getWires() {
        return wires;
    }

    public GraphMetrics getMetrics() {
        return metrics;
    }

    public List<StructuralError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<DriverConflict> getDriverConflicts() {
        List<DriverConflict> conflicts = new ArrayList<>();
        for (StructuralError error : errors) {
            if (error instanceof DriverConflict) {
                conflicts.add((DriverConflict) error);
            }
        }
        return conflicts;
    }

    /**
     * @throws StructuralException if any structural error was found.
     */
    public void checkStructure() {
        if (hasErrors()) {
            throw new StructuralException(errors);
        }
    }

    @Override
    public String toString() {
        return "NetlistGraph(" + moduleName + ", " + nodes.size() + " nodes, " + wires.size() + " wires, "
                + errors.size() + " errors)";
    }
}
