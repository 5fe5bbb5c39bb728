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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.xilinx.netgraph.yosys.YosysBit;
import com.xilinx.netgraph.yosys.YosysCell;
import com.xilinx.netgraph.yosys.YosysDirection;
import com.xilinx.netgraph.yosys.YosysModule;
import com.xilinx.netgraph.yosys.YosysPort;

/**
 * Turns the ports and cells of a module into graph nodes.
 *
 * Every port bit becomes one INPUT node (driving the bit's net) or one OUTPUT
 * node (consuming it); inout ports are treated as outputs. Every cell becomes one
 * node typed by its canonical gate label, with its pins split into consumed and
 * driven nets by the cell's declared pin directions. A pin without a declared
 * direction is an input.
 *
 * Nodes come out ports first (by port name, then bit), then cells (by name);
 * connections are visited by pin name, then bit.
 */
public class NodeBuilder {

    private final BitRegistry registry;

    public NodeBuilder(BitRegistry registry) {
        this.registry = registry;
    }

    public List<GraphNode> build(YosysModule module) {
        List<GraphNode> nodes = new ArrayList<>();
        List<YosysPort> ports = new ArrayList<>(module.getPorts());
        ports.sort(Comparator.comparing(YosysPort::getName));
        for (YosysPort port : ports) {
            nodes.addAll(createPortNodes(port));
        }

        List<YosysCell> cells = new ArrayList<>(module.getCells());
        cells.sort(Comparator.comparing(YosysCell::getName));
        for (YosysCell cell : cells) {
            nodes.add(createCellNode(cell));
        }
        return nodes;
    }

    /**
     * Creates one node per bit of a port.
     * @param port The module port.
     * @return INPUT nodes for an input port, OUTPUT nodes otherwise.
     */
    public List<GraphNode> createPortNodes(YosysPort port) {
        List<GraphNode> nodes = new ArrayList<>(port.getWidth());
        String type = port.isInput() ? GateTypes.INPUT : GateTypes.OUTPUT;
        for (int i = 0; i < port.getWidth(); i++) {
            YosysBit bit = port.getBits().get(i);
            Map<String, String> props = new LinkedHashMap<>();
            props.put(GraphNode.PROP_NAME, port.getBitName(i));
            props.put(GraphNode.PROP_DIRECTION, port.getDirection().toJSONString());

            List<NetKey> nets;
            NetKey net = registry.getNet(bit);
            if (net == null) {
                props.put(GraphNode.PROP_CONSTANT, bit.getConstant());
                nets = Collections.emptyList();
            } else {
                nets = Collections.singletonList(net);
            }
            List<NetKey> none = Collections.emptyList();
            NodeId id = NodeId.port(port.getName(), i);
            if (port.isInput()) {
                nodes.add(new GraphNode(id, type, none, nets, props));
            } else {
                nodes.add(new GraphNode(id, type, nets, none, props));
            }
        }
        return nodes;
    }

    public GraphNode createCellNode(YosysCell cell) {
        List<NetKey> inputs = new ArrayList<>();
        List<NetKey> outputs = new ArrayList<>();
        Map<String, List<YosysBit>> connections = new TreeMap<>(cell.getConnections());
        for (Map.Entry<String, List<YosysBit>> e : connections.entrySet()) {
            YosysDirection dir = cell.getPortDirection(e.getKey());
            List<NetKey> dest = YosysDirection.isDriver(dir) ? outputs : inputs;
            for (YosysBit bit : e.getValue()) {
                NetKey net = registry.getNet(bit);
                if (net != null) {
                    dest.add(net);
                }
            }
        }

        Map<String, String> props = new LinkedHashMap<>();
        props.put(GraphNode.PROP_NAME, cell.getName());
        props.put(GraphNode.PROP_TYPE, cell.getType());
        return new GraphNode(NodeId.cell(cell.getName()), GateTypes.canonicalize(cell.getType()), inputs,
                outputs, props);
    }
}
