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
import java.util.List;

import com.xilinx.netgraph.yosys.YosysModule;
import com.xilinx.netgraph.yosys.YosysNetlist;

/**
 * Converts a Yosys netlist document into a {@link NetlistGraph}:
 * bits are named by the {@link BitRegistry}, ports and cells become nodes through
 * the {@link NodeBuilder}, the {@link NetResolver} finds drivers, consumers and
 * wires, and the {@link GraphMetricsEngine} derives the metrics.
 *
 * Only the top module is processed; the netlist is expected to be flattened.
 * A call shares no state with any other call, so independent documents may be
 * transformed concurrently.
 */
public class NetlistGraphBuilder {

    private NetlistGraphBuilder() {
    }

    /**
     * Builds the graph of a netlist's top module.
     * @param netlist The parsed document.
     * @return The graph. A document without modules yields {@link NetlistGraph#empty()};
     * driver conflicts and combinational loops are reported in
     * {@link NetlistGraph#getErrors()}.
     */
    public static NetlistGraph transform(YosysNetlist netlist) {
        YosysModule top = netlist.getTopModule();
        if (top == null) {
            return NetlistGraph.empty();
        }
        int ignored = netlist.getModules().size() - 1;
        if (ignored > 0) {
            System.err.println("WARNING: Netlist has " + (ignored + 1) + " modules, only '" + top.getName()
                    + "' is analyzed. Flatten the design to include the others.");
        }
        return transform(top);
    }

    public static NetlistGraph transform(YosysModule module) {
        BitRegistry registry = BitRegistry.create(module);
        List<GraphNode> nodes = new NodeBuilder(registry).build(module);
        NetResolver.Resolution resolution = new NetResolver().resolve(nodes);
        GraphMetrics metrics = new GraphMetricsEngine().compute(nodes, resolution);

        List<StructuralError> errors = new ArrayList<>(resolution.getConflicts());
        if (metrics.getDepthError() != null) {
            errors.add(metrics.getDepthError());
        }
        return new NetlistGraph(module.getName(), nodes, resolution.getWires(), metrics, errors);
    }
}
