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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Writes a {@link NetlistGraph} as JSON:
 * <pre>
 * { "module": ..., "nodes": [...], "wires": [...], "metrics": {...}, "errors": [...] }
 * </pre>
 * Nodes and wires keep the graph's order. "maxDepth" is null when a combinational
 * loop made the depth undefined.
 */
public class NetlistGraphJSONWriter {

    public static final String MODULE = "module";
    public static final String NODES = "nodes";
    public static final String WIRES = "wires";
    public static final String METRICS = "metrics";
    public static final String ERRORS = "errors";

    private NetlistGraphJSONWriter() {
    }

    public static JSONObject toJSON(NetlistGraph graph) {
        JSONObject root = new JSONObject();
        root.put(MODULE, graph.getModuleName() == null ? JSONObject.NULL : graph.getModuleName());

        JSONArray nodes = new JSONArray();
        for (GraphNode node : graph.getNodes()) {
            nodes.put(toJSON(node));
        }
        root.put(NODES, nodes);

        JSONArray wires = new JSONArray();
        for (Wire wire : graph.getWires()) {
            wires.put(toJSON(wire));
        }
        root.put(WIRES, wires);

        root.put(METRICS, toJSON(graph.getMetrics()));

        JSONArray errors = new JSONArray();
        for (StructuralError error : graph.getErrors()) {
            errors.put(toJSON(error));
        }
        root.put(ERRORS, errors);
        return root;
    }

    public static JSONObject toJSON(GraphNode node) {
        JSONObject obj = new JSONObject();
        obj.put("id", node.getId().toString());
        obj.put("type", node.getType());
        JSONArray inputs = new JSONArray();
        for (NetKey net : node.getInputs()) {
            inputs.put(net.getLabel());
        }
        obj.put("inputs", inputs);
        JSONArray outputs = new JSONArray();
        for (NetKey net : node.getOutputs()) {
            outputs.put(net.getLabel());
        }
        obj.put("outputs", outputs);
        JSONObject props = new JSONObject();
        for (Map.Entry<String, String> e : node.getProperties().entrySet()) {
            props.put(e.getKey(), e.getValue());
        }
        obj.put("properties", props);
        return obj;
    }

    public static JSONObject toJSON(Wire wire) {
        JSONObject obj = new JSONObject();
        obj.put("from", wire.getFrom().toString());
        obj.put("fromPort", wire.getFromPort());
        obj.put("to", wire.getTo().toString());
        obj.put("toPort", wire.getToPort());
        return obj;
    }

    public static JSONObject toJSON(GraphMetrics metrics) {
        JSONObject obj = new JSONObject();
        obj.put("totalGates", metrics.getTotalGates());
        JSONObject breakdown = new JSONObject();
        for (Map.Entry<String, Integer> e : metrics.getGateBreakdown().entrySet()) {
            breakdown.put(e.getKey(), e.getValue().intValue());
        }
        obj.put("gateBreakdown", breakdown);
        obj.put("maxDepth", metrics.hasMaxDepth() ? (Object) metrics.getMaxDepth() : JSONObject.NULL);
        obj.put("maxFanout", metrics.getMaxFanout());
        obj.put("wireCount", metrics.getWireCount());
        return obj;
    }

    public static JSONObject toJSON(StructuralError error) {
        JSONObject obj = new JSONObject();
        obj.put("kind", error.getKind().getLabel());
        obj.put("message", error.getMessage());
        if (error instanceof DriverConflict) {
            DriverConflict conflict = (DriverConflict) error;
            obj.put("net", conflict.getNet().getLabel());
            JSONArray drivers = new JSONArray();
            for (NodeId id : conflict.getDrivers()) {
                drivers.put(id.toString());
            }
            obj.put("drivers", drivers);
            obj.put("chosen", conflict.getChosenDriver().toString());
        } else if (error instanceof CombinationalCycle) {
            JSONArray cycle = new JSONArray();
            for (NodeId id : ((CombinationalCycle) error).getCycle()) {
                cycle.put(id.toString());
            }
            obj.put("cycle", cycle);
        }
        return obj;
    }

    public static String toJSONString(NetlistGraph graph, int indent) {
        return toJSON(graph).toString(indent);
    }

    public static void writeJSONFile(NetlistGraph graph, Path jsonFile, int indent) {
        try (Writer writer = Files.newBufferedWriter(jsonFile, StandardCharsets.UTF_8)) {
            toJSON(graph).write(writer, indent, 0);
            writer.write(System.lineSeparator());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
