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

import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.netgraph.support.NetlistTestData;
import com.xilinx.netgraph.yosys.YosysModule;

public class TestNetlistGraphJSONWriter {

    @Test
    void testAndGateDocument() {
        NetlistGraph graph = NetlistGraphBuilder.transform(NetlistTestData.createAndGateModule());
        JSONObject json = NetlistGraphJSONWriter.toJSON(graph);

        Assertions.assertEquals("and_gate", json.getString(NetlistGraphJSONWriter.MODULE));
        JSONArray nodes = json.getJSONArray(NetlistGraphJSONWriter.NODES);
        Assertions.assertEquals(4, nodes.length());
        JSONObject g1 = nodes.getJSONObject(3);
        Assertions.assertEquals("cell_g1", g1.getString("id"));
        Assertions.assertEquals("AND", g1.getString("type"));
        Assertions.assertEquals("a", g1.getJSONArray("inputs").getString(0));
        Assertions.assertEquals("b", g1.getJSONArray("inputs").getString(1));
        Assertions.assertEquals("y", g1.getJSONArray("outputs").getString(0));
        Assertions.assertEquals("$_AND_", g1.getJSONObject("properties").getString("type"));

        JSONArray wires = json.getJSONArray(NetlistGraphJSONWriter.WIRES);
        Assertions.assertEquals(3, wires.length());
        JSONObject first = wires.getJSONObject(0);
        Assertions.assertEquals("cell_g1", first.getString("from"));
        Assertions.assertEquals("y", first.getString("fromPort"));
        Assertions.assertEquals("port_y_0", first.getString("to"));
        Assertions.assertEquals("y", first.getString("toPort"));

        JSONObject metrics = json.getJSONObject(NetlistGraphJSONWriter.METRICS);
        Assertions.assertEquals(1, metrics.getInt("totalGates"));
        Assertions.assertEquals(1, metrics.getJSONObject("gateBreakdown").getInt("AND"));
        Assertions.assertEquals(1, metrics.getInt("maxDepth"));
        Assertions.assertEquals(1, metrics.getInt("maxFanout"));
        Assertions.assertEquals(3, metrics.getInt("wireCount"));
        Assertions.assertTrue(json.getJSONArray(NetlistGraphJSONWriter.ERRORS).isEmpty());
    }

    @Test
    void testCycleDocument() {
        NetlistGraph graph = NetlistGraphBuilder.transform(NetlistTestData.read("ring_oscillator.json"));
        JSONObject json = NetlistGraphJSONWriter.toJSON(graph);
        Assertions.assertTrue(json.getJSONObject(NetlistGraphJSONWriter.METRICS).isNull("maxDepth"));

        JSONObject error = json.getJSONArray(NetlistGraphJSONWriter.ERRORS).getJSONObject(0);
        Assertions.assertEquals("CyclicCombinationalDependency", error.getString("kind"));
        JSONArray cycle = error.getJSONArray("cycle");
        Assertions.assertEquals(3, cycle.length());
        Assertions.assertEquals("cell_inv1", cycle.getString(0));
        Assertions.assertTrue(error.getString("message").endsWith("-> cell_inv1"));
    }

    @Test
    void testConflictDocument() {
        YosysModule module = new YosysModule("conflict");
        module.addPort(NetlistTestData.input("a", 2));
        module.addPort(NetlistTestData.output("y", 3));
        module.addCell(NetlistTestData.gate("g1", "$_NOT_", 2, 3));
        module.addCell(NetlistTestData.gate("g2", "$_BUF_", 2, 3));

        JSONObject error = NetlistGraphJSONWriter.toJSON(NetlistGraphBuilder.transform(module))
                .getJSONArray(NetlistGraphJSONWriter.ERRORS).getJSONObject(0);
        Assertions.assertEquals("DriverConflict", error.getString("kind"));
        Assertions.assertEquals("y", error.getString("net"));
        Assertions.assertEquals("cell_g1", error.getJSONArray("drivers").getString(0));
        Assertions.assertEquals("cell_g2", error.getJSONArray("drivers").getString(1));
        Assertions.assertEquals("cell_g1", error.getString("chosen"));
    }

    @Test
    void testEmptyGraph() {
        JSONObject json = NetlistGraphJSONWriter.toJSON(NetlistGraph.empty());
        Assertions.assertTrue(json.isNull(NetlistGraphJSONWriter.MODULE));
        Assertions.assertEquals(0, json.getJSONObject(NetlistGraphJSONWriter.METRICS).getInt("maxDepth"));
    }

    @Test
    void testWriteJSONFile(@TempDir Path dir) throws Exception {
        NetlistGraph graph = NetlistGraphBuilder.transform(NetlistTestData.read("full_adder.json"));
        Path out = dir.resolve("full_adder.graph.json");
        NetlistGraphJSONWriter.writeJSONFile(graph, out, 2);

        JSONObject json = new JSONObject(Files.readString(out));
        Assertions.assertEquals("full_adder", json.getString(NetlistGraphJSONWriter.MODULE));
        Assertions.assertEquals(10, json.getJSONArray(NetlistGraphJSONWriter.NODES).length());
        Assertions.assertEquals(12, json.getJSONArray(NetlistGraphJSONWriter.WIRES).length());
        Assertions.assertEquals(3, json.getJSONObject(NetlistGraphJSONWriter.METRICS).getInt("maxDepth"));
    }
}
