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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestGraphMetricsEngine {

    private static NetKey net(int bit) {
        return new NetKey(bit, "n" + bit);
    }

    private static GraphNode input(String name, int bit) {
        return new GraphNode(NodeId.port(name, 0), GateTypes.INPUT, Collections.emptyList(),
                Collections.singletonList(net(bit)), Collections.emptyMap());
    }

    private static GraphNode output(String name, int bit) {
        return new GraphNode(NodeId.port(name, 0), GateTypes.OUTPUT, Collections.singletonList(net(bit)),
                Collections.emptyList(), Collections.emptyMap());
    }

    private static GraphNode cell(String name, String type, List<Integer> inputs, int output) {
        List<NetKey> in = new ArrayList<>();
        for (int bit : inputs) {
            in.add(net(bit));
        }
        return new GraphNode(NodeId.cell(name), type, in, Collections.singletonList(net(output)),
                Collections.emptyMap());
    }

    private static GraphMetrics compute(List<GraphNode> nodes) {
        return new GraphMetricsEngine().compute(nodes, new NetResolver().resolve(nodes));
    }

    /**
     * Longest combinational path (in nodes) computed on a jgrapht graph in
     * topological order.
     */
    private static int longestPath(List<GraphNode> nodes) {
        Graph<NodeId, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
        NetResolver.Resolution resolution = new NetResolver().resolve(nodes);
        Map<NodeId, GraphNode> byId = new HashMap<>();
        for (GraphNode node : nodes) {
            byId.put(node.getId(), node);
            if (!GateTypes.isBoundary(node.getType())) {
                g.addVertex(node.getId());
            }
        }
        for (Wire wire : resolution.getWires()) {
            if (g.containsVertex(wire.getFrom()) && g.containsVertex(wire.getTo())) {
                g.addEdge(wire.getFrom(), wire.getTo());
            }
        }
        Assertions.assertFalse(new CycleDetector<>(g).detectCycles());

        Map<NodeId, Integer> depth = new HashMap<>();
        int max = 0;
        TopologicalOrderIterator<NodeId, DefaultEdge> it = new TopologicalOrderIterator<>(g);
        while (it.hasNext()) {
            NodeId v = it.next();
            int d = 1;
            for (NodeId pred : Graphs.predecessorListOf(g, v)) {
                d = Math.max(d, depth.get(pred) + 1);
            }
            depth.put(v, d);
            max = Math.max(max, d);
        }
        return max;
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 7, 42, 1234, 98765})
    void testMaxDepthMatchesTopologicalLongestPath(long seed) {
        Random random = new Random(seed);
        List<GraphNode> nodes = new ArrayList<>();
        List<Integer> available = new ArrayList<>();
        int nextBit = 2;
        for (int i = 0; i < 4; i++) {
            nodes.add(input("i" + i, nextBit));
            available.add(nextBit++);
        }
        for (int i = 0; i < 300; i++) {
            int fanin = 1 + random.nextInt(3);
            List<Integer> ins = new ArrayList<>();
            for (int j = 0; j < fanin; j++) {
                ins.add(available.get(random.nextInt(available.size())));
            }
            String type = random.nextInt(10) == 0 ? "DFF_P" : (fanin == 1 ? "NOT" : "AND");
            nodes.add(cell(String.format("g%03d", random.nextInt(1000)) + "_" + i, type, ins, nextBit));
            available.add(nextBit++);
        }
        nodes.add(output("o", nextBit - 1));
        Collections.shuffle(nodes, random);

        GraphMetrics metrics = compute(nodes);
        Assertions.assertTrue(metrics.hasMaxDepth());
        Assertions.assertEquals(longestPath(nodes), metrics.getMaxDepth());
    }

    @Test
    void testDeepChainDoesNotOverflow() {
        int length = 100_000;
        List<GraphNode> nodes = new ArrayList<>();
        nodes.add(input("a", 0));
        for (int i = 0; i < length; i++) {
            nodes.add(cell("inv" + i, "NOT", Collections.singletonList(i), i + 1));
        }
        nodes.add(output("y", length));
        // visit the end of the chain first
        Collections.reverse(nodes);
        GraphMetrics metrics = compute(nodes);
        Assertions.assertEquals(length, metrics.getMaxDepth());
        Assertions.assertEquals(length + 1, metrics.getWireCount());
    }

    @Test
    void testDepths() {
        List<GraphNode> nodes = Arrays.asList(
                input("a", 2),
                input("b", 3),
                cell("x", "XOR", Arrays.asList(2, 3), 4),
                cell("n", "NOT", Collections.singletonList(4), 5),
                cell("o", "OR", Arrays.asList(4, 5), 6),
                output("y", 6));
        GraphMetricsEngine engine = new GraphMetricsEngine();
        NetResolver.Resolution resolution = new NetResolver().resolve(nodes);
        Map<NodeId, Integer> depths = engine.computeDepths(nodes, resolution);
        Assertions.assertEquals(Arrays.asList(NodeId.cell("x"), NodeId.cell("n"), NodeId.cell("o")),
                new ArrayList<>(depths.keySet()));
        Assertions.assertEquals(Arrays.asList(1, 2, 3), new ArrayList<>(depths.values()));
        Assertions.assertEquals(Arrays.asList(NodeId.cell("x"), NodeId.cell("n")),
                engine.getCombinationalPredecessors(nodes, resolution).get(NodeId.cell("o")));
    }

    @Test
    void testRegisterFeedbackIsNotALoop() {
        // counter bit: q -> NOT -> d, closed through a flop
        List<GraphNode> nodes = Arrays.asList(
                input("clk", 2),
                cell("ff", "DFF_P", Arrays.asList(2, 4), 3),
                cell("inv", "NOT", Collections.singletonList(3), 4),
                output("q", 3));
        GraphMetrics metrics = compute(nodes);
        Assertions.assertTrue(metrics.hasMaxDepth());
        Assertions.assertEquals(1, metrics.getMaxDepth());
    }

    @Test
    void testLatchFeedbackIsNotALoop() {
        // $adlatch and $sr canonicalize to "adlatch" and "sr"
        List<GraphNode> nodes = Arrays.asList(
                input("en", 2),
                cell("lat", GateTypes.canonicalize("$adlatch"), Arrays.asList(2, 4), 3),
                cell("inv", "NOT", Collections.singletonList(3), 4),
                cell("rs", GateTypes.canonicalize("$sr"), Arrays.asList(4, 6), 5),
                cell("buf", "BUF", Collections.singletonList(5), 6));
        GraphMetrics metrics = compute(nodes);
        Assertions.assertTrue(metrics.hasMaxDepth());
        Assertions.assertEquals(1, metrics.getMaxDepth());
    }

    @Test
    void testMetricsWithDifferentLoopsDiffer() {
        SortedMap<String, Integer> breakdown = new TreeMap<>(Map.of("NOT", 2));
        GraphMetrics loopA = new GraphMetrics(breakdown, 0, 1, 2,
                new CombinationalCycle(Arrays.asList(NodeId.cell("a"), NodeId.cell("b"))));
        GraphMetrics loopB = new GraphMetrics(breakdown, 0, 1, 2,
                new CombinationalCycle(Arrays.asList(NodeId.cell("c"), NodeId.cell("d"))));
        GraphMetrics loopA2 = new GraphMetrics(breakdown, 0, 1, 2,
                new CombinationalCycle(Arrays.asList(NodeId.cell("a"), NodeId.cell("b"))));
        Assertions.assertNotEquals(loopA, loopB);
        Assertions.assertEquals(loopA, loopA2);
        Assertions.assertEquals(loopA.hashCode(), loopA2.hashCode());
        Assertions.assertNotEquals(loopA, new GraphMetrics(breakdown, GraphMetrics.DEPTH_UNAVAILABLE, 1, 2, null));
    }

    @Test
    void testSelfLoop() {
        List<GraphNode> nodes = Arrays.asList(
                input("a", 2),
                cell("g", "AND", Arrays.asList(2, 3), 3));
        GraphMetricsEngine engine = new GraphMetricsEngine();
        NetResolver.Resolution resolution = new NetResolver().resolve(nodes);
        CombinationalLoopException e = Assertions.assertThrows(CombinationalLoopException.class,
                () -> engine.computeMaxDepth(nodes, resolution));
        Assertions.assertEquals(Collections.singletonList(NodeId.cell("g")), e.getCycle().getCycle());

        GraphMetrics metrics = engine.compute(nodes, resolution);
        Assertions.assertEquals(GraphMetrics.DEPTH_UNAVAILABLE, metrics.getMaxDepth());
        Assertions.assertEquals(e.getCycle(), metrics.getDepthError());
    }

    @Test
    void testFanoutCountsDistinctConsumers() {
        List<GraphNode> nodes = Arrays.asList(
                input("a", 2),
                cell("sq", "AND", Arrays.asList(2, 2), 3),
                cell("inv", "NOT", Collections.singletonList(9), 4));
        GraphMetricsEngine engine = new GraphMetricsEngine();
        NetResolver.Resolution resolution = new NetResolver().resolve(nodes);
        Map<NetKey, Integer> fanout = engine.computeFanout(resolution);
        Assertions.assertEquals(1, fanout.get(net(2)));
        // floating nets still count
        Assertions.assertEquals(1, fanout.get(net(9)));
        Assertions.assertEquals(1, engine.computeMaxFanout(resolution));
    }

    @Test
    void testGateBreakdown() {
        List<GraphNode> nodes = Arrays.asList(
                input("a", 2),
                cell("z1", "XOR", Collections.singletonList(2), 3),
                cell("a1", "AND", Collections.singletonList(2), 4),
                cell("z2", "XOR", Collections.singletonList(2), 5),
                output("y", 5));
        GraphMetrics metrics = compute(nodes);
        Assertions.assertEquals(Arrays.asList("AND", "XOR"), new ArrayList<>(metrics.getGateBreakdown().keySet()));
        Assertions.assertEquals(2, metrics.getGateCount("XOR"));
        Assertions.assertEquals(0, metrics.getGateCount("OR"));
        Assertions.assertEquals(3, metrics.getTotalGates());
        Assertions.assertEquals(3, metrics.getMaxFanout());
    }

    @Test
    void testEmptyMetrics() {
        Assertions.assertEquals(GraphMetrics.EMPTY, compute(Collections.emptyList()));
        Assertions.assertTrue(GraphMetrics.EMPTY.hasMaxDepth());
    }
}
