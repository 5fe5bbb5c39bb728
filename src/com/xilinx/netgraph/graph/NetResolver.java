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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Works out, for every net of a node list, which node drives it and which nodes
 * consume it, and derives the wire set from that.
 *
 * All candidate drivers of a net are gathered before one is picked. When there is
 * more than one, a {@link DriverConflict} is recorded and the smallest
 * {@link NodeId} is kept as the driver. Nets nobody drives (floating inputs) and
 * nets nobody consumes (dead outputs) are legal and produce no wires.
 *
 * A resolver holds no state; every call builds its own maps.
 */
public class NetResolver {

    /**
     * Driver and consumer maps for one node list, plus the wires derived from them.
     */
    public static final class Resolution {

        private final SortedMap<NetKey, NodeId> drivers;

        private final SortedMap<NetKey, List<NodeId>> consumers;

        private final List<DriverConflict> conflicts;

        private final List<Wire> wires;

        private Resolution(SortedMap<NetKey, NodeId> drivers, SortedMap<NetKey, List<NodeId>> consumers,
                           List<DriverConflict> conflicts, List<Wire> wires) {
            this.drivers = Collections.unmodifiableSortedMap(drivers);
            this.consumers = Collections.unmodifiableSortedMap(consumers);
            this.conflicts = Collections.unmodifiableList(conflicts);
            this.wires = Collections.unmodifiableList(wires);
        }

        /**
         * @return Net to driving node, for every net that has a driver.
         */
        public SortedMap<NetKey, NodeId> getDrivers() {
            return drivers;
        }

        public NodeId getDriver(NetKey net) {
            return drivers.get(net);
        }

        /**
         * @return Net to its distinct consumers in node order, for every net with
         * at least one consumer.
         */
        public SortedMap<NetKey, List<NodeId>> getConsumers() {
            return consumers;
        }

        public List<NodeId> getConsumers(NetKey net) {
            List<NodeId> list = consumers.get(net);
            return list == null ? Collections.emptyList() : list;
        }

        public List<DriverConflict> getConflicts() {
            return conflicts;
        }

        public List<Wire> getWires() {
            return wires;
        }

        /**
         * @return Every net that is driven or consumed, in bit order.
         */
        public Set<NetKey> getNets() {
            Set<NetKey> nets = new TreeSet<>(drivers.keySet());
            nets.addAll(consumers.keySet());
            return nets;
        }

        /**
         * @return Nets that are consumed but have no driver.
         */
        public List<NetKey> getFloatingNets() {
            List<NetKey> floating = new ArrayList<>();
            for (NetKey net : consumers.keySet()) {
                if (!drivers.containsKey(net)) {
                    floating.add(net);
                }
            }
            return floating;
        }
    }

    public Resolution resolve(List<GraphNode> nodes) {
        SortedMap<NetKey, Set<NodeId>> candidates = new TreeMap<>();
        SortedMap<NetKey, List<NodeId>> consumers = new TreeMap<>();
        for (GraphNode node : nodes) {
            for (NetKey net : node.getOutputs()) {
                candidates.computeIfAbsent(net, k -> new LinkedHashSet<>()).add(node.getId());
            }
            Set<NetKey> seen = new HashSet<>();
            for (NetKey net : node.getInputs()) {
                if (seen.add(net)) {
                    consumers.computeIfAbsent(net, k -> new ArrayList<>()).add(node.getId());
                }
            }
        }

        SortedMap<NetKey, NodeId> drivers = new TreeMap<>();
        List<DriverConflict> conflicts = new ArrayList<>();
        for (Map.Entry<NetKey, Set<NodeId>> e : candidates.entrySet()) {
            Set<NodeId> netDrivers = e.getValue();
            if (netDrivers.size() == 1) {
                drivers.put(e.getKey(), netDrivers.iterator().next());
            } else {
                DriverConflict conflict = new DriverConflict(e.getKey(), new ArrayList<>(netDrivers));
                conflicts.add(conflict);
                drivers.put(e.getKey(), conflict.getChosenDriver());
            }
        }

        List<Wire> wires = new ArrayList<>();
        for (GraphNode node : nodes) {
            Set<NetKey> seen = new HashSet<>();
            for (NetKey net : node.getInputs()) {
                if (!seen.add(net)) continue;
                NodeId driver = drivers.get(net);
                if (driver != null) {
                    wires.add(new Wire(driver, net, node.getId()));
                }
            }
        }
        return new Resolution(drivers, consumers, conflicts, wires);
    }
}
