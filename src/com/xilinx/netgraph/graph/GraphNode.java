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
 * A vertex of the netlist graph: either a port terminal (type
 * {@link GateTypes#INPUT} or {@link GateTypes#OUTPUT}) or a logic cell whose type
 * is the canonical gate label. Immutable.
 */
public final class GraphNode {

    public static final String PROP_NAME = "name";
    public static final String PROP_TYPE = "type";
    public static final String PROP_DIRECTION = "direction";
    public static final String PROP_CONSTANT = "constant";

    private final NodeId id;

    private final String type;

    private final List<NetKey> inputs;

    private final List<NetKey> outputs;

    private final Map<String, String> properties;

    public GraphNode(NodeId id, String type, List<NetKey> inputs, List<NetKey> outputs,
                     Map<String, String> properties) {
        this.id = id;
        this.type = type;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public NodeId getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /**
     * @return Nets consumed by this node, in pin order. Nets without a driver are
     * kept here even though no wire reaches them.
     */
    public List<NetKey> getInputs() {
        return inputs;
    }

    public List<NetKey> getOutputs() {
        return outputs;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    /**
     * @return The display name: the cell name, or the (bus-indexed) port name.
     */
    public String getName() {
        return properties.get(PROP_NAME);
    }

    public boolean isPort() {
        return GateTypes.isPort(type);
    }

    public boolean isGate() {
        return !isPort();
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GraphNode)) return false;
        GraphNode other = (GraphNode) obj;
        return id.equals(other.id) && type.equals(other.type) && inputs.equals(other.inputs)
                && outputs.equals(other.outputs) && properties.equals(other.properties);
    }

    @Override
    public String toString() {
        return id + "(" + type + ")";
    }
}
