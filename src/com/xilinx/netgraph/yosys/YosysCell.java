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

package com.xilinx.netgraph.yosys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A cell instance inside a Yosys module. Connections and pin directions are kept
 * in insertion order.
 */
public class YosysCell {

    private final String name;

    private final String type;

    private final Map<String, List<YosysBit>> connections = new LinkedHashMap<>();

    private final Map<String, YosysDirection> portDirections = new LinkedHashMap<>();

    private final Map<String, String> parameters = new LinkedHashMap<>();

    private final Map<String, String> attributes = new LinkedHashMap<>();

    public YosysCell(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The raw type string from the netlist, e.g. "$_AND_" or "LUT4".
     */
    public String getType() {
        return type;
    }

    public YosysCell addConnection(String pin, List<YosysBit> bits) {
        connections.put(pin, Collections.unmodifiableList(new ArrayList<>(bits)));
        return this;
    }

    public YosysCell setPortDirection(String pin, YosysDirection direction) {
        portDirections.put(pin, direction);
        return this;
    }

    public Map<String, List<YosysBit>> getConnections() {
        return Collections.unmodifiableMap(connections);
    }

    public Map<String, YosysDirection> getPortDirections() {
        return Collections.unmodifiableMap(portDirections);
    }

    /**
     * Gets the declared direction of a pin.
     * @param pin Name of the pin.
     * @return The declared direction or null if the cell does not declare one.
     */
    public YosysDirection getPortDirection(String pin) {
        return portDirections.get(pin);
    }

    public void addParameter(String key, String value) {
        parameters.put(key, value);
    }

    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public void addAttribute(String key, String value) {
        attributes.put(key, value);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return name + "(" + type + ")";
    }
}
