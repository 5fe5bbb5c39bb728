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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A module of a Yosys JSON netlist: its ports, cells and named nets.
 */
public class YosysModule {

    public static final String TOP_ATTRIBUTE = "top";

    public static final String BLACKBOX_ATTRIBUTE = "blackbox";

    private final String name;

    private final Map<String, YosysPort> ports = new LinkedHashMap<>();

    private final Map<String, YosysCell> cells = new LinkedHashMap<>();

    private final Map<String, YosysNetName> netNames = new LinkedHashMap<>();

    private final Map<String, String> attributes = new LinkedHashMap<>();

    public YosysModule(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public YosysPort addPort(YosysPort port) {
        ports.put(port.getName(), port);
        return port;
    }

    public YosysCell addCell(YosysCell cell) {
        cells.put(cell.getName(), cell);
        return cell;
    }

    public YosysNetName addNetName(YosysNetName netName) {
        netNames.put(netName.getName(), netName);
        return netName;
    }

    public void addAttribute(String key, String value) {
        attributes.put(key, value);
    }

    public YosysPort getPort(String name) {
        return ports.get(name);
    }

    public YosysCell getCell(String name) {
        return cells.get(name);
    }

    public Collection<YosysPort> getPorts() {
        return Collections.unmodifiableCollection(ports.values());
    }

    public Collection<YosysCell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public Collection<YosysNetName> getNetNames() {
        return Collections.unmodifiableCollection(netNames.values());
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Yosys marks the design's top module with a "top" attribute whose value is a
     * 32-bit binary string (or a plain integer in older releases).
     * @return True if this module carries a non-zero top attribute.
     */
    public boolean isTop() {
        return isAttributeSet(TOP_ATTRIBUTE);
    }

    public boolean isBlackbox() {
        return isAttributeSet(BLACKBOX_ATTRIBUTE);
    }

    private boolean isAttributeSet(String key) {
        String value = attributes.get(key);
        if (value == null || value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '0') return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
