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
 * In-memory form of a Yosys JSON netlist document ({@code write_json}). Modules
 * are kept in insertion order.
 */
public class YosysNetlist {

    private String creator;

    private final Map<String, YosysModule> modules = new LinkedHashMap<>();

    public YosysNetlist() {
    }

    public YosysNetlist(String creator) {
        this.creator = creator;
    }

    /**
     * @return The "creator" string of the document (e.g. the Yosys version), or
     * null if absent.
     */
    public String getCreator() {
        return creator;
    }

    public YosysModule addModule(YosysModule module) {
        modules.put(module.getName(), module);
        return module;
    }

    public YosysModule getModule(String name) {
        return modules.get(name);
    }

    public Collection<YosysModule> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    /**
     * Picks the module to analyze. A module carrying the "top" attribute wins;
     * otherwise the first module of the document is used. The netlist is
     * expected to be flattened, so any further modules are ignored.
     * @return The top module, or null if the document has no modules.
     */
    public YosysModule getTopModule() {
        for (YosysModule module : modules.values()) {
            if (module.isTop()) return module;
        }
        return modules.isEmpty() ? null : modules.values().iterator().next();
    }
}
