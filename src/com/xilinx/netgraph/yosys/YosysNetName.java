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
import java.util.List;

/**
 * An entry of a module's "netnames" section: a named wire (possibly a bus) and
 * the signal bits it covers. Yosys marks auto-generated names (e.g.
 * "$abc$123$new_n7") as hidden.
 */
public class YosysNetName {

    private final String name;

    private final boolean hidden;

    private final List<YosysBit> bits;

    public YosysNetName(String name, boolean hidden, List<YosysBit> bits) {
        this.name = name;
        this.hidden = hidden;
        this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
    }

    public String getName() {
        return name;
    }

    public boolean isHidden() {
        return hidden;
    }

    public List<YosysBit> getBits() {
        return bits;
    }

    @Override
    public String toString() {
        return name + bits;
    }
}
