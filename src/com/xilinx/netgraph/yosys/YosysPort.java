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
 * A top-level port of a Yosys module. Bit 0 of {@link #getBits()} is the least
 * significant bit of the port.
 */
public class YosysPort {

    private final String name;

    private final YosysDirection direction;

    private final List<YosysBit> bits;

    public YosysPort(String name, YosysDirection direction, List<YosysBit> bits) {
        this.name = name;
        this.direction = direction;
        this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
    }

    public String getName() {
        return name;
    }

    public YosysDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction == YosysDirection.INPUT;
    }

    public List<YosysBit> getBits() {
        return bits;
    }

    public int getWidth() {
        return bits.size();
    }

    public boolean isBus() {
        return bits.size() > 1;
    }

    /**
     * Gets the display name of one bit of this port: the plain port name for a
     * single-bit port, otherwise the bus-indexed name (e.g. "data[3]").
     * @param i Bit position within the port.
     * @return The bit's name.
     */
    public String getBitName(int i) {
        return isBus() ? name + "[" + i + "]" : name;
    }

    @Override
    public String toString() {
        return direction + " " + name + bits;
    }
}
