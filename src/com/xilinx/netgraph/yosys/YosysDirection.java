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

/**
 * Directions a Yosys port or cell pin may declare.
 */
public enum YosysDirection {
    INPUT,
    OUTPUT,
    INOUT;

    /**
     * Parses a direction string as written by Yosys ("input", "output", "inout").
     * @param s The direction string, case-insensitive.
     * @return The matching direction, or null if the string is null or not a
     * known direction.
     */
    public static YosysDirection getEnum(String s) {
        if (s == null) return null;
        s = s.toUpperCase();
        if (s.equals("BIDIR")) return INOUT;
        for (YosysDirection d : values()) {
            if (d.name().equals(s)) return d;
        }
        return null;
    }

    /**
     * Only an explicit OUTPUT declaration makes a pin a driver; everything else
     * (including an unknown or missing direction) is consumed as an input.
     * @param d The declared direction, possibly null.
     * @return True if the pin drives its nets.
     */
    public static boolean isDriver(YosysDirection d) {
        return d == OUTPUT;
    }

    public String toJSONString() {
        return name().toLowerCase();
    }
}
