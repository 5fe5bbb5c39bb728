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

import java.util.regex.Pattern;

/**
 * Helpers for node type labels: canonicalizing Yosys cell type strings and
 * classifying port and register types.
 */
public class GateTypes {

    public static final String INPUT = "INPUT";

    public static final String OUTPUT = "OUTPUT";

    /** Xilinx flop and latch primitives (FDRE, FDSE, FDCE, FDPE, LDCE, LDPE) */
    private static final Pattern XILINX_REGISTER = Pattern.compile("^(FD|LD)[CPRS]E$");

    private GateTypes() {
    }

    /**
     * Strips the Yosys internal-cell decoration from a raw cell type: leading '$'
     * and '_' characters and trailing '_' padding. For example "$_AND_" becomes
     * "AND", "$_DFF_P_" becomes "DFF_P" and "$and" becomes "and". Library cell
     * names such as "LUT4" are returned unchanged.
     * @param rawType The cell type string from the netlist.
     * @return The canonical type label, or the raw string if stripping would leave
     * nothing.
     */
    public static String canonicalize(String rawType) {
        int start = 0;
        int end = rawType.length();
        while (start < end && (rawType.charAt(start) == '$' || rawType.charAt(start) == '_')) {
            start++;
        }
        while (end > start && rawType.charAt(end - 1) == '_') {
            end--;
        }
        if (start == end) return rawType;
        return rawType.substring(start, end);
    }

    public static boolean isPort(String type) {
        return INPUT.equals(type) || OUTPUT.equals(type);
    }

    /**
     * Checks if a canonical type label names a state element (flip-flop or latch).
     * Matches "FF" or "DLATCH" anywhere in the label (DFF, DFFE_PP, SDFF_PN0,
     * adff, DLATCH_P, adlatch), Yosys set/reset cells (sr, SR_NN) and the Xilinx
     * FD?E/LD?E primitives. Case-insensitive.
     * @param type Canonical type label.
     * @return True if the type is a register.
     */
    public static boolean isRegister(String type) {
        String upper = type.toUpperCase();
        return upper.contains("FF")
                || upper.contains("DLATCH")
                || upper.equals("SR")
                || upper.startsWith("SR_")
                || XILINX_REGISTER.matcher(upper).matches();
    }

    /**
     * Boundary nodes start and end combinational paths and are never counted as a
     * hop of one.
     * @param type Node type label.
     * @return True for INPUT, OUTPUT and register types.
     */
    public static boolean isBoundary(String type) {
        return isPort(type) || isRegister(type);
    }
}
