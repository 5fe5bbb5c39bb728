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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestGateTypes {

    @ParameterizedTest
    @CsvSource({
            "$_AND_, AND",
            "$_DFF_P_, DFF_P",
            "$and, and",
            "$_SDFFE_PN0P_, SDFFE_PN0P",
            "LUT4, LUT4",
            "FDRE, FDRE",
            "$__MUX4_, MUX4",
            "$, $",
    })
    void testCanonicalize(String raw, String expected) {
        Assertions.assertEquals(expected, GateTypes.canonicalize(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"DFF_P", "DFFE_PP", "SDFF_PN0", "adff", "DLATCH_P", "SR_NN", "FDRE", "FDCE", "LDPE",
            "fdse", "adlatch", "dlatch", "DLATCHSR_PPP", "sr", "SR"})
    void testRegisters(String type) {
        Assertions.assertTrue(GateTypes.isRegister(type));
        Assertions.assertTrue(GateTypes.isBoundary(type));
    }

    @ParameterizedTest
    @ValueSource(strings = {"AND", "NOT", "MUX", "LUT6", "FDXE", "CARRY4", "SRL16E", "SRLC32E", "sub"})
    void testCombinational(String type) {
        Assertions.assertFalse(GateTypes.isRegister(type));
        Assertions.assertFalse(GateTypes.isBoundary(type));
    }

    @Test
    void testPorts() {
        Assertions.assertTrue(GateTypes.isPort(GateTypes.INPUT));
        Assertions.assertTrue(GateTypes.isBoundary(GateTypes.OUTPUT));
        Assertions.assertFalse(GateTypes.isPort("input"));
    }

    @Test
    void testNodeIdOrdering() {
        Assertions.assertTrue(NodeId.port("z", 0).compareTo(NodeId.cell("a")) < 0);
        Assertions.assertTrue(NodeId.port("a", 2).compareTo(NodeId.port("a", 10)) < 0);
        Assertions.assertEquals("port_data_3", NodeId.port("data", 3).toString());
        Assertions.assertEquals("cell_$abc$7", NodeId.cell("$abc$7").toString());
        Assertions.assertNotEquals(NodeId.port("a", 0), NodeId.cell("a"));
    }
}
