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

import com.xilinx.netgraph.support.NetlistTestData;
import com.xilinx.netgraph.yosys.YosysBit;
import com.xilinx.netgraph.yosys.YosysModule;
import com.xilinx.netgraph.yosys.YosysNetName;

public class TestBitRegistry {

    @Test
    void testNamingPrecedence() {
        YosysModule module = new YosysModule("m");
        module.addPort(NetlistTestData.input("in", 2, 3));
        module.addNetName(new YosysNetName("alias", false, NetlistTestData.bits(2)));
        module.addNetName(new YosysNetName("$auto$hidden", true, NetlistTestData.bits(4)));
        module.addNetName(new YosysNetName("visible", false, NetlistTestData.bits(4, 5)));
        module.addNetName(new YosysNetName("$auto$only", true, NetlistTestData.bits(6)));

        BitRegistry registry = BitRegistry.create(module);
        Assertions.assertEquals("in[0]", registry.getLabel(2));
        Assertions.assertEquals("in[1]", registry.getLabel(3));
        Assertions.assertEquals("visible[0]", registry.getLabel(4));
        Assertions.assertEquals("visible[1]", registry.getLabel(5));
        Assertions.assertEquals("$auto$only", registry.getLabel(6));
        Assertions.assertEquals("n7", registry.getLabel(7));
        Assertions.assertTrue(registry.isNamed(6));
        Assertions.assertFalse(registry.isNamed(7));
        Assertions.assertEquals(5, registry.getNamedBitCount());
    }

    @Test
    void testSortedNameOrderWins() {
        YosysModule module = new YosysModule("m");
        module.addNetName(new YosysNetName("zz", false, NetlistTestData.bits(9)));
        module.addNetName(new YosysNetName("aa", false, NetlistTestData.bits(9)));
        Assertions.assertEquals("aa", BitRegistry.create(module).getLabel(9));
    }

    @Test
    void testConstantsAreNotNets() {
        BitRegistry registry = new BitRegistry();
        registry.claim("tied", NetlistTestData.bits("0", 8, "x"));
        Assertions.assertNull(registry.getNet(YosysBit.CONST_0));
        Assertions.assertNull(registry.getNet(YosysBit.CONST_Z));
        Assertions.assertEquals(new NetKey(8, "tied[1]"), registry.getNet(YosysBit.of(8)));
        Assertions.assertSame(registry.getNet(YosysBit.of(8)), registry.getNet(YosysBit.of(8)));
        Assertions.assertEquals(1, registry.getNamedBitCount());
    }

    @Test
    void testFallbackLabelAvoidsClaimedName() {
        YosysModule module = new YosysModule("m");
        module.addPort(NetlistTestData.input("n5", 9));
        BitRegistry registry = BitRegistry.create(module);
        Assertions.assertEquals("n5", registry.getLabel(9));
        Assertions.assertEquals("n5_1", registry.getLabel(5));
        Assertions.assertEquals("n5_1", registry.getNet(YosysBit.of(5)).getLabel());
        Assertions.assertFalse(registry.isNamed(5));
    }

    @Test
    void testClaimedNamesAreUnique() {
        YosysModule module = new YosysModule("m");
        module.addPort(NetlistTestData.input("a", 2, 3));
        module.addNetName(new YosysNetName("a[0]", false, NetlistTestData.bits(7)));

        BitRegistry registry = new BitRegistry();
        registry.claim("b", NetlistTestData.bits(8));
        registry.claim("b_1", NetlistTestData.bits(10));
        registry.claim("b", NetlistTestData.bits(11));
        Assertions.assertEquals("b_2", registry.getLabel(11));

        registry = BitRegistry.create(module);
        Assertions.assertEquals("a[0]", registry.getLabel(2));
        Assertions.assertEquals("a[0]_1", registry.getLabel(7));
    }
}
