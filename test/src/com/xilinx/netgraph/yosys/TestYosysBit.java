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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestYosysBit {

    @ParameterizedTest
    @CsvSource({"0, 0", "1, 1", "x, x", "X, x", "z, z", "Z, z"})
    void testConstants(String literal, String expected) {
        YosysBit bit = YosysBit.constant(literal);
        Assertions.assertNotNull(bit);
        Assertions.assertTrue(bit.isConstant());
        Assertions.assertEquals(expected, bit.getConstant());
        Assertions.assertEquals(YosysBit.NO_INDEX, bit.getIndex());
    }

    @Test
    void testNonConstantLiterals() {
        Assertions.assertNull(YosysBit.constant("2"));
        Assertions.assertNull(YosysBit.constant("01"));
        Assertions.assertNull(YosysBit.constant(""));
        Assertions.assertNull(YosysBit.constant(null));
    }

    @Test
    void testSignalBits() {
        YosysBit bit = YosysBit.of(42);
        Assertions.assertFalse(bit.isConstant());
        Assertions.assertEquals(42, bit.getIndex());
        Assertions.assertNull(bit.getConstant());
        Assertions.assertEquals(YosysBit.of(42), bit);
        Assertions.assertNotEquals(YosysBit.of(0), YosysBit.CONST_0);
        Assertions.assertThrows(IllegalArgumentException.class, () -> YosysBit.of(-1));
    }

    @Test
    void testDirections() {
        Assertions.assertEquals(YosysDirection.INPUT, YosysDirection.getEnum("input"));
        Assertions.assertEquals(YosysDirection.OUTPUT, YosysDirection.getEnum("OUTPUT"));
        Assertions.assertEquals(YosysDirection.INOUT, YosysDirection.getEnum("inout"));
        Assertions.assertNull(YosysDirection.getEnum("sideways"));
        Assertions.assertNull(YosysDirection.getEnum(null));

        Assertions.assertTrue(YosysDirection.isDriver(YosysDirection.OUTPUT));
        Assertions.assertFalse(YosysDirection.isDriver(YosysDirection.INOUT));
        Assertions.assertFalse(YosysDirection.isDriver(null));
    }
}
