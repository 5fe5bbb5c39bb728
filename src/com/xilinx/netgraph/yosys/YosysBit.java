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
 * One entry of a Yosys "bits" vector. Yosys numbers every signal bit of a module
 * with a small integer; the strings "0", "1", "x" and "z" stand for constant
 * drivers and are not signal bits.
 */
public final class YosysBit {

    /** Index value used by constant bits */
    public static final int NO_INDEX = -1;

    public static final YosysBit CONST_0 = new YosysBit(NO_INDEX, '0');
    public static final YosysBit CONST_1 = new YosysBit(NO_INDEX, '1');
    public static final YosysBit CONST_X = new YosysBit(NO_INDEX, 'x');
    public static final YosysBit CONST_Z = new YosysBit(NO_INDEX, 'z');

    private final int index;

    private final char constant;

    private YosysBit(int index, char constant) {
        this.index = index;
        this.constant = constant;
    }

    /**
     * Gets the bit for a Yosys signal index.
     * @param index Non-negative bit index.
     * @return The bit.
     */
    public static YosysBit of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("ERROR: Negative bit index " + index);
        }
        return new YosysBit(index, '\0');
    }

    /**
     * Gets the constant bit for one of the Yosys constant literals.
     * @param literal One of "0", "1", "x" or "z" (case-insensitive).
     * @return The constant bit, or null if the literal is not a constant.
     */
    public static YosysBit constant(String literal) {
        if (literal == null || literal.length() != 1) return null;
        switch (Character.toLowerCase(literal.charAt(0))) {
            case '0': return CONST_0;
            case '1': return CONST_1;
            case 'x': return CONST_X;
            case 'z': return CONST_Z;
            default: return null;
        }
    }

    public boolean isConstant() {
        return index == NO_INDEX;
    }

    /**
     * @return The signal index, or {@link #NO_INDEX} for constants.
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return The constant literal ("0", "1", "x", "z"), or null for signal bits.
     */
    public String getConstant() {
        return isConstant() ? String.valueOf(constant) : null;
    }

    @Override
    public int hashCode() {
        return isConstant() ? -constant : index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof YosysBit)) return false;
        YosysBit other = (YosysBit) obj;
        return index == other.index && constant == other.constant;
    }

    @Override
    public String toString() {
        return isConstant() ? getConstant() : Integer.toString(index);
    }
}
