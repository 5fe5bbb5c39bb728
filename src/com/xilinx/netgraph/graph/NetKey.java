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

import java.util.Objects;

/**
 * Identifies a single-bit net of the graph: the Yosys bit index it came from plus
 * the canonical label assigned by the {@link BitRegistry}.
 */
public final class NetKey implements Comparable<NetKey> {

    private final int bit;

    private final String label;

    public NetKey(int bit, String label) {
        this.bit = bit;
        this.label = Objects.requireNonNull(label);
    }

    public int getBit() {
        return bit;
    }

    /**
     * @return The canonical net name, e.g. "a", "data[3]" or "n42".
     */
    public String getLabel() {
        return label;
    }

    @Override
    public int compareTo(NetKey o) {
        int cmp = Integer.compare(bit, o.bit);
        return cmp != 0 ? cmp : label.compareTo(o.label);
    }

    @Override
    public int hashCode() {
        return 31 * bit + label.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NetKey)) return false;
        NetKey other = (NetKey) obj;
        return bit == other.bit && label.equals(other.label);
    }

    @Override
    public String toString() {
        return label;
    }
}
