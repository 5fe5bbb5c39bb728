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
 * Structured identifier of a graph node: where the node came from (a port bit or
 * a cell) plus its name and, for ports, the bit position. Ordering is PORT before
 * CELL, then name, then bit.
 */
public final class NodeId implements Comparable<NodeId> {

    public enum Category {
        PORT("port_"),
        CELL("cell_");

        private final String prefix;

        Category(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    public static final int NO_BIT = -1;

    private final Category category;

    private final String name;

    private final int bit;

    private NodeId(Category category, String name, int bit) {
        this.category = category;
        this.name = Objects.requireNonNull(name);
        this.bit = bit;
    }

    public static NodeId port(String portName, int bit) {
        if (bit < 0) {
            throw new IllegalArgumentException("ERROR: Negative port bit " + bit + " on " + portName);
        }
        return new NodeId(Category.PORT, portName, bit);
    }

    public static NodeId cell(String cellName) {
        return new NodeId(Category.CELL, cellName, NO_BIT);
    }

    public Category getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public int getBit() {
        return bit;
    }

    @Override
    public int compareTo(NodeId o) {
        int cmp = category.compareTo(o.category);
        if (cmp != 0) return cmp;
        cmp = name.compareTo(o.name);
        if (cmp != 0) return cmp;
        return Integer.compare(bit, o.bit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name, bit);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeId)) return false;
        NodeId other = (NodeId) obj;
        return category == other.category && bit == other.bit && name.equals(other.name);
    }

    /**
     * @return The rendered id, "port_&lt;name&gt;_&lt;bit&gt;" or "cell_&lt;name&gt;".
     */
    @Override
    public String toString() {
        if (category == Category.PORT) {
            return category.getPrefix() + name + "_" + bit;
        }
        return category.getPrefix() + name;
    }
}
