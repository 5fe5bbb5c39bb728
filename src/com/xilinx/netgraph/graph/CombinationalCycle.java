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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A loop through combinational (non-boundary) nodes. The maximum combinational
 * depth is undefined while one exists.
 */
public final class CombinationalCycle extends StructuralError {

    private final List<NodeId> cycle;

    /**
     * @param cycle Nodes along the loop, each driving the next; the last node
     *              drives the first.
     */
    public CombinationalCycle(List<NodeId> cycle) {
        this.cycle = Collections.unmodifiableList(new ArrayList<>(cycle));
    }

    @Override
    public Kind getKind() {
        return Kind.COMBINATIONAL_CYCLE;
    }

    public List<NodeId> getCycle() {
        return cycle;
    }

    @Override
    public String getMessage() {
        return "Combinational loop through " + cycle.size() + " node(s): "
                + cycle.stream().map(NodeId::toString).collect(Collectors.joining(" -> "))
                + " -> " + cycle.get(0);
    }

    @Override
    public int hashCode() {
        return cycle.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CombinationalCycle)) return false;
        return cycle.equals(((CombinationalCycle) obj).cycle);
    }
}
