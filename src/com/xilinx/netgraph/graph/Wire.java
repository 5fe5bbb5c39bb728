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
 * A directed edge from the node driving a net to one node consuming it. Both ends
 * carry the net's canonical name. A wire has no identity beyond its endpoints.
 */
public final class Wire {

    private final NodeId from;

    private final NodeId to;

    private final NetKey net;

    public Wire(NodeId from, NetKey net, NodeId to) {
        this.from = Objects.requireNonNull(from);
        this.net = Objects.requireNonNull(net);
        this.to = Objects.requireNonNull(to);
    }

    public NodeId getFrom() {
        return from;
    }

    public NodeId getTo() {
        return to;
    }

    public NetKey getNet() {
        return net;
    }

    public String getFromPort() {
        return net.getLabel();
    }

    public String getToPort() {
        return net.getLabel();
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, net, to);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Wire)) return false;
        Wire other = (Wire) obj;
        return from.equals(other.from) && net.equals(other.net) && to.equals(other.to);
    }

    @Override
    public String toString() {
        return from + " -(" + net + ")-> " + to;
    }
}
