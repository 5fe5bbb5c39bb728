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
 * Two or more nodes drive the same net. The resolver keeps the smallest
 * {@link NodeId} as the net's driver so that the outcome does not depend on the
 * order the netlist listed its ports and cells.
 */
public final class DriverConflict extends StructuralError {

    private final NetKey net;

    private final List<NodeId> drivers;

    /**
     * @param net The multiply-driven net.
     * @param drivers All nodes driving the net; at least two.
     */
    public DriverConflict(NetKey net, List<NodeId> drivers) {
        if (drivers.size() < 2) {
            throw new IllegalArgumentException("ERROR: A driver conflict on " + net + " needs at least two drivers");
        }
        List<NodeId> sorted = new ArrayList<>(drivers);
        Collections.sort(sorted);
        this.net = net;
        this.drivers = Collections.unmodifiableList(sorted);
    }

    @Override
    public Kind getKind() {
        return Kind.DRIVER_CONFLICT;
    }

    public NetKey getNet() {
        return net;
    }

    /**
     * @return The conflicting drivers in ascending id order.
     */
    public List<NodeId> getDrivers() {
        return drivers;
    }

    /**
     * @return The driver kept for wire construction.
     */
    public NodeId getChosenDriver() {
        return drivers.get(0);
    }

    @Override
    public String getMessage() {
        return "Net " + net + " has " + drivers.size() + " drivers ("
                + drivers.stream().map(NodeId::toString).collect(Collectors.joining(", "))
                + "), using " + getChosenDriver();
    }

    @Override
    public int hashCode() {
        return 31 * net.hashCode() + drivers.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DriverConflict)) return false;
        DriverConflict other = (DriverConflict) obj;
        return net.equals(other.net) && drivers.equals(other.drivers);
    }
}
