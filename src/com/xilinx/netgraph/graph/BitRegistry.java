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
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.netgraph.yosys.YosysBit;
import com.xilinx.netgraph.yosys.YosysModule;
import com.xilinx.netgraph.yosys.YosysNetName;
import com.xilinx.netgraph.yosys.YosysPort;

/**
 * Maps Yosys bit indices of one module to canonical net labels. A bus of width N
 * names bit i "name" if N == 1 and "name[i]" otherwise. Port names take
 * precedence over visible netnames, which take precedence over hidden ones; the
 * first claim on a bit wins and each group is visited in sorted-name order. A
 * bit nobody names is labeled "n&lt;bit&gt;". Constant bits are never nets.
 *
 * Labels are unique within a registry. A name already taken by another bit gets
 * the first free "_&lt;k&gt;" suffix (k = 1, 2, ...), so a port called "n5" and the
 * unnamed bit 5 come out as "n5" and "n5_1".
 */
public class BitRegistry {

    public static final String UNNAMED_NET_PREFIX = "n";

    private final Map<Integer, String> labels = new HashMap<>();

    private final Map<Integer, String> fallbackLabels = new HashMap<>();

    private final Set<String> usedLabels = new HashSet<>();

    private final Map<Integer, NetKey> nets = new HashMap<>();

    public BitRegistry() {
    }

    /**
     * Creates the registry for a module from its ports and netnames.
     * @param module The module whose bits should be named.
     * @return A new registry owned by the caller.
     */
    public static BitRegistry create(YosysModule module) {
        BitRegistry registry = new BitRegistry();
        List<YosysPort> ports = new ArrayList<>(module.getPorts());
        ports.sort(Comparator.comparing(YosysPort::getName));
        for (YosysPort port : ports) {
            registry.claim(port.getName(), port.getBits());
        }

        List<YosysNetName> netNames = new ArrayList<>(module.getNetNames());
        netNames.sort(Comparator.comparing(YosysNetName::getName));
        for (YosysNetName netName : netNames) {
            if (!netName.isHidden()) {
                registry.claim(netName.getName(), netName.getBits());
            }
        }
        for (YosysNetName netName : netNames) {
            if (netName.isHidden()) {
                registry.claim(netName.getName(), netName.getBits());
            }
        }
        return registry;
    }

    /**
     * Names the bits of a bus, skipping constants and bits that are already named.
     * All claims must happen before nets are resolved through {@link #getNet(YosysBit)}.
     * @param busName Name of the port or wire.
     * @param bits Bits of the bus, least significant first.
     */
    public void claim(String busName, List<YosysBit> bits) {
        boolean isBus = bits.size() > 1;
        for (int i = 0; i < bits.size(); i++) {
            YosysBit bit = bits.get(i);
            if (bit.isConstant() || isNamed(bit.getIndex())) continue;
            String label = makeUnique(isBus ? busName + "[" + i + "]" : busName);
            labels.put(bit.getIndex(), label);
            usedLabels.add(label);
        }
    }

    /**
     * Gets the canonical label of a bit index.
     * @param bit Yosys bit index.
     * @return The claimed name, or "n&lt;bit&gt;" (made unique) if the bit was
     * never named.
     */
    public String getLabel(int bit) {
        String label = labels.get(bit);
        if (label != null) return label;
        return fallbackLabels.computeIfAbsent(bit, b -> {
            String fallback = makeUnique(UNNAMED_NET_PREFIX + b);
            usedLabels.add(fallback);
            return fallback;
        });
    }

    private String makeUnique(String name) {
        if (!usedLabels.contains(name)) return name;
        int k = 1;
        while (usedLabels.contains(name + "_" + k)) {
            k++;
        }
        return name + "_" + k;
    }

    /**
     * Resolves a bit to its net.
     * @param bit A bit from a port or cell connection.
     * @return The net, or null if the bit is a constant literal.
     */
    public NetKey getNet(YosysBit bit) {
        if (bit.isConstant()) return null;
        return nets.computeIfAbsent(bit.getIndex(), b -> new NetKey(b, getLabel(b)));
    }

    public boolean isNamed(int bit) {
        return labels.containsKey(bit);
    }

    /**
     * @return Number of bits that were given a name.
     */
    public int getNamedBitCount() {
        return labels.size();
    }
}
