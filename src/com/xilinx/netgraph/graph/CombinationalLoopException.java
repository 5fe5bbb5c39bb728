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

/**
 * Thrown by {@link GraphMetricsEngine#computeMaxDepth} when the combinational
 * part of the graph contains a loop.
 */
public class CombinationalLoopException extends RuntimeException {

    private static final long serialVersionUID = -6381407217713652781L;

    private final CombinationalCycle cycle;

    public CombinationalLoopException(CombinationalCycle cycle) {
        super("ERROR: " + cycle.getMessage());
        this.cycle = cycle;
    }

    public CombinationalCycle getCycle() {
        return cycle;
    }
}
