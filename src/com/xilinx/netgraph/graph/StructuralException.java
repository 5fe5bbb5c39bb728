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

/**
 * Thrown by {@link NetlistGraph#checkStructure()} when a graph carries structural
 * errors.
 */
public class StructuralException extends RuntimeException {

    private static final long serialVersionUID = 4476019250845418211L;

    private final List<StructuralError> errors;

    public StructuralException(List<StructuralError> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    private static String buildMessage(List<StructuralError> errors) {
        StringBuilder sb = new StringBuilder("ERROR: Netlist graph has " + errors.size() + " structural error(s)");
        for (StructuralError error : errors) {
            sb.append("\n  ").append(error);
        }
        return sb.toString();
    }

    public List<StructuralError> getErrors() {
        return errors;
    }
}
