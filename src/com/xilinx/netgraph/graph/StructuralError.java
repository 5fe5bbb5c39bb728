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
 * A structural problem found while building or analyzing one netlist graph. Errors
 * are reported as part of the {@link NetlistGraph} they belong to rather than
 * thrown, so the rest of the result stays available.
 */
public abstract class StructuralError {

    public enum Kind {
        DRIVER_CONFLICT("DriverConflict"),
        COMBINATIONAL_CYCLE("CyclicCombinationalDependency");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        /**
         * @return The name used for this kind in JSON output.
         */
        public String getLabel() {
            return label;
        }
    }

    public abstract Kind getKind();

    /**
     * @return A one-line human-readable description.
     */
    public abstract String getMessage();

    @Override
    public String toString() {
        return getKind().getLabel() + ": " + getMessage();
    }
}
