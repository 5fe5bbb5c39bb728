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
 * Thrown when a Yosys JSON document cannot be read into a {@link YosysNetlist}.
 */
public class YosysJSONParseException extends RuntimeException {

    private static final long serialVersionUID = 2417326591128093440L;

    private final String path;

    public YosysJSONParseException(String path, String message) {
        super("ERROR: " + (path == null ? "" : path + ": ") + message);
        this.path = path;
    }

    public YosysJSONParseException(String path, String message, Throwable cause) {
        super("ERROR: " + (path == null ? "" : path + ": ") + message, cause);
        this.path = path;
    }

    /**
     * @return Location in the document (e.g. "modules/top/cells/g1/type") where
     * reading failed, or null if the document itself is not valid JSON.
     */
    public String getPath() {
        return path;
    }
}
