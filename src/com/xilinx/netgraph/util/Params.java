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

package com.xilinx.netgraph.util;

/**
 * Aims to be a centralized helper class to manage global NetGraph settings. Each
 * setting can be given as an environment variable or a JVM property of the same
 * name; the environment variable wins.
 */
public class Params {

    public static String NG_PARALLEL_NAME = "NG_PARALLEL";

    public static String NG_YOSYS_EXEC_NAME = "NG_YOSYS_EXEC";

    public static String NG_YOSYS_TIMEOUT_NAME = "NG_YOSYS_TIMEOUT";

    public static String NG_JSON_INDENT_NAME = "NG_JSON_INDENT";

    public static String NG_DEFAULT_YOSYS_EXEC = "yosys";

    public static int NG_DEFAULT_YOSYS_TIMEOUT = 300;

    public static int NG_DEFAULT_JSON_INDENT = 2;

    /**
     * Name or path of the Yosys executable used by
     * {@link com.xilinx.netgraph.yosys.YosysTools}.
     */
    public static String NG_YOSYS_EXEC = getParamOrDefaultSetting(NG_YOSYS_EXEC_NAME, NG_DEFAULT_YOSYS_EXEC);

    /**
     * Seconds a Yosys run may take before it is killed.
     */
    public static int NG_YOSYS_TIMEOUT = getParamOrDefaultIntSetting(NG_YOSYS_TIMEOUT_NAME,
            NG_DEFAULT_YOSYS_TIMEOUT);

    /**
     * Indentation used when writing JSON graphs.
     */
    public static int NG_JSON_INDENT = getParamOrDefaultIntSetting(NG_JSON_INDENT_NAME, NG_DEFAULT_JSON_INDENT);

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.length() == 0
               || value.equals("0")
               || value.equalsIgnoreCase("false")
               );
    }

    /**
     * Checks if a parameter was explicitly disabled, i.e. set to "0" or "false".
     *
     * @param key Name of the global NetGraph parameter
     * @return True if the parameter has a value that {@link #isSet(String)} rejects
     *         and is not simply missing.
     */
    public static boolean isParamDisabled(String key) {
        String value = getParamValue(key);
        return value != null && !isSet(value);
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String envValue = getParamValue(key);
        if (envValue != null) {
            try {
                return Integer.parseInt(envValue.trim());
            } catch (NumberFormatException e) {
                System.err.println("WARNING: Couldn't interpret the value '" + envValue
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    public static String getParamOrDefaultSetting(String key, String defaultValue) {
        String value = getParamValue(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }
}
