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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Reads the JSON netlist written by Yosys' {@code write_json} command into a
 * {@link YosysNetlist}.
 *
 * org.json does not preserve the key order of JSON objects, so modules, ports,
 * cells, pins and netnames are inserted in sorted-name order. Reading the same
 * text twice always produces the same document.
 */
public class YosysJSONReader {

    public static final String MODULES = "modules";
    public static final String CREATOR = "creator";
    public static final String PORTS = "ports";
    public static final String CELLS = "cells";
    public static final String NETNAMES = "netnames";
    public static final String ATTRIBUTES = "attributes";
    public static final String PARAMETERS = "parameters";
    public static final String DIRECTION = "direction";
    public static final String BITS = "bits";
    public static final String TYPE = "type";
    public static final String CONNECTIONS = "connections";
    public static final String PORT_DIRECTIONS = "port_directions";
    public static final String HIDE_NAME = "hide_name";

    private YosysJSONReader() {
    }

    /**
     * Reads a Yosys JSON netlist file.
     * @param jsonFile Path to the JSON file.
     * @return The parsed netlist.
     */
    public static YosysNetlist readJSONFile(Path jsonFile) {
        try (Reader reader = Files.newBufferedReader(jsonFile, StandardCharsets.UTF_8)) {
            return readJSON(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static YosysNetlist readJSONFile(String jsonFileName) {
        return readJSONFile(Path.of(jsonFileName));
    }

    public static YosysNetlist readJSON(Reader reader) {
        JSONObject root;
        try {
            Object value = new JSONTokener(reader).nextValue();
            if (!(value instanceof JSONObject)) {
                throw new YosysJSONParseException(null, "Document is not a JSON object");
            }
            root = (JSONObject) value;
        } catch (JSONException e) {
            throw new YosysJSONParseException(null, "Invalid JSON: " + e.getMessage(), e);
        }
        return readJSON(root);
    }

    public static YosysNetlist readJSON(String jsonText) {
        JSONObject root;
        try {
            root = new JSONObject(jsonText);
        } catch (JSONException e) {
            throw new YosysJSONParseException(null, "Invalid JSON: " + e.getMessage(), e);
        }
        return readJSON(root);
    }

    /**
     * Converts an already parsed JSON document.
     * @param root The document object.
     * @return The netlist; a document without a "modules" section yields an empty
     * netlist.
     */
    public static YosysNetlist readJSON(JSONObject root) {
        YosysNetlist netlist = new YosysNetlist(root.optString(CREATOR, null));
        JSONObject modules = optObject(root, MODULES, MODULES);
        if (modules == null) {
            return netlist;
        }
        for (String moduleName : new TreeSet<>(modules.keySet())) {
            String path = MODULES + "/" + moduleName;
            netlist.addModule(readModule(moduleName, getObject(modules, moduleName, path), path));
        }
        return netlist;
    }

    private static YosysModule readModule(String moduleName, JSONObject jsonModule, String path) {
        YosysModule module = new YosysModule(moduleName);

        JSONObject attributes = optObject(jsonModule, ATTRIBUTES, path + "/" + ATTRIBUTES);
        if (attributes != null) {
            for (String key : new TreeSet<>(attributes.keySet())) {
                module.addAttribute(key, stringValue(attributes.get(key)));
            }
        }

        JSONObject ports = optObject(jsonModule, PORTS, path + "/" + PORTS);
        if (ports != null) {
            for (String portName : new TreeSet<>(ports.keySet())) {
                String portPath = path + "/" + PORTS + "/" + portName;
                JSONObject jsonPort = getObject(ports, portName, portPath);
                if (!jsonPort.has(DIRECTION)) {
                    throw new YosysJSONParseException(portPath, "Port has no direction");
                }
                String dirString = jsonPort.optString(DIRECTION);
                YosysDirection dir = YosysDirection.getEnum(dirString);
                if (dir == null) {
                    throw new YosysJSONParseException(portPath, "Unknown port direction '" + dirString + "'");
                }
                List<YosysBit> bits = readBits(jsonPort, portPath);
                module.addPort(new YosysPort(portName, dir, bits));
            }
        }

        JSONObject cells = optObject(jsonModule, CELLS, path + "/" + CELLS);
        if (cells != null) {
            for (String cellName : new TreeSet<>(cells.keySet())) {
                String cellPath = path + "/" + CELLS + "/" + cellName;
                module.addCell(readCell(cellName, getObject(cells, cellName, cellPath), cellPath));
            }
        }

        JSONObject netNames = optObject(jsonModule, NETNAMES, path + "/" + NETNAMES);
        if (netNames != null) {
            for (String netName : new TreeSet<>(netNames.keySet())) {
                String netPath = path + "/" + NETNAMES + "/" + netName;
                JSONObject jsonNet = getObject(netNames, netName, netPath);
                boolean hidden = jsonNet.optInt(HIDE_NAME, 0) != 0;
                module.addNetName(new YosysNetName(netName, hidden, readBits(jsonNet, netPath)));
            }
        }
        return module;
    }

    private static YosysCell readCell(String cellName, JSONObject jsonCell, String path) {
        Object type = jsonCell.opt(TYPE);
        if (!(type instanceof String)) {
            throw new YosysJSONParseException(path, "Cell has no type");
        }
        YosysCell cell = new YosysCell(cellName, (String) type);

        JSONObject dirs = optObject(jsonCell, PORT_DIRECTIONS, path + "/" + PORT_DIRECTIONS);
        if (dirs != null) {
            for (String pin : new TreeSet<>(dirs.keySet())) {
                String dirString = stringValue(dirs.get(pin));
                YosysDirection dir = YosysDirection.getEnum(dirString);
                if (dir == null) {
                    System.err.println("WARNING: Unknown direction '" + dirString + "' on pin " + path + "/"
                            + pin + ", treating it as an input");
                    continue;
                }
                cell.setPortDirection(pin, dir);
            }
        }

        JSONObject connections = optObject(jsonCell, CONNECTIONS, path + "/" + CONNECTIONS);
        if (connections != null) {
            for (String pin : new TreeSet<>(connections.keySet())) {
                String pinPath = path + "/" + CONNECTIONS + "/" + pin;
                Object value = connections.get(pin);
                if (!(value instanceof JSONArray)) {
                    throw new YosysJSONParseException(pinPath, "Connection is not a bit array");
                }
                cell.addConnection(pin, readBitArray((JSONArray) value, pinPath));
            }
        }

        JSONObject parameters = optObject(jsonCell, PARAMETERS, path + "/" + PARAMETERS);
        if (parameters != null) {
            for (String key : new TreeSet<>(parameters.keySet())) {
                cell.addParameter(key, stringValue(parameters.get(key)));
            }
        }

        JSONObject attributes = optObject(jsonCell, ATTRIBUTES, path + "/" + ATTRIBUTES);
        if (attributes != null) {
            for (String key : new TreeSet<>(attributes.keySet())) {
                cell.addAttribute(key, stringValue(attributes.get(key)));
            }
        }
        return cell;
    }

    private static List<YosysBit> readBits(JSONObject parent, String path) {
        Object value = parent.opt(BITS);
        if (!(value instanceof JSONArray)) {
            throw new YosysJSONParseException(path, "Missing bits array");
        }
        return readBitArray((JSONArray) value, path + "/" + BITS);
    }

    static List<YosysBit> readBitArray(JSONArray array, String path) {
        List<YosysBit> bits = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object entry = array.get(i);
            if (entry instanceof Number) {
                int index = ((Number) entry).intValue();
                if (index < 0) {
                    throw new YosysJSONParseException(path + "[" + i + "]", "Negative bit index " + index);
                }
                bits.add(YosysBit.of(index));
            } else {
                YosysBit constant = entry instanceof String ? YosysBit.constant((String) entry) : null;
                if (constant == null) {
                    throw new YosysJSONParseException(path + "[" + i + "]", "Unrecognized bit '" + entry + "'");
                }
                bits.add(constant);
            }
        }
        return bits;
    }

    private static JSONObject optObject(JSONObject parent, String key, String path) {
        Object value = parent.opt(key);
        if (value == null || value == JSONObject.NULL) {
            return null;
        }
        if (!(value instanceof JSONObject)) {
            throw new YosysJSONParseException(path, "Expected a JSON object");
        }
        return (JSONObject) value;
    }

    private static JSONObject getObject(JSONObject parent, String key, String path) {
        JSONObject value = optObject(parent, key, path);
        if (value == null) {
            throw new YosysJSONParseException(path, "Expected a JSON object");
        }
        return value;
    }

    private static String stringValue(Object value) {
        return value == null || value == JSONObject.NULL ? "" : value.toString();
    }
}
