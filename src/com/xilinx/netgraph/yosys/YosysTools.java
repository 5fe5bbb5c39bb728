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
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.xilinx.netgraph.util.FileTools;
import com.xilinx.netgraph.util.Params;
import com.xilinx.netgraph.util.StreamGobbler;

/**
 * Runs an installed Yosys to turn Verilog sources into a JSON netlist. Yosys is
 * treated as a black box: it either produces a document or the call fails.
 */
public class YosysTools {

    public static final String READ_VERILOG = "read_verilog";

    public static final String SYNTH = "synth";

    public static final String SYNTH_FLAG_FLATTEN = " -flatten";

    public static final String WRITE_JSON = "write_json";

    public static final String JSON_OUTPUT_NAME = "output.json";

    public static boolean isYosysOnPath() {
        return FileTools.isExecutableOnPath(Params.NG_YOSYS_EXEC);
    }

    /**
     * Builds the Yosys command string that reads the given files, synthesizes them
     * and writes a JSON netlist.
     * @param flags Flags appended to 'synth', e.g. {@link #SYNTH_FLAG_FLATTEN}.
     * @param json Path of the JSON file to write.
     * @param paths Verilog input files.
     * @return Yosys command(s), separated by ';'
     */
    public static String buildSynthCommand(String flags, Path json, Path... paths) {
        StringBuilder sb = new StringBuilder(READ_VERILOG);
        for (Path path : paths) {
            sb.append(' ').append(path);
        }
        sb.append("; ").append(SYNTH).append(flags);
        sb.append("; ").append(WRITE_JSON).append(' ').append(json);
        return sb.toString();
    }

    /**
     * Run the given command string in Yosys.
     * @param command Yosys command(s), separated by ';'
     * @param workDir Working directory
     * @param verbose Echo Yosys' output to stdout
     */
    public static void run(String command, Path workDir, boolean verbose) {
        List<String> exec = new ArrayList<>();
        exec.add(Params.NG_YOSYS_EXEC);
        exec.add("-q");
        exec.add("-p");
        exec.add(command);
        if (verbose) System.out.println(String.join(" ", exec));

        ProcessBuilder pb = new ProcessBuilder(exec);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        Process p = null;
        try {
            p = pb.start();
            StreamGobbler output = new StreamGobbler(p.getInputStream(), verbose);
            output.start();
            if (!p.waitFor(Params.NG_YOSYS_TIMEOUT, TimeUnit.SECONDS)) {
                throw new RuntimeException("ERROR: Yosys did not finish within " + Params.NG_YOSYS_TIMEOUT
                        + " seconds");
            }
            output.join();
            int exitCode = p.exitValue();
            if (exitCode != 0) {
                throw new RuntimeException("ERROR: Yosys exited with code: " + exitCode + "\n"
                        + String.join("\n", output.getTail()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not start " + Params.NG_YOSYS_EXEC, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("ERROR: Interrupted while waiting for Yosys", e);
        } finally {
            if (p != null) p.destroyForcibly();
        }
    }

    /**
     * Synthesizes the given files with Yosys' generic 'synth' flow and reads the
     * resulting JSON netlist.
     * @param flags Flags appended to 'synth'.
     * @param workDir Working directory, receives {@value #JSON_OUTPUT_NAME}.
     * @param paths Verilog input files.
     * @return The netlist Yosys produced.
     */
    public static YosysNetlist synthToJSONWithWorkDir(String flags, Path workDir, Path... paths) {
        final Path json = workDir.resolve(JSON_OUTPUT_NAME);
        run(buildSynthCommand(flags, json, paths), workDir, false);
        if (!Files.exists(json)) {
            throw new RuntimeException("ERROR: Yosys did not produce " + json);
        }
        return YosysJSONReader.readJSONFile(json);
    }

    /**
     * Synthesizes and flattens the given files in a temporary working directory.
     * @param paths Verilog input files.
     * @return The flattened netlist.
     */
    public static YosysNetlist synthToJSON(Path... paths) {
        return synthToJSON(SYNTH_FLAG_FLATTEN, paths);
    }

    public static YosysNetlist synthToJSON(String flags, Path... paths) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("yosysToolsWorkdir");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<Path> absolute = new ArrayList<>();
        for (Path path : paths) {
            absolute.add(path.toAbsolutePath());
        }
        try {
            return synthToJSONWithWorkDir(flags, workDir, absolute.toArray(new Path[0]));
        } finally {
            FileTools.deleteFolder(workDir);
        }
    }
}
