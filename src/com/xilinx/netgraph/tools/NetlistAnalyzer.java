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

package com.xilinx.netgraph.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import com.xilinx.netgraph.graph.GraphMetrics;
import com.xilinx.netgraph.graph.NetlistGraph;
import com.xilinx.netgraph.graph.NetlistGraphBuilder;
import com.xilinx.netgraph.graph.NetlistGraphJSONWriter;
import com.xilinx.netgraph.graph.StructuralError;
import com.xilinx.netgraph.util.FileTools;
import com.xilinx.netgraph.util.ParallelismTools;
import com.xilinx.netgraph.util.Params;
import com.xilinx.netgraph.yosys.YosysJSONReader;
import com.xilinx.netgraph.yosys.YosysNetlist;
import com.xilinx.netgraph.yosys.YosysTools;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * CLI tool that turns Yosys JSON netlists (or Verilog, synthesized through Yosys)
 * into netlist graphs. Supports writing the graph as JSON and printing a metrics
 * report. Several inputs are transformed in parallel.
 */
public final class NetlistAnalyzer {

    private static final String GRAPH_CMD = "Graph";
    private static final String METRICS_CMD = "Metrics";
    private static final String INPUT_OPT = "i";
    private static final String OUTPUT_OPT = "o";
    private static final String INDENT_OPT = "indent";
    private static final String FLATTEN_OPT = "flatten";
    private static final String STRICT_OPT = "strict";
    private static final String HELP_OPT = "h";
    private static final String DESC_INPUT = "Input Yosys JSON netlist or Verilog file (repeatable)";
    private static final String DESC_OUTPUT = "Output JSON file (one input) or directory (several inputs)";
    private static final String DESC_INDENT = "JSON indentation";
    private static final String DESC_FLATTEN = "Flatten hierarchy when synthesizing Verilog inputs";
    private static final String DESC_STRICT = "Exit with an error if any input has structural errors";
    private static final String GRAPH_SUFFIX = ".graph.json";
    private static final String LINE = "-----------------------------------------------------------";

    private NetlistAnalyzer() {
    }

    private static void printHeader(PrintStream out, String title) {
        out.println("===========================================================");
        out.println(" NetGraph " + title);
        out.println("===========================================================");
    }

    /**
     * Prints help showing available commands.
     */
    private static void printMainHelp() {
        printHeader(System.out, "NetlistAnalyzer");
        System.out.println("Build and analyze gate-level netlist graphs.\n");
        System.out.println("Usage: NetlistAnalyzer <command> [options]\n");
        System.out.println("Available commands:");
        System.out.println("  " + GRAPH_CMD + "      Write the node/wire graph and metrics as JSON");
        System.out.println("  " + METRICS_CMD + "    Print a structural metrics report");
        System.out.println();
        System.out.println("Use 'NetlistAnalyzer <command> --help' for command-specific options.");
    }

    /**
     * Entry point. Dispatches to the appropriate subcommand handler.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the tool without exiting the JVM.
     *
     * @param args command-line arguments
     * @return process exit code: 0 on success, 1 on a usage or input error, 2 if
     *         --strict was given and a graph has structural errors
     */
    public static int run(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help") || args[0].equals("-?")) {
            printMainHelp();
            return 0;
        }

        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        if (command.equalsIgnoreCase(GRAPH_CMD)) {
            return runCommand(commandArgs, true);
        } else if (command.equalsIgnoreCase(METRICS_CMD)) {
            return runCommand(commandArgs, false);
        }
        System.err.println("ERROR: Unknown command '" + command + "'");
        printMainHelp();
        return 1;
    }

    /**
     * Creates option parser for the subcommands.
     *
     * @param graph true for the Graph subcommand, which also takes output options
     * @return configured OptionParser
     */
    private static OptionParser createOptionParser(boolean graph) {
        OptionParser optParser = new OptionParser();

        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs(DESC_INPUT);

        if (graph) {
            optParser.acceptsAll(Arrays.asList(OUTPUT_OPT, "output"))
                    .withRequiredArg()
                    .describedAs(DESC_OUTPUT);

            optParser.accepts(INDENT_OPT)
                    .withRequiredArg()
                    .ofType(Integer.class)
                    .defaultsTo(Params.NG_JSON_INDENT)
                    .describedAs(DESC_INDENT);
        }

        optParser.accepts(FLATTEN_OPT, DESC_FLATTEN);
        optParser.accepts(STRICT_OPT, DESC_STRICT);

        optParser.acceptsAll(Arrays.asList(HELP_OPT, "help", "?"), "Print Help")
                .forHelp();

        return optParser;
    }

    private static void printCommandHelp(OptionParser optParser, boolean graph) {
        printHeader(System.out, graph ? GRAPH_CMD : METRICS_CMD);
        System.out.println(graph ? "Write netlist graphs as JSON.\n" : "Print netlist graph metrics.\n");
        try {
            optParser.printHelpOn(System.out);
        } catch (IOException ioException) {
            System.err.println("ERROR: " + ioException.getMessage());
        }
    }

    private static int runCommand(String[] args, boolean graph) {
        OptionParser optParser = createOptionParser(graph);
        OptionSet opts;

        try {
            opts = optParser.parse(args);
        } catch (Exception parseException) {
            System.err.println("ERROR: " + parseException.getMessage());
            printCommandHelp(optParser, graph);
            return 1;
        }

        if (opts.has(HELP_OPT)) {
            printCommandHelp(optParser, graph);
            return 0;
        }

        List<Path> inputs = new ArrayList<>();
        for (Object input : opts.valuesOf(INPUT_OPT)) {
            inputs.add(Paths.get((String) input));
        }
        boolean flatten = opts.has(FLATTEN_OPT);
        Path output = graph && opts.has(OUTPUT_OPT) ? Paths.get((String) opts.valueOf(OUTPUT_OPT)) : null;
        int indent = graph ? (int) opts.valueOf(INDENT_OPT) : Params.NG_JSON_INDENT;

        if (output != null && inputs.size() > 1 && !Files.isDirectory(output)) {
            System.err.println("ERROR: With several inputs, the output must be an existing directory: " + output);
            return 1;
        }

        List<Callable<NetlistGraph>> tasks = new ArrayList<>();
        for (Path input : inputs) {
            tasks.add(() -> NetlistGraphBuilder.transform(loadNetlist(input, flatten)));
        }
        List<Future<NetlistGraph>> futures = ParallelismTools.invokeAll(tasks);

        int exitCode = 0;
        for (int i = 0; i < inputs.size(); i++) {
            Path input = inputs.get(i);
            NetlistGraph netlistGraph;
            try {
                netlistGraph = ParallelismTools.get(futures.get(i));
            } catch (RuntimeException e) {
                System.err.println("ERROR: Failed to process " + input + ": " + e.getMessage());
                exitCode = 1;
                continue;
            }

            if (graph) {
                writeGraph(netlistGraph, input, output, inputs.size() > 1, indent);
            } else {
                printMetricsReport(System.out, input, netlistGraph);
            }
            for (StructuralError error : netlistGraph.getErrors()) {
                System.err.println("WARNING: " + input + ": " + error);
            }
            if (opts.has(STRICT_OPT) && netlistGraph.hasErrors() && exitCode == 0) {
                exitCode = 2;
            }
        }
        return exitCode;
    }

    /**
     * Reads a JSON netlist, or synthesizes a Verilog file with Yosys first.
     *
     * @param input   path to a .json or .v file
     * @param flatten flatten the hierarchy during synthesis
     * @return the netlist document
     */
    static YosysNetlist loadNetlist(Path input, boolean flatten) {
        String ext = FileTools.getFileExtension(input.toString());
        if (ext.equals("v")) {
            return YosysTools.synthToJSON(flatten ? YosysTools.SYNTH_FLAG_FLATTEN : "", input);
        }
        return YosysJSONReader.readJSONFile(input);
    }

    private static void writeGraph(NetlistGraph netlistGraph, Path input, Path output, boolean several,
                                   int indent) {
        if (output == null) {
            System.out.println(NetlistGraphJSONWriter.toJSONString(netlistGraph, indent));
            return;
        }
        Path dest = output;
        if (several || Files.isDirectory(output)) {
            String base = input.getFileName().toString();
            int dot = base.lastIndexOf('.');
            dest = output.resolve((dot < 0 ? base : base.substring(0, dot)) + GRAPH_SUFFIX);
        }
        NetlistGraphJSONWriter.writeJSONFile(netlistGraph, dest, indent);
        System.out.println("Wrote " + dest);
    }

    static void printMetricsReport(PrintStream out, Path input, NetlistGraph netlistGraph) {
        GraphMetrics metrics = netlistGraph.getMetrics();
        out.println(LINE);
        out.println("Netlist Graph Report");
        out.println("Input     : " + input);
        out.println("Module    : " + (netlistGraph.getModuleName() == null ? "<none>" : netlistGraph.getModuleName()));
        out.println(LINE);
        out.printf("Nodes     : %,d%n", netlistGraph.getNodes().size());
        out.printf("Wires     : %,d%n", metrics.getWireCount());
        out.printf("Gates     : %,d%n", metrics.getTotalGates());
        for (Map.Entry<String, Integer> e : metrics.getGateBreakdown().entrySet()) {
            out.printf("  %-12s %,d%n", e.getKey(), e.getValue());
        }
        out.println("Max Depth : " + (metrics.hasMaxDepth() ? Integer.toString(metrics.getMaxDepth()) : "n/a (combinational loop)"));
        out.println("Max Fanout: " + metrics.getMaxFanout());
        out.println("Errors    : " + netlistGraph.getErrors().size());
    }
}
