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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * A collection of file and process helpers.
 */
public class FileTools {

    private FileTools() {
    }

    /**
     * Writes text to a file, followed by a line separator.
     * @param text The text to write.
     * @param fileName Name of the file to create or overwrite.
     */
    public static void writeStringToTextFile(String text, String fileName) {
        String nl = System.lineSeparator();
        try (FileWriter fw = new FileWriter(fileName);
            BufferedWriter bw = new BufferedWriter(fw)) {
            bw.write(text + nl);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                fileName + File.separator + e.getMessage(), e);
        }
    }

    /**
     * Gets the lower-case extension of a file name without the dot.
     * @param fileName The file name or path.
     * @return The extension, or an empty string if there is none.
     */
    public static String getFileExtension(String fileName) {
        String base = Path.of(fileName).getFileName().toString();
        int dot = base.lastIndexOf('.');
        return dot < 0 ? "" : base.substring(dot + 1).toLowerCase();
    }

    /**
     * Recursively deletes a directory and everything in it.
     * @param folder The directory to delete.
     * @return True if the directory no longer exists.
     */
    public static boolean deleteFolder(Path folder) {
        if (!Files.exists(folder)) return true;
        try (Stream<Path> walk = Files.walk(folder)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            System.err.println("WARNING: Could not delete " + folder + ": " + e.getMessage());
            return false;
        }
        return true;
    }

    /**
     * Runs a command and collects its output lines.
     * @param includeError Also collect the command's stderr.
     * @param command The command and its arguments.
     * @return The output lines; empty if the command could not be started.
     */
    public static List<String> execCommandGetOutput(boolean includeError, String... command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(includeError);
        if (!includeError) {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }
        Process p = null;
        List<String> output = new ArrayList<>();
        try {
            p = pb.start();
            try (BufferedReader bri = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = bri.readLine()) != null) {
                    output.add(line);
                }
            }
            p.waitFor();
        } catch (IOException e) {
            System.err.println("WARNING: Could not run '" + command[0] + "': " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (p != null) p.destroyForcibly();
        }
        return output;
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase().startsWith("win");
    }

    /**
     * Checks if an executable is available on the current PATH (uses unix 'which'
     * or windows 'where').
     * @param execName Name of the executable.
     * @return True if it was found.
     */
    public static boolean isExecutableOnPath(String execName) {
        if (execName.contains(File.separator)) {
            return Files.isExecutable(Path.of(execName));
        }
        List<String> lines = execCommandGetOutput(true, isWindows() ? "where" : "which", execName);
        for (String line : lines) {
            if (line.startsWith("which:")) return false;
            if (line.contains("INFO: Could not find files")) return false;
            if (line.contains(File.separator + execName)) return true;
        }
        return false;
    }
}
