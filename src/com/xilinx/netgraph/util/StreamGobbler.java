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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Class to help concurrent threads read stdio/stderr. Keeps the last lines read so
 * a failing command can be reported with its final output.
 */
public class StreamGobbler extends Thread {

    public static final int DEFAULT_TAIL_LINES = 40;

    private final InputStream is;

    private final boolean verbose;

    private final int tailLines;

    private final Deque<String> tail = new ArrayDeque<>();

    public StreamGobbler(InputStream is, boolean verbose) {
        this(is, verbose, DEFAULT_TAIL_LINES);
    }

    public StreamGobbler(InputStream is, boolean verbose, int tailLines) {
        this.is = is;
        this.verbose = verbose;
        this.tailLines = tailLines;
        setDaemon(true);
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String str;
            while ((str = br.readLine()) != null) {
                if (verbose) {
                    System.out.println(str);
                }
                synchronized (tail) {
                    tail.addLast(str);
                    if (tail.size() > tailLines) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
    }

    /**
     * @return The last lines read so far, oldest first.
     */
    public List<String> getTail() {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }
}
