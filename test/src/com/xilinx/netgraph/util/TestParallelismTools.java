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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestParallelismTools {

    private final boolean initial = ParallelismTools.getParallel();

    @AfterEach
    void restore() {
        ParallelismTools.setParallel(initial);
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void testInvokeAllKeepsTaskOrder(boolean parallel) {
        ParallelismTools.setParallel(parallel);
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            final int n = i;
            tasks.add(() -> n * n);
        }
        List<Future<Integer>> futures = ParallelismTools.invokeAll(tasks);
        Assertions.assertEquals(50, futures.size());
        for (int i = 0; i < 50; i++) {
            Assertions.assertEquals(i * i, ParallelismTools.get(futures.get(i)));
        }
    }

    @Test
    void testInvokeAllEmpty() {
        Assertions.assertTrue(ParallelismTools.invokeAll(new ArrayList<Callable<String>>()).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void testGetRethrowsTaskException(boolean parallel) {
        ParallelismTools.setParallel(parallel);
        Future<String> future = ParallelismTools.submit(() -> {
            throw new IllegalStateException("boom");
        });
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> ParallelismTools.get(future));
        Assertions.assertEquals("boom", e.getMessage());
    }

    @Test
    void testCheckedExceptionIsWrapped() {
        Future<String> future = ParallelismTools.submit(() -> {
            throw new Exception("checked");
        });
        RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> ParallelismTools.get(future));
        Assertions.assertEquals("checked", e.getCause().getMessage());
    }

    @Test
    void testSerialModeRunsOnCallingThread() {
        ParallelismTools.setParallel(false);
        Thread caller = Thread.currentThread();
        Future<Thread> future = ParallelismTools.submit(Thread::currentThread);
        Assertions.assertTrue(future.isDone());
        Assertions.assertSame(caller, ParallelismTools.get(future));
    }
}
