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

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Utilities to aid in parallel processing
 *
 * A class that abstracts away single-threaded and multi-threaded execution.
 * Single-threaded mode means that all tasks submitted will be executed
 * immediately (on the submitting thread).
 */
public class ParallelismTools {

    /** A fixed-size thread pool with as many threads as there are processors
     * minus one (at least one), fed by a single task queue */
    private static final ThreadPoolExecutor pool = new ThreadPoolExecutor(
            Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
            Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
            0, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            (r) -> {
                Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });

    private static boolean parallel = true;

    static {
        // Set NG_PARALLEL=0 to disable
        setParallel(!Params.isParamDisabled(Params.NG_PARALLEL_NAME));
    }

    /**
     * Global setter to control parallel processing.
     * @param parallel Enable parallel processing.
     */
    public static void setParallel(boolean parallel) {
        ParallelismTools.parallel = parallel;
        if (parallel) {
            pool.prestartAllCoreThreads();
        }
    }

    /**
     * Global getter for current parallel processing state.
     * @return Current parallel processing state.
     */
    public static boolean getParallel() {
        return parallel;
    }

    /**
     * Submit a task-with-return-value to the thread pool.
     * @param task Task to be performed.
     * @param <T> Type returned by task.
     * @return A Future object holding the value returned by task.
     */
    public static <T> Future<T> submit(Callable<T> task) {
        if (!getParallel()) {
            return completeNow(task);
        }
        return pool.submit(task);
    }

    /**
     * Block until the task behind the given Future is complete.
     * If necessary, steal the task from the job queue for immediate execution
     * on the current thread.
     * @param future Future representing previously submitted task.
     * @return Value returned by task.
     */
    public static <T> T get(Future<T> future) {
        trySteal(future);

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException(cause);
        }
    }

    /**
     * Given a list of tasks-with-return-value, submit all but the last to the
     * thread pool, then execute the last with the current thread. Results are
     * collected with {@link #get(Future)}, which steals any task still queued.
     * @param tasks List of tasks-with-return-value.
     * @param <T> Type returned by all tasks.
     * @return A list of Future objects used to hold returned data, in task order.
     */
    public static <T> List<Future<T>> invokeAll(@NotNull List<? extends Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        if (tasks.isEmpty()) {
            return futures;
        }

        if (!getParallel()) {
            for (Callable<T> task : tasks) {
                futures.add(completeNow(task));
            }
            return futures;
        }

        // Submit all but the last
        for (int i = 0; i < tasks.size() - 1; i++) {
            futures.add(submit(tasks.get(i)));
        }

        // Invoke the last
        futures.add(completeNow(tasks.get(tasks.size() - 1)));

        // Now walk backwards and try and steal those not done
        ListIterator<Future<T>> it = futures.listIterator(futures.size() - 1 /* skip just-inserted */);
        while (it.hasPrevious()) {
            trySteal(it.previous());
        }
        return futures;
    }

    private static <T> CompletableFuture<T> completeNow(Callable<T> task) {
        CompletableFuture<T> f = new CompletableFuture<>();
        try {
            f.complete(task.call());
        } catch (Exception e) {
            f.completeExceptionally(e);
        }
        return f;
    }

    private static <T> boolean trySteal(Future<T> future) {
        boolean doneOrStolen = future.isDone();
        if (!doneOrStolen && (future instanceof Runnable)) {
            doneOrStolen = pool.remove((Runnable) future);
            if (doneOrStolen) {
                ((Runnable) future).run();
            }
        }
        return doneOrStolen;
    }
}
