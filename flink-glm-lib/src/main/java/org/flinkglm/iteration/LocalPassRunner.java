/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.flinkglm.iteration;

import org.apache.flink.util.Preconditions;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.optimizer.PassFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * A {@link PassRunner} over in-memory partitions. Each partition is folded on its own thread of a
 * fixed pool, then the partial accumulators are merged in the configured {@link MergeOrder}.
 *
 * <p>Functions that require ordered input are folded on the calling thread as a single partition
 * holding every example sorted by descending label.
 */
public class LocalPassRunner implements PassRunner, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LocalPassRunner.class);

    /** How the partial accumulators of the partitions are combined. */
    public enum MergeOrder {
        /** Left to right: ((p0 + p1) + p2) + ... */
        SEQUENTIAL,
        /** As a balanced binary tree: (p0 + p1) + (p2 + p3). */
        TREE
    }

    private static final Comparator<LabeledPoint> DESCENDING_LABEL =
            Comparator.comparingDouble(LabeledPoint::getLabel).reversed();

    private final List<List<LabeledPoint>> partitions;

    private final MergeOrder mergeOrder;

    private final ExecutorService executor;

    public LocalPassRunner(List<List<LabeledPoint>> partitions) {
        this(partitions, MergeOrder.SEQUENTIAL);
    }

    public LocalPassRunner(List<List<LabeledPoint>> partitions, MergeOrder mergeOrder) {
        this(
                partitions,
                mergeOrder,
                Math.max(
                        1,
                        Math.min(
                                partitions.size(), Runtime.getRuntime().availableProcessors())));
    }

    public LocalPassRunner(
            List<List<LabeledPoint>> partitions, MergeOrder mergeOrder, int numThreads) {
        Preconditions.checkArgument(!partitions.isEmpty(), "At least one partition is required.");
        Preconditions.checkArgument(numThreads > 0, "The number of threads must be positive.");
        this.partitions = new ArrayList<>(partitions);
        this.mergeOrder = Preconditions.checkNotNull(mergeOrder);
        this.executor = Executors.newFixedThreadPool(numThreads);
    }

    /** Splits the examples round-robin into numPartitions partitions, keeping their order. */
    public static List<List<LabeledPoint>> partition(List<LabeledPoint> data, int numPartitions) {
        Preconditions.checkArgument(
                numPartitions > 0, "The number of partitions must be positive.");
        List<List<LabeledPoint>> partitions = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            partitions.add(new ArrayList<>());
        }
        for (int i = 0; i < data.size(); i++) {
            partitions.get(i % numPartitions).add(data.get(i));
        }
        return partitions;
    }

    /** Shuffles the examples with the given seed, then splits them round-robin. */
    public static List<List<LabeledPoint>> partition(
            List<LabeledPoint> data, int numPartitions, long seed) {
        List<LabeledPoint> shuffled = new ArrayList<>(data);
        Collections.shuffle(shuffled, new Random(seed));
        return partition(shuffled, numPartitions);
    }

    public int getNumPartitions() {
        return partitions.size();
    }

    @Override
    public <ACC, OUT> OUT runPass(PassFunction<ACC, OUT> function) throws Exception {
        if (function.requiresOrderedInput()) {
            List<LabeledPoint> sorted = new ArrayList<>();
            partitions.forEach(sorted::addAll);
            sorted.sort(DESCENDING_LABEL);
            return function.getResult(fold(function, sorted));
        }

        List<Future<ACC>> futures = new ArrayList<>(partitions.size());
        for (List<LabeledPoint> partition : partitions) {
            futures.add(executor.submit(() -> fold(function, partition)));
        }
        List<ACC> accumulators = new ArrayList<>(futures.size());
        for (Future<ACC> future : futures) {
            try {
                accumulators.add(future.get());
            } catch (ExecutionException e) {
                throw unwrap(e);
            }
        }
        ACC merged =
                mergeOrder == MergeOrder.TREE
                        ? mergeTree(function, accumulators, 0, accumulators.size())
                        : mergeSequential(function, accumulators);
        LOG.debug("Folded {} partitions.", partitions.size());
        return function.getResult(merged);
    }

    private static <ACC, OUT> ACC fold(PassFunction<ACC, OUT> function, List<LabeledPoint> points) {
        ACC acc = function.createAccumulator();
        for (LabeledPoint point : points) {
            acc = function.add(point, acc);
        }
        return acc;
    }

    private static <ACC, OUT> ACC mergeSequential(
            PassFunction<ACC, OUT> function, List<ACC> accumulators) {
        ACC merged = accumulators.get(0);
        for (int i = 1; i < accumulators.size(); i++) {
            merged = function.merge(merged, accumulators.get(i));
        }
        return merged;
    }

    private static <ACC, OUT> ACC mergeTree(
            PassFunction<ACC, OUT> function, List<ACC> accumulators, int from, int to) {
        if (to - from == 1) {
            return accumulators.get(from);
        }
        int mid = (from + to) / 2;
        return function.merge(
                mergeTree(function, accumulators, from, mid),
                mergeTree(function, accumulators, mid, to));
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return cause instanceof Exception ? (Exception) cause : e;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
