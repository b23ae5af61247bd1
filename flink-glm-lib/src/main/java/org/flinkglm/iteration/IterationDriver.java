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

import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.ConvexOptimizer;
import org.flinkglm.iteration.store.InMemoryStateStore;
import org.flinkglm.iteration.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs an {@link IterationStep} until the relative change of the loss drops below the tolerance,
 * the maximum number of iterations is reached, or a pass sees no data. Every finalized state is
 * put into a {@link StateStore} under its iteration number before the next pass starts.
 */
public class IterationDriver {
    private static final Logger LOG = LoggerFactory.getLogger(IterationDriver.class);

    private final int maxIter;

    private final double tol;

    private final StateStore store;

    public IterationDriver(int maxIter, double tol) {
        this(maxIter, tol, new InMemoryStateStore());
    }

    public IterationDriver(int maxIter, double tol, StateStore store) {
        Preconditions.checkArgument(maxIter > 0, "maxIter must be positive.");
        Preconditions.checkArgument(tol >= 0, "tol must not be negative.");
        this.maxIter = maxIter;
        this.tol = tol;
        this.store = Preconditions.checkNotNull(store);
    }

    public StateStore getStore() {
        return store;
    }

    /** Runs from scratch. */
    public IterationResult run(IterationStep step, PassRunner runner) throws Exception {
        return run(step, runner, null, 0);
    }

    /** Runs from the latest state of the store, or from scratch if the store is empty. */
    public IterationResult resume(IterationStep step, PassRunner runner) throws Exception {
        int latest = store.latestIteration();
        AccumulatorState start = latest == 0 ? null : store.get(latest).orElse(null);
        LOG.info("Resuming after iteration {}.", latest);
        return run(step, runner, start, latest);
    }

    private IterationResult run(
            IterationStep step, PassRunner runner, AccumulatorState start, int offset)
            throws Exception {
        List<Double> lossHistory = new ArrayList<>();
        AccumulatorState current = start;
        AccumulatorState penultimate = null;
        for (int i = 1; ; i++) {
            AccumulatorState next = step.run(current, runner);
            if (next.isEmpty()) {
                LOG.warn("Iteration {} saw no data.", offset + i);
                return new IterationResult(
                        current == null ? AccumulatorState.empty() : current,
                        i - 1,
                        StopReason.NO_DATA,
                        lossHistory,
                        penultimate);
            }
            store.put(offset + i, next);
            lossHistory.add(next.getLoss());

            double distance =
                    current == null
                            ? Double.POSITIVE_INFINITY
                            : ConvexOptimizer.distance(next, current);
            LOG.info(
                    "Iteration {} finished with loss {} and relative change {}.",
                    offset + i,
                    next.getLoss(),
                    distance);
            penultimate = current;
            current = next;
            if (distance < tol) {
                return new IterationResult(
                        current, i, StopReason.CONVERGED, lossHistory, penultimate);
            }
            if (i >= maxIter) {
                return new IterationResult(
                        current, i, StopReason.MAX_ITERATIONS, lossHistory, penultimate);
            }
        }
    }
}
