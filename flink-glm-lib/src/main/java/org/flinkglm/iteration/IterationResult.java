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

import org.flinkglm.common.optimizer.AccumulatorState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The outcome of {@link IterationDriver#run}. */
public class IterationResult {
    private final AccumulatorState finalState;

    private final int iterations;

    private final StopReason stopReason;

    private final List<Double> lossHistory;

    private final AccumulatorState penultimateState;

    public IterationResult(
            AccumulatorState finalState,
            int iterations,
            StopReason stopReason,
            List<Double> lossHistory,
            AccumulatorState penultimateState) {
        this.finalState = finalState;
        this.iterations = iterations;
        this.stopReason = stopReason;
        this.lossHistory = Collections.unmodifiableList(new ArrayList<>(lossHistory));
        this.penultimateState = penultimateState;
    }

    /** The last finalized state, or an empty state if the first pass saw no data. */
    public AccumulatorState getFinalState() {
        return finalState;
    }

    /** The number of iterations run. */
    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return stopReason == StopReason.CONVERGED;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    /** The loss of every iteration run, in order. */
    public List<Double> getLossHistory() {
        return lossHistory;
    }

    /** The state preceding the final one, or null. */
    public AccumulatorState getPenultimateState() {
        return penultimateState;
    }

    @Override
    public String toString() {
        return "IterationResult{iterations="
                + iterations
                + ", stopReason="
                + stopReason
                + ", lossHistory="
                + lossHistory
                + '}';
    }
}
