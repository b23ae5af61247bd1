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

package org.flinkglm.common.optimizer;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.util.Preconditions;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.Objective;
import org.flinkglm.common.lossfunc.Objectives;
import org.flinkglm.common.optimizer.typeinfo.AccumulatorStateTypeInfo;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.exception.NumericException;
import org.flinkglm.linalg.DenseVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The base class of the optimizers that run one iteration of a convex optimization as a single
 * pass over the training examples.
 *
 * <p>The pass starts from {@link #createAccumulator()}, an empty state. The first example
 * initializes the state by warm start from the finalized state of the previous iteration, or with
 * a zero model when there is none. Each example is then folded by {@link #add}, partial states are
 * combined by {@link #merge} in any grouping, and {@link #getResult} finalizes the pass into the
 * state seeding the next iteration. Merge and finalize never modify their inputs.
 */
public abstract class ConvexOptimizer
        implements PassFunction<AccumulatorState, AccumulatorState> {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ConvexOptimizer.class);

    protected final TaskConfig config;

    protected final Objective objective;

    /** The finalized state of the previous iteration, or null. */
    protected final AccumulatorState previous;

    protected ConvexOptimizer(TaskConfig config, AccumulatorState previous) {
        if (config == null) {
            throw new ConfigException("The task configuration must not be null.");
        }
        this.config = config;
        this.objective = Objectives.get(config.getObjective());
        if (previous != null && previous.isEmpty()) {
            previous = null;
        }
        if (previous != null) {
            Preconditions.checkArgument(
                    previous.getPhase() == Phase.FINALIZED,
                    "Warm start requires a finalized state but got %s.",
                    previous.getPhase());
            if (previous.getDimension() != config.getDimension()) {
                throw new DimensionMismatchException(
                        config.getDimension(), previous.getDimension());
            }
        }
        this.previous = previous;
    }

    public TaskConfig getConfig() {
        return config;
    }

    /** Creates the algorithm-specific accumulator of a new pass. */
    protected abstract Accumulator createAlgorithmAccumulator(Accumulator previousAlgo);

    /** Folds one example into an initialized state. */
    protected abstract void transition(AccumulatorState state, LabeledPoint point);

    /**
     * Merges the algorithm-specific part of other into target. The row count of target is still
     * the one before the merge.
     */
    protected abstract void mergeAlgorithm(AccumulatorState target, AccumulatorState other);

    /** Finalizes a copy of a populated state. */
    protected abstract void finalizeState(AccumulatorState state);

    /** The model a new pass starts from. */
    protected DenseVector initialModel() {
        return previous == null
                ? new DenseVector(config.getDimension())
                : previous.getModel();
    }

    @Override
    public AccumulatorState createAccumulator() {
        return AccumulatorState.empty();
    }

    @Override
    public AccumulatorState add(LabeledPoint point, AccumulatorState state) {
        Preconditions.checkState(
                state.getPhase() != Phase.FINALIZED, "Cannot add to a finalized state.");
        if (state.isEmpty()) {
            state = initialize();
        }
        if (point.getFeatures().size() != config.getDimension()) {
            throw new DimensionMismatchException(
                    config.getDimension(), point.getFeatures().size());
        }
        transition(state, point);
        state.setRowCount(state.getRowCount() + 1);
        return state;
    }

    @Override
    public AccumulatorState merge(AccumulatorState a, AccumulatorState b) {
        Preconditions.checkState(
                a.getPhase() != Phase.FINALIZED && b.getPhase() != Phase.FINALIZED,
                "Cannot merge a finalized state.");
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        if (a.getDimension() != b.getDimension()) {
            throw new DimensionMismatchException(a.getDimension(), b.getDimension());
        }
        AccumulatorState merged = a.copy();
        mergeAlgorithm(merged, b);
        merged.setRowCount(a.getRowCount() + b.getRowCount());
        return merged;
    }

    @Override
    public AccumulatorState getResult(AccumulatorState state) {
        if (state.getPhase() == Phase.FINALIZED) {
            return state.copy();
        }
        if (state.isEmpty() || state.getRowCount() == 0) {
            return AccumulatorState.empty();
        }
        AccumulatorState result = state.copy();
        finalizeState(result);
        result.setPhase(Phase.FINALIZED);
        return result;
    }

    @Override
    public TypeInformation<AccumulatorState> getAccumulatorType() {
        return AccumulatorStateTypeInfo.INSTANCE;
    }

    @Override
    public TypeInformation<AccumulatorState> getResultType() {
        return AccumulatorStateTypeInfo.INSTANCE;
    }

    @Override
    public boolean requiresOrderedInput() {
        return objective.requiresOrderedInput();
    }

    private AccumulatorState initialize() {
        return new AccumulatorState(
                Phase.ACCUMULATING,
                config,
                initialModel(),
                previous == null ? 0 : previous.getIteration(),
                createAlgorithmAccumulator(previous == null ? null : previous.getAlgo()),
                0,
                Double.NaN,
                Double.NaN);
    }

    /**
     * The relative change of the loss between two finalized states: |lossA - lossB| / |lossB|. A
     * zero baseline loss yields positive infinity, meaning not yet converged.
     *
     * @throws NumericException if either loss is NaN.
     */
    public static double distance(AccumulatorState current, AccumulatorState previous) {
        double lossA = current.getLoss();
        double lossB = previous.getLoss();
        if (Double.isNaN(lossA) || Double.isNaN(lossB)) {
            throw new NumericException(
                    String.format("Cannot compare losses %s and %s.", lossA, lossB));
        }
        if (lossB == 0) {
            LOG.warn("The baseline loss is zero, the relative loss change is infinite.");
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(lossA - lossB) / Math.abs(lossB);
    }

    static void checkFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new NumericException("The " + name + " is not finite: " + value + ".");
        }
    }

    static void checkFinite(DenseVector vector, String name) {
        if (!vector.isFinite()) {
            throw new NumericException("The " + name + " is not finite: " + vector + ".");
        }
    }
}
