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
import org.flinkglm.common.optimizer.typeinfo.BestBallResultTypeInfo;
import org.flinkglm.common.optimizer.typeinfo.BestBallStateTypeInfo;
import org.flinkglm.exception.NumericException;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs K candidate optimizers over the same examples in one pass and picks the candidate whose
 * finalized loss is the smallest. Ties go to the lowest index.
 *
 * <p>A candidate that raises a {@link NumericException} is disqualified for the rest of the pass.
 * The pass fails only when every candidate is disqualified.
 */
public class BestBall implements PassFunction<BestBallState, BestBallResult> {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(BestBall.class);

    private final List<ConvexOptimizer> candidates;

    public BestBall(List<? extends ConvexOptimizer> candidates) {
        Preconditions.checkArgument(!candidates.isEmpty(), "At least one candidate is required.");
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    /** Scores the models model + s * direction for each step size s. */
    public static BestBall ofStepSizes(
            TaskConfig config, DenseVector model, DenseVector direction, double[] stepSizes) {
        Preconditions.checkArgument(stepSizes.length > 0, "No step size given.");
        List<LossEvaluator> evaluators = new ArrayList<>();
        for (double stepSize : stepSizes) {
            DenseVector candidate = model.clone();
            BLAS.axpy(stepSize, direction, candidate);
            evaluators.add(new LossEvaluator(config, candidate));
        }
        return new BestBall(evaluators);
    }

    /** Scores the given models. */
    public static BestBall ofModels(TaskConfig config, List<DenseVector> models) {
        List<LossEvaluator> evaluators = new ArrayList<>();
        for (DenseVector model : models) {
            evaluators.add(new LossEvaluator(config, model));
        }
        return new BestBall(evaluators);
    }

    /** Runs one incremental gradient descent pass per step size, all from the same state. */
    public static BestBall ofIgdTrials(
            TaskConfig config, AccumulatorState previous, double[] stepSizes) {
        Preconditions.checkArgument(stepSizes.length > 0, "No step size given.");
        List<IncrementalGradientDescent> trials = new ArrayList<>();
        for (double stepSize : stepSizes) {
            trials.add(new IncrementalGradientDescent(config.withStepSize(stepSize), previous));
        }
        return new BestBall(trials);
    }

    public int size() {
        return candidates.size();
    }

    public ConvexOptimizer getCandidate(int index) {
        return candidates.get(index);
    }

    @Override
    public BestBallState createAccumulator() {
        return BestBallState.empty(candidates.size());
    }

    @Override
    public BestBallState add(LabeledPoint point, BestBallState state) {
        checkSize(state);
        for (int i = 0; i < candidates.size(); i++) {
            if (state.isDisqualified(i)) {
                continue;
            }
            try {
                state.setState(i, candidates.get(i).add(point, state.getState(i)));
            } catch (NumericException e) {
                LOG.warn("Candidate {} is disqualified: {}", i, e.getMessage());
                state.disqualify(i);
            }
        }
        state.setPopulated(true);
        return state;
    }

    @Override
    public BestBallState merge(BestBallState a, BestBallState b) {
        checkSize(a);
        checkSize(b);
        if (!a.isPopulated()) {
            return b;
        }
        if (!b.isPopulated()) {
            return a;
        }
        BestBallState merged = BestBallState.empty(candidates.size());
        merged.setPopulated(true);
        for (int i = 0; i < candidates.size(); i++) {
            if (a.isDisqualified(i) || b.isDisqualified(i)) {
                merged.disqualify(i);
            } else {
                merged.setState(i, candidates.get(i).merge(a.getState(i), b.getState(i)));
            }
        }
        return merged;
    }

    @Override
    public BestBallResult getResult(BestBallState state) {
        checkSize(state);
        if (!state.isPopulated()) {
            return BestBallResult.empty();
        }
        List<AccumulatorState> results = new ArrayList<>();
        int bestIndex = -1;
        for (int i = 0; i < candidates.size(); i++) {
            AccumulatorState result = AccumulatorState.empty();
            if (!state.isDisqualified(i)) {
                try {
                    result = candidates.get(i).getResult(state.getState(i));
                } catch (NumericException e) {
                    LOG.warn("Candidate {} is disqualified at finalize: {}", i, e.getMessage());
                }
            }
            results.add(result);
            if (!result.isEmpty()
                    && (bestIndex < 0 || result.getLoss() < results.get(bestIndex).getLoss())) {
                bestIndex = i;
            }
        }
        if (bestIndex < 0) {
            throw new NumericException(
                    "All " + candidates.size() + " candidates raised numeric errors.");
        }
        LOG.debug("Candidate {} wins with loss {}.", bestIndex, results.get(bestIndex).getLoss());
        return new BestBallResult(results, bestIndex);
    }

    @Override
    public TypeInformation<BestBallState> getAccumulatorType() {
        return BestBallStateTypeInfo.INSTANCE;
    }

    @Override
    public TypeInformation<BestBallResult> getResultType() {
        return BestBallResultTypeInfo.INSTANCE;
    }

    private void checkSize(BestBallState state) {
        if (state.size() != candidates.size()) {
            throw new IllegalArgumentException(
                    String.format(
                            "Expected %d candidates but the state holds %d.",
                            candidates.size(), state.size()));
        }
    }
}
