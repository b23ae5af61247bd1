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
import org.flinkglm.common.optimizer.BestBall;
import org.flinkglm.common.optimizer.BestBallResult;
import org.flinkglm.common.optimizer.ConjugateGradient;
import org.flinkglm.common.optimizer.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One conjugate gradient iteration: a pass computing the search direction, then a move along it by
 * the configured step size or by the candidate step size with the smallest loss.
 */
public class ConjugateGradientStep implements IterationStep {
    private static final Logger LOG = LoggerFactory.getLogger(ConjugateGradientStep.class);

    private final TaskConfig config;

    private final double[] stepSizeCandidates;

    public ConjugateGradientStep(TaskConfig config) {
        this(config, new double[0]);
    }

    public ConjugateGradientStep(TaskConfig config, double[] stepSizeCandidates) {
        this.config = Preconditions.checkNotNull(config);
        this.stepSizeCandidates = stepSizeCandidates.clone();
    }

    @Override
    public AccumulatorState run(AccumulatorState previous, PassRunner runner) throws Exception {
        AccumulatorState state = runner.runPass(new ConjugateGradient(config, previous));
        if (state.isEmpty()) {
            return state;
        }
        if (stepSizeCandidates.length == 0) {
            return ConjugateGradient.updateModel(state, config.getStepSize());
        }
        BestBallResult search =
                runner.runPass(
                        BestBall.ofStepSizes(
                                config,
                                state.getModel(),
                                ConjugateGradient.getDirection(state),
                                stepSizeCandidates));
        if (search.isEmpty()) {
            return AccumulatorState.empty();
        }
        double stepSize = stepSizeCandidates[search.getBestIndex()];
        LOG.info(
                "Line search picks step size {} with loss {}.",
                stepSize,
                search.getBest().getLoss());
        return ConjugateGradient.updateModel(state, stepSize);
    }
}
