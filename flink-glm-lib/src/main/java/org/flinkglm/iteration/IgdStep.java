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
import org.flinkglm.common.optimizer.IncrementalGradientDescent;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.linalg.DenseVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One incremental gradient descent pass. With candidate step sizes, the pass runs one descent per
 * candidate and a second pass scores the resulting models; the best descent wins and carries the
 * loss of its model.
 */
public class IgdStep implements IterationStep {
    private static final Logger LOG = LoggerFactory.getLogger(IgdStep.class);

    private final TaskConfig config;

    private final double[] stepSizeCandidates;

    public IgdStep(TaskConfig config) {
        this(config, new double[0]);
    }

    public IgdStep(TaskConfig config, double[] stepSizeCandidates) {
        this.config = Preconditions.checkNotNull(config);
        this.stepSizeCandidates = stepSizeCandidates.clone();
    }

    @Override
    public AccumulatorState run(AccumulatorState previous, PassRunner runner) throws Exception {
        if (stepSizeCandidates.length == 0) {
            return runner.runPass(new IncrementalGradientDescent(config, previous));
        }
        BestBallResult trials =
                runner.runPass(BestBall.ofIgdTrials(config, previous, stepSizeCandidates));
        if (trials.isEmpty()) {
            return AccumulatorState.empty();
        }
        List<Integer> indices = new ArrayList<>();
        List<DenseVector> models = new ArrayList<>();
        for (int i = 0; i < trials.getCandidates().size(); i++) {
            AccumulatorState trial = trials.getCandidates().get(i);
            if (!trial.isEmpty()) {
                indices.add(i);
                models.add(trial.getModel());
            }
        }
        BestBallResult scores = runner.runPass(BestBall.ofModels(config, models));
        if (scores.isEmpty()) {
            return AccumulatorState.empty();
        }
        int winner = indices.get(scores.getBestIndex());
        LOG.info(
                "Step size {} wins with loss {}.",
                stepSizeCandidates[winner],
                scores.getBest().getLoss());
        return trials.getCandidates().get(winner).withLoss(scores.getBest().getLoss());
    }
}
