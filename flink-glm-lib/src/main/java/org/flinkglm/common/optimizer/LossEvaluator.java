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

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.linalg.DenseVector;

/**
 * Evaluates the regularized loss of a fixed model in one pass. The model is not changed and the
 * iteration counter is not advanced.
 */
public class LossEvaluator extends ConvexOptimizer {
    private static final long serialVersionUID = 1L;

    private final DenseVector model;

    public LossEvaluator(TaskConfig config, DenseVector model) {
        super(config, null);
        if (objective.requiresOrderedInput()) {
            throw new ConfigException(
                    "The " + config.getObjective().getName() + " objective has no additive loss.");
        }
        if (model.size() != config.getDimension()) {
            throw new DimensionMismatchException(config.getDimension(), model.size());
        }
        this.model = model.clone();
    }

    public DenseVector getModel() {
        return model.clone();
    }

    @Override
    protected DenseVector initialModel() {
        return model.clone();
    }

    @Override
    protected Accumulator createAlgorithmAccumulator(Accumulator previousAlgo) {
        return new LossAccumulator();
    }

    @Override
    protected void transition(AccumulatorState state, LabeledPoint point) {
        double loss = objective.computeLoss(point, state.mutableModel());
        checkFinite(loss, "loss");
        ((LossAccumulator) state.getAlgo()).loss += loss;
    }

    @Override
    protected void mergeAlgorithm(AccumulatorState target, AccumulatorState other) {
        ((LossAccumulator) target.getAlgo()).loss += ((LossAccumulator) other.getAlgo()).loss;
    }

    @Override
    protected void finalizeState(AccumulatorState state) {
        double loss =
                ((LossAccumulator) state.getAlgo()).loss
                        + RegularizationUtils.regularizationLoss(
                                state.mutableModel(), config.getReg(), config.getElasticNet());
        checkFinite(loss, "loss");
        state.setLoss(loss);
    }
}
