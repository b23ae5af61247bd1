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
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseVector;

/**
 * Incremental gradient descent: every example moves the model by -stepSize times its gradient.
 *
 * <p>Partitions descend independently from the same starting model, so merge can only average
 * their models weighted by row count. The result depends on the partitioning and the merge order,
 * but stays close to the sequential descent for small step sizes.
 *
 * <p>The loss of a pass is the sum of the losses evaluated right after each update, plus the
 * regularization term of the model before the regularization step taken at finalize.
 */
public class IncrementalGradientDescent extends ConvexOptimizer {
    private static final long serialVersionUID = 1L;

    public IncrementalGradientDescent(TaskConfig config, AccumulatorState previous) {
        super(config, previous);
        if (objective.requiresOrderedInput()) {
            throw new ConfigException(
                    "Incremental gradient descent does not support the "
                            + config.getObjective().getName()
                            + " objective.");
        }
        if (!(config.getStepSize() > 0)) {
            throw new ConfigException(
                    "Step size must be positive but is " + config.getStepSize() + ".");
        }
    }

    @Override
    protected Accumulator createAlgorithmAccumulator(Accumulator previousAlgo) {
        return new IgdAccumulator(config.getDimension());
    }

    @Override
    protected void transition(AccumulatorState state, LabeledPoint point) {
        IgdAccumulator acc = (IgdAccumulator) state.getAlgo();
        DenseVector model = state.mutableModel();
        DenseVector gradient = new DenseVector(model.size());
        objective.computeGradient(point, model, gradient);
        checkFinite(gradient, "gradient");
        BLAS.axpy(-config.getStepSize(), gradient, model);
        BLAS.axpy(1.0, gradient, acc.gradient);
        double loss = objective.computeLoss(point, model);
        checkFinite(loss, "loss");
        acc.loss += loss;
    }

    @Override
    protected void mergeAlgorithm(AccumulatorState target, AccumulatorState other) {
        double total = target.getRowCount() + other.getRowCount();
        DenseVector model = target.mutableModel();
        BLAS.scal(target.getRowCount() / total, model);
        BLAS.axpy(other.getRowCount() / total, other.mutableModel(), model);

        IgdAccumulator acc = (IgdAccumulator) target.getAlgo();
        IgdAccumulator otherAcc = (IgdAccumulator) other.getAlgo();
        acc.loss += otherAcc.loss;
        BLAS.axpy(1.0, otherAcc.gradient, acc.gradient);
    }

    @Override
    protected void finalizeState(AccumulatorState state) {
        IgdAccumulator acc = (IgdAccumulator) state.getAlgo();
        double regLoss =
                RegularizationUtils.regularize(
                        state.mutableModel(),
                        config.getReg(),
                        config.getElasticNet(),
                        config.getStepSize());
        checkFinite(state.mutableModel(), "model");
        double loss = acc.loss + regLoss;
        checkFinite(loss, "loss");
        state.setLoss(loss);
        state.setGradientNorm(BLAS.norm2(acc.gradient));
        state.setIteration(state.getIteration() + 1);
    }
}
