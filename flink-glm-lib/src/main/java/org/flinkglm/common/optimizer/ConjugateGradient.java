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

import org.apache.flink.util.Preconditions;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseVector;

/**
 * Nonlinear conjugate gradient. A pass sums the gradient and the loss at a fixed model; finalize
 * turns the summed gradient into the next search direction using the Polak-Ribiere formula clamped
 * at zero. Moving the model along the direction is a separate step, see {@link #updateModel}.
 *
 * <p>The direction and the gradient of the previous pass are carried from one iteration to the
 * next through warm start.
 */
public class ConjugateGradient extends ConvexOptimizer {
    private static final long serialVersionUID = 1L;

    public ConjugateGradient(TaskConfig config, AccumulatorState previous) {
        super(config, previous);
        if (objective.requiresOrderedInput()) {
            throw new ConfigException(
                    "Conjugate gradient does not support the "
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
        ConjugateGradientAccumulator acc = new ConjugateGradientAccumulator(config.getDimension());
        if (previousAlgo instanceof ConjugateGradientAccumulator) {
            ConjugateGradientAccumulator carried = (ConjugateGradientAccumulator) previousAlgo;
            if (carried.hasDirection) {
                acc.hasDirection = true;
                System.arraycopy(
                        carried.direction.values, 0, acc.direction.values, 0, acc.direction.size());
                System.arraycopy(
                        carried.previousGradient.values,
                        0,
                        acc.previousGradient.values,
                        0,
                        acc.previousGradient.size());
            }
        }
        return acc;
    }

    @Override
    protected void transition(AccumulatorState state, LabeledPoint point) {
        ConjugateGradientAccumulator acc = (ConjugateGradientAccumulator) state.getAlgo();
        DenseVector model = state.mutableModel();
        DenseVector gradient = new DenseVector(model.size());
        objective.computeGradient(point, model, gradient);
        checkFinite(gradient, "gradient");
        double loss = objective.computeLoss(point, model);
        checkFinite(loss, "loss");
        BLAS.axpy(1.0, gradient, acc.gradient);
        acc.loss += loss;
    }

    @Override
    protected void mergeAlgorithm(AccumulatorState target, AccumulatorState other) {
        ConjugateGradientAccumulator acc = (ConjugateGradientAccumulator) target.getAlgo();
        ConjugateGradientAccumulator otherAcc = (ConjugateGradientAccumulator) other.getAlgo();
        BLAS.axpy(1.0, otherAcc.gradient, acc.gradient);
        acc.loss += otherAcc.loss;
    }

    @Override
    protected void finalizeState(AccumulatorState state) {
        ConjugateGradientAccumulator acc = (ConjugateGradientAccumulator) state.getAlgo();
        DenseVector model = state.mutableModel();
        DenseVector gradient = acc.gradient;
        RegularizationUtils.addRegularizationGradient(
                model, config.getReg(), config.getElasticNet(), gradient);
        double loss =
                acc.loss
                        + RegularizationUtils.regularizationLoss(
                                model, config.getReg(), config.getElasticNet());
        checkFinite(loss, "loss");
        checkFinite(gradient, "gradient");

        double beta = 0;
        if (acc.hasDirection) {
            double denominator = BLAS.dot(acc.previousGradient, acc.previousGradient);
            if (denominator > 0) {
                DenseVector change = gradient.clone();
                BLAS.axpy(-1.0, acc.previousGradient, change);
                beta = Math.max(0, BLAS.dot(gradient, change) / denominator);
            }
        }
        DenseVector direction = acc.direction;
        BLAS.scal(beta, direction);
        BLAS.axpy(-1.0, gradient, direction);
        System.arraycopy(gradient.values, 0, acc.previousGradient.values, 0, gradient.size());
        acc.hasDirection = true;

        state.setLoss(loss);
        state.setGradientNorm(BLAS.norm2(gradient));
        state.setIteration(state.getIteration() + 1);
    }

    /** Returns a copy of the search direction of a finalized conjugate gradient state. */
    public static DenseVector getDirection(AccumulatorState state) {
        Preconditions.checkArgument(
                state.getPhase() == Phase.FINALIZED
                        && state.getAlgo() instanceof ConjugateGradientAccumulator,
                "Expected a finalized conjugate gradient state but got %s.",
                state);
        return ((ConjugateGradientAccumulator) state.getAlgo()).direction.clone();
    }

    /**
     * Returns a copy of a finalized conjugate gradient state whose model moved by stepSize along
     * the search direction. The loss of the copy is still the loss at the model before the move.
     */
    public static AccumulatorState updateModel(AccumulatorState state, double stepSize) {
        DenseVector direction = getDirection(state);
        AccumulatorState updated = state.copy();
        BLAS.axpy(stepSize, direction, updated.mutableModel());
        checkFinite(updated.mutableModel(), "model");
        return updated;
    }
}
