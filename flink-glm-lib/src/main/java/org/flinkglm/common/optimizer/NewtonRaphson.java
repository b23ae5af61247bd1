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
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.exception.NumericException;
import org.flinkglm.exception.SizeLimitException;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseMatrix;
import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.SymmetricMatrixSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newton-Raphson. A pass sums the gradient, the dense Hessian and the loss at a fixed model;
 * finalize adds the L2 penalty, checks that the Hessian is positive definite and well
 * conditioned, and replaces the model by model - H^-1 * g.
 *
 * <p>For the Cox objective the examples are folded into a {@link RiskSetAccumulator}, which only
 * accepts a single ordered partition.
 */
public class NewtonRaphson extends ConvexOptimizer {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(NewtonRaphson.class);

    public static final double DEFAULT_MAX_CONDITION_NUMBER = 1e12;

    private final double maxConditionNumber;

    public NewtonRaphson(TaskConfig config, AccumulatorState previous) {
        this(config, previous, DEFAULT_MAX_CONDITION_NUMBER);
    }

    public NewtonRaphson(
            TaskConfig config, AccumulatorState previous, double maxConditionNumber) {
        super(config, previous);
        if (!objective.supportsHessian()) {
            throw new ConfigException(
                    "Newton-Raphson requires a twice differentiable objective but got "
                            + config.getObjective().getName()
                            + ".");
        }
        if (config.getObjective() == ObjectiveKind.LASSO || config.hasL1Penalty()) {
            throw new ConfigException("Newton-Raphson does not support an L1 penalty.");
        }
        if (config.getDimension() > TaskConfig.MAX_DENSE_DIMENSION) {
            throw new SizeLimitException(
                    String.format(
                            "A dense Hessian supports at most %d features but got %d.",
                            TaskConfig.MAX_DENSE_DIMENSION, config.getDimension()));
        }
        if (!(maxConditionNumber > 0)) {
            throw new ConfigException(
                    "The max condition number must be positive but is "
                            + maxConditionNumber
                            + ".");
        }
        this.maxConditionNumber = maxConditionNumber;
    }

    public double getMaxConditionNumber() {
        return maxConditionNumber;
    }

    @Override
    protected Accumulator createAlgorithmAccumulator(Accumulator previousAlgo) {
        return objective.requiresOrderedInput()
                ? new RiskSetAccumulator(config.getDimension())
                : new NewtonAccumulator(config.getDimension());
    }

    @Override
    protected void transition(AccumulatorState state, LabeledPoint point) {
        DenseVector model = state.mutableModel();
        if (state.getAlgo() instanceof RiskSetAccumulator) {
            ((RiskSetAccumulator) state.getAlgo()).add(point, model);
            return;
        }
        NewtonAccumulator acc = (NewtonAccumulator) state.getAlgo();
        DenseVector gradient = new DenseVector(model.size());
        objective.computeGradient(point, model, gradient);
        checkFinite(gradient, "gradient");
        double loss = objective.computeLoss(point, model);
        checkFinite(loss, "loss");
        BLAS.axpy(1.0, gradient, acc.gradient);
        acc.loss += loss;
        objective.computeHessian(point, model, acc.hessian);
    }

    @Override
    protected void mergeAlgorithm(AccumulatorState target, AccumulatorState other) {
        if (target.getAlgo() instanceof RiskSetAccumulator) {
            throw new IllegalStateException(
                    "Risk-set sums of two populated partitions cannot be merged.");
        }
        ((NewtonAccumulator) target.getAlgo()).addSums((NewtonAccumulator) other.getAlgo());
    }

    @Override
    protected void finalizeState(AccumulatorState state) {
        NewtonAccumulator acc = (NewtonAccumulator) state.getAlgo();
        if (acc instanceof RiskSetAccumulator) {
            ((RiskSetAccumulator) acc).flush();
        }
        DenseVector model = state.mutableModel();
        int n = model.size();
        double l2 = config.getReg() * (1 - config.getElasticNet());
        DenseVector gradient = acc.gradient;
        DenseMatrix hessian = acc.hessian;
        double norm = BLAS.norm2(model);
        double loss = acc.loss + l2 / 2 * norm * norm;
        if (l2 > 0) {
            BLAS.axpy(l2, model, gradient);
            for (int i = 0; i < n; i++) {
                hessian.add(i, i, l2);
            }
        }
        checkFinite(loss, "loss");
        checkFinite(gradient, "gradient");
        checkFinite(new DenseVector(hessian.values), "Hessian");

        double[] eigenvalues = SymmetricMatrixSolver.eigenvalues(hessian);
        if (eigenvalues[0] <= 0) {
            throw new NumericException(
                    "The Hessian is not positive definite, its smallest eigenvalue is "
                            + eigenvalues[0]
                            + ".");
        }
        double conditionNumber = SymmetricMatrixSolver.conditionNumber(eigenvalues);
        if (conditionNumber > maxConditionNumber) {
            throw new NumericException(
                    String.format(
                            "The Hessian is ill-conditioned: condition number %s exceeds %s.",
                            conditionNumber, maxConditionNumber));
        }
        LOG.debug("Hessian condition number {}.", conditionNumber);

        DenseVector delta = SymmetricMatrixSolver.solve(hessian, gradient);
        BLAS.axpy(-1.0, delta, model);
        checkFinite(model, "model");
        DenseVector inverseDiagonal = SymmetricMatrixSolver.inverse(hessian).diagonal();
        System.arraycopy(
                inverseDiagonal.values, 0, acc.inverseHessianDiagonal.values, 0, n);
        acc.conditionNumber = conditionNumber;

        state.setLoss(loss);
        state.setGradientNorm(BLAS.norm2(gradient));
        state.setIteration(state.getIteration() + 1);
    }
}
