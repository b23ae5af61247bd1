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

package org.flinkglm.glm;

import org.apache.flink.util.Preconditions;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.NewtonAccumulator;
import org.flinkglm.linalg.DenseVector;

/**
 * The Wald statistics of a model fitted by Newton-Raphson: per coefficient the standard error
 * sqrt(diag(H^-1)), the z statistic coefficient / se and the two-sided p-value 2 * Phi(-|z|),
 * plus the condition number of the Hessian.
 */
public class NewtonSummary {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    private final DenseVector standardErrors;

    private final DenseVector zStatistics;

    private final DenseVector pValues;

    private final double conditionNumber;

    public NewtonSummary(
            DenseVector standardErrors,
            DenseVector zStatistics,
            DenseVector pValues,
            double conditionNumber) {
        this.standardErrors = standardErrors;
        this.zStatistics = zStatistics;
        this.pValues = pValues;
        this.conditionNumber = conditionNumber;
    }

    /**
     * Computes the statistics of a fit.
     *
     * @param finalState The last finalized Newton state.
     * @param penultimateState The state before it, or null. When present, its Hessian gives the
     *     condition number. That Hessian was evaluated at the model two steps before the final
     *     coefficients.
     */
    public static NewtonSummary of(AccumulatorState finalState, AccumulatorState penultimateState) {
        Preconditions.checkArgument(
                finalState.getAlgo() instanceof NewtonAccumulator,
                "Expected a Newton state but got %s.",
                finalState);
        NewtonAccumulator acc = (NewtonAccumulator) finalState.getAlgo();
        DenseVector coefficients = finalState.getModel();
        int n = coefficients.size();
        DenseVector standardErrors = new DenseVector(n);
        DenseVector zStatistics = new DenseVector(n);
        DenseVector pValues = new DenseVector(n);
        for (int i = 0; i < n; i++) {
            double se = Math.sqrt(acc.inverseHessianDiagonal.get(i));
            double z = coefficients.get(i) / se;
            standardErrors.set(i, se);
            zStatistics.set(i, z);
            pValues.set(i, 2 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(z)));
        }
        double conditionNumber = acc.conditionNumber;
        if (penultimateState != null
                && penultimateState.getAlgo() instanceof NewtonAccumulator) {
            conditionNumber = ((NewtonAccumulator) penultimateState.getAlgo()).conditionNumber;
        }
        return new NewtonSummary(standardErrors, zStatistics, pValues, conditionNumber);
    }

    public DenseVector getStandardErrors() {
        return standardErrors;
    }

    public DenseVector getZStatistics() {
        return zStatistics;
    }

    public DenseVector getPValues() {
        return pValues;
    }

    public double getConditionNumber() {
        return conditionNumber;
    }

    @Override
    public String toString() {
        return "NewtonSummary{standardErrors="
                + standardErrors
                + ", zStatistics="
                + zStatistics
                + ", pValues="
                + pValues
                + ", conditionNumber="
                + conditionNumber
                + '}';
    }
}
