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

import org.flinkglm.common.lossfunc.Objective;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.lossfunc.Objectives;
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.iteration.StopReason;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseVector;

import java.io.Serializable;

/** A fitted generalized linear model. */
public class GlmModel implements Serializable {
    private static final long serialVersionUID = 1L;

    private final ObjectiveKind objective;

    private final DenseVector coefficients;

    private final double loss;

    private final int iterations;

    private final StopReason stopReason;

    private final NewtonSummary newtonSummary;

    public GlmModel(
            ObjectiveKind objective,
            DenseVector coefficients,
            double loss,
            int iterations,
            StopReason stopReason,
            NewtonSummary newtonSummary) {
        this.objective = Preconditions.checkNotNull(objective);
        this.coefficients = Preconditions.checkNotNull(coefficients);
        this.loss = loss;
        this.iterations = iterations;
        this.stopReason = stopReason;
        this.newtonSummary = newtonSummary;
    }

    public ObjectiveKind getObjective() {
        return objective;
    }

    public DenseVector getCoefficients() {
        return coefficients;
    }

    /** The loss reported by the last iteration. */
    public double getLoss() {
        return loss;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return stopReason == StopReason.CONVERGED;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    /** The Wald statistics of a Newton-Raphson fit, or null for the other methods. */
    public NewtonSummary getNewtonSummary() {
        return newtonSummary;
    }

    /** Predicts a class for the classifiers and a score for the other objectives. */
    public double predict(DenseVector features) {
        checkDimension(features);
        Objective func = Objectives.get(objective);
        return func.predict(coefficients, features);
    }

    /** Returns the linear predictor coefficients * features. */
    public double predictRaw(DenseVector features) {
        checkDimension(features);
        return BLAS.dot(coefficients, features);
    }

    private void checkDimension(DenseVector features) {
        if (features.size() != coefficients.size()) {
            throw new DimensionMismatchException(coefficients.size(), features.size());
        }
    }

    @Override
    public String toString() {
        return "GlmModel{objective="
                + objective.getName()
                + ", coefficients="
                + coefficients
                + ", loss="
                + loss
                + ", iterations="
                + iterations
                + ", stopReason="
                + stopReason
                + '}';
    }
}
