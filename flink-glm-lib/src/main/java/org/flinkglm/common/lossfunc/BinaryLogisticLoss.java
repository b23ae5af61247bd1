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

package org.flinkglm.common.lossfunc;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseMatrix;
import org.flinkglm.linalg.DenseVector;

/** The loss function for binary logistic loss. Any label above zero is the positive class. */
public class BinaryLogisticLoss implements Objective {
    public static final BinaryLogisticLoss INSTANCE = new BinaryLogisticLoss();

    private BinaryLogisticLoss() {}

    @Override
    public ObjectiveKind getKind() {
        return ObjectiveKind.LOGISTIC;
    }

    @Override
    public double computeLoss(LabeledPoint dataPoint, DenseVector coefficient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        double margin = dot * Objectives.scaleLabel(dataPoint.getLabel());
        // log(1 + exp(-margin)) without overflowing for large negative margins.
        double loss =
                margin >= 0
                        ? Math.log1p(Math.exp(-margin))
                        : -margin + Math.log1p(Math.exp(margin));
        return dataPoint.getWeight() * loss;
    }

    @Override
    public void computeGradient(
            LabeledPoint dataPoint, DenseVector coefficient, DenseVector cumGradient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        double labelScaled = Objectives.scaleLabel(dataPoint.getLabel());
        double multiplier =
                dataPoint.getWeight() * (-labelScaled / (Math.exp(dot * labelScaled) + 1));
        BLAS.axpy(multiplier, dataPoint.getFeatures(), cumGradient);
    }

    @Override
    public boolean supportsHessian() {
        return true;
    }

    @Override
    public void computeHessian(
            LabeledPoint dataPoint, DenseVector coefficient, DenseMatrix cumHessian) {
        double p = sigmoid(BLAS.dot(dataPoint.getFeatures(), coefficient));
        BLAS.rankOneUpdate(
                dataPoint.getWeight() * p * (1 - p), dataPoint.getFeatures(), cumHessian);
    }

    @Override
    public double predict(DenseVector coefficient, DenseVector features) {
        return sigmoid(BLAS.dot(features, coefficient)) > 0.5 ? 1.0 : 0.0;
    }

    static double sigmoid(double x) {
        if (x >= 0) {
            return 1 / (1 + Math.exp(-x));
        }
        double e = Math.exp(x);
        return e / (1 + e);
    }
}
