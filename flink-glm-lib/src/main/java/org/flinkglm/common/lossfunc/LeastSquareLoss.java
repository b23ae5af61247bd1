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

/**
 * The loss function for least square loss. Ridge and LASSO regression share it and differ only in
 * the penalty applied by the optimizer.
 */
public class LeastSquareLoss implements Objective {
    public static final LeastSquareLoss RIDGE = new LeastSquareLoss(ObjectiveKind.RIDGE);

    public static final LeastSquareLoss LASSO = new LeastSquareLoss(ObjectiveKind.LASSO);

    private final ObjectiveKind kind;

    private LeastSquareLoss(ObjectiveKind kind) {
        this.kind = kind;
    }

    @Override
    public ObjectiveKind getKind() {
        return kind;
    }

    @Override
    public double computeLoss(LabeledPoint dataPoint, DenseVector coefficient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        return dataPoint.getWeight() * 0.5 * Math.pow(dot - dataPoint.getLabel(), 2);
    }

    @Override
    public void computeGradient(
            LabeledPoint dataPoint, DenseVector coefficient, DenseVector cumGradient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        BLAS.axpy(
                (dot - dataPoint.getLabel()) * dataPoint.getWeight(),
                dataPoint.getFeatures(),
                cumGradient);
    }

    @Override
    public boolean supportsHessian() {
        return true;
    }

    @Override
    public void computeHessian(
            LabeledPoint dataPoint, DenseVector coefficient, DenseMatrix cumHessian) {
        BLAS.rankOneUpdate(dataPoint.getWeight(), dataPoint.getFeatures(), cumHessian);
    }

    @Override
    public double predict(DenseVector coefficient, DenseVector features) {
        return BLAS.dot(features, coefficient);
    }
}
