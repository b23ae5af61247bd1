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
import org.flinkglm.linalg.DenseVector;

/**
 * The loss function for hinge loss. Any label above zero is the positive class.
 *
 * <p>See https://en.wikipedia.org/wiki/Hinge_loss.
 */
public class HingeLoss implements Objective {
    public static final HingeLoss INSTANCE = new HingeLoss();

    private HingeLoss() {}

    @Override
    public ObjectiveKind getKind() {
        return ObjectiveKind.SVM;
    }

    @Override
    public double computeLoss(LabeledPoint dataPoint, DenseVector coefficient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        double labelScaled = Objectives.scaleLabel(dataPoint.getLabel());
        return dataPoint.getWeight() * Math.max(0, 1 - labelScaled * dot);
    }

    @Override
    public void computeGradient(
            LabeledPoint dataPoint, DenseVector coefficient, DenseVector cumGradient) {
        double dot = BLAS.dot(dataPoint.getFeatures(), coefficient);
        double labelScaled = Objectives.scaleLabel(dataPoint.getLabel());
        // A margin of exactly one contributes no subgradient.
        if (1 - labelScaled * dot > 0) {
            BLAS.axpy(-labelScaled * dataPoint.getWeight(), dataPoint.getFeatures(), cumGradient);
        }
    }

    @Override
    public double predict(DenseVector coefficient, DenseVector features) {
        return BLAS.dot(features, coefficient) > 0 ? 1.0 : 0.0;
    }
}
