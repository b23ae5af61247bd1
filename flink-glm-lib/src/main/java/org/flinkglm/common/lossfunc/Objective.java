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
import org.flinkglm.linalg.DenseMatrix;
import org.flinkglm.linalg.DenseVector;

import java.io.Serializable;

/**
 * An objective computes the loss, gradient and, where the model family allows it, the Hessian of a
 * generalized linear model on one training example. Implementations are stateless.
 */
public interface Objective extends Serializable {

    /** The kind this objective implements. */
    ObjectiveKind getKind();

    /**
     * Computes the loss on the given data point.
     *
     * @param dataPoint A training data point.
     * @param coefficient The model parameters.
     * @return The loss of the input data.
     */
    double computeLoss(LabeledPoint dataPoint, DenseVector coefficient);

    /**
     * Computes the gradient on the given data point and adds the computed gradient to cumGradient.
     *
     * @param dataPoint A training data point.
     * @param coefficient The model parameters.
     * @param cumGradient The accumulated gradient.
     */
    void computeGradient(LabeledPoint dataPoint, DenseVector coefficient, DenseVector cumGradient);

    /** Whether {@link #computeHessian} is supported. */
    default boolean supportsHessian() {
        return false;
    }

    /**
     * Computes the Hessian on the given data point and adds it to cumHessian.
     *
     * @param dataPoint A training data point.
     * @param coefficient The model parameters.
     * @param cumHessian The accumulated Hessian.
     */
    default void computeHessian(
            LabeledPoint dataPoint, DenseVector coefficient, DenseMatrix cumHessian) {
        throw new UnsupportedOperationException(getKind() + " has no Hessian.");
    }

    /**
     * Whether the examples of a pass must be folded as a single partition sorted by descending
     * label. Objectives that return true cannot be evaluated one example at a time.
     */
    default boolean requiresOrderedInput() {
        return false;
    }

    /** Predicts the label of the given features: a class for classifiers, a score otherwise. */
    double predict(DenseVector coefficient, DenseVector features);
}
