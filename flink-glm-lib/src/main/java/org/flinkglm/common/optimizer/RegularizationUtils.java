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

import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseVector;

/**
 * A utility class for algorithms that need to handle regularization. The regularization term is
 * defined as:
 *
 * <p>elasticNet * reg * norm1(coefficient) + (1 - elasticNet) * (reg/2) * (norm2(coefficient))^2
 */
class RegularizationUtils {

    /**
     * Regularizes the model coefficient with one proximal step: the L2 part shrinks each entry by
     * the factor (1 - learningRate * (1 - elasticNet) * reg) and the L1 part soft-thresholds it by
     * learningRate * elasticNet * reg. Entries never cross zero.
     *
     * @param coefficient The model coefficient, updated in place.
     * @param reg The reg param.
     * @param elasticNet The elasticNet param.
     * @param learningRate The learningRate param.
     * @return The regularization loss of the coefficient before the update.
     */
    static double regularize(
            DenseVector coefficient,
            final double reg,
            final double elasticNet,
            final double learningRate) {
        if (Double.compare(reg, 0) == 0) {
            return 0;
        }
        double loss = regularizationLoss(coefficient, reg, elasticNet);
        double shrink = Math.max(0, 1 - learningRate * (1 - elasticNet) * reg);
        double threshold = learningRate * elasticNet * reg;
        double[] values = coefficient.values;
        for (int i = 0; i < values.length; i++) {
            double magnitude = Math.max(0, Math.abs(values[i]) * shrink - threshold);
            values[i] = Math.signum(values[i]) * magnitude;
        }
        return loss;
    }

    /** Computes the regularization term of the given coefficient. */
    static double regularizationLoss(
            DenseVector coefficient, final double reg, final double elasticNet) {
        if (Double.compare(reg, 0) == 0) {
            return 0;
        }
        double norm2 = BLAS.norm2(coefficient);
        return elasticNet * reg * BLAS.asum(coefficient)
                + (1 - elasticNet) * reg / 2 * norm2 * norm2;
    }

    /**
     * Adds the gradient of the regularization term to cumGradient. The L1 part contributes its
     * subgradient elasticNet * reg * sign(c_i), which is zero at c_i = 0.
     */
    static void addRegularizationGradient(
            DenseVector coefficient,
            final double reg,
            final double elasticNet,
            DenseVector cumGradient) {
        if (Double.compare(reg, 0) == 0) {
            return;
        }
        double[] values = coefficient.values;
        for (int i = 0; i < values.length; i++) {
            cumGradient.values[i] +=
                    elasticNet * reg * Math.signum(values[i])
                            + (1 - elasticNet) * reg * values[i];
        }
    }
}
