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
 * The negative Breslow partial log-likelihood of the Cox proportional hazards model. The label of
 * an example is its observed time and {@link LabeledPoint#isEvent()} tells whether a death was
 * observed at that time.
 *
 * <p>The partial likelihood couples every death with its risk set, the examples whose time is not
 * smaller. It is therefore not a sum of per-example terms: the loss, gradient and Hessian are only
 * available once a whole pass has been folded, in descending time order, into a risk-set
 * accumulator. Deaths whose times differ by less than {@link #TIE_TOLERANCE} share one risk set.
 */
public class CoxPartialLikelihood implements Objective {
    public static final CoxPartialLikelihood INSTANCE = new CoxPartialLikelihood();

    /** Deaths closer in time than this belong to the same tie group. */
    public static final double TIE_TOLERANCE = 1e-6;

    private CoxPartialLikelihood() {}

    @Override
    public ObjectiveKind getKind() {
        return ObjectiveKind.COX;
    }

    @Override
    public double computeLoss(LabeledPoint dataPoint, DenseVector coefficient) {
        throw new UnsupportedOperationException(
                "The partial likelihood has no per-example loss.");
    }

    @Override
    public void computeGradient(
            LabeledPoint dataPoint, DenseVector coefficient, DenseVector cumGradient) {
        throw new UnsupportedOperationException(
                "The partial likelihood has no per-example gradient.");
    }

    @Override
    public boolean supportsHessian() {
        return true;
    }

    @Override
    public boolean requiresOrderedInput() {
        return true;
    }

    /** Returns the linear predictor, the log of the hazard ratio. */
    @Override
    public double predict(DenseVector coefficient, DenseVector features) {
        return BLAS.dot(features, coefficient);
    }
}
