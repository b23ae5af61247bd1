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

import org.flinkglm.exception.ConfigException;

/** Selects the {@link Objective} implementing an {@link ObjectiveKind}. */
public class Objectives {

    public static Objective get(ObjectiveKind kind) {
        if (kind == null) {
            throw new ConfigException("The objective kind must be set.");
        }
        switch (kind) {
            case SVM:
                return HingeLoss.INSTANCE;
            case LOGISTIC:
                return BinaryLogisticLoss.INSTANCE;
            case RIDGE:
                return LeastSquareLoss.RIDGE;
            case LASSO:
                return LeastSquareLoss.LASSO;
            case COX:
                return CoxPartialLikelihood.INSTANCE;
            default:
                throw new ConfigException("Unsupported objective kind: " + kind);
        }
    }

    /** Maps a label to +1 for the positive class (label > 0) and to -1 otherwise. */
    static double scaleLabel(double label) {
        return label > 0 ? 1.0 : -1.0;
    }
}
