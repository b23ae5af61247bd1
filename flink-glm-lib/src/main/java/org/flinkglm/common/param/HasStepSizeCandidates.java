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

package org.flinkglm.common.param;

import org.flinkglm.param.DoubleArrayParam;
import org.flinkglm.param.Param;
import org.flinkglm.param.ParamValidators;
import org.flinkglm.param.WithParams;

/**
 * Interface for the shared step size candidates param. When non-empty, every iteration tries each
 * candidate and keeps the one with the smallest loss; otherwise the learning rate is used.
 */
public interface HasStepSizeCandidates<T> extends WithParams<T> {
    Param<Double[]> STEP_SIZE_CANDIDATES =
            new DoubleArrayParam(
                    "stepSizeCandidates",
                    "Candidate step sizes searched in every iteration.",
                    new Double[0],
                    ParamValidators.allGt(0));

    default Double[] getStepSizeCandidates() {
        return get(STEP_SIZE_CANDIDATES);
    }

    default T setStepSizeCandidates(Double... value) {
        return set(STEP_SIZE_CANDIDATES, value);
    }
}
