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

import org.flinkglm.param.DoubleParam;
import org.flinkglm.param.Param;
import org.flinkglm.param.ParamValidators;
import org.flinkglm.param.WithParams;

/**
 * Interface for the shared tolerance param. The iterations stop once the relative change of the
 * loss between two iterations is smaller than it.
 */
public interface HasTol<T> extends WithParams<T> {
    Param<Double> TOL =
            new DoubleParam(
                    "tol",
                    "Convergence tolerance on the relative change of the loss.",
                    1e-6,
                    ParamValidators.gtEq(0));

    default double getTol() {
        return get(TOL);
    }

    default T setTol(Double value) {
        return set(TOL, value);
    }
}
