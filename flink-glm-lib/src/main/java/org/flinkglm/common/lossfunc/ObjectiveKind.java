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

import java.util.Locale;

/** The model families that can be fitted. */
public enum ObjectiveKind {
    /** Linear support vector machine with hinge loss. */
    SVM,
    /** Binary logistic regression. */
    LOGISTIC,
    /** Least squares with L2 penalty. */
    RIDGE,
    /** Least squares with L1 penalty. */
    LASSO,
    /** Cox proportional hazards with Breslow ties. */
    COX;

    /** Parses a case-insensitive kind name such as "svm" or "logistic". */
    public static ObjectiveKind fromName(String name) {
        if (name != null) {
            for (ObjectiveKind kind : values()) {
                if (kind.name().equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
        }
        throw new ConfigException("Unknown objective kind: " + name);
    }

    /** The lower-case name used by parameters. */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
