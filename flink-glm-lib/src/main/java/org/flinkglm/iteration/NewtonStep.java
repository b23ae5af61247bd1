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

package org.flinkglm.iteration;

import org.apache.flink.util.Preconditions;

import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.NewtonRaphson;
import org.flinkglm.common.optimizer.TaskConfig;

/** One Newton-Raphson pass. */
public class NewtonStep implements IterationStep {
    private final TaskConfig config;

    private final double maxConditionNumber;

    public NewtonStep(TaskConfig config) {
        this(config, NewtonRaphson.DEFAULT_MAX_CONDITION_NUMBER);
    }

    public NewtonStep(TaskConfig config, double maxConditionNumber) {
        this.config = Preconditions.checkNotNull(config);
        this.maxConditionNumber = maxConditionNumber;
    }

    @Override
    public AccumulatorState run(AccumulatorState previous, PassRunner runner) throws Exception {
        return runner.runPass(new NewtonRaphson(config, previous, maxConditionNumber));
    }
}
