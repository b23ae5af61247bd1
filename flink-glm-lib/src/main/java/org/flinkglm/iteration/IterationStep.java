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

import org.flinkglm.common.optimizer.AccumulatorState;

/** One iteration of an optimization: one or more passes turning a state into the next one. */
public interface IterationStep {

    /**
     * Runs the iteration.
     *
     * @param previous The finalized state of the previous iteration, or null for the first one.
     * @param runner The runner replaying the examples.
     * @return The finalized state of this iteration, or an empty state if the passes saw no data.
     */
    AccumulatorState run(AccumulatorState previous, PassRunner runner) throws Exception;
}
