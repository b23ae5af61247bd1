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

package org.flinkglm.iteration.store;

import org.flinkglm.common.optimizer.AccumulatorState;

import java.io.IOException;
import java.util.Optional;

/** Keeps the finalized state of every iteration, keyed by iteration number starting at 1. */
public interface StateStore {

    void put(int iteration, AccumulatorState state) throws IOException;

    Optional<AccumulatorState> get(int iteration) throws IOException;

    /** The largest iteration stored, or 0 if the store is empty. */
    int latestIteration() throws IOException;

    default Optional<AccumulatorState> latest() throws IOException {
        int iteration = latestIteration();
        return iteration == 0 ? Optional.empty() : get(iteration);
    }
}
