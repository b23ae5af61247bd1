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

import org.apache.flink.util.Preconditions;

import org.flinkglm.common.optimizer.AccumulatorState;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** A {@link StateStore} holding copies of the states in memory. */
public class InMemoryStateStore implements StateStore {
    private final TreeMap<Integer, AccumulatorState> states = new TreeMap<>();

    @Override
    public synchronized void put(int iteration, AccumulatorState state) {
        Preconditions.checkArgument(iteration > 0, "Iterations start at 1.");
        states.put(iteration, state.copy());
    }

    @Override
    public synchronized Optional<AccumulatorState> get(int iteration) {
        return Optional.ofNullable(states.get(iteration)).map(AccumulatorState::copy);
    }

    @Override
    public synchronized int latestIteration() {
        Map.Entry<Integer, AccumulatorState> last = states.lastEntry();
        return last == null ? 0 : last.getKey();
    }
}
