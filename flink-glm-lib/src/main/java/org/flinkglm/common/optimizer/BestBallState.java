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

import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The accumulator of a {@link BestBall} pass: one {@link AccumulatorState} per candidate, in
 * candidate order, sharing one example stream. A candidate that raised a numeric error is
 * disqualified and keeps an empty state.
 */
public class BestBallState implements Serializable {
    private static final long serialVersionUID = 1L;

    private final List<AccumulatorState> states;

    private final boolean[] disqualified;

    private boolean populated;

    public BestBallState(List<AccumulatorState> states, boolean[] disqualified, boolean populated) {
        Preconditions.checkArgument(
                states.size() == disqualified.length,
                "Got %s states but %s disqualification flags.",
                states.size(),
                disqualified.length);
        this.states = new ArrayList<>(states);
        this.disqualified = disqualified;
        this.populated = populated;
    }

    /** Creates an unpopulated state of numCandidates empty sub-states. */
    public static BestBallState empty(int numCandidates) {
        return new BestBallState(
                Collections.nCopies(numCandidates, AccumulatorState.empty()),
                new boolean[numCandidates],
                false);
    }

    public int size() {
        return states.size();
    }

    public AccumulatorState getState(int index) {
        return states.get(index);
    }

    void setState(int index, AccumulatorState state) {
        states.set(index, state);
    }

    public boolean isDisqualified(int index) {
        return disqualified[index];
    }

    void disqualify(int index) {
        disqualified[index] = true;
        states.set(index, AccumulatorState.empty());
    }

    /** Whether at least one example has been added. */
    public boolean isPopulated() {
        return populated;
    }

    void setPopulated(boolean populated) {
        this.populated = populated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BestBallState)) {
            return false;
        }
        BestBallState that = (BestBallState) o;
        return populated == that.populated
                && states.equals(that.states)
                && Arrays.equals(disqualified, that.disqualified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, Arrays.hashCode(disqualified), populated);
    }

    @Override
    public String toString() {
        return "BestBallState{populated="
                + populated
                + ", disqualified="
                + Arrays.toString(disqualified)
                + ", states="
                + states
                + '}';
    }
}
