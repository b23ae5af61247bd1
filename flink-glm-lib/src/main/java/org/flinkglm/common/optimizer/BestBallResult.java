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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The result of a {@link BestBall} pass: the finalized state of every candidate, in candidate
 * order, and the index of the one with the smallest loss. Disqualified candidates are represented
 * by empty states. The result of a pass without data has no candidates and index -1.
 */
public class BestBallResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private final List<AccumulatorState> candidates;

    private final int bestIndex;

    public BestBallResult(List<AccumulatorState> candidates, int bestIndex) {
        Preconditions.checkArgument(
                bestIndex >= -1 && bestIndex < candidates.size(),
                "Best index %s out of range.",
                bestIndex);
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.bestIndex = bestIndex;
    }

    public static BestBallResult empty() {
        return new BestBallResult(Collections.emptyList(), -1);
    }

    public boolean isEmpty() {
        return bestIndex < 0;
    }

    public List<AccumulatorState> getCandidates() {
        return candidates;
    }

    public int getBestIndex() {
        return bestIndex;
    }

    /** Returns the winning state, or an empty state if the pass saw no data. */
    public AccumulatorState getBest() {
        return isEmpty() ? AccumulatorState.empty() : candidates.get(bestIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BestBallResult)) {
            return false;
        }
        BestBallResult that = (BestBallResult) o;
        return bestIndex == that.bestIndex && candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates, bestIndex);
    }

    @Override
    public String toString() {
        return "BestBallResult{bestIndex=" + bestIndex + ", candidates=" + candidates + '}';
    }
}
