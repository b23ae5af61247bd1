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

package org.flinkglm.common.optimizer.typeinfo;

import org.apache.flink.api.common.typeutils.SimpleTypeSerializerSnapshot;
import org.apache.flink.api.common.typeutils.TypeSerializerSnapshot;
import org.apache.flink.api.common.typeutils.base.TypeSerializerSingleton;
import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;

import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.BestBallResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Specialized serializer for {@link BestBallResult}: the best index, then the candidates. */
public final class BestBallResultSerializer extends TypeSerializerSingleton<BestBallResult> {

    private static final long serialVersionUID = 1L;

    public static final BestBallResultSerializer INSTANCE = new BestBallResultSerializer();

    @Override
    public boolean isImmutableType() {
        return false;
    }

    @Override
    public BestBallResult createInstance() {
        return BestBallResult.empty();
    }

    @Override
    public BestBallResult copy(BestBallResult from) {
        List<AccumulatorState> candidates = new ArrayList<>();
        for (AccumulatorState candidate : from.getCandidates()) {
            candidates.add(candidate.copy());
        }
        return new BestBallResult(candidates, from.getBestIndex());
    }

    @Override
    public BestBallResult copy(BestBallResult from, BestBallResult reuse) {
        return copy(from);
    }

    @Override
    public int getLength() {
        return -1;
    }

    @Override
    public void serialize(BestBallResult result, DataOutputView target) throws IOException {
        target.writeInt(result.getBestIndex());
        target.writeInt(result.getCandidates().size());
        for (AccumulatorState candidate : result.getCandidates()) {
            AccumulatorStateSerializer.INSTANCE.serialize(candidate, target);
        }
    }

    @Override
    public BestBallResult deserialize(DataInputView source) throws IOException {
        int bestIndex = source.readInt();
        int size = source.readInt();
        List<AccumulatorState> candidates = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            candidates.add(AccumulatorStateSerializer.INSTANCE.deserialize(source));
        }
        return new BestBallResult(candidates, bestIndex);
    }

    @Override
    public BestBallResult deserialize(BestBallResult reuse, DataInputView source)
            throws IOException {
        return deserialize(source);
    }

    @Override
    public void copy(DataInputView source, DataOutputView target) throws IOException {
        serialize(deserialize(source), target);
    }

    // ------------------------------------------------------------------------

    @Override
    public TypeSerializerSnapshot<BestBallResult> snapshotConfiguration() {
        return new BestBallResultSerializerSnapshot();
    }

    /** Serializer configuration snapshot for compatibility and format evolution. */
    @SuppressWarnings("WeakerAccess")
    public static final class BestBallResultSerializerSnapshot
            extends SimpleTypeSerializerSnapshot<BestBallResult> {

        public BestBallResultSerializerSnapshot() {
            super(() -> INSTANCE);
        }
    }
}
