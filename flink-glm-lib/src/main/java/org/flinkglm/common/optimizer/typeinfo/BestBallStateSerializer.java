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
import org.flinkglm.common.optimizer.BestBallState;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Specialized serializer for {@link BestBallState}: a marker byte (0 for an unpopulated state, 1
 * for a populated one), the number of candidates, then per candidate its disqualification flag and
 * its {@link AccumulatorState}.
 */
public final class BestBallStateSerializer extends TypeSerializerSingleton<BestBallState> {

    private static final long serialVersionUID = 1L;

    public static final BestBallStateSerializer INSTANCE = new BestBallStateSerializer();

    @Override
    public boolean isImmutableType() {
        return false;
    }

    @Override
    public BestBallState createInstance() {
        return BestBallState.empty(0);
    }

    @Override
    public BestBallState copy(BestBallState from) {
        List<AccumulatorState> states = new ArrayList<>(from.size());
        boolean[] disqualified = new boolean[from.size()];
        for (int i = 0; i < from.size(); i++) {
            states.add(from.getState(i).copy());
            disqualified[i] = from.isDisqualified(i);
        }
        return new BestBallState(states, disqualified, from.isPopulated());
    }

    @Override
    public BestBallState copy(BestBallState from, BestBallState reuse) {
        return copy(from);
    }

    @Override
    public int getLength() {
        return -1;
    }

    @Override
    public void serialize(BestBallState state, DataOutputView target) throws IOException {
        target.writeByte(state.isPopulated() ? 1 : 0);
        target.writeInt(state.size());
        for (int i = 0; i < state.size(); i++) {
            target.writeBoolean(state.isDisqualified(i));
            AccumulatorStateSerializer.INSTANCE.serialize(state.getState(i), target);
        }
    }

    @Override
    public BestBallState deserialize(DataInputView source) throws IOException {
        boolean populated = source.readByte() == 1;
        int size = source.readInt();
        List<AccumulatorState> states = new ArrayList<>(size);
        boolean[] disqualified = new boolean[size];
        for (int i = 0; i < size; i++) {
            disqualified[i] = source.readBoolean();
            states.add(AccumulatorStateSerializer.INSTANCE.deserialize(source));
        }
        return new BestBallState(states, disqualified, populated);
    }

    @Override
    public BestBallState deserialize(BestBallState reuse, DataInputView source)
            throws IOException {
        return deserialize(source);
    }

    @Override
    public void copy(DataInputView source, DataOutputView target) throws IOException {
        serialize(deserialize(source), target);
    }

    // ------------------------------------------------------------------------

    @Override
    public TypeSerializerSnapshot<BestBallState> snapshotConfiguration() {
        return new BestBallStateSerializerSnapshot();
    }

    /** Serializer configuration snapshot for compatibility and format evolution. */
    @SuppressWarnings("WeakerAccess")
    public static final class BestBallStateSerializerSnapshot
            extends SimpleTypeSerializerSnapshot<BestBallState> {

        public BestBallStateSerializerSnapshot() {
            super(() -> INSTANCE);
        }
    }
}
