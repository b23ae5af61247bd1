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

import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.optimizer.Accumulator;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.AccumulatorType;
import org.flinkglm.common.optimizer.Phase;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.typeinfo.DenseVectorSerializer;

import java.io.IOException;

/**
 * Specialized serializer for {@link AccumulatorState}. The layout is the dimension, the phase, the
 * task configuration, the model, the iteration, the tagged accumulator, the row count, the loss
 * and the gradient norm. An empty state is written as dimension 0 followed by its phase.
 */
public final class AccumulatorStateSerializer extends TypeSerializerSingleton<AccumulatorState> {

    private static final long serialVersionUID = 1L;

    public static final AccumulatorStateSerializer INSTANCE = new AccumulatorStateSerializer();

    @Override
    public boolean isImmutableType() {
        return false;
    }

    @Override
    public AccumulatorState createInstance() {
        return AccumulatorState.empty();
    }

    @Override
    public AccumulatorState copy(AccumulatorState from) {
        return from.copy();
    }

    @Override
    public AccumulatorState copy(AccumulatorState from, AccumulatorState reuse) {
        return from.copy();
    }

    @Override
    public int getLength() {
        return -1;
    }

    @Override
    public void serialize(AccumulatorState state, DataOutputView target) throws IOException {
        if (state == null) {
            throw new IllegalArgumentException("The state must not be null.");
        }
        if (state.isEmpty()) {
            target.writeInt(0);
            target.writeByte(Phase.EMPTY.ordinal());
            return;
        }
        TaskConfig config = state.getConfig();
        target.writeInt(config.getDimension());
        target.writeByte(state.getPhase().ordinal());
        target.writeDouble(config.getStepSize());
        target.writeDouble(config.getReg());
        target.writeDouble(config.getElasticNet());
        target.writeInt(config.getObjective().ordinal());
        DenseVectorSerializer.writeDoubles(state.getModel().values, target);
        target.writeInt(state.getIteration());
        target.writeByte(state.getAlgo().getType().getTag());
        state.getAlgo().serialize(target);
        target.writeLong(state.getRowCount());
        target.writeDouble(state.getLoss());
        target.writeDouble(state.getGradientNorm());
    }

    @Override
    public AccumulatorState deserialize(DataInputView source) throws IOException {
        int dimension = source.readInt();
        Phase phase = Phase.values()[source.readByte()];
        if (phase == Phase.EMPTY) {
            return AccumulatorState.empty();
        }
        double stepSize = source.readDouble();
        double reg = source.readDouble();
        double elasticNet = source.readDouble();
        ObjectiveKind objective = ObjectiveKind.values()[source.readInt()];
        TaskConfig config = new TaskConfig(dimension, stepSize, reg, elasticNet, objective);
        DenseVector model = new DenseVector(dimension);
        DenseVectorSerializer.readDoubles(model.values, source);
        int iteration = source.readInt();
        AccumulatorType type = AccumulatorType.fromTag(source.readByte());
        Accumulator algo = Accumulator.deserialize(type, dimension, source);
        long rowCount = source.readLong();
        double loss = source.readDouble();
        double gradientNorm = source.readDouble();
        return new AccumulatorState(
                phase, config, model, iteration, algo, rowCount, loss, gradientNorm);
    }

    @Override
    public AccumulatorState deserialize(AccumulatorState reuse, DataInputView source)
            throws IOException {
        return deserialize(source);
    }

    @Override
    public void copy(DataInputView source, DataOutputView target) throws IOException {
        serialize(deserialize(source), target);
    }

    // ------------------------------------------------------------------------

    @Override
    public TypeSerializerSnapshot<AccumulatorState> snapshotConfiguration() {
        return new AccumulatorStateSerializerSnapshot();
    }

    /** Serializer configuration snapshot for compatibility and format evolution. */
    @SuppressWarnings("WeakerAccess")
    public static final class AccumulatorStateSerializerSnapshot
            extends SimpleTypeSerializerSnapshot<AccumulatorState> {

        public AccumulatorStateSerializerSnapshot() {
            super(() -> INSTANCE);
        }
    }
}
