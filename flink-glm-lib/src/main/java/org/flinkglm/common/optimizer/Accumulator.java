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

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;

import java.io.IOException;
import java.io.Serializable;

/**
 * The algorithm-specific part of an {@link AccumulatorState}: the partial sums of one pass, plus
 * whatever the algorithm carries from one pass to the next.
 */
public abstract class Accumulator implements Serializable {
    private static final long serialVersionUID = 1L;

    /** The tag identifying the concrete accumulator in the serialized layout. */
    public abstract AccumulatorType getType();

    /** Returns a deep copy. */
    public abstract Accumulator copy();

    /** Writes the values of this accumulator, without its tag. */
    public abstract void serialize(DataOutputView target) throws IOException;

    /** Reads an accumulator of the given type written by {@link #serialize}. */
    public static Accumulator deserialize(
            AccumulatorType type, int dimension, DataInputView source) throws IOException {
        switch (type) {
            case LOSS:
                return LossAccumulator.deserialize(source);
            case IGD:
                return IgdAccumulator.deserialize(dimension, source);
            case CONJUGATE_GRADIENT:
                return ConjugateGradientAccumulator.deserialize(dimension, source);
            case NEWTON:
                return NewtonAccumulator.deserialize(dimension, source);
            case RISK_SET:
                return RiskSetAccumulator.deserialize(dimension, source);
            default:
                throw new IOException("Unknown accumulator type " + type);
        }
    }
}
