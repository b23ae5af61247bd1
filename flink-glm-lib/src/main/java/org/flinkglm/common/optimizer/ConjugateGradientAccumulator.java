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

import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.typeinfo.DenseVectorSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * Sums the gradient and the loss at the fixed model of a conjugate gradient pass. The search
 * direction and the gradient of the previous pass are carried over to compute the next direction.
 */
public class ConjugateGradientAccumulator extends Accumulator {
    private static final long serialVersionUID = 1L;

    public final DenseVector gradient;

    public double loss;

    /** Whether {@link #direction} and {@link #previousGradient} hold values of an earlier pass. */
    public boolean hasDirection;

    public final DenseVector direction;

    public final DenseVector previousGradient;

    public ConjugateGradientAccumulator(int dimension) {
        this(
                new DenseVector(dimension),
                0,
                false,
                new DenseVector(dimension),
                new DenseVector(dimension));
    }

    public ConjugateGradientAccumulator(
            DenseVector gradient,
            double loss,
            boolean hasDirection,
            DenseVector direction,
            DenseVector previousGradient) {
        this.gradient = gradient;
        this.loss = loss;
        this.hasDirection = hasDirection;
        this.direction = direction;
        this.previousGradient = previousGradient;
    }

    @Override
    public AccumulatorType getType() {
        return AccumulatorType.CONJUGATE_GRADIENT;
    }

    @Override
    public ConjugateGradientAccumulator copy() {
        return new ConjugateGradientAccumulator(
                gradient.clone(),
                loss,
                hasDirection,
                direction.clone(),
                previousGradient.clone());
    }

    @Override
    public void serialize(DataOutputView target) throws IOException {
        DenseVectorSerializer.writeDoubles(gradient.values, target);
        target.writeDouble(loss);
        target.writeBoolean(hasDirection);
        DenseVectorSerializer.writeDoubles(direction.values, target);
        DenseVectorSerializer.writeDoubles(previousGradient.values, target);
    }

    static ConjugateGradientAccumulator deserialize(int dimension, DataInputView source)
            throws IOException {
        ConjugateGradientAccumulator acc = new ConjugateGradientAccumulator(dimension);
        DenseVectorSerializer.readDoubles(acc.gradient.values, source);
        acc.loss = source.readDouble();
        acc.hasDirection = source.readBoolean();
        DenseVectorSerializer.readDoubles(acc.direction.values, source);
        DenseVectorSerializer.readDoubles(acc.previousGradient.values, source);
        return acc;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ConjugateGradientAccumulator)) {
            return false;
        }
        ConjugateGradientAccumulator that = (ConjugateGradientAccumulator) o;
        return Double.compare(that.loss, loss) == 0
                && hasDirection == that.hasDirection
                && gradient.equals(that.gradient)
                && direction.equals(that.direction)
                && previousGradient.equals(that.previousGradient);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gradient, loss, hasDirection, direction, previousGradient);
    }
}
