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
 * Sums, along the trajectory of incremental gradient descent, the loss evaluated right after each
 * update and the gradient used by each update.
 */
public class IgdAccumulator extends Accumulator {
    private static final long serialVersionUID = 1L;

    public double loss;

    public final DenseVector gradient;

    public IgdAccumulator(int dimension) {
        this(0, new DenseVector(dimension));
    }

    public IgdAccumulator(double loss, DenseVector gradient) {
        this.loss = loss;
        this.gradient = gradient;
    }

    @Override
    public AccumulatorType getType() {
        return AccumulatorType.IGD;
    }

    @Override
    public IgdAccumulator copy() {
        return new IgdAccumulator(loss, gradient.clone());
    }

    @Override
    public void serialize(DataOutputView target) throws IOException {
        target.writeDouble(loss);
        DenseVectorSerializer.writeDoubles(gradient.values, target);
    }

    static IgdAccumulator deserialize(int dimension, DataInputView source) throws IOException {
        double loss = source.readDouble();
        DenseVector gradient = new DenseVector(dimension);
        DenseVectorSerializer.readDoubles(gradient.values, source);
        return new IgdAccumulator(loss, gradient);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IgdAccumulator)) {
            return false;
        }
        IgdAccumulator that = (IgdAccumulator) o;
        return Double.compare(that.loss, loss) == 0 && gradient.equals(that.gradient);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loss, gradient);
    }
}
