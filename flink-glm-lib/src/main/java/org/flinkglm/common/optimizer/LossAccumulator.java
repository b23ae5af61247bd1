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

/** Sums the loss of a fixed model. Used to score candidate models. */
public class LossAccumulator extends Accumulator {
    private static final long serialVersionUID = 1L;

    public double loss;

    public LossAccumulator() {}

    public LossAccumulator(double loss) {
        this.loss = loss;
    }

    @Override
    public AccumulatorType getType() {
        return AccumulatorType.LOSS;
    }

    @Override
    public LossAccumulator copy() {
        return new LossAccumulator(loss);
    }

    @Override
    public void serialize(DataOutputView target) throws IOException {
        target.writeDouble(loss);
    }

    static LossAccumulator deserialize(DataInputView source) throws IOException {
        return new LossAccumulator(source.readDouble());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LossAccumulator
                && Double.compare(((LossAccumulator) o).loss, loss) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(loss);
    }
}
