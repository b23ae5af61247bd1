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

import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseMatrix;
import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.typeinfo.DenseVectorSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * Sums the gradient, the dense Hessian and the loss at the fixed model of a Newton pass. Finalize
 * adds the condition number of the Hessian and the diagonal of its inverse.
 */
public class NewtonAccumulator extends Accumulator {
    private static final long serialVersionUID = 1L;

    public final DenseVector gradient;

    /** Column-major D x D. */
    public final DenseMatrix hessian;

    public double loss;

    /** NaN until finalized. */
    public double conditionNumber;

    /** Zeros until finalized. */
    public final DenseVector inverseHessianDiagonal;

    public NewtonAccumulator(int dimension) {
        this(
                new DenseVector(dimension),
                new DenseMatrix(dimension, dimension),
                0,
                Double.NaN,
                new DenseVector(dimension));
    }

    public NewtonAccumulator(
            DenseVector gradient,
            DenseMatrix hessian,
            double loss,
            double conditionNumber,
            DenseVector inverseHessianDiagonal) {
        this.gradient = gradient;
        this.hessian = hessian;
        this.loss = loss;
        this.conditionNumber = conditionNumber;
        this.inverseHessianDiagonal = inverseHessianDiagonal;
    }

    @Override
    public AccumulatorType getType() {
        return AccumulatorType.NEWTON;
    }

    @Override
    public NewtonAccumulator copy() {
        return new NewtonAccumulator(
                gradient.clone(),
                hessian.clone(),
                loss,
                conditionNumber,
                inverseHessianDiagonal.clone());
    }

    /** Adds the sums of another accumulator of the same dimension. */
    void addSums(NewtonAccumulator other) {
        BLAS.axpy(1.0, other.gradient, gradient);
        BLAS.axpy(1.0, other.hessian, hessian);
        loss += other.loss;
    }

    @Override
    public void serialize(DataOutputView target) throws IOException {
        DenseVectorSerializer.writeDoubles(gradient.values, target);
        DenseVectorSerializer.writeDoubles(hessian.values, target);
        target.writeDouble(loss);
        target.writeDouble(conditionNumber);
        DenseVectorSerializer.writeDoubles(inverseHessianDiagonal.values, target);
    }

    /** Reads the values written by {@link NewtonAccumulator#serialize} into this accumulator. */
    void readNewtonValues(DataInputView source) throws IOException {
        DenseVectorSerializer.readDoubles(gradient.values, source);
        DenseVectorSerializer.readDoubles(hessian.values, source);
        loss = source.readDouble();
        conditionNumber = source.readDouble();
        DenseVectorSerializer.readDoubles(inverseHessianDiagonal.values, source);
    }

    static NewtonAccumulator deserialize(int dimension, DataInputView source) throws IOException {
        NewtonAccumulator acc = new NewtonAccumulator(dimension);
        acc.readNewtonValues(source);
        return acc;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        NewtonAccumulator that = (NewtonAccumulator) o;
        return Double.compare(that.loss, loss) == 0
                && Double.compare(that.conditionNumber, conditionNumber) == 0
                && gradient.equals(that.gradient)
                && hessian.equals(that.hessian)
                && inverseHessianDiagonal.equals(that.inverseHessianDiagonal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gradient, hessian, loss, conditionNumber, inverseHessianDiagonal);
    }
}
