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

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.CoxPartialLikelihood;
import org.flinkglm.linalg.BLAS;
import org.flinkglm.linalg.DenseMatrix;
import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.typeinfo.DenseVectorSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * Folds the Breslow partial likelihood of the Cox model into a {@link NewtonAccumulator}.
 *
 * <p>Examples must arrive in descending time. The running risk-set sums S0 = sum w*exp(eta), S1 =
 * sum w*exp(eta)*x and S2 = sum w*exp(eta)*x*x^T cover every example seen so far, that is every
 * example whose time is not smaller than the current one. Deaths sharing a time are collected into
 * a tie group, which is flushed into the loss, gradient and Hessian once all examples of that time
 * have entered the risk set.
 */
public class RiskSetAccumulator extends NewtonAccumulator {
    private static final long serialVersionUID = 1L;

    public double s0;

    public final DenseVector s1;

    public final DenseMatrix s2;

    /** The time of the current tie group, NaN before the first example. */
    public double tieTime;

    /** The summed weight of the deaths of the current tie group. */
    public double tieWeight;

    /** The weighted sum of the features of the deaths of the current tie group. */
    public final DenseVector tieSum;

    /** The weighted sum of the linear predictors of the deaths of the current tie group. */
    public double tieEta;

    /** The time of the last example added, NaN before the first example. */
    public double lastTime;

    public RiskSetAccumulator(int dimension) {
        super(dimension);
        this.s0 = 0;
        this.s1 = new DenseVector(dimension);
        this.s2 = new DenseMatrix(dimension, dimension);
        this.tieTime = Double.NaN;
        this.tieWeight = 0;
        this.tieSum = new DenseVector(dimension);
        this.tieEta = 0;
        this.lastTime = Double.NaN;
    }

    private RiskSetAccumulator(RiskSetAccumulator other) {
        super(
                other.gradient.clone(),
                other.hessian.clone(),
                other.loss,
                other.conditionNumber,
                other.inverseHessianDiagonal.clone());
        this.s0 = other.s0;
        this.s1 = other.s1.clone();
        this.s2 = other.s2.clone();
        this.tieTime = other.tieTime;
        this.tieWeight = other.tieWeight;
        this.tieSum = other.tieSum.clone();
        this.tieEta = other.tieEta;
        this.lastTime = other.lastTime;
    }

    @Override
    public AccumulatorType getType() {
        return AccumulatorType.RISK_SET;
    }

    @Override
    public RiskSetAccumulator copy() {
        return new RiskSetAccumulator(this);
    }

    /**
     * Adds one example evaluated at the given coefficients.
     *
     * @throws IllegalArgumentException if the time of the example is larger than the time of the
     *     previous example.
     */
    public void add(LabeledPoint point, DenseVector coefficient) {
        double time = point.getLabel();
        if (!Double.isNaN(lastTime) && time > lastTime + CoxPartialLikelihood.TIE_TOLERANCE) {
            throw new IllegalArgumentException(
                    String.format(
                            "Examples must arrive in descending time but %s follows %s.",
                            time, lastTime));
        }
        if (Double.isNaN(tieTime)
                || Math.abs(time - tieTime) >= CoxPartialLikelihood.TIE_TOLERANCE) {
            flush();
            tieTime = time;
        }
        lastTime = time;

        DenseVector x = point.getFeatures();
        double weight = point.getWeight();
        double eta = BLAS.dot(x, coefficient);
        double risk = weight * Math.exp(eta);
        s0 += risk;
        BLAS.axpy(risk, x, s1);
        BLAS.rankOneUpdate(risk, x, s2);

        if (point.isEvent()) {
            tieWeight += weight;
            BLAS.axpy(weight, x, tieSum);
            tieEta += weight * eta;
        }
    }

    /** Adds the pending tie group, if any, to the loss, gradient and Hessian. */
    public void flush() {
        if (tieWeight == 0) {
            return;
        }
        int n = s1.size();
        double d = tieWeight;
        loss += -tieEta + d * Math.log(s0);

        DenseVector mean = s1.clone();
        BLAS.scal(1.0 / s0, mean);
        BLAS.axpy(-1.0, tieSum, gradient);
        BLAS.axpy(d, mean, gradient);

        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                hessian.add(i, j, d * s2.get(i, j) / s0);
            }
        }
        BLAS.rankOneUpdate(-d, mean, hessian);

        tieWeight = 0;
        tieEta = 0;
        BLAS.scal(0, tieSum);
    }

    @Override
    public void serialize(DataOutputView target) throws IOException {
        super.serialize(target);
        target.writeDouble(s0);
        DenseVectorSerializer.writeDoubles(s1.values, target);
        DenseVectorSerializer.writeDoubles(s2.values, target);
        target.writeDouble(tieTime);
        target.writeDouble(tieWeight);
        DenseVectorSerializer.writeDoubles(tieSum.values, target);
        target.writeDouble(tieEta);
        target.writeDouble(lastTime);
    }

    static RiskSetAccumulator deserialize(int dimension, DataInputView source) throws IOException {
        RiskSetAccumulator acc = new RiskSetAccumulator(dimension);
        acc.readNewtonValues(source);
        acc.s0 = source.readDouble();
        DenseVectorSerializer.readDoubles(acc.s1.values, source);
        DenseVectorSerializer.readDoubles(acc.s2.values, source);
        acc.tieTime = source.readDouble();
        acc.tieWeight = source.readDouble();
        DenseVectorSerializer.readDoubles(acc.tieSum.values, source);
        acc.tieEta = source.readDouble();
        acc.lastTime = source.readDouble();
        return acc;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        RiskSetAccumulator that = (RiskSetAccumulator) o;
        return Double.compare(that.s0, s0) == 0
                && Double.compare(that.tieTime, tieTime) == 0
                && Double.compare(that.tieWeight, tieWeight) == 0
                && Double.compare(that.tieEta, tieEta) == 0
                && Double.compare(that.lastTime, lastTime) == 0
                && s1.equals(that.s1)
                && s2.equals(that.s2)
                && tieSum.equals(that.tieSum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), s0, s1, s2, tieTime, tieWeight, tieEta, lastTime);
    }
}
