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

import org.flinkglm.linalg.DenseVector;

import java.io.Serializable;
import java.util.Objects;

/**
 * The state an optimizer folds examples into during one pass: the task configuration, the model,
 * the iteration counter, the algorithm-specific {@link Accumulator} and the number of rows seen.
 * After finalize it also carries the loss and the gradient norm of the pass.
 *
 * <p>An {@link Phase#EMPTY} state holds nothing but its phase. It is both the initial accumulator
 * of every pass and the result of finalizing a pass that saw no data.
 */
public class AccumulatorState implements Serializable {
    private static final long serialVersionUID = 1L;

    private Phase phase;

    private final TaskConfig config;

    private final DenseVector model;

    private int iteration;

    private final Accumulator algo;

    private long rowCount;

    private double loss;

    private double gradientNorm;

    public AccumulatorState(
            Phase phase,
            TaskConfig config,
            DenseVector model,
            int iteration,
            Accumulator algo,
            long rowCount,
            double loss,
            double gradientNorm) {
        Preconditions.checkNotNull(phase);
        if (phase != Phase.EMPTY) {
            Preconditions.checkNotNull(config);
            Preconditions.checkNotNull(algo);
            Preconditions.checkArgument(
                    model.size() == config.getDimension(),
                    "Model size %s does not match dimension %s.",
                    model.size(),
                    config.getDimension());
        }
        this.phase = phase;
        this.config = config;
        this.model = model;
        this.iteration = iteration;
        this.algo = algo;
        this.rowCount = rowCount;
        this.loss = loss;
        this.gradientNorm = gradientNorm;
    }

    /** Creates an empty state. */
    public static AccumulatorState empty() {
        return new AccumulatorState(
                Phase.EMPTY, null, null, 0, null, 0, Double.NaN, Double.NaN);
    }

    public boolean isEmpty() {
        return phase == Phase.EMPTY;
    }

    public Phase getPhase() {
        return phase;
    }

    public TaskConfig getConfig() {
        return config;
    }

    /** The dimension of the model, or 0 for an empty state. */
    public int getDimension() {
        return isEmpty() ? 0 : config.getDimension();
    }

    /** Returns a copy of the model, or null for an empty state. */
    public DenseVector getModel() {
        return model == null ? null : model.clone();
    }

    /** The model updated in place while examples are folded. */
    DenseVector mutableModel() {
        return model;
    }

    public int getIteration() {
        return iteration;
    }

    /** The algorithm accumulator. Callers outside the optimizers must not modify it. */
    public Accumulator getAlgo() {
        return algo;
    }

    public long getRowCount() {
        return rowCount;
    }

    public double getLoss() {
        return loss;
    }

    public double getGradientNorm() {
        return gradientNorm;
    }

    /** Returns a deep copy. */
    public AccumulatorState copy() {
        if (isEmpty()) {
            return empty();
        }
        return new AccumulatorState(
                phase,
                config,
                model.clone(),
                iteration,
                algo.copy(),
                rowCount,
                loss,
                gradientNorm);
    }

    /** Returns a deep copy whose loss is replaced. */
    public AccumulatorState withLoss(double loss) {
        Preconditions.checkState(!isEmpty(), "An empty state has no loss.");
        AccumulatorState copy = copy();
        copy.loss = loss;
        return copy;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    void setIteration(int iteration) {
        this.iteration = iteration;
    }

    void setRowCount(long rowCount) {
        this.rowCount = rowCount;
    }

    void setLoss(double loss) {
        this.loss = loss;
    }

    void setGradientNorm(double gradientNorm) {
        this.gradientNorm = gradientNorm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccumulatorState)) {
            return false;
        }
        AccumulatorState that = (AccumulatorState) o;
        return phase == that.phase
                && iteration == that.iteration
                && rowCount == that.rowCount
                && Double.compare(that.loss, loss) == 0
                && Double.compare(that.gradientNorm, gradientNorm) == 0
                && Objects.equals(config, that.config)
                && Objects.equals(model, that.model)
                && Objects.equals(algo, that.algo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, config, model, iteration, algo, rowCount, loss, gradientNorm);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "AccumulatorState{EMPTY}";
        }
        return "AccumulatorState{phase="
                + phase
                + ", iteration="
                + iteration
                + ", rowCount="
                + rowCount
                + ", loss="
                + loss
                + ", gradientNorm="
                + gradientNorm
                + ", model="
                + model
                + ", algo="
                + algo.getType()
                + '}';
    }
}
