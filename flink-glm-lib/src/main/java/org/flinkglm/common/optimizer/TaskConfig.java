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

import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.exception.ConfigException;

import java.io.Serializable;
import java.util.Objects;

/**
 * The immutable configuration of one optimization pass: the model dimension, the step size, the
 * regularization and the objective.
 *
 * <p>The regularization term is {@code elasticNet * reg * norm1(w) + (1 - elasticNet) * (reg / 2)
 * * norm2(w)^2}.
 */
public final class TaskConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    /** The largest dimension for which a dense D x D Hessian is allocated. */
    public static final int MAX_DENSE_DIMENSION = 4096;

    private final int dimension;

    private final double stepSize;

    private final double reg;

    private final double elasticNet;

    private final ObjectiveKind objective;

    public TaskConfig(
            int dimension,
            double stepSize,
            double reg,
            double elasticNet,
            ObjectiveKind objective) {
        if (dimension <= 0) {
            throw new ConfigException("Dimension must be positive, but is " + dimension + ".");
        }
        if (objective == null) {
            throw new ConfigException("The objective kind must be set.");
        }
        if (Double.isNaN(stepSize)) {
            throw new ConfigException("Step size must be a number.");
        }
        if (!(reg >= 0) || Double.isInfinite(reg)) {
            throw new ConfigException("Regularization must be finite and non-negative: " + reg);
        }
        if (!(elasticNet >= 0 && elasticNet <= 1)) {
            throw new ConfigException("ElasticNet must be in [0, 1], but is " + elasticNet + ".");
        }
        this.dimension = dimension;
        this.stepSize = stepSize;
        this.reg = reg;
        this.elasticNet = elasticNet;
        this.objective = objective;
    }

    public int getDimension() {
        return dimension;
    }

    public double getStepSize() {
        return stepSize;
    }

    public double getReg() {
        return reg;
    }

    public double getElasticNet() {
        return elasticNet;
    }

    public ObjectiveKind getObjective() {
        return objective;
    }

    /** Whether the penalty has a non-zero L1 part. */
    public boolean hasL1Penalty() {
        return reg > 0 && elasticNet > 0;
    }

    /** Returns a copy of this configuration with another step size. */
    public TaskConfig withStepSize(double stepSize) {
        return new TaskConfig(dimension, stepSize, reg, elasticNet, objective);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskConfig)) {
            return false;
        }
        TaskConfig that = (TaskConfig) o;
        return dimension == that.dimension
                && Double.compare(that.stepSize, stepSize) == 0
                && Double.compare(that.reg, reg) == 0
                && Double.compare(that.elasticNet, elasticNet) == 0
                && objective == that.objective;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, stepSize, reg, elasticNet, objective);
    }

    @Override
    public String toString() {
        return "TaskConfig{dimension="
                + dimension
                + ", stepSize="
                + stepSize
                + ", reg="
                + reg
                + ", elasticNet="
                + elasticNet
                + ", objective="
                + objective
                + '}';
    }
}
