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

package org.flinkglm.glm;

import org.apache.flink.util.Preconditions;

import org.apache.commons.lang3.ArrayUtils;
import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.exception.GlmException;
import org.flinkglm.iteration.ConjugateGradientStep;
import org.flinkglm.iteration.IgdStep;
import org.flinkglm.iteration.IterationDriver;
import org.flinkglm.iteration.IterationResult;
import org.flinkglm.iteration.IterationStep;
import org.flinkglm.iteration.LocalPassRunner;
import org.flinkglm.iteration.NewtonStep;
import org.flinkglm.iteration.PassRunner;
import org.flinkglm.iteration.store.InMemoryStateStore;
import org.flinkglm.iteration.store.StateStore;
import org.flinkglm.param.Param;
import org.flinkglm.util.ParamUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits a generalized linear model by running the configured optimizer until convergence.
 *
 * <p>The ridge objective always uses a pure L2 penalty and the lasso objective a pure L1 penalty;
 * the elasticNet param only applies to the other objectives.
 */
public class GlmTrainer implements GlmParams<GlmTrainer> {
    private static final Logger LOG = LoggerFactory.getLogger(GlmTrainer.class);

    private final Map<Param<?>, Object> paramMap = new HashMap<>();

    private StateStore stateStore = new InMemoryStateStore();

    public GlmTrainer() {
        ParamUtils.initializeMapWithDefaultValues(paramMap, this);
    }

    /** Sets the store receiving the state of every iteration. */
    public GlmTrainer setStateStore(StateStore stateStore) {
        this.stateStore = Preconditions.checkNotNull(stateStore);
        return this;
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    /** Builds the task configuration of every pass from the params. */
    public TaskConfig createTaskConfig() {
        Integer dimension = getDimension();
        if (dimension == null) {
            throw new ConfigException("Parameter dimension must be set.");
        }
        ObjectiveKind objective = ObjectiveKind.fromName(getObjective());
        double elasticNet = getElasticNet();
        if (objective == ObjectiveKind.RIDGE) {
            elasticNet = 0;
        } else if (objective == ObjectiveKind.LASSO) {
            elasticNet = 1;
        }
        return new TaskConfig(dimension, getLearningRate(), getReg(), elasticNet, objective);
    }

    /** Creates the step of one iteration of the configured optimizer method. */
    public IterationStep createIterationStep() {
        TaskConfig config = createTaskConfig();
        double[] candidates = ArrayUtils.toPrimitive(getStepSizeCandidates());
        switch (getOptimizerMethod()) {
            case IGD:
                return new IgdStep(config, candidates);
            case CG:
                return new ConjugateGradientStep(config, candidates);
            case NEWTON:
                return new NewtonStep(config, getMaxConditionNumber());
            default:
                throw new ConfigException(
                        "Unsupported optimizer method " + getOptimizerMethod() + ".");
        }
    }

    /**
     * Fits a model over the examples replayed by the runner.
     *
     * @throws GlmException if the runner has no data.
     */
    public GlmModel fit(PassRunner runner) throws Exception {
        IterationStep step = createIterationStep();
        IterationDriver driver = new IterationDriver(getMaxIter(), getTol(), stateStore);
        IterationResult result = driver.run(step, runner);
        LOG.info("Fit finished: {}.", result);
        AccumulatorState state = result.getFinalState();
        if (state.isEmpty()) {
            throw new GlmException("Cannot fit a model without training data.");
        }
        NewtonSummary summary =
                NEWTON.equals(getOptimizerMethod())
                        ? NewtonSummary.of(state, result.getPenultimateState())
                        : null;
        return new GlmModel(
                state.getConfig().getObjective(),
                state.getModel().clone(),
                state.getLoss(),
                result.getIterations(),
                result.getStopReason(),
                summary);
    }

    /**
     * Fits a model over in-memory examples, shuffled with the seed param into the given number of
     * partitions.
     */
    public GlmModel fit(List<LabeledPoint> data, int numPartitions) throws Exception {
        try (LocalPassRunner runner =
                new LocalPassRunner(LocalPassRunner.partition(data, numPartitions, getSeed()))) {
            return fit(runner);
        }
    }

    @Override
    public Map<Param<?>, Object> getUserDefinedParamMap() {
        return paramMap;
    }
}
