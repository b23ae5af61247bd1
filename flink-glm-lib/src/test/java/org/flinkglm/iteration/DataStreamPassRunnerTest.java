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

package org.flinkglm.iteration;

import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.BestBall;
import org.flinkglm.common.optimizer.BestBallResult;
import org.flinkglm.common.optimizer.ConjugateGradient;
import org.flinkglm.common.optimizer.NewtonRaphson;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/** Tests {@link DataStreamPassRunner}. */
public class DataStreamPassRunnerTest {
    private StreamExecutionEnvironment env;

    private List<LabeledPoint> data;

    @Before
    public void before() {
        env = TestUtils.getExecutionEnvironment();
        data = TestUtils.classificationData(60);
    }

    @Test
    public void testNewtonPassMatchesLocalFold() throws Exception {
        TaskConfig config = new TaskConfig(3, 0.1, 0.1, 0, ObjectiveKind.LOGISTIC);
        NewtonRaphson newton = new NewtonRaphson(config, null);
        AccumulatorState expected = TestUtils.foldAndFinalize(newton, data);

        AccumulatorState actual = new DataStreamPassRunner(env, data).runPass(newton);
        assertEquals(60, actual.getRowCount());
        assertEquals(expected.getLoss(), actual.getLoss(), 1e-9);
        assertArrayEquals(expected.getModel().values, actual.getModel().values, 1e-9);
    }

    @Test
    public void testConjugateGradientIterations() throws Exception {
        TaskConfig config = new TaskConfig(3, 0.01, 0.1, 0, ObjectiveKind.LOGISTIC);
        IterationStep step = new ConjugateGradientStep(config);
        IterationResult distributed =
                new IterationDriver(3, 0).run(step, new DataStreamPassRunner(env, data));

        AccumulatorState expected = null;
        for (int i = 0; i < 3; i++) {
            AccumulatorState pass =
                    TestUtils.foldAndFinalize(new ConjugateGradient(config, expected), data);
            expected = ConjugateGradient.updateModel(pass, config.getStepSize());
        }
        assertEquals(3, distributed.getIterations());
        assertEquals(expected.getLoss(), distributed.getFinalState().getLoss(), 1e-9);
        assertArrayEquals(
                expected.getModel().values,
                distributed.getFinalState().getModel().values,
                1e-9);
    }

    @Test
    public void testBestBall() throws Exception {
        TaskConfig config = new TaskConfig(3, 0.1, 0, 0, ObjectiveKind.LOGISTIC);
        BestBall bestBall =
                BestBall.ofModels(
                        config,
                        Arrays.asList(
                                Vectors.dense(0, 0, 0),
                                Vectors.dense(0, 2, 0.6),
                                Vectors.dense(0, -2, -0.6)));
        BestBallResult result = new DataStreamPassRunner(env, data).runPass(bestBall);
        assertEquals(1, result.getBestIndex());
        assertEquals(
                TestUtils.foldAndFinalize(bestBall, data).getBest().getLoss(),
                result.getBest().getLoss(),
                1e-9);
    }

    @Test
    public void testOrderedPassRunsOnOnePartition() throws Exception {
        TaskConfig cox = new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.COX);
        List<LabeledPoint> survival =
                Arrays.asList(
                        new LabeledPoint(Vectors.dense(-1.0), 3.0, 1.0, true),
                        new LabeledPoint(Vectors.dense(0.0), 1.0, 1.0, true),
                        new LabeledPoint(Vectors.dense(2.0), 4.0, 1.0, false),
                        new LabeledPoint(Vectors.dense(1.0), 5.0, 1.0, true),
                        new LabeledPoint(Vectors.dense(0.5), 3.0, 1.0, true));

        AccumulatorState state =
                new DataStreamPassRunner(env, survival).runPass(new NewtonRaphson(cox, null));
        assertEquals(2 * Math.log(4) + Math.log(5), state.getLoss(), 1e-12);
        assertEquals(-2.25 / 3.34375, state.getModel().get(0), 1e-12);
        assertEquals(4, env.getParallelism());
    }

    @Test
    public void testEmptyInput() throws Exception {
        TaskConfig config = new TaskConfig(3, 0.1, 0, 0, ObjectiveKind.LOGISTIC);
        DataStreamPassRunner runner = new DataStreamPassRunner(env, Collections.emptyList());
        assertTrue(runner.runPass(new NewtonRaphson(config, null)).isEmpty());
    }

    @Test
    public void testGlmExceptionIsRethrown() throws Exception {
        TaskConfig config = new TaskConfig(3, 0.1, 0, 0, ObjectiveKind.LOGISTIC);
        List<LabeledPoint> invalid = new ArrayList<>(data);
        invalid.add(new LabeledPoint(Vectors.dense(1.0, 2.0), 1.0));
        try {
            new DataStreamPassRunner(env, invalid).runPass(new NewtonRaphson(config, null));
            fail();
        } catch (DimensionMismatchException expected) {
            assertEquals(3, expected.getExpected());
            assertEquals(2, expected.getActual());
        }
    }
}
