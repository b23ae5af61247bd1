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

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.exception.ConfigException;
import org.flinkglm.exception.NumericException;
import org.flinkglm.exception.SizeLimitException;
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/** Tests {@link NewtonRaphson}. */
public class NewtonRaphsonTest {
    private static final double TOLERANCE = 1e-9;

    @Test
    public void testOneStepSolvesLeastSquares() {
        List<LabeledPoint> data =
                Arrays.asList(
                        new LabeledPoint(Vectors.dense(1.0), 2.1),
                        new LabeledPoint(Vectors.dense(2.0), 3.9),
                        new LabeledPoint(Vectors.dense(3.0), 6.2));
        TaskConfig config = new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.RIDGE);

        AccumulatorState state = TestUtils.foldAndFinalize(new NewtonRaphson(config, null), data);

        double ordinaryLeastSquares = (1 * 2.1 + 2 * 3.9 + 3 * 6.2) / 14.0;
        assertEquals(ordinaryLeastSquares, state.getModel().get(0), TOLERANCE);
        assertEquals(29.03, state.getLoss(), TOLERANCE);
        assertEquals(1, state.getIteration());
        NewtonAccumulator acc = (NewtonAccumulator) state.getAlgo();
        assertEquals(1.0, acc.conditionNumber, TOLERANCE);
        assertArrayEquals(new double[] {1 / 14.0}, acc.inverseHessianDiagonal.values, TOLERANCE);
    }

    @Test
    public void testConvergesOnSeparableData() {
        List<LabeledPoint> data =
                Arrays.asList(
                        new LabeledPoint(Vectors.dense(1.0), 1.0),
                        new LabeledPoint(Vectors.dense(-1.0), 0.0));
        TaskConfig config = new TaskConfig(1, 0.1, 0.1, 0, ObjectiveKind.LOGISTIC);

        AccumulatorState previous = null;
        int iteration = 0;
        double distance = Double.POSITIVE_INFINITY;
        while (iteration < 5 && !(distance < 1e-6)) {
            AccumulatorState next =
                    TestUtils.foldAndFinalize(new NewtonRaphson(config, previous), data);
            if (previous != null) {
                distance = ConvexOptimizer.distance(next, previous);
            }
            previous = next;
            iteration++;
        }

        assertTrue(distance < 1e-6);
        assertEquals(5, previous.getIteration());
        assertTrue(previous.getModel().isFinite());
        assertTrue(previous.getModel().get(0) > 0);
        assertEquals(2.1280345, previous.getModel().get(0), 1e-6);
    }

    @Test
    public void testMergeIsAssociative() {
        TaskConfig config = new TaskConfig(3, 0.1, 0.01, 0, ObjectiveKind.LOGISTIC);
        List<LabeledPoint> points = TestUtils.classificationData(24);
        NewtonRaphson newton = new NewtonRaphson(config, null);
        AccumulatorState a = TestUtils.fold(newton, points.subList(0, 5));
        AccumulatorState b = TestUtils.fold(newton, points.subList(5, 16));
        AccumulatorState c = TestUtils.fold(newton, points.subList(16, 24));

        AccumulatorState leftTree = newton.getResult(newton.merge(newton.merge(a, b), c));
        AccumulatorState rightTree = newton.getResult(newton.merge(a, newton.merge(b, c)));
        AccumulatorState swapped = newton.getResult(newton.merge(newton.merge(a, c), b));

        for (AccumulatorState other : Arrays.asList(rightTree, swapped)) {
            assertEquals(leftTree.getLoss(), other.getLoss(), TOLERANCE);
            assertArrayEquals(leftTree.getModel().values, other.getModel().values, 1e-8);
        }
        assertEquals(24, leftTree.getRowCount());
    }

    @Test
    public void testSingularHessian() {
        List<LabeledPoint> data =
                Arrays.asList(
                        new LabeledPoint(Vectors.dense(1.0, 1.0), 1.0),
                        new LabeledPoint(Vectors.dense(2.0, 2.0), 2.0));
        TaskConfig config = new TaskConfig(2, 0.1, 0, 0, ObjectiveKind.RIDGE);
        NewtonRaphson newton = new NewtonRaphson(config, null);
        AccumulatorState state = TestUtils.fold(newton, data);
        try {
            newton.getResult(state);
            fail();
        } catch (NumericException expected) {
            assertTrue(expected.getMessage().contains("Hessian"));
        }

        // A ridge penalty makes the same Hessian positive definite.
        TaskConfig penalized = new TaskConfig(2, 0.1, 1.0, 0, ObjectiveKind.RIDGE);
        AccumulatorState result =
                TestUtils.foldAndFinalize(new NewtonRaphson(penalized, null), data);
        assertTrue(result.getModel().isFinite());
    }

    @Test
    public void testConditionNumberLimit() {
        List<LabeledPoint> data =
                Arrays.asList(
                        new LabeledPoint(Vectors.dense(1.0, 0.0), 1.0),
                        new LabeledPoint(Vectors.dense(0.0, 10.0), 1.0));
        TaskConfig config = new TaskConfig(2, 0.1, 0, 0, ObjectiveKind.RIDGE);

        AccumulatorState accepted =
                TestUtils.foldAndFinalize(new NewtonRaphson(config, null, 1000), data);
        assertEquals(
                100.0, ((NewtonAccumulator) accepted.getAlgo()).conditionNumber, TOLERANCE);
        assertArrayEquals(new double[] {1.0, 0.1}, accepted.getModel().values, TOLERANCE);

        NewtonRaphson strict = new NewtonRaphson(config, null, 50);
        try {
            TestUtils.foldAndFinalize(strict, data);
            fail();
        } catch (NumericException expected) {
            assertTrue(expected.getMessage().contains("ill-conditioned"));
        }
    }

    @Test
    public void testInvalidConfig() {
        try {
            new NewtonRaphson(new TaskConfig(2, 0.1, 0, 0, ObjectiveKind.SVM), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("svm"));
        }
        try {
            new NewtonRaphson(new TaskConfig(2, 0.1, 0.1, 1, ObjectiveKind.LASSO), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("L1"));
        }
        try {
            new NewtonRaphson(new TaskConfig(2, 0.1, 0.1, 0.5, ObjectiveKind.LOGISTIC), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("L1"));
        }
        try {
            new NewtonRaphson(
                    new TaskConfig(
                            TaskConfig.MAX_DENSE_DIMENSION + 1, 0.1, 0, 0, ObjectiveKind.RIDGE),
                    null);
            fail();
        } catch (SizeLimitException expected) {
            assertTrue(expected.getMessage().contains("4096"));
        }
    }
}
