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
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/** Tests {@link ConjugateGradient}. */
public class ConjugateGradientTest {
    private static final double TOLERANCE = 1e-9;

    /** y = 2x; at the zero model the loss is 90 and the gradient -90. */
    private static final List<LabeledPoint> LINE =
            Arrays.asList(
                    new LabeledPoint(Vectors.dense(3.0), 6.0),
                    new LabeledPoint(Vectors.dense(6.0), 12.0));

    private static final TaskConfig RIDGE_CONFIG =
            new TaskConfig(1, 0.01, 0, 0, ObjectiveKind.RIDGE);

    @Test
    public void testFirstDirectionIsNegativeGradient() {
        AccumulatorState state =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, null), LINE);
        assertEquals(90.0, state.getLoss(), TOLERANCE);
        assertEquals(90.0, state.getGradientNorm(), TOLERANCE);
        assertEquals(1, state.getIteration());
        assertArrayEquals(new double[] {0.0}, state.getModel().values, 0);
        assertArrayEquals(
                new double[] {90.0}, ConjugateGradient.getDirection(state).values, TOLERANCE);
        ConjugateGradient.getDirection(state).set(0, -1.0);
        assertEquals(90.0, ConjugateGradient.getDirection(state).get(0), TOLERANCE);

        AccumulatorState moved = ConjugateGradient.updateModel(state, 0.01);
        assertArrayEquals(new double[] {0.9}, moved.getModel().values, TOLERANCE);
        assertArrayEquals(new double[] {0.0}, state.getModel().values, 0);
        assertEquals(Phase.FINALIZED, moved.getPhase());
    }

    @Test
    public void testLineSearchPicksSmallestLoss() {
        AccumulatorState state =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, null), LINE);
        BestBall search =
                BestBall.ofStepSizes(
                        RIDGE_CONFIG,
                        state.getModel(),
                        ConjugateGradient.getDirection(state),
                        new double[] {0.01, 0.1, 1.0});
        BestBallResult result = TestUtils.foldAndFinalize(search, LINE);

        assertEquals(0, result.getBestIndex());
        assertEquals(27.225, result.getBest().getLoss(), TOLERANCE);
        assertEquals(1102.5, result.getCandidates().get(1).getLoss(), TOLERANCE);
        assertTrue(result.getBest().getLoss() < state.getLoss());
    }

    @Test
    public void testPolakRibiereIsClampedAtZero() {
        AccumulatorState first =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, null), LINE);
        AccumulatorState moved = ConjugateGradient.updateModel(first, 0.01);
        AccumulatorState second =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, moved), LINE);

        assertEquals(2, second.getIteration());
        assertEquals(27.225, second.getLoss(), TOLERANCE);
        // The gradient is -49.5, so beta = -49.5 * 40.5 / 8100 < 0 and is clamped.
        assertArrayEquals(
                new double[] {49.5}, ConjugateGradient.getDirection(second).values, TOLERANCE);
    }

    @Test
    public void testPolakRibiereDirection() {
        AccumulatorState first =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, null), LINE);
        AccumulatorState moved = ConjugateGradient.updateModel(first, 0.1);
        AccumulatorState second =
                TestUtils.foldAndFinalize(new ConjugateGradient(RIDGE_CONFIG, moved), LINE);

        // g = 315, beta = 315 * 405 / 8100 = 15.75, d = -315 + 15.75 * 90.
        assertEquals(315.0, second.getGradientNorm(), TOLERANCE);
        assertArrayEquals(
                new double[] {1102.5}, ConjugateGradient.getDirection(second).values, TOLERANCE);
    }

    @Test
    public void testMergeIsAssociativeAndCommutative() {
        TaskConfig config = new TaskConfig(3, 0.1, 0.5, 0, ObjectiveKind.LOGISTIC);
        List<LabeledPoint> points = TestUtils.classificationData(30);
        AccumulatorState previous =
                ConjugateGradient.updateModel(
                        TestUtils.foldAndFinalize(new ConjugateGradient(config, null), points),
                        0.1);

        ConjugateGradient cg = new ConjugateGradient(config, previous);
        AccumulatorState a = TestUtils.fold(cg, points.subList(0, 7));
        AccumulatorState b = TestUtils.fold(cg, points.subList(7, 20));
        AccumulatorState c = TestUtils.fold(cg, points.subList(20, 30));

        AccumulatorState leftTree = cg.getResult(cg.merge(cg.merge(a, b), c));
        AccumulatorState rightTree = cg.getResult(cg.merge(a, cg.merge(b, c)));
        AccumulatorState swapped = cg.getResult(cg.merge(cg.merge(a, c), b));
        AccumulatorState reversed = cg.getResult(cg.merge(c, cg.merge(b, a)));
        AccumulatorState sequential = TestUtils.foldAndFinalize(cg, points);

        for (AccumulatorState other : Arrays.asList(rightTree, swapped, reversed, sequential)) {
            assertEquals(leftTree.getLoss(), other.getLoss(), TOLERANCE);
            assertEquals(leftTree.getRowCount(), other.getRowCount());
            assertArrayEquals(
                    ConjugateGradient.getDirection(leftTree).values,
                    ConjugateGradient.getDirection(other).values,
                    TOLERANCE);
        }
        assertEquals(30, leftTree.getRowCount());
        assertEquals(2, leftTree.getIteration());
    }

    @Test
    public void testInvalidConfig() {
        try {
            new ConjugateGradient(new TaskConfig(1, -1, 0, 0, ObjectiveKind.RIDGE), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("Step size"));
        }
        try {
            new ConjugateGradient(new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.COX), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("cox"));
        }
    }
}
