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
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.exception.NumericException;
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/** Tests {@link IncrementalGradientDescent}. */
public class IncrementalGradientDescentTest {
    private static final double TOLERANCE = 1e-9;

    private static final List<LabeledPoint> SCENARIO_A =
            Arrays.asList(
                    new LabeledPoint(Vectors.dense(1, 2), 1.0),
                    new LabeledPoint(Vectors.dense(2, 1), 1.0),
                    new LabeledPoint(Vectors.dense(-1, -1), -1.0));

    private static final TaskConfig SVM_CONFIG = new TaskConfig(2, 0.1, 0, 0, ObjectiveKind.SVM);

    @Test
    public void testOnePassLowersHingeLoss() {
        AccumulatorState zeroModelLoss =
                TestUtils.foldAndFinalize(
                        new LossEvaluator(SVM_CONFIG, Vectors.zeros(2)), SCENARIO_A);
        assertEquals(3.0, zeroModelLoss.getLoss(), TOLERANCE);

        AccumulatorState state =
                TestUtils.foldAndFinalize(
                        new IncrementalGradientDescent(SVM_CONFIG, null), SCENARIO_A);
        assertEquals(Phase.FINALIZED, state.getPhase());
        assertEquals(1, state.getIteration());
        assertEquals(3, state.getRowCount());
        assertArrayEquals(new double[] {0.4, 0.4}, state.getModel().values, TOLERANCE);
        // The loss is summed along the descent: 0.5 + 0.1 + 0.2.
        assertEquals(0.8, state.getLoss(), TOLERANCE);

        AccumulatorState trueLoss =
                TestUtils.foldAndFinalize(
                        new LossEvaluator(SVM_CONFIG, state.getModel()), SCENARIO_A);
        assertEquals(0.2, trueLoss.getLoss(), TOLERANCE);
        assertTrue(trueLoss.getLoss() < zeroModelLoss.getLoss());
    }

    @Test
    public void testWarmStart() {
        IncrementalGradientDescent first = new IncrementalGradientDescent(SVM_CONFIG, null);
        AccumulatorState state = TestUtils.foldAndFinalize(first, SCENARIO_A);
        IncrementalGradientDescent second = new IncrementalGradientDescent(SVM_CONFIG, state);
        AccumulatorState next = TestUtils.foldAndFinalize(second, SCENARIO_A);

        assertEquals(2, next.getIteration());
        assertEquals(3, next.getRowCount());
        // Starting from (0.4, 0.4) only the third example is inside the margin.
        assertArrayEquals(new double[] {0.5, 0.5}, next.getModel().values, TOLERANCE);
        assertArrayEquals(new double[] {0.4, 0.4}, state.getModel().values, TOLERANCE);
    }

    @Test
    public void testMergeWithEmpty() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(SVM_CONFIG, null);
        AccumulatorState state = TestUtils.fold(igd, SCENARIO_A);
        AccumulatorState empty = igd.createAccumulator();

        assertSame(state, igd.merge(state, empty));
        assertSame(state, igd.merge(empty, state));
        assertTrue(igd.merge(empty, igd.createAccumulator()).isEmpty());
    }

    @Test
    public void testMergeAveragesModelsByRowCount() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(SVM_CONFIG, null);
        AccumulatorState left = TestUtils.fold(igd, SCENARIO_A.subList(0, 2));
        AccumulatorState right = TestUtils.fold(igd, SCENARIO_A.subList(2, 3));
        AccumulatorState leftCopy = left.copy();

        AccumulatorState merged = igd.merge(left, right);
        assertEquals(3, merged.getRowCount());
        // left = (0.3, 0.3) over 2 rows, right = (0.1, 0.1) over 1 row.
        assertArrayEquals(
                new double[] {0.7 / 3, 0.7 / 3}, merged.getModel().values, TOLERANCE);
        assertEquals(leftCopy, left);
    }

    @Test
    public void testBoundedDivergenceAcrossPartitions() {
        double stepSize = 0.01;
        TaskConfig config = new TaskConfig(3, stepSize, 0, 0, ObjectiveKind.SVM);
        List<LabeledPoint> data = TestUtils.classificationData(40);
        IncrementalGradientDescent igd = new IncrementalGradientDescent(config, null);

        AccumulatorState sequential = TestUtils.foldAndFinalize(igd, data);

        AccumulatorState merged = igd.createAccumulator();
        for (int p = 0; p < 4; p++) {
            List<LabeledPoint> partition = new ArrayList<>();
            for (int i = p; i < data.size(); i += 4) {
                partition.add(data.get(i));
            }
            merged = igd.merge(merged, TestUtils.fold(igd, partition));
        }
        AccumulatorState parallel = igd.getResult(merged);

        assertEquals(sequential.getRowCount(), parallel.getRowCount());
        // Every example moves each coordinate by at most stepSize.
        double bound = stepSize * data.size();
        for (int i = 0; i < 3; i++) {
            double divergence =
                    Math.abs(sequential.getModel().get(i) - parallel.getModel().get(i));
            assertTrue(divergence <= bound);
        }
    }

    @Test
    public void testFinalizeIsIdempotent() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(SVM_CONFIG, null);
        AccumulatorState state = TestUtils.fold(igd, SCENARIO_A);
        AccumulatorState first = igd.getResult(state);
        AccumulatorState second = igd.getResult(state);

        assertEquals(first, second);
        assertEquals(first, igd.getResult(first));
        assertNotSame(first, igd.getResult(first));
        assertEquals(Phase.ACCUMULATING, state.getPhase());
        try {
            igd.add(SCENARIO_A.get(0), first);
            fail();
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("finalized"));
        }
    }

    @Test
    public void testNoDataFinalizesToEmpty() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(SVM_CONFIG, null);
        assertTrue(igd.getResult(igd.createAccumulator()).isEmpty());
    }

    @Test
    public void testRegularizationAtFinalize() {
        TaskConfig config = new TaskConfig(2, 0.1, 1.0, 0, ObjectiveKind.SVM);
        AccumulatorState state =
                TestUtils.foldAndFinalize(new IncrementalGradientDescent(config, null), SCENARIO_A);
        // (0.4, 0.4) shrunk by 1 - 0.1 * 1.0; the penalty of (0.4, 0.4) is 0.16.
        assertArrayEquals(new double[] {0.36, 0.36}, state.getModel().values, TOLERANCE);
        assertEquals(0.96, state.getLoss(), TOLERANCE);
    }

    @Test
    public void testInvalidConfig() {
        try {
            new IncrementalGradientDescent(new TaskConfig(2, 0, 0, 0, ObjectiveKind.SVM), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("Step size"));
        }
        try {
            new IncrementalGradientDescent(new TaskConfig(2, 0.1, 0, 0, ObjectiveKind.COX), null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("cox"));
        }
        try {
            new IncrementalGradientDescent(null, null);
            fail();
        } catch (ConfigException expected) {
            assertTrue(expected.getMessage().contains("null"));
        }
    }

    @Test
    public void testDimensionMismatch() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(SVM_CONFIG, null);
        try {
            igd.add(new LabeledPoint(Vectors.dense(1, 2, 3), 1.0), igd.createAccumulator());
            fail();
        } catch (DimensionMismatchException expected) {
            assertEquals(2, expected.getExpected());
            assertEquals(3, expected.getActual());
        }

        AccumulatorState other =
                TestUtils.foldAndFinalize(
                        new IncrementalGradientDescent(
                                new TaskConfig(3, 0.1, 0, 0, ObjectiveKind.SVM), null),
                        Arrays.asList(new LabeledPoint(Vectors.dense(1, 2, 3), 1.0)));
        try {
            new IncrementalGradientDescent(SVM_CONFIG, other);
            fail();
        } catch (DimensionMismatchException expected) {
            assertEquals(3, expected.getActual());
        }
    }

    @Test
    public void testNonFiniteGradient() {
        TaskConfig config = new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.RIDGE);
        IncrementalGradientDescent igd = new IncrementalGradientDescent(config, null);
        try {
            igd.add(new LabeledPoint(Vectors.dense(1.0), Double.NaN), igd.createAccumulator());
            fail();
        } catch (NumericException expected) {
            assertTrue(expected.getMessage().contains("gradient"));
        }
    }
}
