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
import org.flinkglm.exception.DimensionMismatchException;
import org.flinkglm.exception.NumericException;
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/** Tests the pass life cycle shared by the {@link ConvexOptimizer} implementations. */
public class ConvexOptimizerTest {
    private static final TaskConfig CONFIG = new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.RIDGE);

    private static AccumulatorState finalizedWithLoss(double loss) {
        return new AccumulatorState(
                Phase.FINALIZED, CONFIG, Vectors.dense(0.0), 1, new LossAccumulator(), 1, loss, 0);
    }

    @Test
    public void testDistance() {
        AccumulatorState state = finalizedWithLoss(4.0);
        assertEquals(0.0, ConvexOptimizer.distance(state, state), 0);
        assertEquals(0.25, ConvexOptimizer.distance(finalizedWithLoss(3.0), state), 1e-12);
        assertEquals(0.25, ConvexOptimizer.distance(finalizedWithLoss(5.0), state), 1e-12);
        assertEquals(
                Double.POSITIVE_INFINITY,
                ConvexOptimizer.distance(state, finalizedWithLoss(0.0)),
                0);
        try {
            ConvexOptimizer.distance(finalizedWithLoss(Double.NaN), state);
            fail();
        } catch (NumericException expected) {
            assertTrue(expected.getMessage().contains("NaN"));
        }
    }

    @Test
    public void testEmptyPass() {
        LossEvaluator evaluator = new LossEvaluator(CONFIG, Vectors.dense(1.0));
        AccumulatorState result =
                TestUtils.foldAndFinalize(evaluator, Collections.<LabeledPoint>emptyList());
        assertTrue(result.isEmpty());

        AccumulatorState state =
                TestUtils.fold(
                        evaluator,
                        Collections.singletonList(new LabeledPoint(Vectors.dense(1.0), 3.0)));
        assertSame(state, evaluator.merge(AccumulatorState.empty(), state));
        assertSame(state, evaluator.merge(state, AccumulatorState.empty()));
    }

    @Test
    public void testFinalizedStateIsClosed() {
        LossEvaluator evaluator = new LossEvaluator(CONFIG, Vectors.dense(1.0));
        AccumulatorState result =
                TestUtils.foldAndFinalize(
                        evaluator,
                        Collections.singletonList(new LabeledPoint(Vectors.dense(1.0), 3.0)));
        assertEquals(Phase.FINALIZED, result.getPhase());
        assertEquals(2.0, result.getLoss(), 1e-12);
        assertEquals(0, result.getIteration());
        assertEquals(result, evaluator.getResult(result));
        assertNotSame(result, evaluator.getResult(result));
        result.getModel().set(0, 42.0);
        assertEquals(1.0, result.getModel().get(0), 0);
        try {
            evaluator.add(new LabeledPoint(Vectors.dense(1.0), 3.0), result);
            fail();
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("finalized"));
        }
    }

    @Test
    public void testFinalizeDoesNotModifyInput() {
        IncrementalGradientDescent igd = new IncrementalGradientDescent(CONFIG, null);
        AccumulatorState state =
                TestUtils.fold(
                        igd,
                        Arrays.asList(
                                new LabeledPoint(Vectors.dense(1.0), 3.0),
                                new LabeledPoint(Vectors.dense(2.0), 1.0)));
        AccumulatorState copy = state.copy();
        igd.getResult(state);
        assertEquals(copy, state);
    }

    @Test
    public void testDimensionMismatch() {
        LossEvaluator evaluator = new LossEvaluator(CONFIG, Vectors.dense(1.0));
        try {
            TestUtils.fold(
                    evaluator,
                    Collections.singletonList(new LabeledPoint(Vectors.dense(1.0, 2.0), 3.0)));
            fail();
        } catch (DimensionMismatchException expected) {
            assertEquals(1, expected.getExpected());
            assertEquals(2, expected.getActual());
        }
        try {
            new LossEvaluator(CONFIG, Vectors.dense(1.0, 2.0));
            fail();
        } catch (DimensionMismatchException expected) {
            assertEquals(2, expected.getActual());
        }
    }
}
