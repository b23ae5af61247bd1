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

package org.flinkglm.common.optimizer.typeinfo;

import org.apache.flink.api.common.ExecutionConfig;
import org.apache.flink.api.common.typeutils.TypeSerializer;
import org.apache.flink.core.memory.DataInputViewStreamWrapper;
import org.apache.flink.core.memory.DataOutputViewStreamWrapper;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.BestBall;
import org.flinkglm.common.optimizer.BestBallResult;
import org.flinkglm.common.optimizer.BestBallState;
import org.flinkglm.common.optimizer.ConjugateGradient;
import org.flinkglm.common.optimizer.IncrementalGradientDescent;
import org.flinkglm.common.optimizer.LossEvaluator;
import org.flinkglm.common.optimizer.NewtonRaphson;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.linalg.Vectors;
import org.flinkglm.util.TestUtils;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * Tests the serialization and deserialization from {@link AccumulatorStateSerializer}, {@link
 * BestBallStateSerializer} and {@link BestBallResultSerializer}.
 */
public class AccumulatorStateSerializerTest {
    private static final TaskConfig CONFIG =
            new TaskConfig(3, 0.1, 0.2, 0.5, ObjectiveKind.LOGISTIC);

    private static <T> T roundTrip(TypeSerializer<T> serializer, T value) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        serializer.serialize(value, new DataOutputViewStreamWrapper(baos));
        return serializer.deserialize(
                new DataInputViewStreamWrapper(new ByteArrayInputStream(baos.toByteArray())));
    }

    private static List<AccumulatorState> statesOfEveryKind() {
        List<LabeledPoint> points = TestUtils.classificationData(12);
        TaskConfig l2Only = new TaskConfig(3, 0.1, 0.2, 0, ObjectiveKind.LOGISTIC);
        List<AccumulatorState> states = new ArrayList<>();
        states.add(AccumulatorState.empty());

        IncrementalGradientDescent igd = new IncrementalGradientDescent(CONFIG, null);
        states.add(TestUtils.fold(igd, points));
        AccumulatorState igdResult = TestUtils.foldAndFinalize(igd, points);
        states.add(igdResult);

        ConjugateGradient cg = new ConjugateGradient(CONFIG, igdResult);
        states.add(TestUtils.foldAndFinalize(cg, points));

        NewtonRaphson newton = new NewtonRaphson(l2Only, null);
        states.add(TestUtils.foldAndFinalize(newton, points));
        states.add(
                TestUtils.foldAndFinalize(
                        new LossEvaluator(CONFIG, Vectors.dense(0.1, 0.2, 0.3)), points));

        // A risk set with a pending tie group.
        TaskConfig cox = new TaskConfig(1, 0.1, 0, 0, ObjectiveKind.COX);
        states.add(
                TestUtils.fold(
                        new NewtonRaphson(cox, null),
                        Arrays.asList(
                                new LabeledPoint(Vectors.dense(1.0), 5.0, 1.0, true),
                                new LabeledPoint(Vectors.dense(0.5), 3.0, 2.0, true))));
        return states;
    }

    @Test
    public void testSerializationDeserialization() throws IOException {
        TypeSerializer<AccumulatorState> serializer =
                AccumulatorStateTypeInfo.INSTANCE.createSerializer(new ExecutionConfig());
        assertSame(AccumulatorStateSerializer.INSTANCE, serializer);

        for (AccumulatorState state : statesOfEveryKind()) {
            assertEquals(state, roundTrip(serializer, state));
            assertEquals(state, serializer.copy(state));
        }
    }

    @Test
    public void testEmptyStateLayout() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        AccumulatorStateSerializer.INSTANCE.serialize(
                AccumulatorState.empty(), new DataOutputViewStreamWrapper(baos));
        assertEquals(5, baos.size());
    }

    @Test
    public void testBestBall() throws IOException {
        List<LabeledPoint> points = TestUtils.classificationData(10);
        BestBall bestBall = BestBall.ofIgdTrials(CONFIG, null, new double[] {0.01, 0.1});

        BestBallState empty = bestBall.createAccumulator();
        assertEquals(empty, roundTrip(BestBallStateSerializer.INSTANCE, empty));

        BestBallState state = TestUtils.fold(bestBall, points);
        BestBallState restored = roundTrip(BestBallStateSerializer.INSTANCE, state);
        assertEquals(state, restored);
        assertTrue(restored.isPopulated());

        BestBallResult result = bestBall.getResult(restored);
        assertEquals(result, roundTrip(BestBallResultSerializer.INSTANCE, result));
        assertEquals(
                BestBallResult.empty(),
                roundTrip(BestBallResultSerializer.INSTANCE, BestBallResult.empty()));
    }
}
