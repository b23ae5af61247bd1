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

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.apache.flink.util.ExceptionUtils;
import org.apache.flink.util.Preconditions;

import org.flinkglm.common.datastream.DataStreamUtils;
import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.optimizer.PassFunction;
import org.flinkglm.exception.GlmException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A {@link PassRunner} that runs every pass as a bounded Flink job: the examples are read from a
 * collection, folded per subtask and merged by {@link DataStreamUtils#aggregate}, and the single
 * result is collected back to the client.
 *
 * <p>Functions that require ordered input run with parallelism 1 over examples sorted by
 * descending label.
 */
public class DataStreamPassRunner implements PassRunner {
    private final StreamExecutionEnvironment env;

    private final List<LabeledPoint> data;

    public DataStreamPassRunner(StreamExecutionEnvironment env, List<LabeledPoint> data) {
        this.env = Preconditions.checkNotNull(env);
        this.data = new ArrayList<>(data);
    }

    @Override
    public <ACC, OUT> OUT runPass(PassFunction<ACC, OUT> function) throws Exception {
        if (data.isEmpty()) {
            return function.getResult(function.createAccumulator());
        }
        List<LabeledPoint> input = data;
        int parallelism = env.getParallelism();
        if (function.requiresOrderedInput()) {
            input = new ArrayList<>(data);
            input.sort(Comparator.comparingDouble(LabeledPoint::getLabel).reversed());
            env.setParallelism(1);
        }
        try {
            DataStream<LabeledPoint> points =
                    env.fromCollection(input, TypeInformation.of(LabeledPoint.class));
            DataStream<OUT> result =
                    DataStreamUtils.aggregate(
                            points,
                            function,
                            function.getAccumulatorType(),
                            function.getResultType());
            try (CloseableIterator<OUT> iterator = result.executeAndCollect()) {
                return iterator.next();
            }
        } catch (Exception e) {
            Optional<GlmException> cause = ExceptionUtils.findThrowable(e, GlmException.class);
            if (cause.isPresent()) {
                throw cause.get();
            }
            throw e;
        } finally {
            env.setParallelism(parallelism);
        }
    }
}
