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

package org.flinkglm.common.datastream;

import org.apache.flink.api.common.functions.AggregateFunction;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.runtime.state.StateInitializationContext;
import org.apache.flink.runtime.state.StateSnapshotContext;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.operators.AbstractUdfStreamOperator;
import org.apache.flink.streaming.api.operators.BoundedOneInput;
import org.apache.flink.streaming.api.operators.OneInputStreamOperator;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;

import org.flinkglm.common.state.OperatorStateUtils;

/** Provides utility functions for {@link DataStream}. */
public class DataStreamUtils {

    /**
     * Applies an {@link AggregateFunction} on a bounded input data stream.
     *
     * <p>Each parallel instance folds its partition into one accumulator with {@link
     * AggregateFunction#add}. After all the input records are consumed, the partial accumulators
     * are merged by a single downstream instance, which emits the one value returned by {@link
     * AggregateFunction#getResult}.
     *
     * @param input The input data stream.
     * @param func The user defined aggregate function.
     * @param accType The type information of the accumulator.
     * @param outType The type information of the result.
     * @return The result data stream, holding a single record.
     */
    public static <IN, ACC, OUT> DataStream<OUT> aggregate(
            DataStream<IN> input,
            AggregateFunction<IN, ACC, OUT> func,
            TypeInformation<ACC> accType,
            TypeInformation<OUT> outType) {
        func = input.getExecutionEnvironment().clean(func);
        DataStream<ACC> partialAggregatedStream =
                input.transform(
                        "partialAggregate", accType, new PartialAggregateOperator<>(func, accType));
        DataStream<OUT> aggregatedStream =
                partialAggregatedStream.transform(
                        "aggregate", outType, new AggregateOperator<>(func, accType));
        aggregatedStream.getTransformation().setParallelism(1);

        return aggregatedStream;
    }

    /**
     * A stream operator to apply {@link AggregateFunction#add} on each partition of the input
     * bounded data stream.
     */
    private static class PartialAggregateOperator<IN, ACC, OUT>
            extends AbstractUdfStreamOperator<ACC, AggregateFunction<IN, ACC, OUT>>
            implements OneInputStreamOperator<IN, ACC>, BoundedOneInput {
        /** Type information of the accumulated result. */
        private final TypeInformation<ACC> accType;
        /** The accumulated result of the aggregate function in one partition. */
        private ACC acc;
        /** State of acc. */
        private ListState<ACC> accState;

        public PartialAggregateOperator(
                AggregateFunction<IN, ACC, OUT> userFunction, TypeInformation<ACC> accType) {
            super(userFunction);
            this.accType = accType;
        }

        @Override
        public void endInput() {
            output.collect(new StreamRecord<>(acc));
        }

        @Override
        public void processElement(StreamRecord<IN> streamRecord) throws Exception {
            acc = userFunction.add(streamRecord.getValue(), acc);
        }

        @Override
        public void initializeState(StateInitializationContext context) throws Exception {
            super.initializeState(context);
            accState =
                    context.getOperatorStateStore()
                            .getListState(new ListStateDescriptor<>("accState", accType));
            acc =
                    OperatorStateUtils.getUniqueElement(accState, "accState")
                            .orElse(userFunction.createAccumulator());
        }

        @Override
        public void snapshotState(StateSnapshotContext context) throws Exception {
            super.snapshotState(context);
            accState.clear();
            accState.add(acc);
        }
    }

    /**
     * A stream operator to merge the partial accumulators of {@link PartialAggregateOperator} and
     * to emit the final result.
     */
    private static class AggregateOperator<IN, ACC, OUT>
            extends AbstractUdfStreamOperator<OUT, AggregateFunction<IN, ACC, OUT>>
            implements OneInputStreamOperator<ACC, OUT>, BoundedOneInput {
        /** Type information of the accumulated result. */
        private final TypeInformation<ACC> accType;
        /** The merged accumulator of all partitions. */
        private ACC acc;
        /** State of acc. */
        private ListState<ACC> accState;

        public AggregateOperator(
                AggregateFunction<IN, ACC, OUT> userFunction, TypeInformation<ACC> accType) {
            super(userFunction);
            this.accType = accType;
        }

        @Override
        public void endInput() {
            if (acc == null) {
                acc = userFunction.createAccumulator();
            }
            output.collect(new StreamRecord<>(userFunction.getResult(acc)));
        }

        @Override
        public void processElement(StreamRecord<ACC> streamRecord) throws Exception {
            if (acc == null) {
                acc = streamRecord.getValue();
            } else {
                acc = userFunction.merge(streamRecord.getValue(), acc);
            }
        }

        @Override
        public void initializeState(StateInitializationContext context) throws Exception {
            super.initializeState(context);
            accState =
                    context.getOperatorStateStore()
                            .getListState(new ListStateDescriptor<>("accState", accType));
            acc = OperatorStateUtils.getUniqueElement(accState, "accState").orElse(null);
        }

        @Override
        public void snapshotState(StateSnapshotContext context) throws Exception {
            super.snapshotState(context);
            accState.clear();
            if (acc != null) {
                accState.add(acc);
            }
        }
    }
}
