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

import org.apache.flink.api.common.functions.AggregateFunction;
import org.apache.flink.api.common.typeinfo.TypeInformation;

import org.flinkglm.common.feature.LabeledPoint;

/**
 * An {@link AggregateFunction} folding one full pass over the training examples. Besides the
 * transition, merge and finalize of the aggregate function, a pass function tells a runner the
 * types of its accumulator and result and whether its examples must be folded in order.
 *
 * @param <ACC> The type of the accumulator.
 * @param <OUT> The type of the result.
 */
public interface PassFunction<ACC, OUT> extends AggregateFunction<LabeledPoint, ACC, OUT> {

    TypeInformation<ACC> getAccumulatorType();

    TypeInformation<OUT> getResultType();

    /**
     * Whether the examples must be folded into a single accumulator sorted by descending label,
     * without any merge of populated accumulators.
     */
    default boolean requiresOrderedInput() {
        return false;
    }
}
