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

package org.flinkglm.common.param;

import org.flinkglm.param.LongParam;
import org.flinkglm.param.Param;
import org.flinkglm.param.WithParams;

/** Interface for the shared seed param, which seeds the assignment of examples to partitions. */
public interface HasSeed<T> extends WithParams<T> {
    Param<Long> SEED = new LongParam("seed", "The random seed.", null);

    default long getSeed() {
        Long seed = get(SEED);
        return seed == null ? getClass().getName().hashCode() : seed;
    }

    default T setSeed(long value) {
        return set(SEED, value);
    }
}
