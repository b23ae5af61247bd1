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

/** The concrete {@link Accumulator} kinds, with the tag written in front of their values. */
public enum AccumulatorType {
    LOSS(0),
    IGD(1),
    CONJUGATE_GRADIENT(2),
    NEWTON(3),
    RISK_SET(4);

    private final byte tag;

    AccumulatorType(int tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }

    public static AccumulatorType fromTag(byte tag) {
        for (AccumulatorType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown accumulator tag " + tag);
    }
}
