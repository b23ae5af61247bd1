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

package org.flinkglm.common.feature;

import org.flinkglm.linalg.Vectors;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/** Tests {@link LabeledPoint}. */
public class LabeledPointTest {

    @Test
    public void testDefaults() {
        LabeledPoint empty = new LabeledPoint();
        assertNull(empty.getFeatures());
        assertEquals(1.0, empty.getWeight(), 0);
        assertTrue(empty.isEvent());

        LabeledPoint point = new LabeledPoint(Vectors.dense(1, 2), 3.0);
        assertEquals(1.0, point.getWeight(), 0);
        assertTrue(point.isEvent());
    }

    @Test
    public void testCensoredExample() {
        LabeledPoint point = new LabeledPoint(Vectors.dense(1), 4.0, 2.0, false);
        assertEquals(4.0, point.getLabel(), 0);
        assertEquals(2.0, point.getWeight(), 0);
        assertFalse(point.isEvent());
    }
}
