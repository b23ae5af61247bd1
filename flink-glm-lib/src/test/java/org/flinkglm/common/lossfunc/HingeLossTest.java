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

package org.flinkglm.common.lossfunc;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.linalg.DenseVector;
import org.flinkglm.linalg.Vectors;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

/** Tests {@link HingeLoss}. */
public class HingeLossTest {
    private static final LabeledPoint dataPoint1 =
            new LabeledPoint(Vectors.dense(1.0, -1.0, -1.0), 1.0, 2.0);
    private static final LabeledPoint dataPoint2 =
            new LabeledPoint(Vectors.dense(1.0, -1.0, 1.0), 1.0, 2.0);
    private static final DenseVector coefficient = Vectors.dense(1.0, 1.0, 1.0);
    private static final double TOLERANCE = 1e-7;

    private final DenseVector cumGradient = Vectors.dense(0.0, 0.0, 0.0);

    @Test
    public void computeLoss() {
        double loss = HingeLoss.INSTANCE.computeLoss(dataPoint1, coefficient);
        assertEquals(4.0, loss, TOLERANCE);

        loss = HingeLoss.INSTANCE.computeLoss(dataPoint2, coefficient);
        assertEquals(0.0, loss, TOLERANCE);
    }

    @Test
    public void computeGradient() {
        HingeLoss.INSTANCE.computeGradient(dataPoint1, coefficient, cumGradient);
        assertArrayEquals(new double[] {-2.0, 2.0, 2.0}, cumGradient.values, TOLERANCE);

        HingeLoss.INSTANCE.computeGradient(dataPoint2, coefficient, cumGradient);
        assertArrayEquals(new double[] {-2.0, 2.0, 2.0}, cumGradient.values, TOLERANCE);
    }

    @Test
    public void negativeLabelsMapToMinusOne() {
        // Labels 0 and -1 are both the negative class.
        LabeledPoint zero = new LabeledPoint(Vectors.dense(1.0, 0.0, 0.0), 0.0);
        LabeledPoint minusOne = new LabeledPoint(Vectors.dense(1.0, 0.0, 0.0), -1.0);
        assertEquals(2.0, HingeLoss.INSTANCE.computeLoss(zero, coefficient), TOLERANCE);
        assertEquals(2.0, HingeLoss.INSTANCE.computeLoss(minusOne, coefficient), TOLERANCE);

        HingeLoss.INSTANCE.computeGradient(zero, coefficient, cumGradient);
        assertArrayEquals(new double[] {1.0, 0.0, 0.0}, cumGradient.values, TOLERANCE);
    }

    @Test
    public void unitMarginHasNoGradient() {
        LabeledPoint onMargin = new LabeledPoint(Vectors.dense(0.5, 0.5, 0.0), 1.0);
        HingeLoss.INSTANCE.computeGradient(onMargin, coefficient, cumGradient);
        assertArrayEquals(new double[] {0.0, 0.0, 0.0}, cumGradient.values, 0);
        assertEquals(0.0, HingeLoss.INSTANCE.computeLoss(onMargin, coefficient), 0);
    }

    @Test
    public void predict() {
        assertEquals(1.0, HingeLoss.INSTANCE.predict(coefficient, dataPoint2.getFeatures()), 0);
        assertEquals(0.0, HingeLoss.INSTANCE.predict(coefficient, dataPoint1.getFeatures()), 0);
        assertFalse(HingeLoss.INSTANCE.supportsHessian());
    }
}
