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

package org.flinkglm.linalg;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/** Tests the {@link BLAS}. */
public class BLASTest {

    private static final double TOLERANCE = 1e-7;
    private static final DenseVector inputDenseVec = Vectors.dense(1, -2, 3, 4, -5);

    @Test
    public void testAsum() {
        assertEquals(15, BLAS.asum(inputDenseVec), TOLERANCE);
    }

    @Test
    public void testAxpy() {
        DenseVector anotherDenseVec = Vectors.dense(1, 2, 3, 4, 5);
        BLAS.axpy(1, inputDenseVec, anotherDenseVec);
        double[] expectedResult = new double[] {2, 0, 6, 8, 0};
        assertArrayEquals(expectedResult, anotherDenseVec.values, TOLERANCE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAxpySizeMismatch() {
        BLAS.axpy(1, inputDenseVec, Vectors.dense(1, 2));
    }

    @Test
    public void testMatrixAxpy() {
        DenseMatrix x = new DenseMatrix(2, 2, new double[] {1, 2, 3, 4});
        DenseMatrix y = new DenseMatrix(2, 2, new double[] {1, 0, 0, 1});
        BLAS.axpy(2, x, y);
        assertArrayEquals(new double[] {3, 4, 6, 9}, y.values, TOLERANCE);
    }

    @Test
    public void testDot() {
        DenseVector anotherDenseVec = Vectors.dense(1, 2, 3, 4, 5);
        assertEquals(-3, BLAS.dot(inputDenseVec, anotherDenseVec), TOLERANCE);
    }

    @Test
    public void testNorm2() {
        assertEquals(Math.sqrt(55), BLAS.norm2(inputDenseVec), TOLERANCE);
    }

    @Test
    public void testScal() {
        DenseVector vector = inputDenseVec.clone();
        BLAS.scal(2, vector);
        assertArrayEquals(new double[] {2, -4, 6, 8, -10}, vector.values, TOLERANCE);
        assertArrayEquals(new double[] {1, -2, 3, 4, -5}, inputDenseVec.values, TOLERANCE);
    }

    @Test
    public void testRankOneUpdate() {
        DenseMatrix matrix = new DenseMatrix(2, 2);
        BLAS.rankOneUpdate(0.5, Vectors.dense(2, 4), matrix);
        assertArrayEquals(new double[] {2, 4, 4, 8}, matrix.values, TOLERANCE);
        assertEquals(4, matrix.get(0, 1), TOLERANCE);
    }
}
