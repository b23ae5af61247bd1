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

import org.apache.flink.util.Preconditions;

/** A utility class that provides BLAS routines over matrices and vectors. */
public class BLAS {
    /** For level-1 and level-2 routines, use javaBLAS for better performance. */
    private static final dev.ludovic.netlib.BLAS JAVA_BLAS =
            dev.ludovic.netlib.JavaBLAS.getInstance();

    /** \sum_i |x_i| . */
    public static double asum(DenseVector x) {
        return JAVA_BLAS.dasum(x.size(), x.values, 0, 1);
    }

    /** y += a * x . */
    public static void axpy(double a, DenseVector x, DenseVector y) {
        Preconditions.checkArgument(x.size() == y.size(), "Vector size mismatched.");
        JAVA_BLAS.daxpy(x.size(), a, x.values, 1, y.values, 1);
    }

    /** Y += a * X, element-wise over two matrices of the same shape. */
    public static void axpy(double a, DenseMatrix x, DenseMatrix y) {
        Preconditions.checkArgument(
                x.numRows() == y.numRows() && x.numCols() == y.numCols(),
                "Matrix size mismatched.");
        JAVA_BLAS.daxpy(x.values.length, a, x.values, 1, y.values, 1);
    }

    /** Computes the dot of the two vectors (y \dot x). */
    public static double dot(DenseVector x, DenseVector y) {
        Preconditions.checkArgument(x.size() == y.size(), "Vector size mismatched.");
        return JAVA_BLAS.ddot(x.size(), x.values, 1, y.values, 1);
    }

    /** \sqrt(\sum_i x_i * x_i) . */
    public static double norm2(DenseVector x) {
        return JAVA_BLAS.dnrm2(x.size(), x.values, 1);
    }

    /** x = x * a . */
    public static void scal(double a, DenseVector x) {
        JAVA_BLAS.dscal(x.size(), a, x.values, 1);
    }

    /** A += alpha * x * x^T, with A a square matrix whose size equals the size of x. */
    public static void rankOneUpdate(double alpha, DenseVector x, DenseMatrix matrix) {
        Preconditions.checkArgument(
                matrix.numRows() == x.size() && matrix.numCols() == x.size(),
                "Matrix and vector size mismatched.");
        int n = x.size();
        JAVA_BLAS.dger(n, n, alpha, x.values, 1, x.values, 1, matrix.values, n);
    }
}
