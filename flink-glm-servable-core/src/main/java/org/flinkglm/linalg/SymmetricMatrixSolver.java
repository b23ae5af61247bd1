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

import org.flinkglm.exception.NumericException;
import org.netlib.util.intW;

/**
 * LAPACK routines over symmetric matrices: Cholesky solves, inverses and eigenvalues. Inputs are
 * never modified; every routine works on a copy.
 */
public class SymmetricMatrixSolver {
    private static final dev.ludovic.netlib.LAPACK LAPACK =
            dev.ludovic.netlib.lapack.F2jLAPACK.getInstance();

    /**
     * Solves A * x = b for a symmetric positive definite A.
     *
     * @throws NumericException if A is not positive definite.
     */
    public static DenseVector solve(DenseMatrix a, DenseVector b) {
        int n = checkSquare(a);
        Preconditions.checkArgument(b.size() == n, "Matrix and vector size mismatched.");
        double[] factor = a.values.clone();
        double[] x = b.values.clone();
        intW info = new intW(0);
        LAPACK.dposv("U", n, 1, factor, n, x, n, info);
        checkInfo("dposv", info);
        return new DenseVector(x);
    }

    /**
     * Computes the inverse of a symmetric positive definite matrix through its Cholesky factor.
     *
     * @throws NumericException if A is not positive definite.
     */
    public static DenseMatrix inverse(DenseMatrix a) {
        int n = checkSquare(a);
        double[] inv = a.values.clone();
        intW info = new intW(0);
        LAPACK.dpotrf("U", n, inv, n, info);
        checkInfo("dpotrf", info);
        LAPACK.dpotri("U", n, inv, n, info);
        checkInfo("dpotri", info);
        // dpotri only fills the upper triangle.
        for (int j = 0; j < n; j++) {
            for (int i = j + 1; i < n; i++) {
                inv[j * n + i] = inv[i * n + j];
            }
        }
        return new DenseMatrix(n, n, inv);
    }

    /** Returns the eigenvalues of a symmetric matrix in ascending order. */
    public static double[] eigenvalues(DenseMatrix a) {
        int n = checkSquare(a);
        double[] copy = a.values.clone();
        double[] eigenvalues = new double[n];
        double[] work = new double[Math.max(1, 3 * n - 1)];
        intW info = new intW(0);
        LAPACK.dsyev("N", "U", n, copy, n, eigenvalues, work, work.length, info);
        if (info.val != 0) {
            throw new NumericException(
                    "Eigenvalue decomposition did not converge (info = " + info.val + ").");
        }
        return eigenvalues;
    }

    /**
     * Returns the ratio between the largest and the smallest absolute eigenvalue of a symmetric
     * matrix, or positive infinity if the smallest one is zero.
     */
    public static double conditionNumber(double[] eigenvalues) {
        double min = Double.POSITIVE_INFINITY;
        double max = 0;
        for (double value : eigenvalues) {
            min = Math.min(min, Math.abs(value));
            max = Math.max(max, Math.abs(value));
        }
        return min == 0 ? Double.POSITIVE_INFINITY : max / min;
    }

    private static int checkSquare(DenseMatrix a) {
        Preconditions.checkArgument(a.numRows() == a.numCols(), "Matrix is not square.");
        return a.numRows();
    }

    private static void checkInfo(String routine, intW info) {
        if (info.val > 0) {
            throw new NumericException("Matrix is not positive definite (" + routine + ").");
        } else if (info.val < 0) {
            throw new IllegalArgumentException(
                    "Invalid input to lapack routine " + routine + " at argument " + -info.val);
        }
    }
}
