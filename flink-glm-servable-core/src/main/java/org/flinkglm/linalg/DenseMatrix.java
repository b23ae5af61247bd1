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

import java.io.Serializable;
import java.util.Arrays;

/**
 * Column-major dense matrix. The entry values are stored in a single array of doubles with columns
 * listed in sequence.
 */
public class DenseMatrix implements Serializable {
    private static final long serialVersionUID = 1L;

    /** Row dimension. */
    private final int numRows;

    /** Column dimension. */
    private final int numCols;

    /**
     * Array for internal storage of elements.
     *
     * <p>The matrix data is stored in column major format internally.
     */
    public final double[] values;

    /**
     * Constructs an m-by-n matrix of zeros.
     *
     * @param numRows Number of rows.
     * @param numCols Number of columns.
     */
    public DenseMatrix(int numRows, int numCols) {
        this(numRows, numCols, new double[numRows * numCols]);
    }

    /**
     * Constructs a matrix from a 1-D array. The data in the array should be organized in column
     * major.
     *
     * @param numRows Number of rows.
     * @param numCols Number of cols.
     * @param values One-dimensional array of doubles.
     */
    public DenseMatrix(int numRows, int numCols, double[] values) {
        Preconditions.checkArgument(values.length == numRows * numCols);
        this.numRows = numRows;
        this.numCols = numCols;
        this.values = values;
    }

    public int numRows() {
        return numRows;
    }

    public int numCols() {
        return numCols;
    }

    public double get(int i, int j) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        return values[numRows * j + i];
    }

    public double add(int i, int j, double value) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        return values[numRows * j + i] += value;
    }

    public double set(int i, int j, double value) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        return values[numRows * j + i] = value;
    }

    /** Returns the diagonal of a square matrix. */
    public DenseVector diagonal() {
        Preconditions.checkState(numRows == numCols, "Matrix is not square.");
        DenseVector diagonal = new DenseVector(numRows);
        for (int i = 0; i < numRows; i++) {
            diagonal.values[i] = values[i * numRows + i];
        }
        return diagonal;
    }

    /** Returns a deep copy of this matrix. */
    public DenseMatrix clone() {
        return new DenseMatrix(numRows, numCols, values.clone());
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DenseMatrix)) {
            return false;
        }
        DenseMatrix other = (DenseMatrix) obj;
        return numRows == other.numRows
                && numCols == other.numCols
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * numRows + numCols) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DenseMatrix(" + numRows + "x" + numCols + ") " + Arrays.toString(values);
    }
}
