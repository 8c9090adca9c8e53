/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.spikesort.energy;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A symmetric {@code size x size} matrix of doubles that stores only the upper
 * triangle, diagonal included. Every accessor normalizes its coordinates to
 * {@code row <= col}, so {@code get(i, j)} and {@code get(j, i)} address the
 * same cell.
 */
public class TriangularMatrix {

    private final int size;
    private final double[] values;

    public TriangularMatrix(int size) {
        checkArgument(size > 0, "size must be greater than 0");
        this.size = size;
        this.values = new double[cells(size)];
    }

    /**
     * Wraps packed upper-triangular values, row by row.
     *
     * @param size   number of rows and columns
     * @param values the packed values, copied
     */
    public TriangularMatrix(int size, double[] values) {
        checkArgument(size > 0, "size must be greater than 0");
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == cells(size), "incorrect number of packed values");
        this.size = size;
        this.values = values.clone();
    }

    public TriangularMatrix(TriangularMatrix other) {
        this(other.size, other.values);
    }

    /**
     * Builds a triangular matrix from the upper triangle of a square matrix.
     *
     * @param square a square matrix, the lower triangle is ignored
     * @return the triangular matrix
     */
    public static TriangularMatrix fromUpper(double[][] square) {
        checkNotNull(square, "matrix must not be null");
        TriangularMatrix matrix = new TriangularMatrix(square.length);
        for (int i = 0; i < square.length; i++) {
            checkArgument(square[i].length == square.length, "matrix must be square");
            for (int j = i; j < square.length; j++) {
                matrix.set(i, j, square[i][j]);
            }
        }
        return matrix;
    }

    /**
     * @param size number of rows and columns
     * @return number of stored cells, diagonal included
     */
    public static int cells(int size) {
        return size * (size + 1) / 2;
    }

    public int size() {
        return size;
    }

    /**
     * Position of cell {@code (row, col)} in the packed storage.
     *
     * @param row a row
     * @param col a column
     * @return the packed index
     */
    public int index(int row, int col) {
        checkArgument(row >= 0 && row < size && col >= 0 && col < size, "index out of range");
        int low = Math.min(row, col);
        int high = Math.max(row, col);
        return low * size - low * (low - 1) / 2 + (high - low);
    }

    public double get(int row, int col) {
        return values[index(row, col)];
    }

    public void set(int row, int col, double value) {
        values[index(row, col)] = value;
    }

    public void add(int row, int col, double value) {
        values[index(row, col)] += value;
    }

    /**
     * Sets every off-diagonal cell of row/column {@code k} to {@code offDiagonal}
     * and the diagonal cell to {@code diagonal}.
     *
     * @param k           the row and column
     * @param offDiagonal value of the off-diagonal cells
     * @param diagonal    value of {@code (k, k)}
     */
    public void fillRowAndColumn(int k, double offDiagonal, double diagonal) {
        for (int m = 0; m < size; m++) {
            values[index(k, m)] = (m == k) ? diagonal : offDiagonal;
        }
    }

    /**
     * The two regions touched when cluster {@code high} is merged into cluster
     * {@code low}: every cell {@code (low, k)} and every cell {@code (high, k)}
     * for {@code k} outside {@code {low, high}}, aligned so that position
     * {@code m} of both sets refers to the same third cluster. Each region is an
     * L shape in the upper triangle (a column segment above the diagonal followed
     * by a row segment to its right), whatever the position of {@code k} relative
     * to {@code low} and {@code high}.
     *
     * @param low  the surviving cluster
     * @param high the absorbed cluster
     * @return the aligned index sets
     */
    public MergeIndexSets mergeIndexSets(int low, int high) {
        checkArgument(low >= 0 && low < size && high >= 0 && high < size, "index out of range");
        checkArgument(low != high, "a cluster cannot be merged with itself");
        int[] survivor = new int[size - 2];
        int[] absorbed = new int[size - 2];
        int[] others = new int[size - 2];
        int m = 0;
        for (int k = 0; k < size; k++) {
            if (k == low || k == high) {
                continue;
            }
            survivor[m] = index(low, k);
            absorbed[m] = index(high, k);
            others[m] = k;
            m++;
        }
        return new MergeIndexSets(low, high, others, survivor, absorbed);
    }

    /**
     * Adds the cells of the absorbed region into the aligned cells of the
     * survivor region.
     *
     * @param sets index sets obtained from {@link #mergeIndexSets(int, int)}
     */
    public void accumulate(MergeIndexSets sets) {
        int[] survivor = sets.getSurvivor();
        int[] absorbed = sets.getAbsorbed();
        for (int m = 0; m < survivor.length; m++) {
            values[survivor[m]] += values[absorbed[m]];
        }
    }

    /**
     * @return a square copy, lower triangle mirrored
     */
    public double[][] toSquare() {
        double[][] square = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = i; j < size; j++) {
                square[i][j] = square[j][i] = get(i, j);
            }
        }
        return square;
    }

    /**
     * @return a copy of the packed upper-triangular values, row by row
     */
    public double[] toPacked() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TriangularMatrix)) {
            return false;
        }
        TriangularMatrix that = (TriangularMatrix) o;
        return size == that.size && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(values);
    }
}
