package io.toolgrade.core.assignment;

import io.toolgrade.core.exception.AssignmentException;
import java.util.Arrays;

/// Square matrix of pairing scores: entry `(i, j)` is the score of pairing row `i`
/// (an expected call) with column `j` (an actual call).
///
/// Rows or columns beyond the real call counts are phantom entries with score `0`,
/// standing for "no call".
///
/// @implNote Immutable. The backing array is copied on the way in and out.
public final class CostMatrix {

    private final double[][] values;

    private CostMatrix(double[][] values) {
        this.values = values;
    }

    /// Creates a matrix from a square array.
    ///
    /// @param values square array of finite scores, not null
    /// @return new matrix, never null
    /// @throws AssignmentException if the array is null, ragged, non-square or holds a
    ///     non-finite value
    public static CostMatrix of(double[][] values) {
        if (values == null) {
            throw new AssignmentException("Cost matrix must not be null");
        }
        int size = values.length;
        double[][] copy = new double[size][];
        for (int i = 0; i < size; i++) {
            double[] row = values[i];
            if (row == null || row.length != size) {
                throw new AssignmentException(
                        "Cost matrix must be square: row "
                                + i
                                + " has "
                                + (row == null ? "no" : String.valueOf(row.length))
                                + " columns, expected "
                                + size);
            }
            for (int j = 0; j < size; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new AssignmentException(
                            "Cost matrix entry (" + i + ", " + j + ") is not finite: " + row[j]);
                }
            }
            copy[i] = row.clone();
        }
        return new CostMatrix(copy);
    }

    /// Creates an all-zero matrix.
    public static CostMatrix zeros(int size) {
        return new CostMatrix(new double[size][size]);
    }

    public int size() {
        return values.length;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /// Returns a copy of the backing array.
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return "CostMatrix" + Arrays.deepToString(values);
    }
}
