package io.toolgrade.core.evaluation;

import io.toolgrade.core.assignment.CostMatrix;

/// Cost matrix together with the detailed scores behind each real entry.
///
/// `pair(i, j)` is defined for `i < expectedCount` and `j < actualCount`; all other
/// matrix cells are phantom zeros.
final class PairingTable {

    private final int expectedCount;
    private final int actualCount;
    private final PairScore[][] pairs;
    private final CostMatrix matrix;

    PairingTable(int expectedCount, int actualCount, PairScore[][] pairs) {
        this.expectedCount = expectedCount;
        this.actualCount = actualCount;
        this.pairs = pairs;

        int size = Math.max(expectedCount, actualCount);
        double[][] values = new double[size][size];
        for (int i = 0; i < expectedCount; i++) {
            for (int j = 0; j < actualCount; j++) {
                values[i][j] = pairs[i][j].score();
            }
        }
        this.matrix = CostMatrix.of(values);
    }

    int expectedCount() {
        return expectedCount;
    }

    int actualCount() {
        return actualCount;
    }

    CostMatrix matrix() {
        return matrix;
    }

    boolean isReal(int row, int column) {
        return row < expectedCount && column < actualCount;
    }

    PairScore pair(int row, int column) {
        return pairs[row][column];
    }
}
