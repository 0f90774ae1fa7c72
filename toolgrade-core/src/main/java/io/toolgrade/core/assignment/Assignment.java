package io.toolgrade.core.assignment;

import java.util.Arrays;

/// One-to-one pairing of matrix rows to columns.
///
/// @param rowToColumn column assigned to each row; a permutation of `0..size-1`
/// @param totalCost sum of the selected matrix entries
public record Assignment(int[] rowToColumn, double totalCost) {

    public Assignment {
        rowToColumn = rowToColumn.clone();
    }

    @Override
    public int[] rowToColumn() {
        return rowToColumn.clone();
    }

    /// Returns the column paired with `row`.
    public int columnFor(int row) {
        return rowToColumn[row];
    }

    public int size() {
        return rowToColumn.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment that)) return false;
        return Double.compare(totalCost, that.totalCost) == 0
                && Arrays.equals(rowToColumn, that.rowToColumn);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rowToColumn) + Double.hashCode(totalCost);
    }

    @Override
    public String toString() {
        return "Assignment{rowToColumn=" + Arrays.toString(rowToColumn) + ", totalCost=" + totalCost + "}";
    }
}
