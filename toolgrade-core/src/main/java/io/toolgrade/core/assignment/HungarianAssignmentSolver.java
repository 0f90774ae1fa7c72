package io.toolgrade.core.assignment;

import io.toolgrade.core.exception.AssignmentException;
import java.util.Arrays;
import java.util.Objects;

/// Hungarian algorithm with row/column potentials, `O(k^3)` for a `k x k` matrix.
///
/// Maximization is reduced to minimization over `max - cost`, which keeps every reduced
/// cost non-negative. Rows are inserted one at a time; each insertion grows an
/// alternating tree with Dijkstra-like slack updates until a free column is reached,
/// then flips the augmenting path.
///
/// @implNote Stateless and thread-safe. All working arrays are local to each call.
public final class HungarianAssignmentSolver implements AssignmentSolver {

    @Override
    public Assignment maximize(CostMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        int n = matrix.size();
        if (n == 0) {
            return new Assignment(new int[0], 0.0);
        }

        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                max = Math.max(max, matrix.get(i, j));
            }
        }

        double[][] cost = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                cost[i][j] = max - matrix.get(i, j);
            }
        }

        int[] rowToColumn = minimize(cost);

        double total = 0.0;
        for (int i = 0; i < n; i++) {
            total += matrix.get(i, rowToColumn[i]);
        }
        return new Assignment(rowToColumn, total);
    }

    // 1-based indexing; column 0 is a virtual column holding the row being inserted
    private static int[] minimize(double[][] cost) {
        int n = cost.length;
        double[] u = new double[n + 1];
        double[] v = new double[n + 1];
        int[] rowOfColumn = new int[n + 1];
        int[] way = new int[n + 1];

        for (int row = 1; row <= n; row++) {
            rowOfColumn[0] = row;
            int column = 0;
            double[] minSlack = new double[n + 1];
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[n + 1];

            do {
                used[column] = true;
                int currentRow = rowOfColumn[column];
                double delta = Double.POSITIVE_INFINITY;
                int nextColumn = -1;

                for (int j = 1; j <= n; j++) {
                    if (used[j]) {
                        continue;
                    }
                    double slack = cost[currentRow - 1][j - 1] - u[currentRow] - v[j];
                    if (slack < minSlack[j]) {
                        minSlack[j] = slack;
                        way[j] = column;
                    }
                    if (minSlack[j] < delta) {
                        delta = minSlack[j];
                        nextColumn = j;
                    }
                }

                if (nextColumn < 0) {
                    throw new AssignmentException("No augmenting path found for row " + row);
                }

                for (int j = 0; j <= n; j++) {
                    if (used[j]) {
                        u[rowOfColumn[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minSlack[j] -= delta;
                    }
                }
                column = nextColumn;
            } while (rowOfColumn[column] != 0);

            do {
                int previous = way[column];
                rowOfColumn[column] = rowOfColumn[previous];
                column = previous;
            } while (column != 0);
        }

        int[] rowToColumn = new int[n];
        for (int j = 1; j <= n; j++) {
            rowToColumn[rowOfColumn[j] - 1] = j - 1;
        }
        return rowToColumn;
    }
}
