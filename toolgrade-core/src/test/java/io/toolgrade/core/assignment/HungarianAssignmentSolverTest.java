package io.toolgrade.core.assignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class HungarianAssignmentSolverTest {

    private final HungarianAssignmentSolver solver = new HungarianAssignmentSolver();

    @Nested
    class KnownMatrices {

        @Test
        void shouldReturnEmptyAssignmentForEmptyMatrix() {
            Assignment assignment = solver.maximize(CostMatrix.zeros(0));

            assertThat(assignment.size()).isZero();
            assertThat(assignment.totalCost()).isZero();
        }

        @Test
        void shouldSolveSingleCell() {
            Assignment assignment = solver.maximize(CostMatrix.of(new double[][] {{2.5}}));

            assertThat(assignment.columnFor(0)).isZero();
            assertThat(assignment.totalCost()).isEqualTo(2.5);
        }

        @Test
        void shouldPreferCrossPairingWhenItScoresHigher() {
            CostMatrix matrix = CostMatrix.of(new double[][] {{1, 3}, {3, 1}});

            Assignment assignment = solver.maximize(matrix);

            assertThat(assignment.rowToColumn()).containsExactly(1, 0);
            assertThat(assignment.totalCost()).isEqualTo(6.0);
        }

        @Test
        void shouldSolveClassicThreeByThree() {
            CostMatrix matrix =
                    CostMatrix.of(
                            new double[][] {
                                {7, 5, 11},
                                {5, 4, 1},
                                {9, 3, 2}
                            });

            Assignment assignment = solver.maximize(matrix);

            assertThat(assignment.totalCost()).isEqualTo(24.0);
            assertThat(assignment.rowToColumn()).containsExactly(2, 1, 0);
        }

        @Test
        void shouldHandlePhantomRowsOfZeros() {
            CostMatrix matrix =
                    CostMatrix.of(
                            new double[][] {
                                {0.2, 2.0, 0.0},
                                {0.0, 0.0, 0.0},
                                {0.0, 0.0, 0.0}
                            });

            Assignment assignment = solver.maximize(matrix);

            assertThat(assignment.columnFor(0)).isEqualTo(1);
            assertThat(assignment.totalCost()).isEqualTo(2.0);
        }

        @Test
        void shouldHandleNegativeEntries() {
            CostMatrix matrix = CostMatrix.of(new double[][] {{-1, -5}, {-4, -2}});

            assertThat(solver.maximize(matrix).totalCost()).isEqualTo(-3.0);
        }
    }

    @RepeatedTest(25)
    void shouldMatchBruteForceOptimum() {
        Random random = new Random();
        int size = 1 + random.nextInt(6);
        double[][] values = new double[size][size];
        for (double[] row : values) {
            for (int j = 0; j < size; j++) {
                row[j] = Math.round(random.nextDouble() * 1000) / 100.0;
            }
        }

        Assignment assignment = solver.maximize(CostMatrix.of(values));

        assertThat(isPermutation(assignment.rowToColumn())).isTrue();
        assertThat(assignment.totalCost())
                .isCloseTo(bruteForceMaximum(values), within(1e-9));
    }

    private static boolean isPermutation(int[] columns) {
        int[] sorted = columns.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] != i) {
                return false;
            }
        }
        return true;
    }

    private static double bruteForceMaximum(double[][] values) {
        return best(values, 0, new boolean[values.length]);
    }

    private static double best(double[][] values, int row, boolean[] used) {
        if (row == values.length) {
            return 0.0;
        }
        double best = Double.NEGATIVE_INFINITY;
        for (int column = 0; column < values.length; column++) {
            if (!used[column]) {
                used[column] = true;
                best = Math.max(best, values[row][column] + best(values, row + 1, used));
                used[column] = false;
            }
        }
        return best;
    }
}
