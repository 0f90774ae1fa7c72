package io.toolgrade.core.assignment;

/// Solves the linear assignment problem over a square {@link CostMatrix}.
///
/// ### Contracts
/// - **Postcondition**: the returned pairing is a permutation whose total is greater than
///   or equal to that of every other permutation (global optimum, not a heuristic)
///
/// @see HungarianAssignmentSolver for the default implementation
public interface AssignmentSolver {

    /// Finds the pairing that maximizes the sum of selected entries.
    ///
    /// @param matrix square matrix of pairing scores, not null
    /// @return optimal assignment, never null
    /// @throws io.toolgrade.core.exception.AssignmentException if the matrix is malformed
    Assignment maximize(CostMatrix matrix);
}
