package io.toolgrade.core.exception;

import java.io.Serial;

/// Invariant violation inside the assignment solver, such as a ragged or non-square matrix.
///
/// Indicates a programming error in matrix construction; callers are not expected to
/// recover from it.
public class AssignmentException extends IllegalStateException {
    @Serial private static final long serialVersionUID = 8861150293372905127L;

    public AssignmentException(String message) {
        super(message);
    }
}
