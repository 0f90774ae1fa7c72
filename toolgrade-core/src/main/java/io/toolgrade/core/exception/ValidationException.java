package io.toolgrade.core.exception;

import java.io.Serial;

/// Raised when a case, critic, rubric or suite definition is structurally invalid.
///
/// Thrown at construction time, before any scenario runs. Examples: critic weights that
/// sum above the allowed total, thresholds outside `[0, 1]`, a fail threshold above the
/// warn threshold, or a duplicate case name within a suite.
public class ValidationException extends IllegalArgumentException {
    @Serial private static final long serialVersionUID = 3124687519902846135L;

    public ValidationException(String message) {
        super(message);
    }
}
