package io.toolgrade.core.exception;

import java.io.Serial;

/// Raised when a critic cannot score a value pair with its own configuration.
///
/// Surfaces at evaluation time (degenerate numeric range, non-numeric input to a numeric
/// critic, unregistered similarity metric) and aborts the evaluation of the owning case.
/// It is never converted into a zero score.
public class CriticConfigurationException extends IllegalStateException {
    @Serial private static final long serialVersionUID = -6402274718356020914L;

    private final String field;

    public CriticConfigurationException(String field, String message) {
        super("Critic '" + field + "': " + message);
        this.field = field;
    }

    public CriticConfigurationException(String field, String message, Throwable cause) {
        super("Critic '" + field + "': " + message, cause);
        this.field = field;
    }

    /// Returns the argument field of the failing critic.
    ///
    /// @return critic field, never null
    public String getField() {
        return field;
    }
}
