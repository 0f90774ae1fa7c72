package io.toolgrade.core.exception;

import java.io.Serial;

/// Failure of the external component that supplies actual tool calls.
///
/// The suite runner converts it into a failed case outcome carrying the message as
/// diagnostic; the rest of the suite keeps running.
public class ToolCallProviderException extends RuntimeException {
    @Serial private static final long serialVersionUID = -1733907463181290520L;

    public ToolCallProviderException(String message) {
        super(message);
    }

    public ToolCallProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
