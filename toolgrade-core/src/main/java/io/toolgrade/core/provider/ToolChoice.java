package io.toolgrade.core.provider;

/// How strongly the model is asked to call a tool.
public enum ToolChoice {
    /// The model may answer with text instead of calling a tool.
    AUTO,
    /// The model must call at least one tool.
    REQUIRED
}
