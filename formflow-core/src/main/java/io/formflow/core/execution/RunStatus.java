package io.formflow.core.execution;

/// Lifecycle status of a run.
///
/// ```
/// RUNNING ⇄ SUSPENDED_FOR_INPUT
///    │              │
///    └──────┬───────┘
///           ▼
/// COMPLETED | FAILED | TIMED_OUT
/// ```
public enum RunStatus {
    RUNNING,
    SUSPENDED_FOR_INPUT,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    /// Returns whether no further transition is possible.
    ///
    /// @return true for COMPLETED, FAILED and TIMED_OUT
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
