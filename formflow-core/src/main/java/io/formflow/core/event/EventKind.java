package io.formflow.core.event;

/// Discriminator of an {@link Event}.
///
/// Workflows declare their own kinds as enums implementing this interface; the
/// orchestrator's privileged kinds live in {@link SystemEvents}. Routing compares kinds
/// by equality only, so every kind must be a singleton constant (enum constants are).
///
/// @see SystemEvents for START, STOP, INPUT_REQUIRED and HUMAN_RESPONSE
public interface EventKind {

    /// Returns the stable name of this kind, used in logs and serialized events.
    ///
    /// @return kind name, never null
    String name();
}
