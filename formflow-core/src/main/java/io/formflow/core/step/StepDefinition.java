package io.formflow.core.step;

import io.formflow.core.event.EventKind;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// A registered unit of work: the kinds it accepts, the kinds it may emit, and its
/// handler.
///
/// Structural rules (unique ids, outward-only kinds, human-response ownership) are
/// enforced when the definition is added to a {@link StepRegistry}.
///
/// @param id unique step identifier, not null
/// @param accepts kinds that trigger this step, not null
/// @param emits kinds this step is allowed to produce, not null
/// @param handler step body, not null
public record StepDefinition(
        String id, Set<EventKind> accepts, Set<EventKind> emits, StepHandler handler) {

    public StepDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        accepts = Collections.unmodifiableSet(new LinkedHashSet<>(accepts));
        emits = Collections.unmodifiableSet(new LinkedHashSet<>(emits));
    }

    /// Returns whether this step is triggered by the given kind.
    ///
    /// @param kind kind to test, not null
    /// @return true if accepted
    public boolean accepts(EventKind kind) {
        return accepts.contains(kind);
    }

    /// Returns whether this step declared the given output kind.
    ///
    /// @param kind kind to test, not null
    /// @return true if the step may emit it
    public boolean mayEmit(EventKind kind) {
        return emits.contains(kind);
    }

    /// Starts a definition for the given step id.
    ///
    /// @param id unique step identifier, not null
    /// @return new builder, never null
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private final Set<EventKind> accepts = new LinkedHashSet<>();
        private final Set<EventKind> emits = new LinkedHashSet<>();
        private StepHandler handler;

        private Builder(String id) {
            this.id = id;
        }

        public Builder accepts(EventKind... kinds) {
            accepts.addAll(List.of(kinds));
            return this;
        }

        public Builder emits(EventKind... kinds) {
            emits.addAll(List.of(kinds));
            return this;
        }

        public Builder handler(StepHandler handler) {
            this.handler = handler;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(id, accepts, emits, handler);
        }
    }
}
