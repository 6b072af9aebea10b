package io.formflow.core.context;

import io.formflow.core.event.EventKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Multiset of event kinds a barrier waits for.
///
/// Counts are strictly positive. The special {@link #pending()} value stands for
/// "count not yet known": collecting against it buffers the event and always reports
/// {@link CollectResult.Incomplete}.
///
/// ### Usage
/// {@snippet :
/// RequiredKinds required = RequiredKinds.of(FIELD_RESPONSE, totalFields);
/// RequiredKinds pair = RequiredKinds.of(LEFT, 1).and(RIGHT, 1);
/// }
public final class RequiredKinds {

    private static final RequiredKinds PENDING = new RequiredKinds(Map.of(), true);

    private final Map<EventKind, Integer> counts;
    private final boolean pending;

    private RequiredKinds(Map<EventKind, Integer> counts, boolean pending) {
        this.counts = Collections.unmodifiableMap(counts);
        this.pending = pending;
    }

    /// Creates a requirement for `count` events of one kind.
    ///
    /// @param kind required kind, not null
    /// @param count number of events, must be at least 1
    /// @return new requirement, never null
    /// @throws IllegalArgumentException if `count` is below 1
    public static RequiredKinds of(EventKind kind, int count) {
        return new RequiredKinds(new LinkedHashMap<>(), false).and(kind, count);
    }

    /// Returns the requirement whose count is not yet known.
    ///
    /// @return shared pending instance, never null
    public static RequiredKinds pending() {
        return PENDING;
    }

    /// Returns a copy of this requirement with another kind added.
    ///
    /// Adding a kind already present increases its count.
    ///
    /// @param kind required kind, not null
    /// @param count number of events, must be at least 1
    /// @return new requirement, never null
    /// @throws IllegalArgumentException if `count` is below 1
    /// @throws IllegalStateException if this is the pending requirement
    public RequiredKinds and(EventKind kind, int count) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (pending) {
            throw new IllegalStateException("Cannot add kinds to a pending requirement");
        }
        if (count < 1) {
            throw new IllegalArgumentException(
                    "Required count for " + kind.name() + " must be at least 1, got " + count);
        }
        Map<EventKind, Integer> copy = new LinkedHashMap<>(counts);
        copy.merge(kind, count, Integer::sum);
        return new RequiredKinds(copy, false);
    }

    /// Returns whether the counts are still unknown.
    ///
    /// @return true for {@link #pending()}
    public boolean isPending() {
        return pending;
    }

    /// Returns the required counts in declaration order.
    ///
    /// @return unmodifiable kind to count map, empty when pending
    public Map<EventKind, Integer> counts() {
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequiredKinds other)) {
            return false;
        }
        return pending == other.pending && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts, pending);
    }

    @Override
    public String toString() {
        return pending ? "RequiredKinds[pending]" : "RequiredKinds" + counts;
    }
}
