package io.formflow.core.context;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/// Per-run shared state: a key/value store plus the run's {@link Barrier}.
///
/// Exactly one context exists per run. It lives from START until the run reaches a
/// terminal status, at which point {@link #release()} clears it; any step still
/// running afterwards fails on its next access, and its failure is discarded because
/// the run is already terminal.
///
/// ### Contracts
/// - Writes are last-write-wins
/// - Values are never null
/// - Suspension does not touch the context
///
/// @implNote Thread-safe. Every read and write is serialized by one lock per run.
public final class RunContext {

    private final String runId;
    private final Map<String, Object> values = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Barrier barrier = new Barrier();
    private boolean released;

    /// Creates an empty context for a run.
    ///
    /// @param runId owning run, not null
    public RunContext(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
    }

    public String getRunId() {
        return runId;
    }

    /// Stores a value, replacing any previous one.
    ///
    /// @param key value name, not null
    /// @param value value, not null
    /// @throws IllegalStateException if the context was released
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value for '" + key + "' must not be null");
        lock.lock();
        try {
            ensureActive();
            values.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /// Looks up a value.
    ///
    /// @param key value name, not null
    /// @param type expected type, not null
    /// @param <T> value type
    /// @return the value, or empty if absent
    /// @throws IllegalStateException if the context was released
    /// @throws ClassCastException if the stored value has another type
    public <T> Optional<T> find(String key, Class<T> type) {
        lock.lock();
        try {
            ensureActive();
            return Optional.ofNullable(values.get(key)).map(type::cast);
        } finally {
            lock.unlock();
        }
    }

    /// Returns a value that must be present.
    ///
    /// @param key value name, not null
    /// @param type expected type, not null
    /// @param <T> value type
    /// @return the value, never null
    /// @throws IllegalStateException if the value is absent or the context was released
    public <T> T get(String key, Class<T> type) {
        return find(key, type)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "No value '" + key + "' in context of run " + runId));
    }

    /// Returns a copy of all stored values.
    ///
    /// @return snapshot map, never null
    public Map<String, Object> snapshot() {
        lock.lock();
        try {
            ensureActive();
            return Map.copyOf(values);
        } finally {
            lock.unlock();
        }
    }

    /// Returns the fan-in buffers of this run.
    ///
    /// @return barrier, never null
    public Barrier barrier() {
        return barrier;
    }

    /// Clears the store and drains all barrier buffers. Idempotent.
    public void release() {
        lock.lock();
        try {
            released = true;
            values.clear();
        } finally {
            lock.unlock();
        }
        barrier.release();
    }

    public boolean isReleased() {
        lock.lock();
        try {
            return released;
        } finally {
            lock.unlock();
        }
    }

    private void ensureActive() {
        if (released) {
            throw new IllegalStateException("Context of run " + runId + " has been released");
        }
    }
}
