package io.formflow.core.context;

import io.formflow.core.event.Event;
import io.formflow.core.event.EventKind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Fan-in buffers keyed by step id.
///
/// Each collecting step owns one buffer. {@link #collect} appends the offered event,
/// then checks whether the buffer holds at least the required count of every required
/// kind; if so it removes exactly that many of each kind, earliest first, and returns
/// them as a {@link CollectResult.Batch}. Surplus events stay buffered for the next
/// round, so 2k arrivals against a requirement of k release exactly two batches.
///
/// @implNote Thread-safe. Append, check and drain happen under the monitor of the
/// step's buffer, so concurrent executions of the same step never both observe a
/// satisfied requirement for the same events. Buffers of different steps do not
/// contend.
public final class Barrier {

    private static final Logger logger = Logger.getLogger(Barrier.class.getName());

    private final Map<String, List<Event>> buffers = new ConcurrentHashMap<>();
    private volatile boolean released;

    /// Offers an event to the buffer of `stepId`.
    ///
    /// @param stepId owning step, not null
    /// @param event event to buffer, not null
    /// @param required kinds and counts that release a batch, not null
    /// @return batch when the requirement is met, otherwise incomplete; never null
    /// @throws IllegalStateException if the barrier was released with its run
    public CollectResult collect(String stepId, Event event, RequiredKinds required) {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(required, "required must not be null");
        ensureActive();

        List<Event> buffer = buffers.computeIfAbsent(stepId, id -> new ArrayList<>());
        synchronized (buffer) {
            ensureActive();
            buffer.add(event);
            if (required.isPending() || !satisfied(buffer, required)) {
                logger.fine(
                        () ->
                                "Buffered "
                                        + event.kind().name()
                                        + " for "
                                        + stepId
                                        + " ("
                                        + buffer.size()
                                        + " held)");
                return new CollectResult.Incomplete();
            }
            List<Event> batch = drain(buffer, required);
            logger.fine(() -> "Released batch of " + batch.size() + " to " + stepId);
            return new CollectResult.Batch(batch);
        }
    }

    /// Returns how many events are buffered for a step.
    ///
    /// @param stepId owning step, not null
    /// @return number of held events, 0 if none
    public int buffered(String stepId) {
        List<Event> buffer = buffers.get(stepId);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /// Drops every buffer. Later calls to {@link #collect} fail.
    public void release() {
        released = true;
        buffers.values()
                .forEach(
                        buffer -> {
                            synchronized (buffer) {
                                buffer.clear();
                            }
                        });
        buffers.clear();
    }

    private void ensureActive() {
        if (released) {
            throw new IllegalStateException("Barrier has been released");
        }
    }

    private static boolean satisfied(List<Event> buffer, RequiredKinds required) {
        for (Map.Entry<EventKind, Integer> entry : required.counts().entrySet()) {
            long held = buffer.stream().filter(e -> e.is(entry.getKey())).count();
            if (held < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    private static List<Event> drain(List<Event> buffer, RequiredKinds required) {
        List<Event> batch = new ArrayList<>();
        for (Map.Entry<EventKind, Integer> entry : required.counts().entrySet()) {
            int remaining = entry.getValue();
            Iterator<Event> it = buffer.iterator();
            while (remaining > 0 && it.hasNext()) {
                Event candidate = it.next();
                if (candidate.is(entry.getKey())) {
                    batch.add(candidate);
                    it.remove();
                    remaining--;
                }
            }
        }
        return batch;
    }
}
