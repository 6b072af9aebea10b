package io.formflow.core.step;

import io.formflow.core.context.CollectResult;
import io.formflow.core.context.RequiredKinds;
import io.formflow.core.context.RunContext;
import io.formflow.core.event.Event;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/// View of a run handed to one step execution.
///
/// Wraps the run's {@link RunContext} and adds the operations that need to know which
/// step is calling: emitting events mid-execution and collecting into the step's own
/// barrier buffer.
///
/// @implNote Events passed to {@link #sendEvent} are delivered before the events the
/// handler returns, so one execution's emissions keep handler order.
public final class StepContext {

    private final StepDefinition step;
    private final RunContext context;
    private final Consumer<Event> emitter;

    /// Creates a view for one execution.
    ///
    /// @param step executing step, not null
    /// @param context run state, not null
    /// @param emitter sink for events sent mid-execution, not null
    public StepContext(StepDefinition step, RunContext context, Consumer<Event> emitter) {
        this.step = Objects.requireNonNull(step, "step must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
    }

    public String runId() {
        return context.getRunId();
    }

    public String stepId() {
        return step.id();
    }

    public void set(String key, Object value) {
        context.set(key, value);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        return context.find(key, type);
    }

    public <T> T get(String key, Class<T> type) {
        return context.get(key, type);
    }

    /// Emits an event immediately, before the handler returns.
    ///
    /// @param event event to emit, not null
    /// @throws IllegalStateException if the step did not declare the event's kind
    public void sendEvent(Event event) {
        ensureDeclared(step, event);
        emitter.accept(event);
    }

    /// Buffers an event in this step's barrier.
    ///
    /// @param event event to buffer, not null
    /// @param required kinds and counts that release a batch, not null
    /// @return batch or incomplete, never null
    public CollectResult collect(Event event, RequiredKinds required) {
        return context.barrier().collect(step.id(), event, required);
    }

    /// Checks an emission against the step's declared output kinds.
    ///
    /// @param step emitting step, not null
    /// @param event emitted event, not null
    /// @throws IllegalStateException if the kind was not declared
    public static void ensureDeclared(StepDefinition step, Event event) {
        if (!step.mayEmit(event.kind())) {
            throw new IllegalStateException(
                    "Step '"
                            + step.id()
                            + "' emitted undeclared kind "
                            + event.kind().name()
                            + ", declared "
                            + step.emits());
        }
    }
}
