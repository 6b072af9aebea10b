package io.formflow.core.execution;

import io.formflow.core.context.RunContext;
import io.formflow.core.event.Event;
import io.formflow.core.step.StepContext;
import io.formflow.core.step.StepDefinition;
import io.formflow.core.step.StepRegistry;
import io.formflow.core.step.StepResult;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Routes a run's events to the steps subscribed to their kind.
///
/// Every matching step is scheduled once on the worker pool. Whatever a step emits,
/// and any failure it raises, is posted back to the run's signal queue; the dispatcher
/// never routes emitted events itself. Events no step accepts are absorbed.
///
/// @implNote Thread-safe. {@link #dispatch} is called by the single driving thread,
/// step bodies run concurrently on the pool, and the in-flight counter is atomic.
public final class Dispatcher {

    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final StepRegistry registry;
    private final RunContext context;
    private final ExecutorService workers;
    private final BlockingQueue<RunSignal> signals;
    private final RunListener listener;
    private final AtomicInteger inFlight = new AtomicInteger();

    Dispatcher(
            StepRegistry registry,
            RunContext context,
            ExecutorService workers,
            BlockingQueue<RunSignal> signals,
            RunListener listener) {
        this.registry = registry;
        this.context = context;
        this.workers = workers;
        this.signals = signals;
        this.listener = listener;
    }

    /// Schedules every step accepting the event's kind.
    ///
    /// @param event event to route, not null
    /// @return number of scheduled executions, 0 if the event was absorbed
    public int dispatch(Event event) {
        List<StepDefinition> targets = registry.stepsAccepting(event.kind());
        if (targets.isEmpty()) {
            logger.fine(
                    () ->
                            "Run "
                                    + context.getRunId()
                                    + ": no step accepts "
                                    + event.kind().name()
                                    + ", event absorbed");
            return 0;
        }
        for (StepDefinition step : targets) {
            logger.fine(
                    () ->
                            "Run "
                                    + context.getRunId()
                                    + ": dispatching "
                                    + event.kind().name()
                                    + " to "
                                    + step.id());
            schedule(step, event);
        }
        return targets.size();
    }

    /// Returns the number of step executions scheduled but not yet finished.
    ///
    /// @return in-flight count, never negative
    public int inFlight() {
        return inFlight.get();
    }

    private void schedule(StepDefinition step, Event event) {
        inFlight.incrementAndGet();
        try {
            workers.execute(() -> execute(step, event));
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            signals.add(new RunSignal.StepFailed(step.id(), e));
        }
    }

    private void execute(StepDefinition step, Event event) {
        String runId = context.getRunId();
        try {
            listener.onStepStarted(runId, step.id(), event);
            StepContext stepContext =
                    new StepContext(
                            step,
                            context,
                            emitted -> signals.add(new RunSignal.Emitted(step.id(), emitted)));
            StepResult result = step.handler().handle(event, stepContext);
            if (result == null) {
                throw new IllegalStateException("Step '" + step.id() + "' returned null");
            }
            List<Event> emitted = result.events();
            for (Event out : emitted) {
                StepContext.ensureDeclared(step, out);
            }
            emitted.forEach(out -> signals.add(new RunSignal.Emitted(step.id(), out)));
            listener.onStepCompleted(runId, step.id(), emitted);
        } catch (Exception e) {
            if (context.isReleased()) {
                logger.fine(
                        () ->
                                "Run "
                                        + runId
                                        + ": discarding failure of "
                                        + step.id()
                                        + " after termination");
            } else {
                logger.log(Level.WARNING, "Run " + runId + ": step " + step.id() + " failed", e);
            }
            signals.add(new RunSignal.StepFailed(step.id(), e));
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
