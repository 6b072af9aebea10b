package io.formflow.core.execution;

import io.formflow.core.context.RunContext;
import io.formflow.core.event.Event;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.exception.InjectionRejectedException;
import io.formflow.core.exception.StepFailureException;
import io.formflow.core.exception.WorkflowCancelledException;
import io.formflow.core.exception.WorkflowException;
import io.formflow.core.exception.WorkflowTimeoutException;
import io.formflow.core.workflow.Workflow;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// State machine of a single run.
///
/// ### Dispatch loop
/// The thread holding `driveLock` takes the next event from the local ready queue,
/// or waits on the signal queue until the deadline, and routes it:
/// - STOP completes the run and is returned outward
/// - INPUT_REQUIRED suspends the run and is returned outward
/// - while suspended, every other event is held back in arrival order
/// - anything else goes to the {@link Dispatcher}
///
/// An injected HUMAN_RESPONSE lifts the suspension, is dispatched to the step
/// accepting it, and moves the held-back events back onto the ready queue.
///
/// @implNote The terminal outcome is recorded by compare-and-set before the status
/// changes, so the driver, the watchdog and a cancelling caller agree on exactly one
/// of them. Injection flips the status with its own compare-and-set. The ready queue, the held-back list and the `halted` flag are only
/// touched under `driveLock`.
final class WorkflowRun implements RunHandle {

    private static final Logger logger = Logger.getLogger(WorkflowRun.class.getName());

    private final String runId;
    private final Workflow workflow;
    private final RunContext context;
    private final Dispatcher dispatcher;
    private final RunListener listener;
    private final BlockingQueue<RunSignal> signals = new LinkedBlockingQueue<>();
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.RUNNING);
    private final CompletableFuture<Object> result = new CompletableFuture<>();
    private final ReentrantLock driveLock = new ReentrantLock();
    private final Instant startedAt;
    private final long deadlineNanos;
    private final Duration timeout;

    private final Deque<Event> ready = new ArrayDeque<>();
    private final List<Event> held = new ArrayList<>();
    private boolean halted;

    private final AtomicReference<Outcome> outcome = new AtomicReference<>();
    private volatile Event pendingInput;
    private volatile ScheduledFuture<?> watchdog;

    WorkflowRun(
            String runId,
            Workflow workflow,
            Map<String, ?> arguments,
            Duration timeout,
            ExecutorService workers,
            RunListener listener) {
        this.runId = runId;
        this.workflow = workflow;
        this.timeout = timeout;
        this.listener = listener;
        this.context = new RunContext(runId);
        this.dispatcher =
                new Dispatcher(workflow.getRegistry(), context, workers, signals, listener);
        this.startedAt = Instant.now();
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
        ready.add(SystemEvents.start(arguments));
    }

    void setWatchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
        if (outcome.get() != null) {
            watchdog.cancel(false);
        }
    }

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public RunStatus status() {
        return status.get();
    }

    @Override
    public Optional<Event> pendingInput() {
        return Optional.ofNullable(pendingInput);
    }

    @Override
    public int inFlightSteps() {
        return dispatcher.inFlight();
    }

    RunContext context() {
        return context;
    }

    @Override
    public Optional<Event> nextEvent() throws WorkflowException, InterruptedException {
        driveLock.lockInterruptibly();
        try {
            while (true) {
                Outcome done = outcome.get();
                if (done != null) {
                    if (done.failure() == null) {
                        return Optional.empty();
                    }
                    throw done.failure();
                }
                Event next = ready.pollFirst();
                if (next == null) {
                    next = awaitSignal();
                    if (next == null) {
                        continue;
                    }
                }
                Optional<Event> outward = route(next);
                if (outward.isPresent()) {
                    return outward;
                }
            }
        } finally {
            driveLock.unlock();
        }
    }

    @Override
    public Iterator<Event> events() {
        return new Iterator<>() {
            private Event next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (done) {
                    return false;
                }
                try {
                    next = nextEvent().orElse(null);
                } catch (WorkflowException e) {
                    logger.fine(() -> "Run " + runId + ": event sequence ended by " + e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                done = next == null;
                return next != null;
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Event current = next;
                next = null;
                return current;
            }
        };
    }

    @Override
    public Stream<Event> streamEvents() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        events(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    @Override
    public void respond(String feedback) throws InjectionRejectedException {
        inject(SystemEvents.humanResponse(feedback));
    }

    @Override
    public void inject(Event event) throws InjectionRejectedException {
        if (!event.is(SystemEvents.HUMAN_RESPONSE)) {
            throw new InjectionRejectedException(
                    "Only HUMAN_RESPONSE can be injected, got " + event.kind().name());
        }
        if (!status.compareAndSet(RunStatus.SUSPENDED_FOR_INPUT, RunStatus.RUNNING)) {
            throw new InjectionRejectedException(
                    "Run " + runId + " is " + status.get() + ", not awaiting input");
        }
        pendingInput = null;
        signals.add(new RunSignal.Injected(event));
        logger.info("Run " + runId + " resumed by human response");
        listener.onResumed(runId, event);
    }

    @Override
    public Object await() throws WorkflowException, InterruptedException {
        while (outcome.get() == null) {
            nextEvent();
        }
        Outcome done = outcome.get();
        if (done.failure() != null) {
            throw done.failure();
        }
        return done.value();
    }

    @Override
    public CompletableFuture<Object> result() {
        return result;
    }

    @Override
    public boolean cancel() {
        return terminate(RunStatus.FAILED, null, new WorkflowCancelledException(runId));
    }

    /// Watchdog entry point: terminates the run as TIMED_OUT unless already terminal.
    void expire() {
        terminate(RunStatus.TIMED_OUT, null, new WorkflowTimeoutException(runId, timeout));
    }

    private Event awaitSignal() throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            expire();
            return null;
        }
        RunSignal signal = signals.poll(remaining, TimeUnit.NANOSECONDS);
        if (signal == null) {
            expire();
            return null;
        }
        if (signal instanceof RunSignal.Emitted emitted) {
            listener.onEventEmitted(runId, emitted.stepId(), emitted.event());
            return emitted.event();
        }
        if (signal instanceof RunSignal.StepFailed failed) {
            Throwable cause = failed.cause();
            String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            terminate(
                    RunStatus.FAILED,
                    null,
                    new StepFailureException(failed.stepId(), message, cause));
            return null;
        }
        if (signal instanceof RunSignal.Injected injected) {
            halted = false;
            dispatcher.dispatch(injected.event());
            ready.addAll(held);
            held.clear();
        }
        return null;
    }

    private Optional<Event> route(Event event) {
        if (halted) {
            logger.fine(() -> "Run " + runId + ": holding back " + event.kind().name());
            held.add(event);
            return Optional.empty();
        }
        if (event.is(SystemEvents.STOP)) {
            Object value = event.get(SystemEvents.RESULT, Object.class);
            return terminate(RunStatus.COMPLETED, value, null)
                    ? Optional.of(event)
                    : Optional.empty();
        }
        if (event.is(SystemEvents.INPUT_REQUIRED)) {
            if (!status.compareAndSet(RunStatus.RUNNING, RunStatus.SUSPENDED_FOR_INPUT)) {
                return Optional.empty();
            }
            halted = true;
            pendingInput = event;
            logger.info("Run " + runId + " suspended for human input");
            listener.onSuspended(runId, event);
            return Optional.of(event);
        }
        dispatcher.dispatch(event);
        return Optional.empty();
    }

    private boolean terminate(RunStatus terminal, Object value, WorkflowException cause) {
        if (!outcome.compareAndSet(null, new Outcome(value, cause))) {
            return false;
        }
        status.set(terminal);
        pendingInput = null;
        context.release();
        ScheduledFuture<?> timer = watchdog;
        if (timer != null) {
            timer.cancel(false);
        }
        if (cause == null) {
            logger.info("Run " + runId + " of workflow " + workflow.getId() + " completed");
            result.complete(value);
        } else {
            logger.warning("Run " + runId + " ended " + terminal + ": " + cause.getMessage());
            result.completeExceptionally(cause);
        }
        listener.onRunTerminated(runId, terminal, cause);
        signals.add(new RunSignal.Wakeup());
        return true;
    }

    /// Terminal outcome; the first one recorded wins.
    private record Outcome(Object value, WorkflowException failure) {}
}
