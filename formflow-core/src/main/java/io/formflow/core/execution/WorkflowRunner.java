package io.formflow.core.execution;

import io.formflow.core.EngineConfig;
import io.formflow.core.exception.WorkflowValidationException;
import io.formflow.core.workflow.Workflow;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Entry point for running workflows.
///
/// Owns the worker pool shared by all runs and a scheduler for the per-run timeout
/// watchdogs. {@link #start} validates the run arguments, creates the run's context,
/// queues START and returns a {@link RunHandle} without executing any step.
///
/// ### Usage
/// {@snippet :
/// try (WorkflowRunner runner = new WorkflowRunner(EngineConfig.builder().build())) {
///     RunHandle run = runner.start(workflow, Map.of("text", "hello"));
///     Object result = run.await();
/// }
/// }
///
/// @implNote Thread-safe. Runs share nothing but the read-only workflow definition and
/// the worker pool.
public class WorkflowRunner implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(WorkflowRunner.class.getName());

    private final EngineConfig config;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final RunListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();

    /// Creates a runner with its own worker pool and no listener.
    ///
    /// @param config engine settings, not null
    public WorkflowRunner(EngineConfig config) {
        this(config, RunListener.NOOP);
    }

    /// Creates a runner with its own worker pool.
    ///
    /// @param config engine settings, not null
    /// @param listener lifecycle listener for every run, not null
    public WorkflowRunner(EngineConfig config, RunListener listener) {
        this(
                config,
                Executors.newFixedThreadPool(config.getWorkerPoolSize()),
                Executors.newSingleThreadScheduledExecutor(),
                listener);
    }

    /// Creates a runner on the given executors. The runner takes ownership of both and
    /// shuts them down on {@link #close()}.
    ///
    /// @param config engine settings, not null
    /// @param workers pool executing step bodies, not null
    /// @param scheduler scheduler for timeout watchdogs, not null
    /// @param listener lifecycle listener for every run, not null
    public WorkflowRunner(
            EngineConfig config,
            ExecutorService workers,
            ScheduledExecutorService scheduler,
            RunListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Starts a run.
    ///
    /// @apiNote **Side effects**: creates the run context, queues START and arms the
    /// timeout watchdog. No step executes until the handle is pulled.
    ///
    /// @param workflow workflow to run, not null
    /// @param arguments run arguments carried by START, not null
    /// @return handle of the new run, never null
    /// @throws WorkflowValidationException if a required argument is missing or blank, or
    ///     any argument is null
    /// @throws IllegalStateException if the runner has been closed
    public RunHandle start(Workflow workflow, Map<String, ?> arguments)
            throws WorkflowValidationException {
        Objects.requireNonNull(workflow, "workflow must not be null");
        ensureOpen();
        if (arguments == null) {
            throw new WorkflowValidationException("Run arguments must not be null");
        }
        workflow.validateArguments(arguments);

        String runId = UUID.randomUUID().toString();
        Duration timeout = workflow.getTimeout().orElse(config.getDefaultTimeout());
        WorkflowRun run = new WorkflowRun(runId, workflow, arguments, timeout, workers, listener);
        ScheduledFuture<?> watchdog;
        try {
            watchdog = scheduler.schedule(run::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // close() raced this start
            run.cancel();
            throw new IllegalStateException("Workflow runner is closed", e);
        }
        run.setWatchdog(watchdog);

        logger.info(
                "Started run "
                        + runId
                        + " of workflow "
                        + workflow.getId()
                        + " (timeout "
                        + timeout.toSeconds()
                        + "s)");
        listener.onRunStarted(runId, workflow.getId());
        return run;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Workflow runner is closed");
        }
    }

    public EngineConfig getConfig() {
        return config;
    }

    /// Stops the worker pool and the watchdog scheduler. Running step bodies are
    /// interrupted; handles of unfinished runs time out or fail on their next pull.
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdownNow();
        scheduler.shutdownNow();
        logger.info("Workflow runner closed");
    }
}
