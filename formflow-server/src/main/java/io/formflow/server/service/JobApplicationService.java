package io.formflow.server.service;

import io.formflow.core.event.Event;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.exception.InjectionRejectedException;
import io.formflow.core.exception.WorkflowException;
import io.formflow.core.execution.RunHandle;
import io.formflow.core.execution.RunStatus;
import io.formflow.core.execution.WorkflowRunner;
import io.formflow.core.jobapp.JobApplicationWorkflow;
import io.formflow.core.workflow.Workflow;
import io.formflow.server.validation.LogSanitizer;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.Serial;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Runs job-application workflows on behalf of HTTP clients.
///
/// An upload stores both documents under the data directory, starts a run and
/// drives it to its first review request. Each response injects the reviewer's
/// feedback and drives the run to the next review request or to completion.
///
/// ### Run retention
/// Live runs are tracked until their outcome is known. On any terminal outcome
/// (completion, failure, timeout, cancellation) the run's files are deleted and it is
/// replaced by a final {@link RunSnapshot}. Only the most recent
/// `formflow.runs.retained` snapshots are kept; older ids answer as not found.
///
/// ### Stored file names
/// `<type>_<yyyyMMdd_HHmmss><ext>`, e.g. `resume_20240301_142530.pdf`. A numeric
/// suffix is added when two uploads land in the same second.
///
/// @implNote Thread-safe. Live runs sit in a concurrent map, finished snapshots in a
/// synchronized insertion-ordered map. Concurrent responses to the same run are
/// serialized by the run itself, which rejects every injection but the first.
@ApplicationScoped
public class JobApplicationService {

    private static final Logger LOG = Logger.getLogger(JobApplicationService.class);

    public static final int DEFAULT_RETAINED_RUNS = 100;

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final WorkflowRunner runner;
    private final Workflow workflow;
    private final Path dataDir;
    private final Map<String, TrackedRun> runs = new ConcurrentHashMap<>();
    private final Map<String, RunSnapshot> finished;

    @Inject
    public JobApplicationService(
            WorkflowRunner runner,
            Workflow workflow,
            @ConfigProperty(name = "formflow.data.dir", defaultValue = "data") String dataDir,
            @ConfigProperty(name = "formflow.runs.retained", defaultValue = "100")
                    int retainedRuns) {
        this(runner, workflow, Path.of(dataDir), retainedRuns);
    }

    public JobApplicationService(WorkflowRunner runner, Workflow workflow, Path dataDir) {
        this(runner, workflow, dataDir, DEFAULT_RETAINED_RUNS);
    }

    public JobApplicationService(
            WorkflowRunner runner, Workflow workflow, Path dataDir, int retainedRuns) {
        if (retainedRuns < 0) {
            throw new IllegalArgumentException("retainedRuns must not be negative");
        }
        this.runner = runner;
        this.workflow = workflow;
        this.dataDir = dataDir;
        this.finished =
                Collections.synchronizedMap(
                        new LinkedHashMap<String, RunSnapshot>() {
                            @Override
                            protected boolean removeEldestEntry(
                                    Map.Entry<String, RunSnapshot> eldest) {
                                return size() > retainedRuns;
                            }
                        });
    }

    /// Stores the uploaded documents, starts a run and waits for its first review
    /// request.
    ///
    /// @param resume uploaded resume, not null
    /// @param applicationForm uploaded form, not null
    /// @return the run id with the first filled form, never null
    /// @throws WorkflowExecutionException if storing fails or the run ends before
    ///     asking for review; stored files are deleted first
    public UploadResult upload(UploadedDocument resume, UploadedDocument applicationForm) {
        List<Path> stored = new ArrayList<>();
        RunHandle handle = null;
        try {
            Path resumePath = store("resume", resume);
            stored.add(resumePath);
            Path formPath = store("application_form", applicationForm);
            stored.add(formPath);

            handle =
                    runner.start(
                            workflow,
                            Map.of(
                                    JobApplicationWorkflow.RESUME_FILE, resumePath.toString(),
                                    JobApplicationWorkflow.APPLICATION_FORM, formPath.toString()));
            track(handle, List.copyOf(stored));

            Event event = handle.nextEvent().orElse(null);
            if (event == null || !event.is(SystemEvents.INPUT_REQUIRED)) {
                throw new WorkflowExecutionException(
                        handle.runId(), "Run ended before requesting review", null);
            }
            LOG.infov("Run {0} awaiting review", handle.runId());
            return new UploadResult(
                    handle.runId(),
                    event.getString(SystemEvents.RESULT),
                    event.getString(SystemEvents.PREFIX));
        } catch (IOException | WorkflowException e) {
            discard(handle, stored);
            throw new WorkflowExecutionException(
                    runIdOf(handle), "Failed to process upload: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discard(handle, stored);
            throw new WorkflowExecutionException(
                    runIdOf(handle), "Interrupted while processing upload", e);
        } catch (RuntimeException e) {
            discard(handle, stored);
            throw e;
        }
    }

    /// Injects reviewer feedback and drives the run to its next outward event.
    ///
    /// @param runId run to answer, not null
    /// @param feedback reviewer text, not null
    /// @return the run's state after the feedback was processed, never null
    /// @throws RunNotFoundException if no run has this id
    /// @throws RunNotAwaitingInputException if the run is not suspended for review
    /// @throws WorkflowExecutionException if the run fails or times out
    public RespondResult respond(String runId, String feedback) {
        TrackedRun tracked = runs.get(runId);
        if (tracked == null) {
            RunSnapshot done = finished.get(runId);
            if (done != null) {
                throw new RunNotAwaitingInputException(
                        runId, "Run " + runId + " is " + done.status() + ", not awaiting input");
            }
            throw new RunNotFoundException(runId);
        }
        RunHandle handle = tracked.handle();
        try {
            handle.respond(feedback);
        } catch (InjectionRejectedException e) {
            throw new RunNotAwaitingInputException(runId, e.getMessage());
        }

        try {
            Optional<Event> next = handle.nextEvent();
            if (next.isPresent() && next.get().is(SystemEvents.INPUT_REQUIRED)) {
                Event request = next.get();
                return new RespondResult(
                        RunStatus.SUSPENDED_FOR_INPUT,
                        request.getString(SystemEvents.RESULT),
                        request.getString(SystemEvents.PREFIX));
            }
            String result =
                    next.flatMap(stop -> stop.find(SystemEvents.RESULT))
                            .map(Object::toString)
                            .orElse(null);
            LOG.infov("Run {0} completed", LogSanitizer.sanitize(runId));
            return new RespondResult(handle.status(), result, null);
        } catch (WorkflowException e) {
            throw new WorkflowExecutionException(runId, "Run failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowExecutionException(
                    runId, "Interrupted while processing response", e);
        }
    }

    /// Returns a snapshot of a live or recently finished run.
    ///
    /// @param runId run to inspect, not null
    /// @return current state, never null
    /// @throws RunNotFoundException if no run has this id or its snapshot was evicted
    public RunSnapshot status(String runId) {
        TrackedRun tracked = runs.get(runId);
        if (tracked != null) {
            return snapshotOf(tracked.handle());
        }
        RunSnapshot done = finished.get(runId);
        if (done == null) {
            throw new RunNotFoundException(runId);
        }
        return done;
    }

    /// Number of runs whose outcome is not yet known.
    int liveRuns() {
        return runs.size();
    }

    /// Cancels unfinished runs and deletes every stored document.
    @PreDestroy
    public void cleanup() {
        int live = runs.size();
        for (TrackedRun tracked : List.copyOf(runs.values())) {
            tracked.handle().cancel();
            retire(tracked);
        }
        runs.clear();
        finished.clear();
        LOG.infov("Cleaned up {0} live run(s)", live);
    }

    private void track(RunHandle handle, List<Path> files) {
        TrackedRun tracked = new TrackedRun(handle, files);
        runs.put(handle.runId(), tracked);
        handle.result().whenComplete((value, failure) -> retire(tracked));
    }

    // Runs on the thread that ended the run; may race cleanup(), hence the remove check.
    private void retire(TrackedRun tracked) {
        RunHandle handle = tracked.handle();
        if (runs.remove(handle.runId(), tracked)) {
            finished.put(handle.runId(), snapshotOf(handle));
            deleteFiles(tracked.files());
            LOG.debugv("Run {0} retired as {1}", handle.runId(), handle.status());
        }
    }

    private static RunSnapshot snapshotOf(RunHandle handle) {
        CompletableFuture<Object> outcome = handle.result();
        Object result =
                outcome.isDone() && !outcome.isCompletedExceptionally()
                        ? outcome.getNow(null)
                        : null;
        return new RunSnapshot(
                handle.runId(),
                handle.status(),
                handle.startedAt(),
                handle.pendingInput().orElse(null),
                result != null ? result.toString() : null);
    }

    private Path store(String type, UploadedDocument document) throws IOException {
        Files.createDirectories(dataDir);
        String base = type + "_" + LocalDateTime.now().format(TIMESTAMP);
        String extension = extensionOf(document.fileName());
        Path target = dataDir.resolve(base + extension);
        for (int i = 1; Files.exists(target); i++) {
            target = dataDir.resolve(base + "_" + i + extension);
        }
        Files.copy(document.content(), target);
        LOG.debugv(
                "Stored {0} as {1}",
                LogSanitizer.sanitize(document.fileName()),
                target.getFileName());
        return target;
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = Path.of(fileName).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static String runIdOf(RunHandle handle) {
        return handle != null ? handle.runId() : null;
    }

    private void discard(RunHandle handle, List<Path> files) {
        if (handle != null) {
            handle.cancel();
            runs.remove(handle.runId());
            finished.remove(handle.runId());
        }
        deleteFiles(files);
    }

    private void deleteFiles(List<Path> files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warnv("Failed to delete {0}: {1}", file, e.getMessage());
            }
        }
    }

    private record TrackedRun(RunHandle handle, List<Path> files) {}

    // --- DTOs ---

    /// An uploaded document as received by the transport.
    ///
    /// @param fileName client-side file name, may be null
    /// @param content server-side temporary copy, not null
    public record UploadedDocument(String fileName, Path content) {}

    public record UploadResult(String runId, String filledForm, String feedbackPrompt) {}

    public record RespondResult(RunStatus status, String filledForm, String feedbackPrompt) {}

    /// State of a run at the time of the call.
    ///
    /// @param pendingInput the outstanding INPUT_REQUIRED event, or null
    /// @param result the STOP result once completed, or null
    public record RunSnapshot(
            String runId, RunStatus status, Instant startedAt, Event pendingInput, String result) {}

    // --- Exceptions ---

    /// Thrown when no run has the requested id.
    public static class RunNotFoundException extends RuntimeException {
        @Serial private static final long serialVersionUID = 3905725815474316611L;

        private final String runId;

        public RunNotFoundException(String runId) {
            super("Workflow not found: " + runId);
            this.runId = runId;
        }

        public String getRunId() {
            return runId;
        }
    }

    /// Thrown when feedback arrives for a run that is not suspended for review.
    public static class RunNotAwaitingInputException extends RuntimeException {
        @Serial private static final long serialVersionUID = -1774087395231904228L;

        private final String runId;

        public RunNotAwaitingInputException(String runId, String message) {
            super(message);
            this.runId = runId;
        }

        public String getRunId() {
            return runId;
        }
    }

    /// Thrown when a run fails, times out or cannot be started.
    public static class WorkflowExecutionException extends RuntimeException {
        @Serial private static final long serialVersionUID = 8412503375619770451L;

        private final String runId;

        /// @param runId affected run, or null when no run was started
        public WorkflowExecutionException(String runId, String message, Throwable cause) {
            super(message, cause);
            this.runId = runId;
        }

        public String getRunId() {
            return runId;
        }
    }
}
