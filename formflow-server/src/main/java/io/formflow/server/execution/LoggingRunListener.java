package io.formflow.server.execution;

import io.formflow.core.event.Event;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.execution.RunListener;
import io.formflow.core.execution.RunStatus;
import java.util.List;
import org.jboss.logging.Logger;

/// Logs run lifecycle and step activity to the server log.
///
/// Milestones (start, suspension, resume, termination) go to INFO; per-step
/// traffic goes to DEBUG so that a fan-out over many fields stays quiet by default.
///
/// ### Log Format
/// ```
/// [runId] started workflow job-application
/// [runId] → parse-form  on PARSE_FORM
/// [runId] ← parse-form  emitted 1 event(s)
/// [runId] suspended: How does this look? ...
/// [runId] terminated COMPLETED
/// ```
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.formflow.server.execution.LoggingRunListener`.
///
/// @implNote Thread-safe. Stateless; callbacks arrive from worker threads and
/// from whichever thread drives the run.
public class LoggingRunListener implements RunListener {

    private static final Logger LOG = Logger.getLogger(LoggingRunListener.class);

    @Override
    public void onRunStarted(String runId, String workflowId) {
        LOG.infov("[{0}] started workflow {1}", runId, workflowId);
    }

    @Override
    public void onStepStarted(String runId, String stepId, Event trigger) {
        LOG.debugv("[{0}] → {1}  on {2}", runId, stepId, trigger.kind().name());
    }

    @Override
    public void onStepCompleted(String runId, String stepId, List<Event> emitted) {
        LOG.debugv("[{0}] ← {1}  emitted {2} event(s)", runId, stepId, emitted.size());
    }

    @Override
    public void onEventEmitted(String runId, String stepId, Event event) {
        LOG.debugv("[{0}] {1} sent {2}", runId, stepId, event.kind().name());
    }

    @Override
    public void onSuspended(String runId, Event request) {
        LOG.infov("[{0}] suspended: {1}", runId, request.find(SystemEvents.PREFIX).orElse(""));
    }

    @Override
    public void onResumed(String runId, Event response) {
        LOG.infov("[{0}] resumed", runId);
    }

    @Override
    public void onRunTerminated(String runId, RunStatus status, Throwable failure) {
        if (failure == null) {
            LOG.infov("[{0}] terminated {1}", runId, status);
        } else {
            LOG.warnv("[{0}] terminated {1}: {2}", runId, status, failure.getMessage());
        }
    }
}
