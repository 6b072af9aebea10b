package io.formflow.server.execution;

import static org.assertj.core.api.Assertions.assertThatCode;

import io.formflow.core.EngineConfig;
import io.formflow.core.event.Event;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.execution.RunHandle;
import io.formflow.core.execution.RunStatus;
import io.formflow.core.execution.WorkflowRunner;
import io.formflow.core.step.StepDefinition;
import io.formflow.core.step.StepResult;
import io.formflow.core.workflow.Workflow;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoggingRunListenerTest {

    private final LoggingRunListener listener = new LoggingRunListener();

    @Test
    void shouldAcceptEveryCallback() {
        Event request = SystemEvents.inputRequired("Looks good?", "form");

        assertThatCode(
                        () -> {
                            listener.onRunStarted("run-1", "job-application");
                            listener.onStepStarted("run-1", "set-up", SystemEvents.start(Map.of()));
                            listener.onStepCompleted("run-1", "set-up", List.of(request));
                            listener.onEventEmitted("run-1", "set-up", request);
                            listener.onSuspended("run-1", request);
                            listener.onResumed("run-1", SystemEvents.humanResponse("OKAY"));
                            listener.onRunTerminated("run-1", RunStatus.COMPLETED, null);
                            listener.onRunTerminated(
                                    "run-1", RunStatus.FAILED, new IllegalStateException("boom"));
                        })
                .doesNotThrowAnyException();
    }

    @Test
    void shouldObserveRealRun() throws Exception {
        Workflow workflow =
                Workflow.builder("echo")
                        .step(
                                StepDefinition.builder("finish")
                                        .accepts(SystemEvents.START)
                                        .emits(SystemEvents.STOP)
                                        .handler(
                                                (event, ctx) ->
                                                        StepResult.emit(SystemEvents.stop("done")))
                                        .build())
                        .build();

        try (WorkflowRunner runner = new WorkflowRunner(new EngineConfig(), listener)) {
            RunHandle run = runner.start(workflow, Map.of());
            assertThatCode(run::await).doesNotThrowAnyException();
        }
    }
}
