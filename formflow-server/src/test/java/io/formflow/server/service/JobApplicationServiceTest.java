package io.formflow.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formflow.core.EngineConfig;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.execution.RunStatus;
import io.formflow.core.execution.WorkflowRunner;
import io.formflow.core.jobapp.JobApplicationServices;
import io.formflow.core.jobapp.JobApplicationWorkflow;
import io.formflow.core.jobapp.stub.StubDocumentIndexService;
import io.formflow.core.jobapp.stub.StubFormFieldExtractor;
import io.formflow.core.jobapp.stub.StubTextCompletionService;
import io.formflow.core.workflow.Workflow;
import io.formflow.server.service.JobApplicationService.RespondResult;
import io.formflow.server.service.JobApplicationService.RunNotAwaitingInputException;
import io.formflow.server.service.JobApplicationService.RunNotFoundException;
import io.formflow.server.service.JobApplicationService.RunSnapshot;
import io.formflow.server.service.JobApplicationService.UploadResult;
import io.formflow.server.service.JobApplicationService.UploadedDocument;
import io.formflow.server.service.JobApplicationService.WorkflowExecutionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobApplicationServiceTest {

    @TempDir Path tempDir;

    private WorkflowRunner runner;
    private Path dataDir;
    private JobApplicationServices services;
    private Workflow workflow;
    private JobApplicationService service;
    private UploadedDocument resume;
    private UploadedDocument form;

    @BeforeEach
    void setUp() throws Exception {
        runner = new WorkflowRunner(EngineConfig.builder().workerPoolSize(4).build());
        dataDir = tempDir.resolve("data");
        services =
                new JobApplicationServices(
                        new StubDocumentIndexService().withAnswer("Full name", "Ada Lovelace"),
                        new StubFormFieldExtractor(),
                        new StubTextCompletionService());
        workflow = JobApplicationWorkflow.create(services, Duration.ofSeconds(10));
        service = new JobApplicationService(runner, workflow, dataDir);
        resume =
                new UploadedDocument(
                        "cv.pdf",
                        Files.writeString(tempDir.resolve("upload-1"), "Ada Lovelace, analyst"));
        form =
                new UploadedDocument(
                        "form.txt",
                        Files.writeString(tempDir.resolve("upload-2"), "Full name:\n- Email\n"));
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private List<Path> storedFiles() throws IOException {
        if (!Files.exists(dataDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.toList();
        }
    }

    @Nested
    class Upload {

        @Test
        void shouldStoreFilesAndReturnFirstReview() throws Exception {
            UploadResult result = service.upload(resume, form);

            assertThat(result.runId()).isNotBlank();
            assertThat(result.feedbackPrompt()).isEqualTo(JobApplicationWorkflow.FEEDBACK_PROMPT);
            assertThat(result.filledForm())
                    .contains("Field: Full name\nResponse: Ada Lovelace")
                    .contains("Field: Email");
            assertThat(storedFiles())
                    .extracting(path -> path.getFileName().toString())
                    .anyMatch(name -> name.matches("resume_\\d{8}_\\d{6}\\.pdf"))
                    .anyMatch(name -> name.matches("application_form_\\d{8}_\\d{6}\\.txt"));
        }

        @Test
        void shouldDeleteFilesWhenRunFails() throws Exception {
            UploadedDocument emptyForm =
                    new UploadedDocument("form.txt", Files.writeString(tempDir.resolve("e"), "\n"));

            assertThatThrownBy(() -> service.upload(resume, emptyForm))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .hasMessageContaining("No fillable fields");
            assertThat(storedFiles()).isEmpty();
        }

        @Test
        void shouldSuffixNamesWithinSameSecond() throws Exception {
            service.upload(resume, form);
            service.upload(resume, form);

            assertThat(storedFiles()).hasSize(4);
        }
    }

    @Nested
    class Respond {

        @Test
        void shouldCompleteOnApprovalAndDeleteFiles() throws Exception {
            UploadResult upload = service.upload(resume, form);

            RespondResult result = service.respond(upload.runId(), "OKAY");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.filledForm()).isEqualTo(upload.filledForm());
            assertThat(result.feedbackPrompt()).isNull();
            assertThat(storedFiles()).isEmpty();
        }

        @Test
        void shouldAskAgainAfterFeedback() throws Exception {
            UploadResult upload = service.upload(resume, form);

            RespondResult result = service.respond(upload.runId(), "Use my work email");

            assertThat(result.status()).isEqualTo(RunStatus.SUSPENDED_FOR_INPUT);
            assertThat(result.filledForm()).contains("Revised after feedback: Use my work email");
            assertThat(result.feedbackPrompt()).isEqualTo(JobApplicationWorkflow.FEEDBACK_PROMPT);
        }

        @Test
        void shouldRejectUnknownRun() {
            assertThatThrownBy(() -> service.respond("missing", "OKAY"))
                    .isInstanceOf(RunNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldRejectResponseToFinishedRun() throws Exception {
            UploadResult upload = service.upload(resume, form);
            service.respond(upload.runId(), "OKAY");

            assertThatThrownBy(() -> service.respond(upload.runId(), "OKAY"))
                    .isInstanceOf(RunNotAwaitingInputException.class);
        }
    }

    @Nested
    class Status {

        @Test
        void shouldReportPendingReview() throws Exception {
            UploadResult upload = service.upload(resume, form);

            RunSnapshot snapshot = service.status(upload.runId());

            assertThat(snapshot.status()).isEqualTo(RunStatus.SUSPENDED_FOR_INPUT);
            assertThat(snapshot.pendingInput().getString(SystemEvents.PREFIX))
                    .isEqualTo(JobApplicationWorkflow.FEEDBACK_PROMPT);
            assertThat(snapshot.pendingInput().getString(SystemEvents.RESULT))
                    .isEqualTo(upload.filledForm());
            assertThat(snapshot.result()).isNull();
        }

        @Test
        void shouldReportResultAfterCompletion() throws Exception {
            UploadResult upload = service.upload(resume, form);
            service.respond(upload.runId(), "okay");

            RunSnapshot snapshot = service.status(upload.runId());

            assertThat(snapshot.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(snapshot.pendingInput()).isNull();
            assertThat(snapshot.result()).isEqualTo(upload.filledForm());
        }

        @Test
        void shouldRejectUnknownRun() {
            assertThatThrownBy(() -> service.status("missing"))
                    .isInstanceOf(RunNotFoundException.class);
        }
    }

    @Nested
    class Retention {

        @Test
        void shouldStopTrackingFinishedRuns() throws Exception {
            for (int i = 0; i < 3; i++) {
                UploadResult upload = service.upload(resume, form);
                service.respond(upload.runId(), "OKAY");
            }

            assertThat(service.liveRuns()).isZero();
            assertThat(storedFiles()).isEmpty();
        }

        @Test
        void shouldEvictOldestSnapshotsBeyondLimit() throws Exception {
            JobApplicationService bounded =
                    new JobApplicationService(runner, workflow, dataDir, 2);
            List<String> runIds = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                UploadResult upload = bounded.upload(resume, form);
                bounded.respond(upload.runId(), "OKAY");
                runIds.add(upload.runId());
            }

            assertThatThrownBy(() -> bounded.status(runIds.get(0)))
                    .isInstanceOf(RunNotFoundException.class);
            assertThat(bounded.status(runIds.get(1)).status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(bounded.status(runIds.get(2)).status()).isEqualTo(RunStatus.COMPLETED);
        }

        @Test
        void shouldRetireRunThatTimesOutWhileAwaitingReview() throws Exception {
            JobApplicationService shortLived =
                    new JobApplicationService(
                            runner,
                            JobApplicationWorkflow.create(services, Duration.ofMillis(750)),
                            dataDir);
            UploadResult upload = shortLived.upload(resume, form);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (shortLived.liveRuns() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            assertThat(shortLived.liveRuns()).isZero();
            assertThat(shortLived.status(upload.runId()).status())
                    .isEqualTo(RunStatus.TIMED_OUT);
            assertThat(storedFiles()).isEmpty();
        }
    }

    @Test
    void cleanupShouldCancelRunsAndDeleteFiles() throws Exception {
        UploadResult upload = service.upload(resume, form);

        service.cleanup();

        assertThat(storedFiles()).isEmpty();
        assertThatThrownBy(() -> service.status(upload.runId()))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void extensionOfShouldKeepLastSuffixOnly() {
        assertThat(JobApplicationService.extensionOf("resume.final.pdf")).isEqualTo(".pdf");
        assertThat(JobApplicationService.extensionOf("README")).isEmpty();
        assertThat(JobApplicationService.extensionOf(".hidden")).isEmpty();
        assertThat(JobApplicationService.extensionOf(null)).isEmpty();
    }
}
