package io.formflow.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.execution.RunStatus;
import io.formflow.serialization.FormflowSerializer;
import io.formflow.server.service.JobApplicationService;
import io.formflow.server.service.JobApplicationService.RespondResult;
import io.formflow.server.service.JobApplicationService.RunNotAwaitingInputException;
import io.formflow.server.service.JobApplicationService.RunNotFoundException;
import io.formflow.server.service.JobApplicationService.RunSnapshot;
import io.formflow.server.service.JobApplicationService.UploadResult;
import io.formflow.server.service.JobApplicationService.WorkflowExecutionException;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.Response;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.jboss.resteasy.reactive.multipart.FileUpload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JobApplicationResourceTest {

    private final ObjectMapper mapper = FormflowSerializer.createMapper();

    private JobApplicationService service;
    private JobApplicationResource resource;

    @BeforeEach
    void setUp() {
        service = mock(JobApplicationService.class);
        resource = new JobApplicationResource(service);
    }

    private static FileUpload fileUpload(String fileName, String tempName) {
        FileUpload upload = mock(FileUpload.class);
        when(upload.fileName()).thenReturn(fileName);
        when(upload.uploadedFile()).thenReturn(Path.of("/tmp", tempName));
        return upload;
    }

    @Nested
    class Upload {

        @Test
        void shouldReturnFilledFormAndPrompt() {
            when(service.upload(any(), any()))
                    .thenReturn(new UploadResult("run-1", "Filled form", "How does this look?"));

            Map<String, Object> entity;
            try (Response response =
                    resource.upload(
                            fileUpload("cv.pdf", "tmp-1"), fileUpload("form.pdf", "tmp-2"))) {
                assertThat(response.getStatus()).isEqualTo(200);
                entity = (Map<String, Object>) response.getEntity();
            }
            assertThat(entity)
                    .containsEntry("message", "Please provide your feedback")
                    .containsEntry("workflow_id", "run-1")
                    .containsEntry("filled_form", "Filled form")
                    .containsEntry("feedback_prompt", "How does this look?");
            verify(service)
                    .upload(
                            argThat(doc -> doc.fileName().equals("cv.pdf")),
                            argThat(doc -> doc.content().endsWith("tmp-2")));
        }

        @Test
        void shouldRejectMissingForm() {
            assertThatThrownBy(() -> resource.upload(fileUpload("cv.pdf", "tmp-1"), null))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("application_form");
            verifyNoInteractions(service);
        }

        @Test
        void shouldPropagateRunFailure() {
            when(service.upload(any(), any()))
                    .thenThrow(
                            new WorkflowExecutionException(null, "Failed to process upload", null));

            assertThatThrownBy(
                            () ->
                                    resource.upload(
                                            fileUpload("cv.pdf", "tmp-1"),
                                            fileUpload("form.pdf", "tmp-2")))
                    .isInstanceOf(WorkflowExecutionException.class);
        }
    }

    @Nested
    class Respond {

        @Test
        void shouldReturnResultWhenCompleted() {
            when(service.respond("run-1", "OKAY"))
                    .thenReturn(new RespondResult(RunStatus.COMPLETED, "Final form", null));

            Map<String, Object> entity;
            try (Response response =
                    resource.respond("run-1", new JobApplicationResource.RespondRequest("OKAY"))) {
                assertThat(response.getStatus()).isEqualTo(200);
                entity = (Map<String, Object>) response.getEntity();
            }
            assertThat(entity)
                    .containsEntry("message", "Response processed successfully")
                    .containsEntry("status", "COMPLETED")
                    .containsEntry("result", "Final form")
                    .doesNotContainKey("feedback_prompt");
        }

        @Test
        void shouldReturnNextPromptWhenAskedAgain() {
            when(service.respond(eq("run-1"), any()))
                    .thenReturn(
                            new RespondResult(
                                    RunStatus.SUSPENDED_FOR_INPUT, "Revised", "How does this look?"));

            Map<String, Object> entity;
            try (Response response =
                    resource.respond("run-1", new JobApplicationResource.RespondRequest("Fix it"))) {
                entity = (Map<String, Object>) response.getEntity();
            }
            assertThat(entity)
                    .containsEntry("status", "SUSPENDED_FOR_INPUT")
                    .containsEntry("filled_form", "Revised")
                    .containsEntry("feedback_prompt", "How does this look?");
        }

        @Test
        void shouldLeaveUnknownRunToExceptionMapper() {
            when(service.respond(eq("missing"), any()))
                    .thenThrow(new RunNotFoundException("missing"));

            assertThatThrownBy(
                            () ->
                                    resource.respond(
                                            "missing",
                                            new JobApplicationResource.RespondRequest("OKAY")))
                    .isInstanceOf(RunNotFoundException.class)
                    .hasMessage("Workflow not found: missing");
        }

        @Test
        void shouldLeaveRejectedResponseToExceptionMapper() {
            when(service.respond(eq("run-1"), any()))
                    .thenThrow(
                            new RunNotAwaitingInputException("run-1", "Run run-1 is RUNNING"));

            assertThatThrownBy(
                            () ->
                                    resource.respond(
                                            "run-1",
                                            new JobApplicationResource.RespondRequest("OKAY")))
                    .isInstanceOf(RunNotAwaitingInputException.class);
        }

        @Test
        void shouldRejectMissingFeedback() {
            assertThatThrownBy(
                            () ->
                                    resource.respond(
                                            "run-1", new JobApplicationResource.RespondRequest(null)))
                    .isInstanceOf(BadRequestException.class);
            verifyNoInteractions(service);
        }
    }

    @Nested
    class Status {

        @Test
        void shouldRenderPendingInputAsEvent() throws Exception {
            when(service.status("run-1"))
                    .thenReturn(
                            new RunSnapshot(
                                    "run-1",
                                    RunStatus.SUSPENDED_FOR_INPUT,
                                    Instant.parse("2024-03-01T14:25:30Z"),
                                    SystemEvents.inputRequired("How does this look?", "Filled form"),
                                    null));

            Object entity;
            try (Response response = resource.status("run-1")) {
                assertThat(response.getStatus()).isEqualTo(200);
                entity = response.getEntity();
            }
            JsonNode json = mapper.readTree(mapper.writeValueAsString(entity));

            assertThat(json.get("workflow_id").asText()).isEqualTo("run-1");
            assertThat(json.get("status").asText()).isEqualTo("SUSPENDED_FOR_INPUT");
            assertThat(json.get("started_at").asText()).isEqualTo("2024-03-01T14:25:30Z");
            assertThat(json.at("/pending_input/kind").asText()).isEqualTo("INPUT_REQUIRED");
            assertThat(json.at("/pending_input/fields/prefix").asText())
                    .isEqualTo("How does this look?");
            assertThat(json.at("/pending_input/fields/result").asText()).isEqualTo("Filled form");
            assertThat(json.has("result")).isFalse();
        }

        @Test
        void shouldRenderResultOfFinishedRun() throws Exception {
            when(service.status("run-1"))
                    .thenReturn(
                            new RunSnapshot(
                                    "run-1", RunStatus.COMPLETED, Instant.now(), null, "Final form"));

            Object entity;
            try (Response response = resource.status("run-1")) {
                entity = response.getEntity();
            }
            JsonNode json = mapper.readTree(mapper.writeValueAsString(entity));

            assertThat(json.get("result").asText()).isEqualTo("Final form");
            assertThat(json.has("pending_input")).isFalse();
        }

        @Test
        void shouldLeaveUnknownRunToExceptionMapper() {
            when(service.status("missing")).thenThrow(new RunNotFoundException("missing"));

            assertThatThrownBy(() -> resource.status("missing"))
                    .isInstanceOf(RunNotFoundException.class);
        }
    }
}
