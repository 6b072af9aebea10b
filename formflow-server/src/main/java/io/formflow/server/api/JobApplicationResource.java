package io.formflow.server.api;

import io.formflow.server.service.JobApplicationService;
import io.formflow.server.service.JobApplicationService.RespondResult;
import io.formflow.server.service.JobApplicationService.RunSnapshot;
import io.formflow.server.service.JobApplicationService.UploadResult;
import io.formflow.server.service.JobApplicationService.UploadedDocument;
import io.formflow.server.validation.LogSanitizer;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

/// REST API for job-application runs.
///
/// Provides endpoints for:
/// - Uploading a resume and an application form, which starts a run
/// - Answering a run's review request with feedback
/// - Querying a run's status
///
/// @see JobApplicationService for business logic
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class JobApplicationResource {

    private static final Logger LOG = Logger.getLogger(JobApplicationResource.class);

    static final String FEEDBACK_MESSAGE = "Please provide your feedback";
    static final String RESPONSE_MESSAGE = "Response processed successfully";

    private final JobApplicationService service;

    @Inject
    public JobApplicationResource(JobApplicationService service) {
        this.service = service;
    }

    /// Uploads both documents and runs the workflow up to its first review request.
    ///
    /// ### Request
    /// ```
    /// POST /upload
    /// Content-Type: multipart/form-data
    ///
    /// resume=<file>, application_form=<file>
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {
    ///   "message": "Please provide your feedback",
    ///   "workflow_id": "3f0c...",
    ///   "filled_form": "...",
    ///   "feedback_prompt": "How does this look? ..."
    /// }
    /// ```
    @POST
    @Path("/upload")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Response upload(
            @RestForm("resume") FileUpload resume,
            @RestForm("application_form") FileUpload applicationForm) {
        if (resume == null || applicationForm == null) {
            throw new BadRequestException("Both resume and application_form are required");
        }

        LOG.infov(
                "Upload request: resume={0}, form={1}",
                LogSanitizer.sanitize(resume.fileName()),
                LogSanitizer.sanitize(applicationForm.fileName()));

        UploadResult result = service.upload(toDocument(resume), toDocument(applicationForm));

        return Response.ok()
                .entity(
                        Map.of(
                                "message", FEEDBACK_MESSAGE,
                                "workflow_id", result.runId(),
                                "filled_form", result.filledForm(),
                                "feedback_prompt", result.feedbackPrompt()))
                .build();
    }

    /// Answers the run's pending review request.
    ///
    /// ### Request
    /// ```
    /// POST /workflow/{workflowId}/respond
    /// Content-Type: application/json
    ///
    /// {"feedback": "OKAY"}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"message": "Response processed successfully", "status": "COMPLETED", "result": "..."}
    /// ```
    /// A run that asks again answers with `status` `SUSPENDED_FOR_INPUT` plus
    /// `filled_form` and `feedback_prompt`.
    /// An unknown id answers 404 and a run that is not awaiting input answers 409,
    /// both through {@link GlobalExceptionMapper}.
    @POST
    @Path("/workflow/{workflowId}/respond")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response respond(@PathParam("workflowId") String workflowId, RespondRequest request) {
        if (request == null || request.feedback() == null) {
            throw new BadRequestException("feedback is required");
        }

        LOG.infov("Respond request: workflow={0}", LogSanitizer.sanitize(workflowId));

        RespondResult result = service.respond(workflowId, request.feedback());

        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("message", RESPONSE_MESSAGE);
        entity.put("status", result.status().name());
        if (result.feedbackPrompt() != null) {
            entity.put("filled_form", result.filledForm());
            entity.put("feedback_prompt", result.feedbackPrompt());
        } else if (result.filledForm() != null) {
            entity.put("result", result.filledForm());
        }
        return Response.ok().entity(entity).build();
    }

    /// Gets the status of a live or recently finished run.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {
    ///   "workflow_id": "3f0c...",
    ///   "status": "SUSPENDED_FOR_INPUT",
    ///   "started_at": "2024-03-01T14:25:30Z",
    ///   "pending_input": {
    ///     "kind": "INPUT_REQUIRED",
    ///     "fields": {"prefix": "How does this look? ...", "result": "..."}
    ///   }
    /// }
    /// ```
    /// A completed run carries `result` instead of `pending_input`. The event is
    /// rendered by the application's Jackson event serializer.
    @GET
    @Path("/workflow/{workflowId}")
    public Response status(@PathParam("workflowId") String workflowId) {
        RunSnapshot snapshot = service.status(workflowId);

        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("workflow_id", snapshot.runId());
        entity.put("status", snapshot.status().name());
        entity.put("started_at", snapshot.startedAt());
        if (snapshot.pendingInput() != null) {
            entity.put("pending_input", snapshot.pendingInput());
        }
        if (snapshot.result() != null) {
            entity.put("result", snapshot.result());
        }
        return Response.ok().entity(entity).build();
    }

    private static UploadedDocument toDocument(FileUpload upload) {
        return new UploadedDocument(upload.fileName(), upload.uploadedFile());
    }

    /// Request body for {@link #respond}.
    ///
    /// @param feedback reviewer text; `OKAY` approves the form
    public record RespondRequest(String feedback) {}
}
