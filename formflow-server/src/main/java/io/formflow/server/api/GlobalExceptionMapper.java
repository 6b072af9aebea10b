package io.formflow.server.api;

import io.formflow.server.service.JobApplicationService.RunNotAwaitingInputException;
import io.formflow.server.service.JobApplicationService.RunNotFoundException;
import io.formflow.server.service.JobApplicationService.WorkflowExecutionException;
import io.formflow.server.validation.LogSanitizer;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/// Translates run-level failures and unhandled exceptions into JSON error bodies.
///
/// | Exception | Status | Message |
/// |-----------|--------|---------|
/// | `RunNotFoundException` | 404 | names the unknown run |
/// | `RunNotAwaitingInputException` | 409 | names the run and its status |
/// | `WorkflowExecutionException` | 500 | generic; cause logged server-side |
/// | `WebApplicationException` | its own | kept for 400, generic otherwise |
/// | anything else | 500 | generic |
///
/// ### Response Format
/// ```json
/// {"error": "Workflow not found: 3f0c...", "status": 404, "workflow_id": "3f0c..."}
/// ```
/// `workflow_id` is present whenever the failure concerns a known run.
///
/// @implNote Thread-safe. Stateless. Stack traces never reach the client.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    static final String RUN_FAILED = "Workflow run failed";
    static final String INTERNAL_ERROR = "Internal server error";

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof RunNotFoundException notFound) {
            LOG.debugv("Unknown run {0}", LogSanitizer.sanitize(notFound.getRunId()));
            return error(404, notFound.getMessage(), notFound.getRunId());
        }
        if (exception instanceof RunNotAwaitingInputException conflict) {
            LOG.debugv("Rejected response: {0}", LogSanitizer.sanitize(conflict.getMessage()));
            return error(409, conflict.getMessage(), conflict.getRunId());
        }
        if (exception instanceof WorkflowExecutionException failed) {
            LOG.errorv(exception, "Run {0} failed: {1}", failed.getRunId(), failed.getMessage());
            return error(500, RUN_FAILED, failed.getRunId());
        }
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", exception.getMessage());
                return error(status, INTERNAL_ERROR, null);
            }
            LOG.debugv("Client error {0}: {1}", status, exception.getMessage());
            String message = status == 400 ? exception.getMessage() : null;
            return error(status, message != null ? message : "Request failed", null);
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return error(500, INTERNAL_ERROR, null);
    }

    private static Response error(int status, String message, String runId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("status", status);
        if (runId != null) {
            body.put("workflow_id", runId);
        }
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
