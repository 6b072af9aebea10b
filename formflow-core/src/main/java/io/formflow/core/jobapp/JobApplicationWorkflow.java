package io.formflow.core.jobapp;

import static io.formflow.core.jobapp.JobApplicationEvents.FEEDBACK;
import static io.formflow.core.jobapp.JobApplicationEvents.FIELD_QUERY;
import static io.formflow.core.jobapp.JobApplicationEvents.FIELD_RESPONSE;
import static io.formflow.core.jobapp.JobApplicationEvents.GENERATE_QUESTIONS;
import static io.formflow.core.jobapp.JobApplicationEvents.PARSE_FORM;

import io.formflow.core.context.CollectResult;
import io.formflow.core.context.RequiredKinds;
import io.formflow.core.event.Event;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.exception.WorkflowValidationException;
import io.formflow.core.step.StepContext;
import io.formflow.core.step.StepDefinition;
import io.formflow.core.step.StepResult;
import io.formflow.core.workflow.Workflow;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Fills in a job application form from a resume, with a human review loop.
///
/// ```
/// START ─► set-up ─► PARSE_FORM ─► parse-form ─► GENERATE_QUESTIONS
///       ─► generate-questions ─► FIELD_QUERY × n ─► ask-question (concurrent)
///       ─► FIELD_RESPONSE × n ─► fill-in-application (barrier of n)
///       ─► INPUT_REQUIRED ⋯ HUMAN_RESPONSE ─► get-feedback
///            ├─ verdict OKAY ─► STOP(filled form)
///            └─ otherwise    ─► FEEDBACK ─► integrate-feedback ─► INPUT_REQUIRED ⋯
/// ```
///
/// Run arguments: `resume_file` and `application_form`, both paths.
public final class JobApplicationWorkflow {

    public static final String WORKFLOW_ID = "job-application";

    public static final String RESUME_FILE = "resume_file";
    public static final String APPLICATION_FORM = "application_form";

    public static final String FEEDBACK_PROMPT =
            "How does this look? Give me any feedback you have on any of the answers.";

    static final String INDEX = "index";
    static final String FIELDS_TO_FILL = "fields_to_fill";
    static final String TOTAL_FIELDS = "total_fields";
    static final String FILLED_FORM = "filled_form";

    private static final Logger logger = Logger.getLogger(JobApplicationWorkflow.class.getName());

    private final JobApplicationServices services;

    private JobApplicationWorkflow(JobApplicationServices services) {
        this.services = services;
    }

    /// Builds the workflow with the runner's default timeout.
    ///
    /// @param services collaborators, not null
    /// @return workflow definition, never null
    /// @throws WorkflowValidationException never for this fixed step set
    public static Workflow create(JobApplicationServices services)
            throws WorkflowValidationException {
        return create(services, null);
    }

    /// Builds the workflow.
    ///
    /// @param services collaborators, not null
    /// @param timeout run deadline overriding the runner default, may be null
    /// @return workflow definition, never null
    /// @throws WorkflowValidationException if `timeout` is not positive
    public static Workflow create(JobApplicationServices services, Duration timeout)
            throws WorkflowValidationException {
        JobApplicationWorkflow steps = new JobApplicationWorkflow(services);
        return Workflow.builder(WORKFLOW_ID)
                .requiredArgument(RESUME_FILE)
                .requiredArgument(APPLICATION_FORM)
                .timeout(timeout)
                .step(
                        StepDefinition.builder("set-up")
                                .accepts(SystemEvents.START)
                                .emits(PARSE_FORM)
                                .handler(steps::setUp)
                                .build())
                .step(
                        StepDefinition.builder("parse-form")
                                .accepts(PARSE_FORM)
                                .emits(GENERATE_QUESTIONS)
                                .handler(steps::parseForm)
                                .build())
                .step(
                        StepDefinition.builder("generate-questions")
                                .accepts(GENERATE_QUESTIONS)
                                .emits(FIELD_QUERY)
                                .handler(steps::generateQuestions)
                                .build())
                .step(
                        StepDefinition.builder("ask-question")
                                .accepts(FIELD_QUERY)
                                .emits(FIELD_RESPONSE)
                                .handler(steps::askQuestion)
                                .build())
                .step(
                        StepDefinition.builder("fill-in-application")
                                .accepts(FIELD_RESPONSE)
                                .emits(SystemEvents.INPUT_REQUIRED)
                                .handler(steps::fillInApplication)
                                .build())
                .step(
                        StepDefinition.builder("get-feedback")
                                .accepts(SystemEvents.HUMAN_RESPONSE)
                                .emits(SystemEvents.STOP, FEEDBACK)
                                .handler(steps::getFeedback)
                                .build())
                .step(
                        StepDefinition.builder("integrate-feedback")
                                .accepts(FEEDBACK)
                                .emits(SystemEvents.INPUT_REQUIRED)
                                .handler(steps::integrateFeedback)
                                .build())
                .build();
    }

    StepResult setUp(Event start, StepContext ctx) throws Exception {
        Path resume = Path.of(start.getString(RESUME_FILE));
        String form = start.getString(APPLICATION_FORM);
        logger.info("Run " + ctx.runId() + ": indexing resume " + resume.getFileName());
        DocumentIndex index = services.documentIndex().index(List.of(resume));
        ctx.set(INDEX, index);
        return StepResult.emit(Event.of(PARSE_FORM, Map.of(APPLICATION_FORM, form)));
    }

    StepResult parseForm(Event event, StepContext ctx) throws Exception {
        Path form = Path.of(event.getString(APPLICATION_FORM));
        List<String> fields = services.fieldExtractor().extractFields(form);
        if (fields.isEmpty()) {
            throw new IllegalStateException("No fillable fields found in " + form.getFileName());
        }
        logger.info("Run " + ctx.runId() + ": found " + fields.size() + " fields to fill");
        ctx.set(FIELDS_TO_FILL, List.copyOf(fields));
        return StepResult.emit(Event.of(GENERATE_QUESTIONS));
    }

    StepResult generateQuestions(Event event, StepContext ctx) {
        List<String> fields = fieldsToFill(ctx);
        // the barrier count must be known before the first response can arrive
        ctx.set(TOTAL_FIELDS, fields.size());
        for (String field : fields) {
            ctx.sendEvent(
                    Event.of(
                            FIELD_QUERY,
                            Map.of(
                                    "field",
                                    field,
                                    "query",
                                    "How would you answer this question about the candidate? "
                                            + "<field>"
                                            + field
                                            + "</field>")));
        }
        return StepResult.none();
    }

    static List<String> fieldsToFill(StepContext ctx) {
        List<?> stored = ctx.get(FIELDS_TO_FILL, List.class);
        return stored.stream().map(String.class::cast).collect(Collectors.toList());
    }

    StepResult askQuestion(Event event, StepContext ctx) {
        String field = event.getString("field");
        DocumentIndex index = ctx.get(INDEX, DocumentIndex.class);
        String answer =
                services.documentIndex()
                        .query(
                                index,
                                "This is a question about the specific resume we have in our "
                                        + "database: "
                                        + event.getString("query"));
        logger.fine(() -> "Run " + ctx.runId() + ": answered field " + field);
        return StepResult.emit(
                Event.of(FIELD_RESPONSE, Map.of("field", field, "response", answer)));
    }

    StepResult fillInApplication(Event event, StepContext ctx) {
        RequiredKinds required =
                ctx.find(TOTAL_FIELDS, Integer.class)
                        .map(total -> RequiredKinds.of(FIELD_RESPONSE, total))
                        .orElse(RequiredKinds.pending());
        CollectResult collected = ctx.collect(event, required);
        if (!(collected instanceof CollectResult.Batch batch)) {
            return StepResult.none();
        }

        String responses =
                batch.events().stream()
                        .map(
                                r ->
                                        "Field: "
                                                + r.getString("field")
                                                + "\nResponse: "
                                                + r.getString("response"))
                        .collect(Collectors.joining("\n"));
        String filled =
                services.completion()
                        .complete(
                                "You are given a list of fields in an application form and"
                                        + " responses to questions about those fields from a"
                                        + " resume. Combine the two into a list of fields and"
                                        + " succinct, factual answers to fill in those fields.\n\n"
                                        + "<responses>\n"
                                        + responses
                                        + "\n</responses>");
        ctx.set(FILLED_FORM, filled);
        logger.info("Run " + ctx.runId() + ": form filled, requesting review");
        return StepResult.emit(SystemEvents.inputRequired(FEEDBACK_PROMPT, filled));
    }

    StepResult getFeedback(Event event, StepContext ctx) {
        String feedback = event.getString(SystemEvents.RESPONSE);
        String verdict =
                services.completion()
                        .complete(
                                "You have received some human feedback on the form-filling"
                                        + " task you've done.\n"
                                        + "Does everything look good, or is there more work to"
                                        + " be done?\n"
                                        + "<feedback>\n"
                                        + feedback
                                        + "\n</feedback>\n"
                                        + "If everything is fine, respond with just the word"
                                        + " 'OKAY'.\n"
                                        + "If there's any other feedback, respond with just the"
                                        + " word 'FEEDBACK'.");
        if (isApproval(verdict)) {
            logger.info("Run " + ctx.runId() + ": form approved");
            return StepResult.emit(SystemEvents.stop(ctx.get(FILLED_FORM, String.class)));
        }
        logger.info("Run " + ctx.runId() + ": revision requested");
        return StepResult.emit(Event.of(FEEDBACK, Map.of("feedback", feedback)));
    }

    StepResult integrateFeedback(Event event, StepContext ctx) {
        String current = ctx.get(FILLED_FORM, String.class);
        String revised =
                services.completion()
                        .complete(
                                "You have received some human feedback on the form-filling"
                                        + " task you've done.\n"
                                        + "Please integrate the feedback into the form.\n"
                                        + "<form>"
                                        + current
                                        + "</form>\n"
                                        + "<feedback>"
                                        + event.getString("feedback")
                                        + "</feedback>\n"
                                        + "Return the updated form.");
        ctx.set(FILLED_FORM, revised);
        return StepResult.emit(SystemEvents.inputRequired(FEEDBACK_PROMPT, revised));
    }

    /// Accepts `OKAY` with surrounding whitespace, quotes or a trailing period.
    static boolean isApproval(String verdict) {
        String normalized = verdict.strip().replaceAll("^[\"'`]+|[\"'`.!]+$", "");
        return normalized.toUpperCase(Locale.ROOT).equals("OKAY");
    }
}
