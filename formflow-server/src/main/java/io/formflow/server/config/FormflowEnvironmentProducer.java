package io.formflow.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.formflow.adapter.langchain4j.LangChain4jProvider;
import io.formflow.core.EngineConfig;
import io.formflow.core.exception.WorkflowValidationException;
import io.formflow.core.execution.WorkflowRunner;
import io.formflow.core.jobapp.JobApplicationServices;
import io.formflow.core.jobapp.JobApplicationWorkflow;
import io.formflow.core.jobapp.stub.StubDocumentIndexService;
import io.formflow.core.jobapp.stub.StubFormFieldExtractor;
import io.formflow.core.jobapp.stub.StubTextCompletionService;
import io.formflow.core.workflow.Workflow;
import io.formflow.serialization.FormflowSerializer;
import io.formflow.serialization.jobapp.JacksonFieldListParser;
import io.formflow.server.execution.LoggingRunListener;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the workflow runner, the job-application workflow and its
/// collaborators.
///
/// ### Credential Discovery
/// Credentials are loaded from (in priority order):
/// 1. **Application properties** under `formflow.credentials.*`
/// 2. **Environment variable** `OPENAI_API_KEY`
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `formflow.worker.pool-size` | int | `10` | Step worker threads shared by all runs |
/// | `formflow.run.timeout` | Duration | `600s` | Wall-clock limit per run |
/// | `formflow.stub.enabled` | Boolean | `false` | Use stub collaborators instead of OpenAI |
/// | `formflow.storage.dir` | Path | `storage` | Persisted document indexes |
/// | `formflow.model.chat` | String | `gpt-4o-mini` | Chat model name |
/// | `formflow.model.embedding` | String | `text-embedding-3-small` | Embedding model name |
/// | `formflow.credentials.OPENAI_API_KEY` | String | - | OpenAI API key |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see WorkflowRunner
/// @see LangChain4jProvider
@ApplicationScoped
public class FormflowEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(FormflowEnvironmentProducer.class);

    static final String CREDENTIALS_PREFIX = "formflow.credentials.";
    static final String OPENAI_API_KEY = "OPENAI_API_KEY";

    private WorkflowRunner runner;

    @Inject Config config;

    /// Produces the shared workflow runner.
    ///
    /// @return configured runner, never null
    @Produces
    @Singleton
    public WorkflowRunner workflowRunner() {
        EngineConfig engineConfig =
                EngineConfig.builder()
                        .workerPoolSize(
                                config.getOptionalValue("formflow.worker.pool-size", Integer.class)
                                        .orElse(EngineConfig.DEFAULT_WORKER_POOL_SIZE))
                        .defaultTimeout(runTimeout())
                        .build();
        runner = new WorkflowRunner(engineConfig, new LoggingRunListener());
        LOG.infov(
                "Configured WorkflowRunner: workers={0}, timeout={1}",
                engineConfig.getWorkerPoolSize(),
                engineConfig.getDefaultTimeout());
        return runner;
    }

    /// Produces the collaborators, stubbed or backed by LangChain4j.
    ///
    /// @param objectMapper mapper used to read field lists, not null
    /// @return collaborator bundle, never null
    /// @throws IllegalStateException if live mode is configured without an API key
    @Produces
    @Singleton
    public JobApplicationServices jobApplicationServices(ObjectMapper objectMapper) {
        if (config.getOptionalValue("formflow.stub.enabled", Boolean.class).orElse(false)) {
            LOG.info("Using stub collaborators");
            return new JobApplicationServices(
                    new StubDocumentIndexService(),
                    new StubFormFieldExtractor(),
                    new StubTextCompletionService());
        }
        return new LangChain4jProvider()
                .createServices(
                        stringValue("formflow.model.chat", LangChain4jProvider.DEFAULT_CHAT_MODEL),
                        stringValue(
                                "formflow.model.embedding",
                                LangChain4jProvider.DEFAULT_EMBEDDING_MODEL),
                        Path.of(stringValue("formflow.storage.dir", "storage")),
                        new JacksonFieldListParser(objectMapper),
                        extractCredentials());
    }

    /// Produces the job-application workflow definition.
    ///
    /// @param services collaborators the steps call, not null
    /// @return validated workflow, never null
    @Produces
    @Singleton
    public Workflow jobApplicationWorkflow(JobApplicationServices services) {
        try {
            return JobApplicationWorkflow.create(services);
        } catch (WorkflowValidationException e) {
            throw new IllegalStateException("Invalid job-application workflow", e);
        }
    }

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return FormflowSerializer.createMapper();
    }

    /// Collects `formflow.credentials.*` with the prefix stripped, then falls back to
    /// the `OPENAI_API_KEY` environment variable.
    Map<String, String> extractCredentials() {
        Map<String, String> credentials = new HashMap<>();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .filter(value -> !value.isBlank())
                        .ifPresent(
                                value ->
                                        credentials.put(
                                                propertyName.substring(CREDENTIALS_PREFIX.length()),
                                                value));
            }
        }
        if (!credentials.containsKey(OPENAI_API_KEY)) {
            String fromEnv = System.getenv(OPENAI_API_KEY);
            if (fromEnv != null && !fromEnv.isBlank()) {
                credentials.put(OPENAI_API_KEY, fromEnv);
            }
        }
        return credentials;
    }

    private Duration runTimeout() {
        return config.getOptionalValue("formflow.run.timeout", Duration.class)
                .orElse(EngineConfig.DEFAULT_TIMEOUT);
    }

    private String stringValue(String key, String defaultValue) {
        return config.getOptionalValue(key, String.class)
                .filter(value -> !value.isBlank())
                .orElse(defaultValue);
    }

    /// Shuts down the runner's worker pool and watchdog.
    @PreDestroy
    public void cleanup() {
        if (runner != null) {
            runner.close();
            LOG.info("WorkflowRunner closed");
        }
    }
}
