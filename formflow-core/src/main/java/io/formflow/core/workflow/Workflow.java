package io.formflow.core.workflow;

import io.formflow.core.event.SystemEvents;
import io.formflow.core.exception.WorkflowValidationException;
import io.formflow.core.step.StepDefinition;
import io.formflow.core.step.StepRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A runnable workflow definition: its steps, the arguments a run must be given, and
/// an optional timeout overriding the runner's default.
///
/// Definitions are immutable and may be started any number of times concurrently.
///
/// ### Usage
/// {@snippet :
/// Workflow workflow = Workflow.builder("echo")
///         .requiredArgument("text")
///         .step(StepDefinition.builder("echo")
///                 .accepts(SystemEvents.START)
///                 .emits(SystemEvents.STOP)
///                 .handler((event, ctx) -> StepResult.emit(
///                         SystemEvents.stop(event.getString("text"))))
///                 .build())
///         .build();
/// }
public final class Workflow {

    private final String id;
    private final StepRegistry registry;
    private final List<String> requiredArguments;
    private final Duration timeout;

    private Workflow(
            String id, StepRegistry registry, List<String> requiredArguments, Duration timeout) {
        this.id = id;
        this.registry = registry;
        this.requiredArguments = List.copyOf(requiredArguments);
        this.timeout = timeout;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public StepRegistry getRegistry() {
        return registry;
    }

    public List<String> getRequiredArguments() {
        return requiredArguments;
    }

    /// Returns the per-workflow timeout, if one overrides the runner default.
    ///
    /// @return timeout, or empty to use the engine default
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /// Checks run arguments against the required argument names.
    ///
    /// An argument is missing when absent, null, or a blank string. Null keys and null
    /// values are rejected for every argument, since START cannot carry them.
    ///
    /// @param arguments run arguments, not null
    /// @throws WorkflowValidationException naming the first missing argument
    public void validateArguments(Map<String, ?> arguments) throws WorkflowValidationException {
        for (Map.Entry<String, ?> argument : arguments.entrySet()) {
            if (argument.getKey() == null || argument.getValue() == null) {
                throw new WorkflowValidationException(
                        "Workflow '"
                                + id
                                + "' received null argument '"
                                + argument.getKey()
                                + "'");
            }
        }
        for (String name : requiredArguments) {
            Object value = arguments.get(name);
            if (value == null || (value instanceof String s && s.isBlank())) {
                throw new WorkflowValidationException(
                        "Workflow '" + id + "' requires argument '" + name + "'");
            }
        }
    }

    public static final class Builder {
        private final String id;
        private final StepRegistry.Builder registry = StepRegistry.builder();
        private final List<String> requiredArguments = new ArrayList<>();
        private Duration timeout;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder step(StepDefinition step) {
            registry.register(step);
            return this;
        }

        public Builder requiredArgument(String name) {
            requiredArguments.add(Objects.requireNonNull(name, "name must not be null"));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /// Validates and builds the workflow.
        ///
        /// @return immutable workflow, never null
        /// @throws WorkflowValidationException if the steps are inconsistent or nothing
        ///     accepts START
        public Workflow build() throws WorkflowValidationException {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new WorkflowValidationException(
                        "Timeout of workflow '" + id + "' must be positive");
            }
            StepRegistry built = registry.build();
            if (built.stepsAccepting(SystemEvents.START).isEmpty()) {
                throw new WorkflowValidationException(
                        "Workflow '" + id + "' has no step accepting START");
            }
            return new Workflow(id, built, requiredArguments, timeout);
        }
    }
}
