package io.formflow.core.step;

import io.formflow.core.event.EventKind;
import io.formflow.core.event.SystemEvents;
import io.formflow.core.exception.WorkflowValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Immutable routing table from event kind to the steps accepting it.
///
/// Built once per workflow definition and shared read-only by all of its runs.
///
/// ### Contracts
/// - Step ids are unique and non-blank
/// - Every step accepts at least one kind
/// - No step accepts {@link SystemEvents#INPUT_REQUIRED} or {@link SystemEvents#STOP}
/// - No step emits {@link SystemEvents#START} or {@link SystemEvents#HUMAN_RESPONSE}
/// - At most one step accepts {@link SystemEvents#HUMAN_RESPONSE}, and one must exist
///   whenever any step emits {@link SystemEvents#INPUT_REQUIRED}
///
/// @see io.formflow.core.execution.Dispatcher for the consumer of the table
public final class StepRegistry {

    private final Map<String, StepDefinition> steps;
    private final Map<EventKind, List<StepDefinition>> routes;

    private StepRegistry(Map<String, StepDefinition> steps) {
        this.steps = Collections.unmodifiableMap(steps);
        Map<EventKind, List<StepDefinition>> table = new HashMap<>();
        for (StepDefinition step : steps.values()) {
            for (EventKind kind : step.accepts()) {
                table.computeIfAbsent(kind, k -> new ArrayList<>()).add(step);
            }
        }
        table.replaceAll((kind, list) -> List.copyOf(list));
        this.routes = Collections.unmodifiableMap(table);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the steps subscribed to a kind, in registration order.
    ///
    /// @param kind event kind, not null
    /// @return matching steps, empty if the event would be absorbed
    public List<StepDefinition> stepsAccepting(EventKind kind) {
        return routes.getOrDefault(kind, List.of());
    }

    /// Looks up a step by id.
    ///
    /// @param id step identifier, not null
    /// @return the step, or empty if unknown
    public Optional<StepDefinition> find(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    /// Returns the single step accepting human responses.
    ///
    /// @return the step, or empty if the workflow never suspends
    public Optional<StepDefinition> humanResponseStep() {
        return stepsAccepting(SystemEvents.HUMAN_RESPONSE).stream().findFirst();
    }

    /// Returns all steps in registration order.
    ///
    /// @return unmodifiable list, never null
    public List<StepDefinition> steps() {
        return List.copyOf(steps.values());
    }

    public int size() {
        return steps.size();
    }

    public static final class Builder {
        private final List<StepDefinition> pending = new ArrayList<>();

        private Builder() {}

        public Builder register(StepDefinition step) {
            pending.add(step);
            return this;
        }

        /// Validates the collected steps and freezes them into a registry.
        ///
        /// @return immutable registry, never null
        /// @throws WorkflowValidationException if any structural rule is violated
        public StepRegistry build() throws WorkflowValidationException {
            Map<String, StepDefinition> byId = new LinkedHashMap<>();
            int humanResponseSteps = 0;
            boolean suspends = false;
            for (StepDefinition step : pending) {
                if (step.id().isBlank()) {
                    throw new WorkflowValidationException("Step id must not be blank");
                }
                if (byId.putIfAbsent(step.id(), step) != null) {
                    throw new WorkflowValidationException("Duplicate step id: " + step.id());
                }
                if (step.accepts().isEmpty()) {
                    throw new WorkflowValidationException(
                            "Step '" + step.id() + "' accepts no event kinds");
                }
                rejectOverlap(step, step.accepts(), "accept", SystemEvents.INPUT_REQUIRED);
                rejectOverlap(step, step.accepts(), "accept", SystemEvents.STOP);
                rejectOverlap(step, step.emits(), "emit", SystemEvents.START);
                rejectOverlap(step, step.emits(), "emit", SystemEvents.HUMAN_RESPONSE);
                if (step.accepts(SystemEvents.HUMAN_RESPONSE)) {
                    humanResponseSteps++;
                }
                suspends |= step.mayEmit(SystemEvents.INPUT_REQUIRED);
            }
            if (humanResponseSteps > 1) {
                throw new WorkflowValidationException(
                        "At most one step may accept HUMAN_RESPONSE, found " + humanResponseSteps);
            }
            if (suspends && humanResponseSteps == 0) {
                throw new WorkflowValidationException(
                        "A step emits INPUT_REQUIRED but no step accepts HUMAN_RESPONSE");
            }
            return new StepRegistry(byId);
        }

        private static void rejectOverlap(
                StepDefinition step, Set<EventKind> kinds, String verb, SystemEvents kind)
                throws WorkflowValidationException {
            if (kinds.contains(kind)) {
                throw new WorkflowValidationException(
                        "Step '" + step.id() + "' may not " + verb + " " + kind.name());
            }
        }
    }
}
