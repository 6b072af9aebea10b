package io.formflow.core;

import java.time.Duration;

/// Configuration of a {@link io.formflow.core.execution.WorkflowRunner}.
///
/// ### Default Values
/// - `workerPoolSize`: `10` (threads executing step bodies, shared by all runs)
/// - `defaultTimeout`: `600s` (wall-clock deadline of a run unless the workflow
///   overrides it)
///
/// @implNote **Not thread-safe**. Configure before handing to the runner and do not
/// modify afterwards.
///
/// @see Builder
public class EngineConfig {
    public static final int DEFAULT_WORKER_POOL_SIZE = 10;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    private int workerPoolSize = DEFAULT_WORKER_POOL_SIZE;
    private Duration defaultTimeout = DEFAULT_TIMEOUT;

    /// Creates a configuration with default values.
    public EngineConfig() {}

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets the number of worker threads.
    ///
    /// ### Contracts
    /// - **Precondition**: `workerPoolSize` must be positive
    ///
    /// @param workerPoolSize thread count
    public void setWorkerPoolSize(int workerPoolSize) {
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be positive");
        }
        this.workerPoolSize = workerPoolSize;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /// Sets the run deadline used when a workflow declares none.
    ///
    /// @param defaultTimeout positive duration, not null
    public void setDefaultTimeout(Duration defaultTimeout) {
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        this.defaultTimeout = defaultTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link EngineConfig}.
    public static class Builder {
        private final EngineConfig config = new EngineConfig();

        public Builder workerPoolSize(int workerPoolSize) {
            config.setWorkerPoolSize(workerPoolSize);
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            config.setDefaultTimeout(defaultTimeout);
            return this;
        }

        public EngineConfig build() {
            return config;
        }
    }
}
