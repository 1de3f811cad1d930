package io.arbor.core;

/// Configuration options for {@link io.arbor.core.execution.TreeExecutor}.
///
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `maxTicks`: `0` (unlimited)
/// - `resetOnCompletion`: `true`
/// - `stopOnUninterestedRoot`: `true`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to the executor. Do not modify while a tree is running.
///
/// @see Builder
public class ArborConfig {
    private int maxTicks = 0;
    private boolean resetOnCompletion = true;
    private boolean stopOnUninterestedRoot = true;

    /// Creates a configuration with default values.
    public ArborConfig() {}

    /// Returns the maximum number of {@link io.arbor.core.tree.Status#RUNNING} ticks a
    /// poll-model run may take before it is reported as pending.
    ///
    /// @return tick bound, `0` when unlimited
    public int getMaxTicks() {
        return maxTicks;
    }

    /// Sets the poll-model tick bound.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxTicks >= 0`
    ///
    /// @param maxTicks tick bound, `0` for unlimited
    /// @throws IllegalArgumentException if `maxTicks` is negative
    public void setMaxTicks(int maxTicks) {
        if (maxTicks < 0) {
            throw new IllegalArgumentException("maxTicks must be >= 0");
        }
        this.maxTicks = maxTicks;
    }

    /// Returns whether the executor resets the root after it produced a terminal status.
    ///
    /// @return `true` if the tree is rearmed after each completed run
    public boolean isResetOnCompletion() {
        return resetOnCompletion;
    }

    public void setResetOnCompletion(boolean resetOnCompletion) {
        this.resetOnCompletion = resetOnCompletion;
    }

    /// Returns whether a reactive run stops at the first event the root is not
    /// interested in. When disabled such events are skipped and the run continues.
    ///
    /// @return `true` to stop, `false` to skip
    public boolean isStopOnUninterestedRoot() {
        return stopOnUninterestedRoot;
    }

    public void setStopOnUninterestedRoot(boolean stopOnUninterestedRoot) {
        this.stopOnUninterestedRoot = stopOnUninterestedRoot;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ArborConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ArborConfig config = new ArborConfig();

        /// @param maxTicks tick bound, `0` for unlimited
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if `maxTicks` is negative
        public Builder maxTicks(int maxTicks) {
            config.setMaxTicks(maxTicks);
            return this;
        }

        /// @param resetOnCompletion whether to rearm the root after each completed run
        /// @return this builder for chaining, never null
        public Builder resetOnCompletion(boolean resetOnCompletion) {
            config.resetOnCompletion = resetOnCompletion;
            return this;
        }

        /// @param stopOnUninterestedRoot `true` to stop, `false` to skip such events
        /// @return this builder for chaining, never null
        public Builder stopOnUninterestedRoot(boolean stopOnUninterestedRoot) {
            config.stopOnUninterestedRoot = stopOnUninterestedRoot;
            return this;
        }

        /// @return the configured instance, never null
        public ArborConfig build() {
            return config;
        }
    }
}
