package io.arbor.core.execution;

import io.arbor.core.tree.Status;

/// Outcome of driving a tree with {@link TreeExecutor}.
///
/// ### Permitted Subtypes
/// - {@link Succeeded} - root produced {@link Status#SUCCESS}
/// - {@link Failed} - root produced {@link Status#FAILURE}
/// - {@link Pending} - run ended without a verdict: event source exhausted, root not
///   interested in an event, or tick limit reached
///
/// Every subtype reports `ticks`, the number of step or react calls made on the root.
public sealed interface ExecutionResult {

    /// @return number of step or react calls made on the root
    long ticks();

    /// Returns the root's terminal status, or {@link Status#RUNNING} when pending.
    ///
    /// @return status of the last root call, never null
    Status status();

    /// @return `true` only for {@link Succeeded}
    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    /// @return `true` for {@link Pending}
    default boolean isPending() {
        return this instanceof Pending;
    }

    /// Root finished with {@link Status#SUCCESS}.
    ///
    /// @param ticks number of root calls, at least 1
    record Succeeded(long ticks) implements ExecutionResult {
        @Override
        public Status status() {
            return Status.SUCCESS;
        }
    }

    /// Root finished with {@link Status#FAILURE}.
    ///
    /// @param ticks number of root calls, at least 1
    record Failed(long ticks) implements ExecutionResult {
        @Override
        public Status status() {
            return Status.FAILURE;
        }
    }

    /// Run stopped before the root produced a terminal status. The tree keeps its
    /// resumption state; resetting it is the caller's responsibility.
    ///
    /// @param ticks number of root calls, may be 0
    record Pending(long ticks) implements ExecutionResult {
        @Override
        public Status status() {
            return Status.RUNNING;
        }
    }

    /// Maps a terminal status to its result.
    ///
    /// @param status terminal status, not {@link Status#RUNNING}
    /// @param ticks number of root calls
    /// @return matching result, never null
    /// @throws IllegalArgumentException if `status` is {@link Status#RUNNING}
    static ExecutionResult of(Status status, long ticks) {
        return switch (status) {
            case SUCCESS -> new Succeeded(ticks);
            case FAILURE -> new Failed(ticks);
            case RUNNING -> throw new IllegalArgumentException("Not a terminal status: " + status);
        };
    }
}
