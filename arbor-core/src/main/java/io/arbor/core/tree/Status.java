package io.arbor.core.tree;

/// Outcome of a single node step.
///
/// Exactly one value is produced per {@link Node#step} or
/// {@link io.arbor.core.reactive.ReactiveNode#react} call. Values carry no ordering
/// and are compared only for equality.
///
/// @see Node#reset(Status) for the reset discipline following a terminal status
public enum Status {

    /// Node has not finished yet and expects to be called again.
    RUNNING,

    /// Node finished and achieved its goal.
    SUCCESS,

    /// Node finished without achieving its goal. A normal, propagated value.
    FAILURE;

    /// Returns whether this status ends the current run of a node.
    ///
    /// @return `true` for {@link #SUCCESS} and {@link #FAILURE}
    public boolean isTerminal() {
        return this != RUNNING;
    }

    /// Swaps {@link #SUCCESS} and {@link #FAILURE}; {@link #RUNNING} is unchanged.
    ///
    /// @return the inverted status, never null
    public Status invert() {
        return switch (this) {
            case SUCCESS -> FAILURE;
            case FAILURE -> SUCCESS;
            case RUNNING -> RUNNING;
        };
    }
}
