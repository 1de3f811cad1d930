package io.arbor.core.tree.composite;

import io.arbor.core.tree.Status;

/// Continuation policy of a composite node.
///
/// The policy fixes which child status lets traversal move on to the next child
/// ({@link #continueStatus()}) and which one ends the composite's run immediately
/// ({@link #shortCircuitStatus()}). Reaching the end of the child list yields the
/// continue status.
///
/// Shared by the poll and reactive composite engines.
public enum ListPolicy {

    /// Ordered AND: continue on success, stop on the first failure.
    SEQUENCE(Status.SUCCESS),

    /// Ordered OR: continue on failure, stop on the first success.
    SELECTOR(Status.FAILURE);

    private final Status continueStatus;

    ListPolicy(Status continueStatus) {
        this.continueStatus = continueStatus;
    }

    /// @return status that advances the cursor to the next child, never null
    public Status continueStatus() {
        return continueStatus;
    }

    /// @return status that ends the composite's run, never null
    public Status shortCircuitStatus() {
        return continueStatus.invert();
    }
}
