package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;

/// Re-runs the child until it fails. Child successes are swallowed: the child is
/// reset and {@link Status#RUNNING} is returned.
///
/// @param <C> type of the shared context
public final class RepeatUntilFailure<C> extends Decorator<C> {

    public RepeatUntilFailure(Node<C> child) {
        super(child);
    }

    @Override
    public Status step(C context) {
        Status status = child.step(context);
        if (status == Status.SUCCESS) {
            child.reset(status);
            return Status.RUNNING;
        }
        return status;
    }
}
