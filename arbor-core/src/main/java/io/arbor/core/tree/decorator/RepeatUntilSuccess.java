package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;

/// Re-runs the child until it succeeds. Child failures are swallowed: the child is
/// reset and {@link Status#RUNNING} is returned.
///
/// @param <C> type of the shared context
public final class RepeatUntilSuccess<C> extends Decorator<C> {

    public RepeatUntilSuccess(Node<C> child) {
        super(child);
    }

    @Override
    public Status step(C context) {
        Status status = child.step(context);
        if (status == Status.FAILURE) {
            child.reset(status);
            return Status.RUNNING;
        }
        return status;
    }
}
