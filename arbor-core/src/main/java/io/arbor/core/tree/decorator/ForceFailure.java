package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;

/// Runs the child until it finishes and then reports {@link Status#FAILURE}
/// whatever the child returned.
///
/// @param <C> type of the shared context
public final class ForceFailure<C> extends Decorator<C> {

    public ForceFailure(Node<C> child) {
        super(child);
    }

    @Override
    public Status step(C context) {
        return child.step(context).isTerminal() ? Status.FAILURE : Status.RUNNING;
    }
}
