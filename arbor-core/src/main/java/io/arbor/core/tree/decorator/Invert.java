package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;

/// Swaps the child's {@link Status#SUCCESS} and {@link Status#FAILURE};
/// {@link Status#RUNNING} passes through.
///
/// @param <C> type of the shared context
public final class Invert<C> extends Decorator<C> {

    public Invert(Node<C> child) {
        super(child);
    }

    @Override
    public Status step(C context) {
        return child.step(context).invert();
    }
}
