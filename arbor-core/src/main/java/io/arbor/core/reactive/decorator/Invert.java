package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;

/// Swaps the child's terminal statuses; {@link Status#RUNNING} passes through.
///
/// @param <C> type of the shared context
public final class Invert<C> extends ReactiveDecorator<C> {

    public Invert(ReactiveNode<C> child) {
        super(child);
    }

    @Override
    public Status react(Event event, C context) {
        return child.react(event, context).invert();
    }
}
