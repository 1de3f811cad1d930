package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;

/// Reports {@link Status#FAILURE} whenever the child finishes.
///
/// @param <C> type of the shared context
public final class ForceFailure<C> extends ReactiveDecorator<C> {

    public ForceFailure(ReactiveNode<C> child) {
        super(child);
    }

    @Override
    public Status react(Event event, C context) {
        return child.react(event, context).isTerminal() ? Status.FAILURE : Status.RUNNING;
    }
}
