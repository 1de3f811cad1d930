package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;

/// Retries the child on subsequent events until it succeeds.
///
/// A child failure is swallowed: the child is reset and {@link Status#RUNNING} is
/// returned. Success is propagated.
///
/// @param <C> type of the shared context
public final class RepeatUntilSuccess<C> extends ReactiveDecorator<C> {

    public RepeatUntilSuccess(ReactiveNode<C> child) {
        super(child);
    }

    @Override
    public Status react(Event event, C context) {
        Status status = child.react(event, context);
        if (status == Status.FAILURE) {
            child.reset(status);
            return Status.RUNNING;
        }
        return status;
    }
}
