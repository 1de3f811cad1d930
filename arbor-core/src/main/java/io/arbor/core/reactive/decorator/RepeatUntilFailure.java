package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;

/// Retries the child on subsequent events until it fails.
///
/// A child success is swallowed: the child is reset and {@link Status#RUNNING} is
/// returned. Failure is propagated.
///
/// @param <C> type of the shared context
public final class RepeatUntilFailure<C> extends ReactiveDecorator<C> {

    public RepeatUntilFailure(ReactiveNode<C> child) {
        super(child);
    }

    @Override
    public Status react(Event event, C context) {
        Status status = child.react(event, context);
        if (status == Status.SUCCESS) {
            child.reset(status);
            return Status.RUNNING;
        }
        return status;
    }
}
