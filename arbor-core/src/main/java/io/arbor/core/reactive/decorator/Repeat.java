package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;

/// Reactive counterpart of {@link io.arbor.core.tree.decorator.Repeat}: one event per
/// child call, `count` full child runs, the last status surfaced unmodified.
///
/// @param <C> type of the shared context
public final class Repeat<C> extends ReactiveDecorator<C> {

    private final int count;
    private int current = 1;

    /// @throws IllegalArgumentException if `count < 1`
    public Repeat(ReactiveNode<C> child, int count) {
        super(child);
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        this.count = count;
    }

    @Override
    public Status react(Event event, C context) {
        if (current >= count) {
            return child.react(event, context);
        }

        Status status = child.react(event, context);
        if (status.isTerminal()) {
            child.reset(status);
            current++;
        }
        return Status.RUNNING;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        current = 1;
    }
}
