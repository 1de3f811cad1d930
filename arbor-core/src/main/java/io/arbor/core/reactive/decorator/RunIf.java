package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Offers events to the child only while a context predicate holds; otherwise reports
/// {@link Status#FAILURE}, resetting a child interrupted mid-run.
///
/// @param <C> type of the shared context
public final class RunIf<C> extends ReactiveDecorator<C> {

    private final Predicate<? super C> condition;
    private boolean running;

    public RunIf(ReactiveNode<C> child, Predicate<? super C> condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        if (!condition.test(context)) {
            if (running) {
                child.reset(Status.FAILURE);
                running = false;
            }
            return Status.FAILURE;
        }

        Status status = child.react(event, context);
        running = status == Status.RUNNING;
        return status;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        running = false;
    }
}
