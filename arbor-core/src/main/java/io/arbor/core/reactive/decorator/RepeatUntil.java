package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Reactive counterpart of {@link io.arbor.core.tree.decorator.RepeatUntil}. The
/// predicate is checked at most once per completed child run.
///
/// @param <C> type of the shared context
public final class RepeatUntil<C> extends ReactiveDecorator<C> {

    private final Predicate<? super C> condition;
    private boolean checked;

    public RepeatUntil(ReactiveNode<C> child, Predicate<? super C> condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        Status status = child.react(event, context);
        if (status.isTerminal()) {
            child.reset(status);
            checked = false;
        }

        if (!checked) {
            if (condition.test(context)) {
                return Status.SUCCESS;
            }
            checked = true;
        }

        return Status.RUNNING;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        checked = false;
    }
}
