package io.arbor.core.reactive.leaf;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Reactive context predicate; the event is ignored.
///
/// @param <C> type of the shared context
public final class ReactiveCondition<C> implements ReactiveNode<C> {

    private final Predicate<? super C> predicate;

    public ReactiveCondition(Predicate<? super C> predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        return predicate.test(context) ? Status.SUCCESS : Status.FAILURE;
    }
}
