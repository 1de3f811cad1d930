package io.arbor.core.reactive.leaf;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.BiFunction;

/// Reactive leaf that sees the consumed event as well as the context.
///
/// Useful behind an {@link io.arbor.core.reactive.decorator.EventGate}, where the event
/// type is known and its payload can be read.
///
/// @param <C> type of the shared context
public final class EventAction<C> implements ReactiveNode<C> {

    private final BiFunction<? super Event, ? super C, Status> action;

    public EventAction(BiFunction<? super Event, ? super C, Status> action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        return Objects.requireNonNull(action.apply(event, context), "action returned null status");
    }
}
