package io.arbor.core.reactive.leaf;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Function;

/// Reactive function reporting its own {@link Status}; may span several events.
///
/// @param <C> type of the shared context
public final class ReactiveStatefulAction<C> implements ReactiveNode<C> {

    private final Function<? super C, Status> action;

    public ReactiveStatefulAction(Function<? super C, Status> action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        return Objects.requireNonNull(action.apply(context), "action returned null status");
    }
}
