package io.arbor.core.reactive.leaf;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Consumer;

/// Reactive context mutation that ignores the event and always succeeds.
///
/// @param <C> type of the shared context
public final class ReactiveAction<C> implements ReactiveNode<C> {

    private final Consumer<? super C> action;

    public ReactiveAction(Consumer<? super C> action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public Status react(Event event, C context) {
        action.accept(context);
        return Status.SUCCESS;
    }
}
