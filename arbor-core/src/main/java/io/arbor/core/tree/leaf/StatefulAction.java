package io.arbor.core.tree.leaf;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Function;

/// Adapts a function reporting its own {@link Status}, letting a single leaf span several
/// ticks by returning {@link Status#RUNNING}.
///
/// Any progress state lives in the context or in the function itself; this adaptor holds
/// none and keeps the no-op reset.
///
/// @param <C> type of the shared context
public final class StatefulAction<C> implements Node<C> {

    private final Function<? super C, Status> action;

    public StatefulAction(Function<? super C, Status> action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public Status step(C context) {
        return Objects.requireNonNull(action.apply(context), "action returned null status");
    }
}
