package io.arbor.core.tree.leaf;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Consumer;

/// Adapts a context mutation into a node that always succeeds in one step.
///
/// @param <C> type of the shared context
public final class Action<C> implements Node<C> {

    private final Consumer<? super C> action;

    public Action(Consumer<? super C> action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public Status step(C context) {
        action.accept(context);
        return Status.SUCCESS;
    }
}
