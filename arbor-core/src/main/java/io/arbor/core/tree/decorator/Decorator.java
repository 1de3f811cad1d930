package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;

/// Base class for nodes owning exactly one child.
///
/// The default {@link #reset(Status)} forwards to the child. Subclasses holding their own
/// resumption state override it and call `super.reset`.
///
/// @param <C> type of the shared context
public abstract class Decorator<C> implements Node<C> {

    protected final Node<C> child;

    /// @param child the decorated node, not null
    protected Decorator(Node<C> child) {
        this.child = Objects.requireNonNull(child, "child must not be null");
    }

    @Override
    public void reset(Status lastStatus) {
        child.reset(lastStatus);
    }

    /// @return the decorated node, never null
    public Node<C> getChild() {
        return child;
    }
}
