package io.arbor.core.reactive.decorator;

import io.arbor.core.event.EventKind;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;

/// Base class for reactive nodes owning exactly one child.
///
/// Interest and reset are forwarded to the child unless a subclass overrides them.
///
/// @param <C> type of the shared context
public abstract class ReactiveDecorator<C> implements ReactiveNode<C> {

    protected final ReactiveNode<C> child;

    protected ReactiveDecorator(ReactiveNode<C> child) {
        this.child = Objects.requireNonNull(child, "child must not be null");
    }

    @Override
    public boolean isInterestedIn(EventKind kind) {
        return child.isInterestedIn(kind);
    }

    @Override
    public void reset(Status lastStatus) {
        child.reset(lastStatus);
    }

    public ReactiveNode<C> getChild() {
        return child;
    }
}
