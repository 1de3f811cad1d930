package io.arbor.core.reactive.decorator;

import io.arbor.core.event.Event;
import io.arbor.core.event.EventKind;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import java.util.Objects;

/// Lets only events of one kind reach the child.
///
/// Inside a reactive composite the gate also holds back every later sibling: the prefix
/// scan stops at the gate for any other kind, so those siblings are not offered the
/// event either.
///
/// @param <C> type of the shared context
public final class EventGate<C> extends ReactiveDecorator<C> {

    private final EventKind kind;

    /// @param kind the only kind the child reacts to, not null
    /// @param child the gated node, not null
    public EventGate(EventKind kind, ReactiveNode<C> child) {
        super(child);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public boolean isInterestedIn(EventKind kind) {
        return this.kind.equals(kind);
    }

    @Override
    public Status react(Event event, C context) {
        return child.react(event, context);
    }

    /// @return the kind this gate lets through, never null
    public EventKind getKind() {
        return kind;
    }
}
