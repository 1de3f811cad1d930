package io.arbor.core.reactive;

import io.arbor.core.event.Event;
import io.arbor.core.event.EventKind;
import io.arbor.core.event.MarkerEvent;
import io.arbor.core.reactive.decorator.EventGate;
import io.arbor.core.reactive.decorator.ForceFailure;
import io.arbor.core.reactive.decorator.ForceSuccess;
import io.arbor.core.reactive.decorator.Invert;
import io.arbor.core.reactive.decorator.Repeat;
import io.arbor.core.reactive.decorator.RepeatUntil;
import io.arbor.core.reactive.decorator.RepeatUntilFailure;
import io.arbor.core.reactive.decorator.RepeatUntilSuccess;
import io.arbor.core.reactive.decorator.RunIf;
import io.arbor.core.tree.Status;
import java.util.function.Predicate;

/// A behavior tree node driven by discrete external events.
///
/// Instead of being polled, a reactive node consumes one {@link Event} per
/// {@link #react} call. Before offering an event, composites ask each child whether it
/// {@link #isInterestedIn(EventKind) cares} about the event's kind; the first child that
/// does not ends the scan for that event.
///
/// Reactive nodes follow the same reset discipline as {@link io.arbor.core.tree.Node}.
///
/// @implNote Not thread-safe. A tree must be driven by a single thread.
///
/// @param <C> type of the shared context
/// @see io.arbor.core.reactive.composite.ReactiveListNode for the prefix scan
public interface ReactiveNode<C> {

    /// Returns whether this node wants to receive events of the given kind.
    ///
    /// @param kind kind of the pending event, not null
    /// @return `true` by default
    default boolean isInterestedIn(EventKind kind) {
        return true;
    }

    /// Advances this node in response to one event.
    ///
    /// @param event the event being consumed, not null
    /// @param context the shared mutable context, owned by the caller
    /// @return the outcome of this call, never null
    Status react(Event event, C context);

    /// Rearms this node after it produced a terminal status. No-op by default.
    ///
    /// @param lastStatus the terminal status the node last produced
    default void reset(Status lastStatus) {}

    default ReactiveNode<C> invert() {
        return new Invert<>(this);
    }

    default ReactiveNode<C> forceSuccess() {
        return new ForceSuccess<>(this);
    }

    default ReactiveNode<C> forceFailure() {
        return new ForceFailure<>(this);
    }

    default ReactiveNode<C> repeat(int count) {
        return new Repeat<>(this, count);
    }

    default ReactiveNode<C> repeatUntil(Predicate<? super C> condition) {
        return new RepeatUntil<>(this, condition);
    }

    default ReactiveNode<C> repeatUntilSuccess() {
        return new RepeatUntilSuccess<>(this);
    }

    default ReactiveNode<C> repeatUntilFailure() {
        return new RepeatUntilFailure<>(this);
    }

    default ReactiveNode<C> runIf(Predicate<? super C> condition) {
        return new RunIf<>(this, condition);
    }

    /// Restricts this node to events of a single kind.
    ///
    /// @param kind the only kind this node reacts to, not null
    /// @return the gated node, never null
    default ReactiveNode<C> waitFor(EventKind kind) {
        return new EventGate<>(kind, this);
    }

    /// Restricts this node to events of a single marker type.
    ///
    /// @param type the only event type this node reacts to, not null
    /// @return the gated node, never null
    default ReactiveNode<C> waitFor(Class<? extends MarkerEvent> type) {
        return new EventGate<>(EventKind.of(type), this);
    }
}
