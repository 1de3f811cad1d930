package io.arbor.core.tree;

import io.arbor.core.tree.decorator.ForceFailure;
import io.arbor.core.tree.decorator.ForceSuccess;
import io.arbor.core.tree.decorator.Invert;
import io.arbor.core.tree.decorator.Repeat;
import io.arbor.core.tree.decorator.RepeatUntil;
import io.arbor.core.tree.decorator.RepeatUntilFailure;
import io.arbor.core.tree.decorator.RepeatUntilSuccess;
import io.arbor.core.tree.decorator.RunIf;
import java.util.function.Predicate;

/// A behavior tree node driven by polling.
///
/// Each call to {@link #step} advances the node by one tick against the shared context.
/// {@link Status#RUNNING} means "call me again"; {@link Status#SUCCESS} and
/// {@link Status#FAILURE} end the current run.
///
/// ### Reset discipline
/// After a node produced a terminal status, the caller (or the enclosing composite or
/// decorator) must call {@link #reset(Status)} before stepping it again. Reset restores
/// any resumption state (cursors, repeat counters) to its initial value and must be
/// idempotent.
///
/// ### Fluent decoration
/// The default methods wrap this node in a decorator:
/// {@snippet :
/// Node<Counter> tree = Nodes.<Counter>action(c -> c.value++).repeat(3).invert();
/// }
///
/// @implNote Implementations keep private mutable state and are **not thread-safe**.
/// A tree must be driven by a single thread.
///
/// @param <C> type of the shared context
/// @see io.arbor.core.execution.TreeExecutor for driving a tree to completion
public interface Node<C> {

    /// Advances this node by one tick.
    ///
    /// @param context the shared mutable context, owned by the caller
    /// @return the outcome of this tick, never null
    Status step(C context);

    /// Rearms this node after it produced a terminal status.
    ///
    /// Stateless nodes keep the default no-op.
    ///
    /// @param lastStatus the terminal status the node last produced
    default void reset(Status lastStatus) {}

    /// @return a node mapping {@link Status#SUCCESS} to {@link Status#FAILURE} and back
    default Node<C> invert() {
        return new Invert<>(this);
    }

    /// @return a node reporting {@link Status#SUCCESS} whenever this node finishes
    default Node<C> forceSuccess() {
        return new ForceSuccess<>(this);
    }

    /// @return a node reporting {@link Status#FAILURE} whenever this node finishes
    default Node<C> forceFailure() {
        return new ForceFailure<>(this);
    }

    /// @param count number of full runs to perform, at least 1
    /// @return a node running this node `count` times and reporting the last status
    default Node<C> repeat(int count) {
        return new Repeat<>(this, count);
    }

    /// @param condition checked after each completed run, not null
    /// @return a node re-running this node until `condition` holds
    default Node<C> repeatUntil(Predicate<? super C> condition) {
        return new RepeatUntil<>(this, condition);
    }

    /// @return a node re-running this node until it succeeds
    default Node<C> repeatUntilSuccess() {
        return new RepeatUntilSuccess<>(this);
    }

    /// @return a node re-running this node until it fails
    default Node<C> repeatUntilFailure() {
        return new RepeatUntilFailure<>(this);
    }

    /// @param condition evaluated on every tick, not null
    /// @return a node stepping this node only while `condition` holds
    default Node<C> runIf(Predicate<? super C> condition) {
        return new RunIf<>(this, condition);
    }
}
