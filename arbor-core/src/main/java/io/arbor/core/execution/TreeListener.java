package io.arbor.core.execution;

import io.arbor.core.event.Event;
import io.arbor.core.tree.Status;

/// Listener for tree execution lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only
/// the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onStart()                       — run begins
/// onTick(tick, status)            — poll model, after every root step
/// onEvent(tick, event, status)    — reactive model, after every root react
/// onEventIgnored(event)           — reactive model, root not interested in event
/// onFinish(result)                — run ended (terminal, pending or limit reached)
/// ```
///
/// @implNote Called on the thread driving the tree.
///
/// @see TreeExecutor
public interface TreeListener {

    /// Called before the first root call of a run.
    default void onStart() {}

    /// Called after each poll-model step of the root.
    ///
    /// @param tick 1-based index of the step
    /// @param status status the root returned, not null
    default void onTick(long tick, Status status) {}

    /// Called after the root reacted to an event.
    ///
    /// @param tick 1-based index of the react call
    /// @param event the consumed event, not null
    /// @param status status the root returned, not null
    default void onEvent(long tick, Event event, Status status) {}

    /// Called when an event was not offered to the root because it is not interested in
    /// the event's kind.
    ///
    /// @param event the event left unconsumed, not null
    default void onEventIgnored(Event event) {}

    /// Called once when the run ends.
    ///
    /// @param result the run outcome, not null
    default void onFinish(ExecutionResult result) {}

    /// No-op listener instance that ignores all events.
    TreeListener NOOP = new TreeListener() {};
}
