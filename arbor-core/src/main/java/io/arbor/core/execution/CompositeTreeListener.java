package io.arbor.core.execution;

import io.arbor.core.event.Event;
import io.arbor.core.tree.Status;

/// Fans out all execution lifecycle events to an ordered set of delegates.
///
/// ### Usage
/// {@snippet :
/// TreeListener listener = new CompositeTreeListener(metricsListener, new LoggingTreeListener());
/// new TreeExecutor(config, listener).run(tree, context);
/// }
///
/// @implNote Delegates are captured at construction and never mutated.
///
/// @see TreeListener
/// @see LoggingTreeListener
public final class CompositeTreeListener implements TreeListener {

    private final TreeListener[] delegates;

    /// @param delegates listeners to notify; must not be null, elements must not be null
    public CompositeTreeListener(TreeListener... delegates) {
        this.delegates = delegates.clone();
    }

    @Override
    public void onStart() {
        for (TreeListener d : delegates) d.onStart();
    }

    @Override
    public void onTick(long tick, Status status) {
        for (TreeListener d : delegates) d.onTick(tick, status);
    }

    @Override
    public void onEvent(long tick, Event event, Status status) {
        for (TreeListener d : delegates) d.onEvent(tick, event, status);
    }

    @Override
    public void onEventIgnored(Event event) {
        for (TreeListener d : delegates) d.onEventIgnored(event);
    }

    @Override
    public void onFinish(ExecutionResult result) {
        for (TreeListener d : delegates) d.onFinish(result);
    }
}
