package io.arbor.core.execution;

import io.arbor.core.event.Event;
import io.arbor.core.tree.Status;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logs tree execution progress through `java.util.logging`.
///
/// ### Log Format
/// ```
/// tick 3 → RUNNING                        (FINER)
/// event 4 [com.example.Exit] → SUCCESS    (FINE)
/// event [com.example.Tick] ignored by root (FINE)
/// run finished: Succeeded[ticks=4]         (INFO)
/// ```
///
/// @apiNote **Side effects**: writes to the logger category
/// `io.arbor.core.execution.LoggingTreeListener`.
public class LoggingTreeListener implements TreeListener {

    private static final Logger logger = Logger.getLogger(LoggingTreeListener.class.getName());

    @Override
    public void onTick(long tick, Status status) {
        if (logger.isLoggable(Level.FINER)) {
            logger.finer("tick " + tick + " → " + status);
        }
    }

    @Override
    public void onEvent(long tick, Event event, Status status) {
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("event " + tick + " [" + event.eventName() + "] → " + status);
        }
    }

    @Override
    public void onEventIgnored(Event event) {
        logger.fine(() -> "event [" + event.eventName() + "] ignored by root");
    }

    @Override
    public void onFinish(ExecutionResult result) {
        logger.info("run finished: " + result);
    }
}
