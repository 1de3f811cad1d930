package io.arbor.core.event;

import java.util.Iterator;
import java.util.List;

/// Factory methods for event sources consumed by
/// {@link io.arbor.core.execution.TreeExecutor}.
public final class EventSources {

    private EventSources() {}

    /// Returns an endless source yielding {@link UnitEvent#INSTANCE}.
    ///
    /// Driving a tree from this source only ends once the root reaches a terminal status,
    /// or once the root loses interest in unit events.
    ///
    /// @return infinite event source, never null
    public static Iterable<Event> unitPump() {
        return () ->
                new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Event next() {
                        return UnitEvent.INSTANCE;
                    }
                };
    }

    /// Returns a finite source replaying the given events in order.
    ///
    /// @param events events to replay, not null
    /// @return immutable event source, never null
    public static Iterable<Event> of(Event... events) {
        return List.of(events);
    }
}
