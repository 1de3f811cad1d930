package io.arbor.core.event;

/// Payload-free event for driving reactive trees that ignore event content.
///
/// @see EventSources#unitPump()
public enum UnitEvent implements MarkerEvent {
    INSTANCE
}
