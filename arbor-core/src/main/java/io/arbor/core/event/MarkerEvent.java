package io.arbor.core.event;

/// An event whose kind depends only on its class, not on its payload.
///
/// The event name is the binary class name and the kind is cached per class, so a
/// gate can be built from the type alone with {@link EventKind#of(Class)}. A marker that
/// overrides {@link #eventName()} takes the kind of that name instead, and gates must
/// then be built with {@link EventKind#of(String)}.
public interface MarkerEvent extends Event {

    @Override
    default String eventName() {
        return getClass().getName();
    }

    @Override
    default EventKind kind() {
        Class<? extends MarkerEvent> type = getClass();
        String name = eventName();
        return name.equals(type.getName()) ? EventKind.of(type) : EventKind.of(name);
    }
}
