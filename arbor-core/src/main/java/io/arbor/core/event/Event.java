package io.arbor.core.event;

/// A discrete external event consumed by reactive nodes.
///
/// Implement this directly for value-dependent events whose variants must be told apart
/// by value, for example an enum whose constants are distinct kinds:
/// {@snippet :
/// enum Input implements Event {
///     JUMP, CROUCH;
///
///     public String eventName() {
///         return "Input." + name();
///     }
/// }
/// }
/// Names must come from a bounded set; see {@link EventKind}. Events whose identity
/// depends only on their type implement {@link MarkerEvent}.
///
/// @see EventKind
public interface Event {

    /// Returns the canonical name this event's kind is derived from.
    ///
    /// @return stable name, never null
    String eventName();

    /// Returns the kind of this event. Kinds are cached per name, so repeated dispatch
    /// of the same name does not rehash it.
    ///
    /// @return fingerprint of {@link #eventName()}, never null
    default EventKind kind() {
        return EventKind.of(eventName());
    }
}
