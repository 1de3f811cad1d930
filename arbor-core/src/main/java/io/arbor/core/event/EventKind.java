package io.arbor.core.event;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Opaque 64-bit fingerprint identifying the logical kind of an {@link Event}.
///
/// A kind is derived by hashing a canonical name with 64-bit FNV-1a over its UTF-8
/// bytes: the event's declared {@link Event#eventName() name}, or the binary class name
/// for {@link MarkerEvent} types. Kinds are compared for equality only and are never used
/// to recover the event payload.
///
/// ### Collisions
/// A fingerprint is not a uniqueness guarantee. For `n` distinct names the probability
/// that any two share a fingerprint is roughly `n² / 2^65`, about 3e-8 for a million
/// names. Every name hashed in this JVM is remembered, and a second name producing an
/// already-taken fingerprint is rejected with {@link EventKindCollisionException} instead
/// of silently aliasing two kinds.
///
/// ### Bounded names
/// Each distinct name is interned for the lifetime of the JVM and its kind is cached, so
/// later lookups skip hashing. Names must come from a bounded set (types, enum constants,
/// fixed strings); never derive them from unbounded payload data such as ids or
/// timestamps.
///
/// @param value the fingerprint bits
public record EventKind(long value) {

    private static final Logger logger = Logger.getLogger(EventKind.class.getName());

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final Map<Long, String> NAMES = new ConcurrentHashMap<>();
    private static final Map<String, EventKind> KINDS = new ConcurrentHashMap<>();

    private static final ClassValue<EventKind> CLASS_KINDS =
            new ClassValue<>() {
                @Override
                protected EventKind computeValue(Class<?> type) {
                    return of(type.getName());
                }
            };

    /// Returns the kind for a canonical event name.
    ///
    /// @param name canonical event name, not null
    /// @return the fingerprint of `name`, never null
    /// @throws EventKindCollisionException if a different name already produced the same
    /// fingerprint
    public static EventKind of(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return KINDS.computeIfAbsent(name, n -> register(n, fingerprint(n)));
    }

    static EventKind register(String name, long hash) {
        String previous = NAMES.putIfAbsent(hash, name);
        if (previous == null) {
            logger.finest(() -> "Registered event kind '" + name + "' as " + Long.toHexString(hash));
        } else if (!previous.equals(name)) {
            throw new EventKindCollisionException(previous, name, hash);
        }
        return new EventKind(hash);
    }

    /// Returns the static kind of a marker event type, computed once per class.
    ///
    /// @param type marker event class, not null
    /// @return the fingerprint of the class's binary name, never null
    public static EventKind of(Class<? extends MarkerEvent> type) {
        Objects.requireNonNull(type, "type must not be null");
        return CLASS_KINDS.get(type);
    }

    static long fingerprint(String name) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    @Override
    public String toString() {
        String name = NAMES.get(value);
        return "EventKind[" + (name != null ? name : Long.toHexString(value)) + "]";
    }
}
