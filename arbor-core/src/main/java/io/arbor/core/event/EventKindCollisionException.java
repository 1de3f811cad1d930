package io.arbor.core.event;

import java.io.Serial;

/// Thrown when two distinct event names hash to the same {@link EventKind} fingerprint.
public class EventKindCollisionException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2917645530284460153L;

    private final String existingName;
    private final String collidingName;

    public EventKindCollisionException(String existingName, String collidingName, long value) {
        super(
                "Event name '"
                        + collidingName
                        + "' collides with '"
                        + existingName
                        + "' on fingerprint "
                        + Long.toHexString(value));
        this.existingName = existingName;
        this.collidingName = collidingName;
    }

    public String getExistingName() {
        return existingName;
    }

    public String getCollidingName() {
        return collidingName;
    }
}
