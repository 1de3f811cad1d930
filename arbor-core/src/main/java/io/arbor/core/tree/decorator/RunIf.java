package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Steps the child only while a context predicate holds.
///
/// The predicate is evaluated on every call. When it does not hold the child is not
/// stepped and {@link Status#FAILURE} is returned; a child interrupted mid-run is reset
/// first so its next run starts from scratch.
///
/// @param <C> type of the shared context
public final class RunIf<C> extends Decorator<C> {

    private final Predicate<? super C> condition;
    private boolean running;

    /// @param child the guarded node, not null
    /// @param condition guard over the context, not null
    public RunIf(Node<C> child, Predicate<? super C> condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public Status step(C context) {
        if (!condition.test(context)) {
            if (running) {
                child.reset(Status.FAILURE);
                running = false;
            }
            return Status.FAILURE;
        }

        Status status = child.step(context);
        running = status == Status.RUNNING;
        return status;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        running = false;
    }
}
