package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Re-runs the child until a context predicate holds, then reports
/// {@link Status#SUCCESS}.
///
/// The predicate is evaluated at most once per completed child run: after it returned
/// `false` it is not consulted again until the child finishes another run. The child's
/// own terminal statuses are never surfaced; the child is reset after each of them.
///
/// @param <C> type of the shared context
public final class RepeatUntil<C> extends Decorator<C> {

    private final Predicate<? super C> condition;
    private boolean checked;

    /// @param child the repeated node, not null
    /// @param condition stop condition over the context, not null
    public RepeatUntil(Node<C> child, Predicate<? super C> condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public Status step(C context) {
        Status status = child.step(context);
        if (status.isTerminal()) {
            child.reset(status);
            checked = false;
        }

        if (!checked) {
            if (condition.test(context)) {
                return Status.SUCCESS;
            }
            checked = true;
        }

        return Status.RUNNING;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        checked = false;
    }
}
