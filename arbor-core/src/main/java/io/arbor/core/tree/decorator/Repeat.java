package io.arbor.core.tree.decorator;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;

/// Runs the child a fixed number of times and reports the status of the last run.
///
/// The counter starts at 1. While it is below `count`, every terminal child status is
/// swallowed: the child is reset, the counter advances and {@link Status#RUNNING} is
/// returned. Once the counter reaches `count` the child's status is returned unmodified,
/// so the child completes `count - 1` runs silently before its final run is surfaced.
///
/// ### Contracts
/// - **Precondition**: `count >= 1`
/// - **Postcondition**: `Repeat(1)` behaves exactly like its child
///
/// @param <C> type of the shared context
public final class Repeat<C> extends Decorator<C> {

    private final int count;
    private int current = 1;

    /// @param child the repeated node, not null
    /// @param count number of full runs, at least 1
    /// @throws IllegalArgumentException if `count < 1`
    public Repeat(Node<C> child, int count) {
        super(child);
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        this.count = count;
    }

    @Override
    public Status step(C context) {
        if (current >= count) {
            return child.step(context);
        }

        Status status = child.step(context);
        if (status.isTerminal()) {
            child.reset(status);
            current++;
        }
        return Status.RUNNING;
    }

    @Override
    public void reset(Status lastStatus) {
        super.reset(lastStatus);
        current = 1;
    }

    /// @return configured number of runs
    public int getCount() {
        return count;
    }
}
