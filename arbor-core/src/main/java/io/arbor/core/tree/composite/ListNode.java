package io.arbor.core.tree.composite;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.List;
import java.util.Objects;

/// Generic engine running an ordered list of children under a {@link ListPolicy}.
///
/// ### Contracts
/// - **Precondition**: at least one child, no null children
/// - **Invariant**: between calls, `cursor` points at a child that has not produced the
///   short-circuit status in the current run, `0 <= cursor <= children.size()`
/// - **Postcondition**: after every terminal result the cursor is back at 0 and every
///   visited child has been reset
///
/// ### Step algorithm
/// Starting at the cursor, children are stepped one after another within the same call:
/// - continue status: advance the cursor and step the next child
/// - {@link Status#RUNNING}: return it, the cursor stays on that child
/// - short-circuit status: reset visited children, rewind, return it
///
/// When the cursor runs past the last child the whole list is reset and the continue
/// status is returned.
///
/// @param <C> type of the shared context
/// @see Sequence
/// @see Selector
public abstract class ListNode<C> implements Node<C> {

    private final List<Node<C>> children;
    private final ListPolicy policy;
    private int cursor;
    private boolean dirty;

    /// Creates the engine over a defensive copy of `children`.
    ///
    /// @param children ordered children, not null, not empty
    /// @param policy continuation policy, not null
    /// @throws IllegalArgumentException if `children` is empty
    protected ListNode(List<? extends Node<C>> children, ListPolicy policy) {
        Objects.requireNonNull(children, "children must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException(policy + " requires at least one child node");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public Status step(C context) {
        dirty = true;
        while (cursor < children.size()) {
            Status status = children.get(cursor).step(context);

            if (status == policy.continueStatus()) {
                cursor++;
            } else if (status == Status.RUNNING) {
                return Status.RUNNING;
            } else {
                reset(status);
                return status;
            }
        }

        reset(policy.continueStatus());
        return policy.continueStatus();
    }

    /// Resets every visited child and rewinds the cursor.
    ///
    /// Children before the cursor are told they last produced the continue status; the
    /// child under the cursor receives `lastStatus`. A no-op when no child has been
    /// stepped since the last reset, which includes the self-reset on completion.
    @Override
    public void reset(Status lastStatus) {
        if (!dirty) {
            return;
        }
        int last = Math.min(cursor, children.size() - 1);
        for (int i = 0; i < last; i++) {
            children.get(i).reset(policy.continueStatus());
        }
        children.get(last).reset(lastStatus);
        cursor = 0;
        dirty = false;
    }

    /// @return the continuation policy of this composite, never null
    public ListPolicy getPolicy() {
        return policy;
    }

    /// @return number of children, always positive
    public int size() {
        return children.size();
    }

    /// @return index of the child the next step starts from
    int cursor() {
        return cursor;
    }
}
