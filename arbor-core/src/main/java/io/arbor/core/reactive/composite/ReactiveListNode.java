package io.arbor.core.reactive.composite;

import io.arbor.core.event.Event;
import io.arbor.core.event.EventKind;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Status;
import io.arbor.core.tree.composite.ListPolicy;
import java.util.List;
import java.util.Objects;

/// Event-driven counterpart of {@link io.arbor.core.tree.composite.ListNode}.
///
/// For each event, children are offered the event starting at the cursor, for as long
/// as the child under the cursor is interested in the event's kind. The first
/// uninterested child ends the scan: neither it nor any later sibling sees the event,
/// and the composite reports {@link Status#RUNNING} while it waits for a suitable event.
/// Within the scanned prefix the {@link ListPolicy} applies exactly as in the poll
/// model, so several children may consume the same event in one call.
///
/// List order is the scheduling primitive: a gated child placed after instantaneous
/// children only fires once those have passed and its event kind arrives.
///
/// A composite is interested in every event kind.
///
/// @param <C> type of the shared context
/// @see ReactiveSequence
/// @see ReactiveSelector
public abstract class ReactiveListNode<C> implements ReactiveNode<C> {

    private final List<ReactiveNode<C>> children;
    private final ListPolicy policy;
    private int cursor;
    private boolean dirty;

    /// @param children ordered children, not null, not empty
    /// @param policy continuation policy, not null
    /// @throws IllegalArgumentException if `children` is empty
    protected ReactiveListNode(List<? extends ReactiveNode<C>> children, ListPolicy policy) {
        Objects.requireNonNull(children, "children must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException(policy + " requires at least one child node");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public Status react(Event event, C context) {
        EventKind kind = event.kind();

        while (cursor < children.size()) {
            ReactiveNode<C> child = children.get(cursor);
            if (!child.isInterestedIn(kind)) {
                return Status.RUNNING;
            }
            dirty = true;

            Status status = child.react(event, context);
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

    /// Resets every child that reacted since the last reset; a no-op otherwise.
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
}
