package io.arbor.core.tree.composite;

import io.arbor.core.tree.Node;
import java.util.List;

/// Runs its children in order until one of them fails, in which case the sequence
/// fails. Succeeds once every child succeeded.
///
/// @param <C> type of the shared context
public final class Sequence<C> extends ListNode<C> {

    /// @param children ordered children, not null, not empty
    /// @throws IllegalArgumentException if `children` is empty
    public Sequence(List<? extends Node<C>> children) {
        super(children, ListPolicy.SEQUENCE);
    }
}
