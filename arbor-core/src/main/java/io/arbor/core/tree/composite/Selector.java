package io.arbor.core.tree.composite;

import io.arbor.core.tree.Node;
import java.util.List;

/// Runs its children in order until one of them succeeds, in which case the selector
/// succeeds. Fails once every child failed.
///
/// @param <C> type of the shared context
public final class Selector<C> extends ListNode<C> {

    /// @param children ordered children, not null, not empty
    /// @throws IllegalArgumentException if `children` is empty
    public Selector(List<? extends Node<C>> children) {
        super(children, ListPolicy.SELECTOR);
    }
}
