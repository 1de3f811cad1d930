package io.arbor.core.reactive.composite;

import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.composite.ListPolicy;
import java.util.List;

/// Reactive ordered AND: fails on the first child failure, succeeds once every child
/// succeeded.
///
/// @param <C> type of the shared context
public final class ReactiveSequence<C> extends ReactiveListNode<C> {

    public ReactiveSequence(List<? extends ReactiveNode<C>> children) {
        super(children, ListPolicy.SEQUENCE);
    }
}
