package io.arbor.core.reactive.composite;

import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.composite.ListPolicy;
import java.util.List;

/// Reactive ordered OR: succeeds on the first child success, fails once every child
/// failed.
///
/// @param <C> type of the shared context
public final class ReactiveSelector<C> extends ReactiveListNode<C> {

    public ReactiveSelector(List<? extends ReactiveNode<C>> children) {
        super(children, ListPolicy.SELECTOR);
    }
}
