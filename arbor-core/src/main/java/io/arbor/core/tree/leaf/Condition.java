package io.arbor.core.tree.leaf;

import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.function.Predicate;

/// Adapts a context predicate into a node: `true` is {@link Status#SUCCESS},
/// `false` is {@link Status#FAILURE}.
///
/// @param <C> type of the shared context
public final class Condition<C> implements Node<C> {

    private final Predicate<? super C> predicate;

    public Condition(Predicate<? super C> predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    @Override
    public Status step(C context) {
        return predicate.test(context) ? Status.SUCCESS : Status.FAILURE;
    }
}
