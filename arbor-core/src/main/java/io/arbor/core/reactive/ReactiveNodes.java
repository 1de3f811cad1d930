package io.arbor.core.reactive;

import io.arbor.core.event.Event;
import io.arbor.core.reactive.composite.ReactiveSelector;
import io.arbor.core.reactive.composite.ReactiveSequence;
import io.arbor.core.reactive.leaf.EventAction;
import io.arbor.core.reactive.leaf.ReactiveAction;
import io.arbor.core.reactive.leaf.ReactiveCondition;
import io.arbor.core.reactive.leaf.ReactiveStatefulAction;
import io.arbor.core.tree.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/// Static factories for assembling reactive trees.
///
/// ### Example
/// {@snippet :
/// final class Step implements MarkerEvent {}
/// final class Exit implements MarkerEvent {}
///
/// ReactiveNode<int[]> tree =
///         ReactiveNodes.sequence(
///                 ReactiveNodes.action(i -> i[0]++),
///                 ReactiveNodes.<int[]>action(i -> System.out.println("exiting"))
///                         .waitFor(Exit.class));
/// }
///
/// @see io.arbor.core.tree.Nodes for the poll-model counterpart
public final class ReactiveNodes {

    private ReactiveNodes() {}

    @SafeVarargs
    public static <C> ReactiveSequence<C> sequence(
            ReactiveNode<C> first, ReactiveNode<C>... rest) {
        return new ReactiveSequence<>(collect(first, rest));
    }

    /// @throws IllegalArgumentException if `children` is empty
    public static <C> ReactiveSequence<C> sequence(List<? extends ReactiveNode<C>> children) {
        return new ReactiveSequence<>(children);
    }

    @SafeVarargs
    public static <C> ReactiveSelector<C> selector(
            ReactiveNode<C> first, ReactiveNode<C>... rest) {
        return new ReactiveSelector<>(collect(first, rest));
    }

    /// @throws IllegalArgumentException if `children` is empty
    public static <C> ReactiveSelector<C> selector(List<? extends ReactiveNode<C>> children) {
        return new ReactiveSelector<>(children);
    }

    public static <C> ReactiveNode<C> action(Consumer<? super C> action) {
        return new ReactiveAction<>(action);
    }

    public static <C> ReactiveNode<C> condition(Predicate<? super C> predicate) {
        return new ReactiveCondition<>(predicate);
    }

    public static <C> ReactiveNode<C> statefulAction(Function<? super C, Status> action) {
        return new ReactiveStatefulAction<>(action);
    }

    public static <C> ReactiveNode<C> eventAction(
            BiFunction<? super Event, ? super C, Status> action) {
        return new EventAction<>(action);
    }

    @SafeVarargs
    private static <N> List<N> collect(N first, N... rest) {
        List<N> all = new ArrayList<>(rest.length + 1);
        all.add(first);
        all.addAll(List.of(rest));
        return all;
    }
}
