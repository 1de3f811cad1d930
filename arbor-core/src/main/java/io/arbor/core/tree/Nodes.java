package io.arbor.core.tree;

import io.arbor.core.tree.composite.Selector;
import io.arbor.core.tree.composite.Sequence;
import io.arbor.core.tree.leaf.Action;
import io.arbor.core.tree.leaf.Condition;
import io.arbor.core.tree.leaf.StatefulAction;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/// Static factories for assembling poll-model trees.
///
/// The varargs composite factories take a mandatory first child, so an empty composite
/// cannot be written; the list overloads reject an empty list at construction.
///
/// ### Example
/// {@snippet :
/// Node<int[]> tree =
///         Nodes.selector(
///                 Nodes.sequence(
///                         Nodes.condition(v -> v[0] < 10),
///                         Nodes.action(v -> System.out.println("one digit"))),
///                 Nodes.action(v -> System.out.println("more digits")));
/// }
public final class Nodes {

    private Nodes() {}

    /// @param first first child, not null
    /// @param rest remaining children in order, not null
    /// @return a sequence over all children, never null
    @SafeVarargs
    public static <C> Sequence<C> sequence(Node<C> first, Node<C>... rest) {
        return new Sequence<>(collect(first, rest));
    }

    /// @param children children in order, not null
    /// @return a sequence over `children`, never null
    /// @throws IllegalArgumentException if `children` is empty
    public static <C> Sequence<C> sequence(List<? extends Node<C>> children) {
        return new Sequence<>(children);
    }

    /// @param first first child, not null
    /// @param rest remaining children in order, not null
    /// @return a selector over all children, never null
    @SafeVarargs
    public static <C> Selector<C> selector(Node<C> first, Node<C>... rest) {
        return new Selector<>(collect(first, rest));
    }

    /// @param children children in order, not null
    /// @return a selector over `children`, never null
    /// @throws IllegalArgumentException if `children` is empty
    public static <C> Selector<C> selector(List<? extends Node<C>> children) {
        return new Selector<>(children);
    }

    public static <C> Node<C> action(Consumer<? super C> action) {
        return new Action<>(action);
    }

    public static <C> Node<C> condition(Predicate<? super C> predicate) {
        return new Condition<>(predicate);
    }

    public static <C> Node<C> statefulAction(Function<? super C, Status> action) {
        return new StatefulAction<>(action);
    }

    @SafeVarargs
    private static <N> List<N> collect(N first, N... rest) {
        List<N> all = new ArrayList<>(rest.length + 1);
        all.add(first);
        all.addAll(List.of(rest));
        return all;
    }
}
