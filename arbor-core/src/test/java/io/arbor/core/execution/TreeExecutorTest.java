package io.arbor.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.arbor.core.ArborConfig;
import io.arbor.core.event.EventSources;
import io.arbor.core.event.TestEvents.Exit;
import io.arbor.core.event.TestEvents.Tick;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.reactive.ReactiveNodes;
import io.arbor.core.tree.Node;
import io.arbor.core.tree.Nodes;
import io.arbor.core.tree.ScriptedNode;
import io.arbor.core.tree.Status;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TreeExecutorTest {

    static final class Bot {
        int i;
        int v;
        String branch;
        final List<String> out = new ArrayList<>();
    }

    @Mock private TreeListener listener;

    @Nested
    class PollScenarios {

        @Test
        void shouldRunSequenceOfActionsToSuccess() {
            // Given
            Bot bot = new Bot();
            Node<Bot> tree =
                    Nodes.sequence(
                            Nodes.<Bot>action(b -> b.out.add("hello")),
                            Nodes.<Bot>action(b -> b.i += 1),
                            Nodes.<Bot>action(b -> b.i += 1));

            // When
            boolean succeeded = new TreeExecutor().run(tree, bot);

            // Then
            assertThat(succeeded).isTrue();
            assertThat(bot.i).isEqualTo(2);
            assertThat(bot.out).containsExactly("hello");
        }

        @Test
        void shouldTakeFallbackBranchWhenNoRangeMatches() {
            // Given
            Bot bot = new Bot();
            bot.v = 25;
            Node<Bot> tree =
                    Nodes.selector(
                            Nodes.sequence(
                                    Nodes.<Bot>condition(b -> b.v >= 0 && b.v < 5),
                                    Nodes.<Bot>action(b -> b.branch = "low")),
                            Nodes.sequence(
                                    Nodes.<Bot>condition(b -> b.v >= 5 && b.v < 25),
                                    Nodes.<Bot>action(b -> b.branch = "mid")),
                            Nodes.<Bot>action(b -> b.branch = "fallback"));

            // When
            ExecutionResult result = new TreeExecutor().execute(tree, bot);

            // Then
            assertThat(result).isEqualTo(new ExecutionResult.Succeeded(1));
            assertThat(bot.branch).isEqualTo("fallback");
        }

        @Test
        void shouldReportFailureFromRun() {
            Node<Object> tree = ScriptedNode.of(Status.RUNNING, Status.FAILURE);

            assertThat(new TreeExecutor().run(tree, null)).isFalse();
        }
    }

    @Nested
    class PollLimits {

        @Test
        void shouldReturnPendingAtTickLimit() {
            // Given
            ScriptedNode<Object> root = ScriptedNode.of(Status.RUNNING);
            TreeExecutor executor = new TreeExecutor(ArborConfig.builder().maxTicks(5).build());

            // When
            ExecutionResult result = executor.execute(root, null);

            // Then
            assertThat(result).isEqualTo(new ExecutionResult.Pending(5));
            assertThat(root.resets()).isZero();
        }

        @Test
        void shouldThrowFromRunWhenTreeDoesNotFinish() {
            TreeExecutor executor = new TreeExecutor(ArborConfig.builder().maxTicks(3).build());

            assertThatThrownBy(() -> executor.run(ScriptedNode.of(Status.RUNNING), null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("3");
        }

        @Test
        void shouldResetRootAfterCompletionByDefault() {
            // Given
            ScriptedNode<Object> root = ScriptedNode.of(Status.RUNNING, Status.SUCCESS);

            // When
            new TreeExecutor().execute(root, null);

            // Then
            assertThat(root.resets()).isEqualTo(1);
            assertThat(root.lastReset()).isEqualTo(Status.SUCCESS);
        }

        @Test
        void shouldLeaveRootAloneWhenResetOnCompletionIsDisabled() {
            // Given
            ScriptedNode<Object> root = ScriptedNode.of(Status.SUCCESS);
            TreeExecutor executor =
                    new TreeExecutor(ArborConfig.builder().resetOnCompletion(false).build());

            // When
            executor.execute(root, null);

            // Then
            assertThat(root.resets()).isZero();
        }

        @Test
        void shouldPropagateExceptionsFromLeaves() {
            Node<Object> root =
                    Nodes.action(
                            c -> {
                                throw new IllegalStateException("boom");
                            });

            assertThatThrownBy(() -> new TreeExecutor().execute(root, null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");
        }
    }

    @Nested
    class ReactiveRuns {

        private ReactiveNode<Bot> exitGatedTree() {
            return ReactiveNodes.sequence(
                    ReactiveNodes.<Bot>action(b -> b.i += 1),
                    ReactiveNodes.<Bot>action(b -> b.i += 1),
                    ReactiveNodes.<Bot>action(b -> b.out.add("bye")).waitFor(Exit.class));
        }

        @Test
        void shouldSucceedExactlyOnExitEvent() {
            // Given
            Bot bot = new Bot();
            ReactiveNode<Bot> tree = exitGatedTree();
            TreeExecutor executor = new TreeExecutor();

            // When
            ExecutionResult beforeExit =
                    executor.execute(
                            tree,
                            EventSources.of(new Tick(), new Tick(), new Tick(), new Tick(), new Tick()),
                            bot);
            ExecutionResult onExit = executor.execute(tree, EventSources.of(new Exit()), bot);

            // Then
            assertThat(beforeExit).isEqualTo(new ExecutionResult.Pending(5));
            assertThat(onExit).isEqualTo(new ExecutionResult.Succeeded(1));
            assertThat(bot.i).isEqualTo(2);
            assertThat(bot.out).containsExactly("bye");
        }

        @Test
        void shouldSucceedOnSixthEventInOneRun() {
            // Given
            Bot bot = new Bot();

            // When
            ExecutionResult result =
                    new TreeExecutor()
                            .execute(
                                    exitGatedTree(),
                                    EventSources.of(
                                            new Tick(), new Tick(), new Tick(), new Tick(), new Tick(),
                                            new Exit()),
                                    bot);

            // Then
            assertThat(result).isEqualTo(new ExecutionResult.Succeeded(6));
            assertThat(bot.i).isEqualTo(2);
        }

        @Test
        void shouldBePendingWhenSourceIsEmpty() {
            ExecutionResult result =
                    new TreeExecutor().execute(exitGatedTree(), List.of(), new Bot());

            assertThat(result).isEqualTo(new ExecutionResult.Pending(0));
        }

        @Test
        void shouldFinishFromUnitPump() {
            Bot bot = new Bot();
            ReactiveNode<Bot> tree = ReactiveNodes.<Bot>action(b -> b.i++).repeat(4);

            ExecutionResult result = new TreeExecutor().execute(tree, EventSources.unitPump(), bot);

            assertThat(result).isEqualTo(new ExecutionResult.Succeeded(4));
            assertThat(bot.i).isEqualTo(4);
        }

        @Test
        void shouldStopAtFirstEventRootIgnores() {
            // Given
            Bot bot = new Bot();
            ReactiveNode<Bot> root = ReactiveNodes.<Bot>action(b -> b.i++).waitFor(Exit.class);
            TreeExecutor executor = new TreeExecutor(new ArborConfig(), listener);

            // When
            ExecutionResult result =
                    executor.execute(root, EventSources.of(new Tick(), new Exit()), bot);

            // Then
            assertThat(result).isEqualTo(new ExecutionResult.Pending(0));
            assertThat(bot.i).isZero();
            verify(listener).onEventIgnored(any(Tick.class));
            verify(listener, never()).onEvent(anyLong(), any(), any());
        }

        @Test
        void shouldSkipIgnoredEventsWhenConfigured() {
            // Given
            Bot bot = new Bot();
            ReactiveNode<Bot> root = ReactiveNodes.<Bot>action(b -> b.i++).waitFor(Exit.class);
            TreeExecutor executor =
                    new TreeExecutor(ArborConfig.builder().stopOnUninterestedRoot(false).build());

            // When
            ExecutionResult result =
                    executor.execute(root, EventSources.of(new Tick(), new Tick(), new Exit()), bot);

            // Then
            assertThat(result).isEqualTo(new ExecutionResult.Succeeded(1));
            assertThat(bot.i).isEqualTo(1);
        }
    }

    @Nested
    class Listener {

        @Test
        void shouldNotifyListenerOfPollLifecycle() {
            // Given
            TreeExecutor executor = new TreeExecutor(new ArborConfig(), listener);

            // When
            executor.execute(ScriptedNode.of(Status.RUNNING, Status.FAILURE), null);

            // Then
            InOrder order = inOrder(listener);
            order.verify(listener).onStart();
            order.verify(listener).onTick(1, Status.RUNNING);
            order.verify(listener).onTick(2, Status.FAILURE);
            order.verify(listener).onFinish(new ExecutionResult.Failed(2));
        }

        @Test
        void shouldNotifyListenerOfReactiveEvents() {
            // Given
            TreeExecutor executor = new TreeExecutor(new ArborConfig(), listener);
            Tick tick = new Tick();

            // When
            executor.execute(ReactiveNodes.<Object>condition(c -> true), EventSources.of(tick), null);

            // Then
            InOrder order = inOrder(listener);
            order.verify(listener).onStart();
            order.verify(listener).onEvent(1, tick, Status.SUCCESS);
            order.verify(listener).onFinish(new ExecutionResult.Succeeded(1));
        }

        @Test
        void shouldRejectNullListener() {
            assertThatThrownBy(() -> new TreeExecutor(new ArborConfig(), null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("listener");
        }
    }
}
