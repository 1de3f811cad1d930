package io.arbor.core.tree.composite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.execution.ExecutionResult;
import io.arbor.core.execution.TreeExecutor;
import io.arbor.core.tree.Node;
import io.arbor.core.tree.ScriptedNode;
import io.arbor.core.tree.Status;
import io.arbor.core.tree.decorator.Invert;
import java.util.List;
import org.junit.jupiter.api.Test;

class SelectorTest {

    private static Node<Object> scripted(int running, Status outcome) {
        return ScriptedNode.finishingAfter(running, outcome);
    }

    @Test
    void shouldRejectEmptyChildList() {
        assertThatThrownBy(() -> new Selector<Object>(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SELECTOR");
    }

    @Test
    void shouldSucceedOnFirstSuccessfulChild() {
        // Given
        ScriptedNode<Object> a = ScriptedNode.of(Status.FAILURE);
        ScriptedNode<Object> b = ScriptedNode.of(Status.SUCCESS);
        ScriptedNode<Object> c = ScriptedNode.of(Status.SUCCESS);
        Selector<Object> selector = new Selector<>(List.of(a, b, c));

        // When
        Status status = selector.step(null);

        // Then
        assertThat(status).isEqualTo(Status.SUCCESS);
        assertThat(c.steps()).isZero();
        assertThat(a.lastReset()).isEqualTo(Status.FAILURE);
        assertThat(b.lastReset()).isEqualTo(Status.SUCCESS);
    }

    @Test
    void shouldFailWhenEveryChildFails() {
        // Given
        ScriptedNode<Object> a = ScriptedNode.of(Status.FAILURE);
        ScriptedNode<Object> b = ScriptedNode.of(Status.FAILURE);
        Selector<Object> selector = new Selector<>(List.of(a, b));

        // When
        Status status = selector.step(null);

        // Then
        assertThat(status).isEqualTo(Status.FAILURE);
        assertThat(List.of(a.steps(), b.steps())).containsExactly(1, 1);
        assertThat(List.of(a.resets(), b.resets())).containsExactly(1, 1);
    }

    @Test
    void shouldResumeFromRunningChild() {
        // Given
        ScriptedNode<Object> a = ScriptedNode.of(Status.FAILURE);
        ScriptedNode<Object> b = ScriptedNode.finishingAfter(1, Status.SUCCESS);
        Selector<Object> selector = new Selector<>(List.of(a, b));

        // When
        Status first = selector.step(null);
        Status second = selector.step(null);

        // Then
        assertThat(first).isEqualTo(Status.RUNNING);
        assertThat(second).isEqualTo(Status.SUCCESS);
        assertThat(a.steps()).isEqualTo(1);
    }

    @Test
    void shouldBeDualOfSequenceUnderInversion() {
        TreeExecutor executor = new TreeExecutor();
        Status[] outcomes = {Status.SUCCESS, Status.FAILURE};

        for (int runningA = 0; runningA <= 2; runningA++) {
            for (Status outcomeA : outcomes) {
                for (int runningB = 0; runningB <= 1; runningB++) {
                    for (Status outcomeB : outcomes) {
                        // Given
                        Node<Object> selector =
                                new Selector<>(
                                        List.of(
                                                scripted(runningA, outcomeA),
                                                scripted(runningB, outcomeB)));
                        Node<Object> dual =
                                new Invert<>(
                                        new Sequence<>(
                                                List.of(
                                                        new Invert<>(scripted(runningA, outcomeA)),
                                                        new Invert<>(scripted(runningB, outcomeB)))));

                        // When
                        ExecutionResult expected = executor.execute(selector, null);
                        ExecutionResult actual = executor.execute(dual, null);

                        // Then
                        assertThat(actual.status())
                                .as("A=%dxRUNNING+%s, B=%dxRUNNING+%s", runningA, outcomeA, runningB, outcomeB)
                                .isEqualTo(expected.status());
                        assertThat(actual.ticks()).isEqualTo(expected.ticks());
                    }
                }
            }
        }
    }
}
