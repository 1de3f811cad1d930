package io.arbor.core.execution;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import io.arbor.core.event.TestEvents.Tick;
import io.arbor.core.tree.Status;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompositeTreeListenerTest {

    @Mock private TreeListener first;
    @Mock private TreeListener second;

    @Test
    void shouldFanOutEveryCallbackInRegistrationOrder() {
        // Given
        CompositeTreeListener composite = new CompositeTreeListener(first, second);
        Tick tick = new Tick();
        ExecutionResult result = new ExecutionResult.Succeeded(2);

        // When
        composite.onStart();
        composite.onTick(1, Status.RUNNING);
        composite.onEvent(2, tick, Status.SUCCESS);
        composite.onEventIgnored(tick);
        composite.onFinish(result);

        // Then
        InOrder order = inOrder(first, second);
        order.verify(first).onStart();
        order.verify(second).onStart();
        order.verify(first).onTick(1, Status.RUNNING);
        order.verify(second).onTick(1, Status.RUNNING);
        verify(first).onEvent(2, tick, Status.SUCCESS);
        verify(second).onEventIgnored(tick);
        order.verify(first).onFinish(result);
        order.verify(second).onFinish(result);
    }
}
