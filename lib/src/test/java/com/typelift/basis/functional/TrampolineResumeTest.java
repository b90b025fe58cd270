package com.typelift.basis.functional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.Function;
import java.util.function.Supplier;

import static com.typelift.basis.functional.Trampoline.now;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for single-step resumption of computation nodes.
 */
@ExtendWith(MockitoExtension.class)
class TrampolineResumeTest {

    @Mock
    private Function<Integer, Trampoline<Integer>> f;

    @Mock
    private Function<Integer, Trampoline<Integer>> g;

    @Mock
    private Function<Integer, Trampoline<Integer>> h;

    @Mock
    private Supplier<Trampoline<Integer>> thunk;

    private static Trampoline<Integer> increment(Integer x) {
        return now(x + 1);
    }

    @Test
    void doneResumesToItsValue() {
        Resumption<String> step = Trampoline.resume(new Node.Done<>("value"));

        Resumption.Finished<String> finished = assertInstanceOf(Resumption.Finished.class, step);
        assertEquals("value", finished.value());
    }

    @Test
    void suspendResumesWithoutInvokingThunk() {
        when(thunk.get()).thenReturn(now(5));

        Resumption<Integer> step = Trampoline.resume(Trampoline.later(thunk).node);

        Resumption.More<Integer> more = assertInstanceOf(Resumption.More.class, step);
        verifyNoInteractions(thunk);

        Node<Integer> next = more.next().get();
        verify(thunk, times(1)).get();
        assertEquals(new Node.Done<>(5), next);
    }

    @Test
    void bindOnDoneDefersContinuation() {
        when(f.apply(anyInt())).thenAnswer(inv -> increment(inv.getArgument(0)));

        Resumption<Integer> step = Trampoline.resume(now(1).bind(f).node);

        Resumption.More<Integer> more = assertInstanceOf(Resumption.More.class, step);
        verifyNoInteractions(f);

        assertEquals(new Node.Done<>(2), more.next().get());
        verify(f).apply(1);
    }

    @Test
    void bindOnSuspendForcesThunkOnNextStepAndRebinds() {
        when(thunk.get()).thenReturn(now(10));

        Resumption<Integer> step = Trampoline.resume(Trampoline.later(thunk).bind(f).node);

        Resumption.More<Integer> more = assertInstanceOf(Resumption.More.class, step);
        verifyNoInteractions(thunk, f);

        Node<Integer> next = more.next().get();
        verify(thunk).get();
        verifyNoInteractions(f);

        Node.Bind<?, Integer> rebound = assertInstanceOf(Node.Bind.class, next);
        assertEquals(new Node.Done<>(10), rebound.sub());
    }

    @Test
    void nestedBindsAreReassociatedWithoutInvokingContinuations() {
        when(f.apply(anyInt())).thenAnswer(inv -> increment(inv.getArgument(0)));

        Node<Integer> leftNested = now(0).bind(f).bind(g).bind(h).node;

        Resumption<Integer> step = Trampoline.resume(leftNested);

        // The whole left spine is flattened into a single step
        Resumption.More<Integer> more = assertInstanceOf(Resumption.More.class, step);
        verifyNoInteractions(f, g, h);

        // Forcing the step runs only the innermost continuation
        Node<Integer> next = more.next().get();
        verify(f).apply(0);
        verifyNoInteractions(g, h);

        Node.Bind<?, Integer> remaining = assertInstanceOf(Node.Bind.class, next);
        assertEquals(new Node.Done<>(1), remaining.sub());
    }

    @Test
    void drivingReassociatedChainRunsContinuationsInOrder() {
        when(f.apply(anyInt())).thenAnswer(inv -> increment(inv.getArgument(0)));
        when(g.apply(anyInt())).thenAnswer(inv -> now((Integer) inv.getArgument(0) * 10));
        when(h.apply(anyInt())).thenAnswer(inv -> increment(inv.getArgument(0)));

        Trampoline<Integer> trampoline = now(0).bind(f).bind(g).bind(h);

        assertEquals(11, trampoline.run());

        InOrder order = inOrder(f, g, h);
        order.verify(f).apply(0);
        order.verify(g).apply(1);
        order.verify(h).apply(10);
    }

    @Test
    void unknownNodeIsAnInvariantViolation() {
        TrampolineInvariantError error = assertThrows(TrampolineInvariantError.class,
            () -> Trampoline.resume(null));

        assertTrue(error.getMessage().contains("null"));
    }

    @Test
    void unknownSubNodeIsAnInvariantViolation() {
        Node<Integer> broken = new Node.Bind<Integer, Integer>(null, x -> new Node.Done<>(x));

        assertThrows(TrampolineInvariantError.class, () -> Trampoline.resume(broken));
    }

    @Test
    void unknownNodeDeepInLeftSpineIsAnInvariantViolation() {
        Node<Integer> malformed = new Node.Bind<Integer, Integer>(
            new Node.Bind<Integer, Integer>(null, Node.Done::new), Node.Done::new);

        assertThrows(TrampolineInvariantError.class, () -> Trampoline.resume(malformed));
    }
}
