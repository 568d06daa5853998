package com.questrail.statestore.internal.dispatch;

import com.questrail.statestore.api.Effect;
import com.questrail.statestore.api.Reducer;
import com.questrail.statestore.api.StoreClosedException;
import com.questrail.statestore.api.TransitionFailedException;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.observability.RecordingObservabilitySink;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DispatchLoopTest
 * -----------------------------------------------------------------------------
 * Exercises the loop directly with an integer state and string actions:
 * {@code "+"} adds one, {@code "-"} subtracts one, {@code "!"} throws.
 */
class DispatchLoopTest
{
    private static final Reducer<Integer, String> REDUCER = (state, action) -> {
        switch (action) {
            case "+":
                return state + 1;
            case "-":
                return state - 1;
            case "!":
                throw new IllegalArgumentException("unsupported action");
            default:
                return state;
        }
    };

    private DefaultEventExecutor executor;
    private RecordingObservabilitySink sink;
    private StateStoreConfig config;

    private final List<Integer> published = new CopyOnWriteArrayList<>();
    private final List<String> hooked = new CopyOnWriteArrayList<>();
    private final AtomicReference<TransitionFailedException> fatal = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        executor = new DefaultEventExecutor(new DefaultThreadFactory("loop-test", true));
        sink = new RecordingObservabilitySink();
        config = StateStoreConfig.builder()
            .withName("loop-test")
            .withObservabilitySink(sink)
            .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(2_000);
    }

    private DispatchLoop<Integer, String> loop(List<Effect<Integer, String>> effects) {
        return new DispatchLoop<>(executor, 0, REDUCER, effects, published::add, hooked::add, fatal::set, config);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void settledDispatchPublishesCommittedState() throws Exception {
        DispatchLoop<Integer, String> loop = loop(List.of());

        assertEquals(DispatchLoop.Result.SETTLED, await(loop.submit("+")));
        assertEquals(DispatchLoop.Result.SETTLED, await(loop.submit("+")));

        assertEquals(2, loop.currentState());
        assertEquals(List.of(1, 2), published);
        assertEquals(List.of("+", "+"), hooked);
        assertEquals(2, sink.getTransitions().size());
        assertEquals(2, sink.getTransitions().get(1).sequence());
    }

    @Test
    void vetoedGuardSuppressesWithoutTransition() throws Exception {
        DispatchLoop<Integer, String> loop = loop(List.of());

        assertEquals(DispatchLoop.Result.SUPPRESSED, await(loop.submit("+", () -> false)));

        assertEquals(0, loop.currentState());
        assertTrue(published.isEmpty());
        assertTrue(hooked.isEmpty(), "the hook only sees actions that will be reduced");
        assertTrue(sink.getTransitions().isEmpty());
    }

    @Test
    void guardIsEvaluatedOnTheLoopThreadWhenTheActionIsDequeued() throws Exception {
        CompletableFuture<Optional<String>> gate = new CompletableFuture<>();
        Effect<Integer, String> parkOnFirst = (action, state) ->
            state == 1 ? gate : CompletableFuture.completedFuture(Optional.empty());
        DispatchLoop<Integer, String> loop = loop(List.of(parkOnFirst));

        AtomicInteger guardCalls = new AtomicInteger();
        AtomicReference<Boolean> guardInLoop = new AtomicReference<>();
        CompletableFuture<DispatchLoop.Result> first = loop.submit("+");
        CompletableFuture<DispatchLoop.Result> second = loop.submit("+", () -> {
            guardCalls.incrementAndGet();
            guardInLoop.set(loop.inLoop());
            return true;
        });

        Thread.sleep(50);
        assertEquals(0, guardCalls.get(), "the guard waits for the active cycle");

        gate.complete(Optional.empty());
        assertEquals(DispatchLoop.Result.SETTLED, await(first));
        assertEquals(DispatchLoop.Result.SETTLED, await(second));
        assertEquals(1, guardCalls.get());
        assertTrue(guardInLoop.get());
        assertEquals(2, loop.currentState());
    }

    @Test
    void longFollowUpChainRunsIteratively() throws Exception {
        Effect<Integer, String> climb = (action, state) ->
            CompletableFuture.completedFuture(state < 10_000 ? Optional.of("+") : Optional.empty());
        DispatchLoop<Integer, String> loop = loop(List.of(climb));

        await(loop.submit("+"));

        assertEquals(10_000, loop.currentState());
        assertEquals(10_000, published.size());
    }

    @Test
    void reducerDefectFailsActiveAndPendingDispatches() throws Exception {
        CompletableFuture<Optional<String>> gate = new CompletableFuture<>();
        Effect<Integer, String> parkOnFirst = (action, state) ->
            state == 1 ? gate : CompletableFuture.completedFuture(Optional.empty());
        DispatchLoop<Integer, String> loop = loop(List.of(parkOnFirst));

        CompletableFuture<DispatchLoop.Result> active = loop.submit("+");
        CompletableFuture<DispatchLoop.Result> queued = loop.submit("+");
        Thread.sleep(20);

        gate.complete(Optional.of("!"));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> await(active));
        TransitionFailedException transitionFailure = assertInstanceOf(TransitionFailedException.class, failure.getCause());
        assertEquals("!", transitionFailure.action());

        ExecutionException rejected = assertThrows(ExecutionException.class, () -> await(queued));
        assertInstanceOf(StoreClosedException.class, rejected.getCause());

        assertTrue(loop.isTerminated());
        assertSame(transitionFailure, fatal.get());
        assertEquals(1, loop.currentState());

        ExecutionException late = assertThrows(ExecutionException.class, () -> await(loop.submit("+")));
        assertInstanceOf(StoreClosedException.class, late.getCause());
    }

    @Test
    void errorFromPublisherFailsTheLoopButLeavesItsThreadRunning() throws Exception {
        DispatchLoop<Integer, String> loop = new DispatchLoop<>(executor, 0, REDUCER, List.of(),
            state -> {
                throw new OutOfMemoryError("subscriber buffer");
            },
            hooked::add, fatal::set, config);

        CompletableFuture<DispatchLoop.Result> first = loop.submit("+");
        CompletableFuture<DispatchLoop.Result> queued = loop.submit("+");

        ExecutionException failure = assertThrows(ExecutionException.class, () -> await(first));
        assertInstanceOf(OutOfMemoryError.class, failure.getCause().getCause());
        ExecutionException rejected = assertThrows(ExecutionException.class, () -> await(queued));
        assertInstanceOf(StoreClosedException.class, rejected.getCause());
        assertTrue(loop.isTerminated());
        assertNotNull(fatal.get());

        assertEquals("alive", executor.submit(() -> "alive").get(5, TimeUnit.SECONDS));
        StoreClosedException reason = new StoreClosedException("closing");
        executor.submit(() -> loop.terminate(reason)).awaitUninterruptibly(1_000);
    }

    @Test
    void terminateFailsInFlightDispatch() throws Exception {
        CompletableFuture<Optional<String>> never = new CompletableFuture<>();
        DispatchLoop<Integer, String> loop = loop(List.of((action, state) -> never));

        CompletableFuture<DispatchLoop.Result> parked = loop.submit("+");
        Thread.sleep(20);

        StoreClosedException reason = new StoreClosedException("closing");
        executor.submit(() -> loop.terminate(reason)).awaitUninterruptibly(1_000);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> await(parked));
        assertSame(reason, failure.getCause());
        assertNull(fatal.get(), "a requested shutdown is not a transition failure");

        never.complete(Optional.of("+"));
        Thread.sleep(20);
        assertEquals(1, loop.currentState());
    }
}
