package com.questrail.statestore.internal.dispatch;

import com.questrail.statestore.api.Effect;
import com.questrail.statestore.api.Reducer;
import com.questrail.statestore.api.StoreClosedException;
import com.questrail.statestore.api.TransitionFailedException;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.observability.StateTransitionEvent;
import com.questrail.statestore.observability.StoreErrorEvent;

import io.netty.util.concurrent.EventExecutor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * DispatchLoop
 * =============================================================================
 * Serialized transition and effect pipeline for one store.
 *
 * <h2>Threading model</h2>
 * Everything below runs on a single Netty {@link EventExecutor} thread:
 * <ul>
 *   <li>the pending-dispatch queue</li>
 *   <li>the pre-dispatch hook, the reducer and every effect invocation</li>
 *   <li>the work stack of in-progress dispatch cycles</li>
 * </ul>
 * Only {@link #currentState()} and {@link #isTerminated()} are read from
 * other threads, through volatile fields.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   submit → pending queue → hook → reducer → publish → effects (stack) → settle
 * </pre>
 * <p>One top-level dispatch is active at a time. Its effects are walked with
 * an explicit stack of {@link Frame}s: a follow-up action pushes a new frame,
 * so its own effects finish before the parent frame moves to its next effect.
 * This keeps the depth-first ordering without growing the Java call stack.</p>
 *
 * <p>When an effect's stage is still running, the loop parks: the stage's
 * completion resumes it on the loop thread. New submissions wait in the
 * pending queue until the active cycle settles.</p>
 *
 * <h2>Failure</h2>
 * A reducer or hook exception terminates the loop for good. The active
 * dispatch fails with {@link TransitionFailedException} and everything pending
 * fails with {@link StoreClosedException}, after {@code onFatal} has run.
 */
public final class DispatchLoop<S, A>
{
    /**
     * How a submitted dispatch ended.
     */
    public enum Result
    {
        /** The cycle ran and settled. */
        SETTLED,
        /** The guard vetoed the action before its transition; nothing changed. */
        SUPPRESSED
    }

    private static final BooleanSupplier ALWAYS = () -> true;

    private final EventExecutor executor;
    private final Reducer<S, A> reducer;
    private final List<Effect<S, A>> effects;
    private final Consumer<S> publisher;
    private final Consumer<A> preDispatch;
    private final Consumer<TransitionFailedException> onFatal;
    private final StateStoreConfig config;

    // Loop-thread state.
    private final Deque<PendingDispatch<A>> pending = new ArrayDeque<>();
    private final Deque<Frame<S, A>> stack = new ArrayDeque<>();
    private PendingDispatch<A> active;
    private long sequence;

    private volatile S state;
    private volatile boolean terminated;

    public DispatchLoop(EventExecutor executor,
                        S initialState,
                        Reducer<S, A> reducer,
                        List<Effect<S, A>> effects,
                        Consumer<S> publisher,
                        Consumer<A> preDispatch,
                        Consumer<TransitionFailedException> onFatal,
                        StateStoreConfig config)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.effects = List.copyOf(effects);
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.preDispatch = Objects.requireNonNull(preDispatch, "preDispatch");
        this.onFatal = Objects.requireNonNull(onFatal, "onFatal");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Queues an unconditional dispatch.
     */
    public CompletableFuture<Result> submit(A action)
    {
        return submit(action, ALWAYS);
    }

    /**
     * Queues a dispatch that is dropped if {@code guard} answers {@code false}
     * when the action reaches the head of the queue. The guard runs on the
     * loop thread, immediately before the hook and the reducer.
     */
    public CompletableFuture<Result> submit(A action, BooleanSupplier guard)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(guard, "guard");

        CompletableFuture<Result> settled = new CompletableFuture<>();
        if (terminated) {
            settled.completeExceptionally(closed());
            return settled;
        }
        try {
            executor.execute(() -> enqueue(new PendingDispatch<>(action, guard, settled)));
        } catch (RejectedExecutionException e) {
            settled.completeExceptionally(new StoreClosedException("store '" + config.name() + "' is closed", e));
        }
        return settled;
    }

    public S currentState()
    {
        return state;
    }

    public boolean isTerminated()
    {
        return terminated;
    }

    public boolean inLoop()
    {
        return executor.inEventLoop();
    }

    /**
     * Stops the loop: the active and all pending dispatches fail with
     * {@code reason}. Must run on the loop thread, or after that thread has
     * stopped for good.
     */
    public void terminate(StoreClosedException reason)
    {
        if (terminated) {
            return;
        }
        terminated = true;
        stack.clear();
        PendingDispatch<A> interrupted = active;
        active = null;
        if (interrupted != null) {
            interrupted.settled().completeExceptionally(reason);
        }
        failPending(reason);
    }

    // ---------------------------------------------------------------------
    // Loop thread
    // ---------------------------------------------------------------------

    private void enqueue(PendingDispatch<A> dispatch)
    {
        if (terminated) {
            dispatch.settled().completeExceptionally(closed());
            return;
        }
        pending.addLast(dispatch);
        if (active == null) {
            guarded(this::pump);
        }
    }

    /**
     * Runs dispatch cycles until the queue is empty or an effect stage parks
     * the loop.
     */
    private void pump()
    {
        while (!terminated) {
            if (active == null) {
                PendingDispatch<A> next = pending.pollFirst();
                if (next == null) {
                    return;
                }
                if (!next.guard().getAsBoolean()) {
                    next.settled().complete(Result.SUPPRESSED);
                    continue;
                }
                active = next;
                if (!apply(next.action())) {
                    return;
                }
            }
            if (!advance()) {
                return;
            }
            PendingDispatch<A> done = active;
            active = null;
            done.settled().complete(Result.SETTLED);
        }
    }

    /**
     * Walks the effect stack of the active cycle.
     *
     * @return {@code true} when the cycle is complete; {@code false} if the
     *         loop parked on a running stage or terminated
     */
    private boolean advance()
    {
        while (!stack.isEmpty()) {
            Frame<S, A> frame = stack.peek();
            if (!frame.hasNextEffect(effects.size())) {
                stack.pop();
                continue;
            }
            Effect<S, A> effect = effects.get(frame.takeEffectIndex());
            CompletableFuture<Optional<A>> outcome = invoke(effect, frame);

            if (!outcome.isDone()) {
                outcome.whenCompleteAsync((value, failure) -> resume(frame, outcome), executor);
                return false;
            }
            if (!applyFollowUp(frame, outcome)) {
                return false;
            }
        }
        // An effect may have closed the store from this thread.
        return !terminated;
    }

    private void resume(Frame<S, A> frame, CompletableFuture<Optional<A>> outcome)
    {
        if (terminated) {
            return;
        }
        guarded(() -> {
            if (applyFollowUp(frame, outcome)) {
                pump();
            }
        });
    }

    /**
     * Anything thrown past the reducer (a publisher or sink) fails the loop
     * the same way a transition defect does. Nothing leaves the loop thread.
     */
    private void guarded(Runnable body)
    {
        try {
            body.run();
        } catch (Throwable t) {
            if (!terminated) {
                PendingDispatch<A> current = active;
                fail(new TransitionFailedException(current != null ? current.action() : null, t));
            }
        }
    }

    private CompletableFuture<Optional<A>> invoke(Effect<S, A> effect, Frame<S, A> frame)
    {
        try {
            CompletionStage<Optional<A>> stage = effect.run(frame.action(), frame.state());
            if (stage == null) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return stage.toCompletableFuture();
        } catch (Throwable e) {
            reportEffectFailure(frame.action(), e);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * @return {@code false} only if applying the follow-up failed the loop
     */
    private boolean applyFollowUp(Frame<S, A> frame, CompletableFuture<Optional<A>> outcome)
    {
        Optional<A> followUp;
        try {
            followUp = outcome.join();
        } catch (CancellationException e) {
            followUp = Optional.empty();
        } catch (CompletionException e) {
            reportEffectFailure(frame.action(), e.getCause() != null ? e.getCause() : e);
            followUp = Optional.empty();
        }
        if (followUp == null || followUp.isEmpty()) {
            return true;
        }
        if (terminated) {
            // The effect closed the store from this thread.
            return false;
        }
        return apply(followUp.get());
    }

    /**
     * Hook, reducer, publish, and a new frame for the action's effects.
     *
     * @return {@code false} if the transition failed and the loop terminated
     */
    private boolean apply(A action)
    {
        S previous = state;
        S next;
        try {
            preDispatch.accept(action);
            if (terminated) {
                // The hook closed the store.
                return false;
            }
            next = Objects.requireNonNull(reducer.reduce(previous, action), "reducer returned null");
        } catch (Throwable e) {
            fail(new TransitionFailedException(action, e));
            return false;
        }

        state = next;
        sequence++;
        config.observabilitySink().onTransition(new StateTransitionEvent(
            config.wallClock().now(),
            config.name(),
            sequence,
            action,
            previous,
            next
        ));
        publisher.accept(next);
        stack.push(new Frame<>(action, next));
        return true;
    }

    private void fail(TransitionFailedException failure)
    {
        terminated = true;
        stack.clear();

        config.observabilitySink().onError(new StoreErrorEvent(
            config.wallClock().now(),
            config.name(),
            StoreErrorEvent.Source.TRANSITION,
            failure.getMessage(),
            failure.getCause()
        ));

        // Callers woken by the failed futures must find the store already torn down.
        onFatal.accept(failure);

        PendingDispatch<A> failed = active;
        active = null;
        if (failed != null) {
            failed.settled().completeExceptionally(failure);
        }
        failPending(new StoreClosedException("store '" + config.name() + "' failed", failure));
    }

    private void failPending(StoreClosedException reason)
    {
        PendingDispatch<A> dispatch;
        while ((dispatch = pending.pollFirst()) != null) {
            dispatch.settled().completeExceptionally(reason);
        }
    }

    private void reportEffectFailure(A action, Throwable cause)
    {
        config.observabilitySink().onError(new StoreErrorEvent(
            config.wallClock().now(),
            config.name(),
            StoreErrorEvent.Source.EFFECT,
            "effect failed for action " + action,
            cause
        ));
    }

    private StoreClosedException closed()
    {
        return new StoreClosedException("store '" + config.name() + "' is closed");
    }

    private record PendingDispatch<A>(A action, BooleanSupplier guard, CompletableFuture<Result> settled) {}
}
