package com.questrail.statestore.api;

import java.util.concurrent.CompletableFuture;

/**
 * StateStore
 * =============================================================================
 * Single source of truth for one state value that changes only through a
 * {@link Reducer}, with {@link Effect}s reacting to each transition and a live
 * multicast feed of every committed state.
 *
 * <h2>Dispatch cycle</h2>
 * <pre>
 *   dispatch(a) → hook(a) → reduce(a) → publish → E1(a) … En(a)
 * </pre>
 * <p>Effects run in registration order and each one is awaited. A follow-up
 * action returned by an effect goes through the whole cycle, depth-first,
 * before the next sibling effect runs. With effects {@code [E1, E2]} and
 * {@code E1(A) → B} the trace is:</p>
 * <pre>
 *   reduce(A), E1(A), reduce(B), E1(B), E2(B), E2(A)
 * </pre>
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>All transitions form a single total order. Concurrent dispatches are
 *       queued in arrival order; each starts only after the previous one's
 *       cycle, follow-ups included, has settled.</li>
 *   <li>Every subscriber observes states in that order.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * A store is open until {@link #close()} or until a reducer defect fails it.
 * Either way, later dispatches fail with {@link StoreClosedException}, effect
 * tasks are cancelled and feeds end.
 *
 * @param <S> state type
 * @param <A> action type
 */
public interface StateStore<S, A> extends AutoCloseable
{
    /**
     * Queues an action for the full dispatch cycle.
     *
     * @param action the action to apply (must not be {@code null})
     * @return a future completing when the cycle, including every follow-up it
     *         triggered, has settled; completes exceptionally with
     *         {@link TransitionFailedException} on a reducer defect or
     *         {@link StoreClosedException} if the store is not open
     */
    CompletableFuture<Void> dispatch(A action);

    /**
     * Dispatches and blocks until the cycle settles.
     *
     * @throws IllegalStateException if called from the store's dispatch thread
     * @throws StateStoreException   if the dispatch failed, or if interrupted
     */
    void dispatchAndWait(A action);

    /**
     * @return the latest committed state; safe from any thread
     */
    S currentState();

    /**
     * Opens a pull-style feed starting from the current state.
     */
    StateFeed<S> subscribe();

    /**
     * Registers a push-style listener starting from the current state.
     */
    StateSubscription subscribe(StateListener<S> listener);

    /**
     * Launches an independently cancellable effect with a snapshot of the
     * current state. Its follow-up, if any, is dispatched like any other
     * action unless the task is cancelled first.
     *
     * @throws StoreClosedException if the store is not open
     */
    EffectTask<A> launchEffect(Effect<S, A> effect, A action);

    /**
     * Cancels every effect task tracked at the moment of the call. Tasks
     * launched afterwards are unaffected.
     *
     * @return the number of tasks this call cancelled
     */
    int cancelAllEffectTasks();

    /**
     * Installs (or clears, with {@code null}) the hook invoked before every
     * transition.
     */
    void setPreDispatchHook(PreDispatchHook<S, A> hook);

    /**
     * @return {@code true} once the store has been closed or has failed
     */
    boolean isClosed();

    /**
     * Closes the store. Idempotent.
     */
    @Override
    void close();
}
