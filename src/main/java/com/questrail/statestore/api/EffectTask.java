package com.questrail.statestore.api;

import com.questrail.statestore.time.Cancellable;

import java.util.concurrent.CompletableFuture;

/**
 * EffectTask
 * =============================================================================
 * Handle to an effect launched outside the automatic per-dispatch pipeline.
 *
 * <h2>Cancellation model</h2>
 * Cancellation is cooperative. {@link #cancel()} cancels the stage the effect
 * returned (the effect may observe this and stop early) and, regardless of
 * what the effect does afterwards, guarantees that its follow-up action is
 * never applied. The check happens on the dispatch thread right before the
 * follow-up's transition, so even a follow-up that is already queued is
 * dropped.
 *
 * <p>Once a follow-up has been applied the task can no longer be cancelled;
 * {@link #cancel()} then returns {@code false}.</p>
 *
 * @param <A> action type
 */
public interface EffectTask<A> extends Cancellable
{
    /**
     * How a task settled.
     */
    enum Outcome
    {
        /** The follow-up action was applied and its dispatch cycle settled. */
        DISPATCHED,
        /** The effect completed without a follow-up action. */
        NO_ACTION,
        /** The task was cancelled before any follow-up was applied. */
        CANCELLED,
        /** The effect failed, or its follow-up could not be dispatched. */
        FAILED
    }

    /**
     * Store-unique, increasing task id.
     */
    long id();

    /**
     * The action the effect was launched with.
     */
    A action();

    /**
     * Cancels the task.
     *
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         had already settled, was already cancelled, or its follow-up was
     *         already applied
     */
    @Override
    boolean cancel();

    boolean isCancelled();

    boolean isDone();

    /**
     * @return a future completing with the outcome once the task has fully settled
     */
    CompletableFuture<Outcome> completion();
}
