package com.questrail.statestore.internal.effect;

import com.questrail.statestore.api.EffectTask;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * LaunchedEffectTask
 * -----------------------------------------------------------------------------
 * {@link EffectTask} implementation driven by {@link EffectTaskRegistry}.
 *
 * <h2>Phases</h2>
 * <pre>
 *   RUNNING ──► FOLLOW_UP_QUEUED ──► FOLLOW_UP_APPLIED ──► SETTLED
 *      │               │
 *      └──► CANCELLED ◄┘
 *   RUNNING ──► SETTLED   (no action / failure)
 * </pre>
 * <p>{@link #cancel()} and {@link #claimFollowUp()} race on the same atomic
 * phase, so exactly one of "follow-up applied" and "cancelled" wins.</p>
 *
 * <p>{@code onSettled} runs once, before {@link #completion()} completes.</p>
 */
final class LaunchedEffectTask<A> implements EffectTask<A>
{
    enum Phase
    {
        RUNNING,
        FOLLOW_UP_QUEUED,
        FOLLOW_UP_APPLIED,
        CANCELLED,
        SETTLED
    }

    private final long id;
    private final A action;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.RUNNING);
    private final CompletableFuture<Outcome> completion = new CompletableFuture<>();
    private final BiConsumer<LaunchedEffectTask<A>, Outcome> onSettled;

    // Stage returned by the effect; set once the effect has been invoked.
    private volatile CompletableFuture<?> work;

    LaunchedEffectTask(long id, A action, BiConsumer<LaunchedEffectTask<A>, Outcome> onSettled)
    {
        this.id = id;
        this.action = action;
        this.onSettled = onSettled;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public A action() {
        return action;
    }

    @Override
    public boolean cancel() {
        while (true) {
            Phase current = phase.get();
            if (current != Phase.RUNNING && current != Phase.FOLLOW_UP_QUEUED) {
                return false;
            }
            if (phase.compareAndSet(current, Phase.CANCELLED)) {
                break;
            }
        }
        CompletableFuture<?> running = work;
        if (running != null) {
            running.cancel(true);
        }
        finish(Outcome.CANCELLED);
        return true;
    }

    @Override
    public boolean isCancelled() {
        return phase.get() == Phase.CANCELLED;
    }

    @Override
    public boolean isDone() {
        return completion.isDone();
    }

    @Override
    public CompletableFuture<Outcome> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "EffectTask[" + id + ", " + action + ", " + phase.get() + "]";
    }

    // ---------------------------------------------------------------------
    // Registry side
    // ---------------------------------------------------------------------

    /**
     * Records the effect's stage so cancellation can reach it. If the task was
     * cancelled while the effect was being invoked, the stage is cancelled now.
     */
    void attach(CompletableFuture<?> stage) {
        work = stage;
        if (isCancelled()) {
            stage.cancel(true);
        }
    }

    /**
     * The effect produced a follow-up and it is about to be queued.
     *
     * @return {@code false} if the task was cancelled first
     */
    boolean markFollowUpQueued() {
        return phase.compareAndSet(Phase.RUNNING, Phase.FOLLOW_UP_QUEUED);
    }

    /**
     * Dispatch guard, evaluated on the dispatch thread right before the
     * follow-up's transition.
     *
     * @return {@code true} if the follow-up may be applied
     */
    boolean claimFollowUp() {
        return phase.compareAndSet(Phase.FOLLOW_UP_QUEUED, Phase.FOLLOW_UP_APPLIED);
    }

    /**
     * Settles the task unless cancellation already did.
     */
    void settle(Outcome outcome) {
        Phase current = phase.get();
        while (current != Phase.CANCELLED && current != Phase.SETTLED) {
            if (phase.compareAndSet(current, Phase.SETTLED)) {
                finish(outcome);
                return;
            }
            current = phase.get();
        }
    }

    private void finish(Outcome outcome) {
        try {
            onSettled.accept(this, outcome);
        } finally {
            completion.complete(outcome);
        }
    }
}
