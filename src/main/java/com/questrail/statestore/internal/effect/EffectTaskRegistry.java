package com.questrail.statestore.internal.effect;

import com.questrail.statestore.api.Effect;
import com.questrail.statestore.api.EffectTask;
import com.questrail.statestore.api.StoreClosedException;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.internal.dispatch.DispatchLoop;
import com.questrail.statestore.observability.EffectTaskEvent;
import com.questrail.statestore.observability.StoreErrorEvent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * EffectTaskRegistry
 * =============================================================================
 * Launches effects outside the per-dispatch pipeline and tracks them until
 * they settle.
 *
 * <h2>Lifecycle of a task</h2>
 * <ol>
 *   <li>{@link #launch} registers the task under the registry lock, snapshots
 *       the current state and hands the effect to the effect executor</li>
 *   <li>A follow-up action is submitted to the {@link DispatchLoop} with the
 *       task's claim as guard, so a cancellation that lands before the
 *       transition always wins</li>
 *   <li>When the task settles, for whatever reason, it leaves the tracked
 *       set before its completion future completes</li>
 * </ol>
 *
 * <h2>Bulk cancellation</h2>
 * {@link #cancelAll()} holds the same lock as {@link #launch}, so it cancels
 * exactly the tasks registered before it started.
 */
public final class EffectTaskRegistry<S, A>
{
    private final DispatchLoop<S, A> loop;
    private final Executor effectExecutor;
    private final StateStoreConfig config;

    private final Object lock = new Object();

    // Guarded by lock.
    private final Set<LaunchedEffectTask<A>> tasks = new LinkedHashSet<>();
    private long nextId = 1;
    private boolean closed;

    public EffectTaskRegistry(DispatchLoop<S, A> loop, Executor effectExecutor, StateStoreConfig config)
    {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.effectExecutor = Objects.requireNonNull(effectExecutor, "effectExecutor");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Starts {@code effect} for {@code action} with a snapshot of the current state.
     *
     * @throws StoreClosedException if the registry is closed or the store has failed
     */
    public EffectTask<A> launch(Effect<S, A> effect, A action)
    {
        Objects.requireNonNull(effect, "effect");
        Objects.requireNonNull(action, "action");

        LaunchedEffectTask<A> task;
        synchronized (lock) {
            if (closed || loop.isTerminated()) {
                throw new StoreClosedException("store '" + config.name() + "' is closed");
            }
            task = new LaunchedEffectTask<>(nextId++, action, this::retire);
            tasks.add(task);
        }
        emit(task, EffectTaskEvent.Kind.LAUNCHED);

        S snapshot = loop.currentState();
        try {
            effectExecutor.execute(() -> run(task, effect, snapshot));
        } catch (RejectedExecutionException e) {
            reportFailure(task, e);
            task.settle(EffectTask.Outcome.FAILED);
        }
        return task;
    }

    /**
     * Cancels every task tracked right now.
     *
     * @return how many tasks this call cancelled
     */
    public int cancelAll()
    {
        synchronized (lock) {
            List<LaunchedEffectTask<A>> snapshot = new ArrayList<>(tasks);
            int cancelled = 0;
            for (LaunchedEffectTask<A> task : snapshot) {
                if (task.cancel()) {
                    cancelled++;
                }
            }
            return cancelled;
        }
    }

    /**
     * Refuses further launches and cancels everything tracked.
     */
    public void close()
    {
        synchronized (lock) {
            closed = true;
            cancelAll();
        }
    }

    public int activeCount()
    {
        synchronized (lock) {
            return tasks.size();
        }
    }

    // ---------------------------------------------------------------------
    // Task execution
    // ---------------------------------------------------------------------

    private void run(LaunchedEffectTask<A> task, Effect<S, A> effect, S snapshot)
    {
        if (task.isCancelled()) {
            return;
        }

        CompletableFuture<Optional<A>> stage;
        try {
            CompletionStage<Optional<A>> returned = effect.run(task.action(), snapshot);
            stage = returned == null
                ? CompletableFuture.completedFuture(Optional.empty())
                : returned.toCompletableFuture();
        } catch (RuntimeException e) {
            reportFailure(task, e);
            task.settle(EffectTask.Outcome.FAILED);
            return;
        }

        task.attach(stage);
        stage.whenComplete((followUp, failure) -> onEffectComplete(task, followUp, failure));
    }

    private void onEffectComplete(LaunchedEffectTask<A> task, Optional<A> followUp, Throwable failure)
    {
        if (task.isCancelled()) {
            return;
        }

        if (failure != null) {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
            if (cause instanceof CancellationException) {
                // The effect gave up on its own.
                task.settle(EffectTask.Outcome.NO_ACTION);
                return;
            }
            reportFailure(task, cause);
            task.settle(EffectTask.Outcome.FAILED);
            return;
        }

        if (followUp == null || followUp.isEmpty()) {
            task.settle(EffectTask.Outcome.NO_ACTION);
            return;
        }

        if (!task.markFollowUpQueued()) {
            return;
        }

        loop.submit(followUp.get(), task::claimFollowUp).whenComplete((result, dispatchFailure) -> {
            if (dispatchFailure != null) {
                task.settle(EffectTask.Outcome.FAILED);
            } else if (result == DispatchLoop.Result.SETTLED) {
                task.settle(EffectTask.Outcome.DISPATCHED);
            }
            // SUPPRESSED: cancel() already completed the task.
        });
    }

    private void retire(LaunchedEffectTask<A> task, EffectTask.Outcome outcome)
    {
        synchronized (lock) {
            tasks.remove(task);
        }
        emit(task, EffectTaskEvent.Kind.valueOf(outcome.name()));
    }

    private void reportFailure(LaunchedEffectTask<A> task, Throwable cause)
    {
        config.observabilitySink().onError(new StoreErrorEvent(
            config.wallClock().now(),
            config.name(),
            StoreErrorEvent.Source.EFFECT_TASK,
            "effect task " + task.id() + " failed for action " + task.action(),
            cause
        ));
    }

    private void emit(LaunchedEffectTask<A> task, EffectTaskEvent.Kind kind)
    {
        config.observabilitySink().onEffectTaskEvent(new EffectTaskEvent(
            config.wallClock().now(),
            config.name(),
            task.id(),
            task.action(),
            kind
        ));
    }
}
