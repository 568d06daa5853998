package com.questrail.statestore.effect;

import com.questrail.statestore.api.Effect;
import com.questrail.statestore.time.Cancellable;
import com.questrail.statestore.time.MonotonicClock;
import com.questrail.statestore.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Effects
 * -----------------------------------------------------------------------------
 * Small combinators for building {@link Effect}s.
 *
 * <p>Everything here follows the effect contract: {@code run} returns
 * promptly, slow work happens inside the returned stage, and cancelling the
 * returned stage is passed on to whatever the combinator is waiting for.</p>
 */
public final class Effects
{
    private Effects() {
    }

    /**
     * An effect that never produces a follow-up.
     */
    public static <S, A> Effect<S, A> none()
    {
        return (action, state) -> CompletableFuture.completedFuture(Optional.empty());
    }

    /**
     * Wraps a fast, synchronous function.
     */
    public static <S, A> Effect<S, A> of(BiFunction<? super A, ? super S, Optional<A>> function)
    {
        Objects.requireNonNull(function, "function");
        return (action, state) -> CompletableFuture.completedFuture(function.apply(action, state));
    }

    /**
     * Runs a blocking function on {@code executor}. A function that throws
     * makes the stage complete exceptionally, which the store treats as
     * "no follow-up".
     */
    public static <S, A> Effect<S, A> async(BiFunction<? super A, ? super S, Optional<A>> function,
                                            Executor executor)
    {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(executor, "executor");
        return (action, state) -> CompletableFuture.supplyAsync(() -> function.apply(action, state), executor);
    }

    /**
     * Runs {@code effect} only for actions accepted by {@code filter}.
     */
    public static <S, A> Effect<S, A> when(Predicate<? super A> filter, Effect<S, A> effect)
    {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(effect, "effect");
        return (action, state) -> filter.test(action)
            ? effect.run(action, state)
            : CompletableFuture.completedFuture(Optional.empty());
    }

    /**
     * Runs {@code effect} after {@code delay}, measured on {@code clock}.
     *
     * <p>Cancelling the returned stage before the timer fires cancels the
     * timer, so the inner effect never runs. Typical uses are debounce and
     * simulated latency.</p>
     */
    public static <S, A> Effect<S, A> delayed(Duration delay,
                                              MonotonicScheduler scheduler,
                                              MonotonicClock clock,
                                              Effect<S, A> effect)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(effect, "effect");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return (action, state) -> {
            CompletableFuture<Optional<A>> result = new CompletableFuture<>();
            Cancellable timer = scheduler.scheduleAfter(delay, clock, () -> {
                if (!result.isDone()) {
                    relay(effect, action, state, result);
                }
            });
            result.whenComplete((value, failure) -> {
                if (result.isCancelled()) {
                    timer.cancel();
                }
            });
            return result;
        };
    }

    private static <S, A> void relay(Effect<S, A> effect, A action, S state, CompletableFuture<Optional<A>> target)
    {
        CompletionStage<Optional<A>> inner;
        try {
            inner = effect.run(action, state);
        } catch (RuntimeException e) {
            target.completeExceptionally(e);
            return;
        }
        if (inner == null) {
            target.complete(Optional.empty());
            return;
        }
        inner.whenComplete((value, failure) -> {
            if (failure != null) {
                target.completeExceptionally(failure);
            } else {
                target.complete(value);
            }
        });
    }
}
