package com.questrail.statestore.internal.broadcast;

import com.questrail.statestore.api.StateListener;
import com.questrail.statestore.api.StateSubscription;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.LongConsumer;

/**
 * MailboxSubscription
 * -----------------------------------------------------------------------------
 * Push delivery for one {@link StateListener} through a private mailbox.
 *
 * <h2>Delivery model</h2>
 * <ul>
 *   <li>The hub appends to the mailbox and returns immediately</li>
 *   <li>At most one drain task per subscription runs on the delivery
 *       executor at any time, so calls to the listener are serialized and
 *       ordered</li>
 *   <li>A listener failure is handed to the error callback and the drain
 *       moves on to the next state</li>
 * </ul>
 */
final class MailboxSubscription<S> implements StateSubscription, Subscriber<S>
{
    private static final Object END = new Object();

    private final long token;
    private final StateListener<S> listener;
    private final Executor executor;
    private final LongConsumer onCancel;
    private final BiConsumer<Long, Throwable> onListenerFailure;

    private final Queue<Object> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    private volatile boolean active = true;

    MailboxSubscription(long token,
                        StateListener<S> listener,
                        Executor executor,
                        LongConsumer onCancel,
                        BiConsumer<Long, Throwable> onListenerFailure)
    {
        this.token = token;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.onCancel = Objects.requireNonNull(onCancel, "onCancel");
        this.onListenerFailure = Objects.requireNonNull(onListenerFailure, "onListenerFailure");
    }

    @Override
    public long token() {
        return token;
    }

    @Override
    public void offer(S state) {
        if (active) {
            mailbox.add(state);
            schedule();
        }
    }

    @Override
    public void terminate() {
        if (active) {
            mailbox.add(END);
            schedule();
        }
    }

    @Override
    public void cancel() {
        if (!active) {
            return;
        }
        active = false;
        mailbox.clear();
        onCancel.accept(token);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            active = false;
            mailbox.clear();
            onListenerFailure.accept(token, e);
        }
    }

    @SuppressWarnings("unchecked")
    private void drain() {
        Object item;
        while (active && (item = mailbox.poll()) != null) {
            if (item == END) {
                active = false;
                notifyTerminated();
                break;
            }
            try {
                listener.onState((S) item);
            } catch (RuntimeException e) {
                onListenerFailure.accept(token, e);
            }
        }
        scheduled.set(false);

        // Items offered after the loop's last poll but before the flag reset.
        if (active && !mailbox.isEmpty()) {
            schedule();
        }
    }

    private void notifyTerminated() {
        mailbox.clear();
        try {
            listener.onTerminated();
        } catch (RuntimeException e) {
            onListenerFailure.accept(token, e);
        }
    }
}
