package com.questrail.statestore.internal.broadcast;

import com.questrail.statestore.api.StateFeed;
import com.questrail.statestore.api.StateStoreException;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * QueueStateFeed
 * -----------------------------------------------------------------------------
 * {@link StateFeed} backed by an unbounded, subscriber-local blocking queue.
 *
 * <p>The writer side (hub) only ever appends; the reader side owns the
 * look-ahead slot and the end-of-feed flag, so a single reader thread needs no
 * further locking.</p>
 */
final class QueueStateFeed<S> implements StateFeed<S>, Subscriber<S>
{
    private static final Object END = new Object();

    private final long token;
    private final LongConsumer onClose;
    private final LinkedBlockingQueue<Object> buffer = new LinkedBlockingQueue<>();

    private volatile boolean closed;

    // Reader-side state.
    private Object lookahead;
    private boolean ended;

    QueueStateFeed(long token, LongConsumer onClose)
    {
        this.token = token;
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    @Override
    public long token() {
        return token;
    }

    @Override
    public void offer(S state) {
        if (!closed) {
            buffer.add(state);
        }
    }

    @Override
    public void terminate() {
        buffer.add(END);
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        try {
            return accept(buffer.take());
        } catch (InterruptedException e) {
            // An interrupted reader is gone; stop buffering for it.
            close();
            Thread.currentThread().interrupt();
            throw new StateStoreException("interrupted while waiting for the next state", e);
        }
    }

    @Override
    public S next() {
        if (!hasNext()) {
            throw new NoSuchElementException("state feed " + token + " has ended");
        }
        return takeLookahead();
    }

    @Override
    public Optional<S> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (lookahead != null) {
            return Optional.of(takeLookahead());
        }
        if (ended) {
            return Optional.empty();
        }
        Object item;
        try {
            item = buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            close();
            throw e;
        }
        if (item == null || !accept(item)) {
            return Optional.empty();
        }
        return Optional.of(takeLookahead());
    }

    @Override
    public boolean isEnded() {
        return ended;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.accept(token);
        buffer.clear();
        buffer.add(END);
        lookahead = null;
    }

    private boolean accept(Object item) {
        if (item == END) {
            ended = true;
            return false;
        }
        lookahead = item;
        return true;
    }

    @SuppressWarnings("unchecked")
    private S takeLookahead() {
        S value = (S) lookahead;
        lookahead = null;
        return value;
    }
}
