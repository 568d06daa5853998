package com.questrail.statestore.internal.broadcast;

import com.questrail.statestore.api.StateFeed;
import com.questrail.statestore.api.StateListener;
import com.questrail.statestore.api.StateSubscription;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.observability.StoreErrorEvent;
import com.questrail.statestore.observability.SubscriberEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * StateBroadcastHub
 * =============================================================================
 * Multicast of committed states with late-join replay of the current value.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Registration seeds the new subscriber with the latest state under the
 *       same lock that {@link #publish} takes. A subscriber therefore sees
 *       exactly the current state first, then every later one, with no gaps
 *       and no duplicates.</li>
 *   <li>{@link #publish} only appends to subscriber-local buffers. It never
 *       waits on a subscriber.</li>
 *   <li>Subscribers are referenced only by token; removing the token releases
 *       the subscriber's buffer.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #publish} is called from the dispatch thread. Subscribe and
 * unsubscribe may come from any thread.
 */
public final class StateBroadcastHub<S>
{
    private final StateStoreConfig config;
    private final Executor deliveryExecutor;

    private final Object lock = new Object();
    private final Map<Long, Subscriber<S>> subscribers = new LinkedHashMap<>();

    // Guarded by lock.
    private S latest;
    private long nextToken = 1;
    private boolean terminated;

    public StateBroadcastHub(S initialState, StateStoreConfig config, Executor deliveryExecutor)
    {
        this.latest = Objects.requireNonNull(initialState, "initialState");
        this.config = Objects.requireNonNull(config, "config");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }

    /**
     * Publishes a newly committed state to every live subscriber.
     */
    public void publish(S state)
    {
        Objects.requireNonNull(state, "state");
        synchronized (lock) {
            if (terminated) {
                return;
            }
            latest = state;
            for (Subscriber<S> subscriber : subscribers.values()) {
                subscriber.offer(state);
            }
        }
    }

    /**
     * Opens a pull feed seeded with the latest state. After termination the
     * feed yields the final state once and then ends.
     */
    public StateFeed<S> openFeed()
    {
        QueueStateFeed<S> feed;
        synchronized (lock) {
            feed = new QueueStateFeed<>(nextToken++, this::remove);
            register(feed);
        }
        return feed;
    }

    /**
     * Registers a push listener seeded with the latest state.
     */
    public StateSubscription addListener(StateListener<S> listener)
    {
        Objects.requireNonNull(listener, "listener");
        MailboxSubscription<S> subscription;
        synchronized (lock) {
            subscription = new MailboxSubscription<>(
                nextToken++,
                listener,
                deliveryExecutor,
                this::remove,
                this::reportListenerFailure);
            register(subscription);
        }
        return subscription;
    }

    /**
     * Ends every feed and refuses further publishing. Later subscribers get
     * the final state and an immediately ended feed.
     */
    public void terminate()
    {
        List<Subscriber<S>> ended;
        synchronized (lock) {
            if (terminated) {
                return;
            }
            terminated = true;
            ended = new ArrayList<>(subscribers.values());
            for (Subscriber<S> subscriber : ended) {
                subscriber.terminate();
            }
            subscribers.clear();
        }
        for (Subscriber<S> subscriber : ended) {
            emit(subscriber.token(), SubscriberEvent.Kind.TERMINATED, 0);
        }
    }

    public int subscriberCount()
    {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public boolean isTerminated()
    {
        synchronized (lock) {
            return terminated;
        }
    }

    // Caller holds lock.
    private void register(Subscriber<S> subscriber)
    {
        subscriber.offer(latest);
        if (terminated) {
            subscriber.terminate();
            return;
        }
        subscribers.put(subscriber.token(), subscriber);
        emit(subscriber.token(), SubscriberEvent.Kind.SUBSCRIBED, subscribers.size());
    }

    private void remove(long token)
    {
        int remaining;
        synchronized (lock) {
            if (subscribers.remove(token) == null) {
                return;
            }
            remaining = subscribers.size();
        }
        emit(token, SubscriberEvent.Kind.UNSUBSCRIBED, remaining);
    }

    private void reportListenerFailure(Long token, Throwable cause)
    {
        config.observabilitySink().onError(new StoreErrorEvent(
            config.wallClock().now(),
            config.name(),
            StoreErrorEvent.Source.SUBSCRIBER,
            "listener " + token + " failed",
            cause
        ));
    }

    private void emit(long token, SubscriberEvent.Kind kind, int remaining)
    {
        config.observabilitySink().onSubscriberEvent(new SubscriberEvent(
            config.wallClock().now(),
            config.name(),
            token,
            kind,
            remaining
        ));
    }
}
