package com.questrail.statestore.internal.broadcast;

/**
 * Hub-side view of one registered subscriber.
 *
 * <p>{@link #offer} and {@link #terminate} are called with the hub lock held
 * and must not block.</p>
 */
interface Subscriber<S>
{
    long token();

    void offer(S state);

    /**
     * The store is going away; end the feed after anything already buffered.
     */
    void terminate();
}
