package com.questrail.statestore.api;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;

/**
 * StateFeed
 * -----------------------------------------------------------------------------
 * Pull-style, per-subscriber sequence of committed states.
 *
 * <h2>Sequence guarantees</h2>
 * <ul>
 *   <li>The first element is the state current when the feed was opened</li>
 *   <li>Every later committed state follows, in transition order, with no
 *       gaps and no duplicates</li>
 *   <li>The buffer is local to this feed and unbounded, so a slow reader never
 *       holds up the store or other subscribers</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * The feed is infinite until either {@link #close()} is called (buffered
 * states are discarded) or the store closes or fails (buffered states remain
 * readable, then {@link #hasNext()} returns {@code false}).
 *
 * <p>A feed is meant to be consumed by one thread at a time.</p>
 *
 * @param <S> state type
 */
public interface StateFeed<S> extends Iterator<S>, AutoCloseable
{
    /**
     * Blocks until a state is available or the feed has ended.
     *
     * @throws com.questrail.statestore.api.StateStoreException if interrupted
     *         while waiting (the interrupt flag is restored and the feed is closed)
     */
    @Override
    boolean hasNext();

    /**
     * Blocks until the next state is available.
     *
     * @throws java.util.NoSuchElementException if the feed has ended
     */
    @Override
    S next();

    /**
     * Waits up to {@code timeout} for the next state.
     *
     * @return the next state, or empty if none arrived in time or the feed ended
     * @throws InterruptedException if interrupted while waiting; the feed is
     *         closed before this propagates
     */
    Optional<S> poll(Duration timeout) throws InterruptedException;

    /**
     * @return {@code true} once the end of the feed has been observed by the reader
     */
    boolean isEnded();

    @Override
    void close();
}
