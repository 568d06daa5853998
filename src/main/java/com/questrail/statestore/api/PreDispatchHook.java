package com.questrail.statestore.api;

/**
 * Callback invoked on the dispatch thread immediately before an action's
 * transition is applied.
 *
 * <p>The usual job is superseding stale work: a new search query cancels the
 * effect tasks launched for the previous one. The hook finishes, including any
 * cancellation it performs, before the reducer sees the action. A hook that
 * throws fails the store the same way a reducer defect does.</p>
 *
 * @param <S> state type
 * @param <A> action type
 */
@FunctionalInterface
public interface PreDispatchHook<S, A>
{
    void beforeDispatch(A action, StateStore<S, A> store);
}
