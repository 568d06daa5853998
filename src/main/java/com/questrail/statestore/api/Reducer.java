package com.questrail.statestore.api;

/**
 * Reducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function from a prior state and a single
 * action to the next state.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>No I/O, no timers, no side effects</li>
 *   <li>Must not return {@code null}</li>
 *   <li>Never invoked concurrently with itself by a {@link StateStore}</li>
 * </ul>
 *
 * <p>A reducer that throws is treated as a programming defect. The store that
 * owns it fails permanently; see {@link TransitionFailedException}.</p>
 *
 * @param <S> state type
 * @param <A> action type
 */
@FunctionalInterface
public interface Reducer<S, A>
{
    /**
     * Computes the next state.
     *
     * @param state  the latest committed state (never {@code null})
     * @param action the action being applied (never {@code null})
     * @return the next state; returning {@code state} itself means "no change"
     */
    S reduce(S state, A action);
}
