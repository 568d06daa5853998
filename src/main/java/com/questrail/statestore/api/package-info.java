/**
 * State Store Public API
 * =============================================================================
 *
 * The types host code programs against: {@link com.questrail.statestore.api.StateStore},
 * the consumer-supplied {@link com.questrail.statestore.api.Reducer} and
 * {@link com.questrail.statestore.api.Effect}, and the subscriber and task
 * handles the store gives back.
 *
 * <h2>Data flow</h2>
 * <pre>
 *   dispatch(action)
 *        → PreDispatchHook
 *        → Reducer
 *        → publish to every StateFeed / StateListener
 *        → Effect 1 … Effect n (each awaited, follow-ups depth-first)
 * </pre>
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>The store owns the state; consumers only ever see snapshots</li>
 *   <li>The store owns tracked effect tasks and subscriber buffers</li>
 *   <li>Consumers own their reducer, effects, and listeners</li>
 * </ul>
 */
package com.questrail.statestore.api;
