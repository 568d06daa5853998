package com.questrail.statestore.api;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Effect
 * -----------------------------------------------------------------------------
 * Asynchronous reaction to an applied action.
 *
 * <p>Every registered effect is invoked after every transition, with the
 * action that was applied and the state produced by that transition. The
 * effect decides relevance itself and completes with {@link Optional#empty()}
 * when it has nothing to add.</p>
 *
 * <h2>Execution rules</h2>
 * <ul>
 *   <li>{@link #run} is called on the store's dispatch thread and must return
 *       promptly. Slow work belongs inside the returned stage.</li>
 *   <li>Failures are the effect's own business. Translate them into an
 *       error-carrying follow-up action or complete empty. A stage that
 *       completes exceptionally is reported and treated as empty.</li>
 *   <li>Effects never mutate state directly; follow-up actions are the only
 *       channel back into the store.</li>
 * </ul>
 *
 * @param <S> state type
 * @param <A> action type
 */
@FunctionalInterface
public interface Effect<S, A>
{
    /**
     * @param action the action that was just applied
     * @param state  the state after that action was applied
     * @return a stage completing with an optional follow-up action
     */
    CompletionStage<Optional<A>> run(A action, S state);
}
