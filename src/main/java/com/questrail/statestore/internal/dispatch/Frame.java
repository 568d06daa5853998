package com.questrail.statestore.internal.dispatch;

/**
 * One applied action whose effects are still being walked.
 */
final class Frame<S, A>
{
    private final A action;
    private final S state;
    private int nextEffect;

    Frame(A action, S state)
    {
        this.action = action;
        this.state = state;
    }

    A action() {
        return action;
    }

    /**
     * The state produced by this frame's transition.
     */
    S state() {
        return state;
    }

    boolean hasNextEffect(int effectCount) {
        return nextEffect < effectCount;
    }

    int takeEffectIndex() {
        return nextEffect++;
    }
}
