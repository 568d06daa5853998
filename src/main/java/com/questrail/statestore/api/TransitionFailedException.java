package com.questrail.statestore.api;

/**
 * A reducer or pre-dispatch hook threw while an action was being applied.
 *
 * <p>This is a programming defect, not a recoverable condition. The store that
 * raised it is failed for good: the dispatch that hit the defect completes
 * with this exception, everything queued behind it completes with a
 * {@link StoreClosedException}, and subscriber feeds end.</p>
 */
public class TransitionFailedException extends StateStoreException
{
    private final transient Object action;

    public TransitionFailedException(Object action, Throwable cause) {
        super("transition failed for action " + action, cause);
        this.action = action;
    }

    /**
     * The action whose transition failed.
     */
    public Object action() {
        return action;
    }
}
