package com.questrail.statestore.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StateStoreObservabilitySink that emits logs via SLF4J.
 *
 * <p>Transitions and lifecycle events go to DEBUG. Contained failures go to
 * WARN, the fatal transition defect to ERROR.</p>
 */
public final class Slf4jObservabilitySink implements StateStoreObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onTransition(StateTransitionEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (event.isStateChange()) {
            log.debug("[{}] #{} {}: {} -> {}",
                event.storeName(),
                event.sequence(),
                event.action(),
                event.previousState(),
                event.newState());
        } else {
            log.debug("[{}] #{} {}: state unchanged",
                event.storeName(),
                event.sequence(),
                event.action());
        }
    }

    @Override
    public void onEffectTaskEvent(EffectTaskEvent event) {
        log.debug("[{}] Effect task {} {} ({})",
            event.storeName(), event.taskId(), event.kind(), event.action());
    }

    @Override
    public void onSubscriberEvent(SubscriberEvent event) {
        log.debug("[{}] Subscriber {} {}, {} remaining",
            event.storeName(), event.token(), event.kind(), event.remaining());
    }

    @Override
    public void onError(StoreErrorEvent event) {
        if (event.isFatal()) {
            log.error("[{}] {}", event.storeName(), event.message(), event.cause());
        } else {
            log.warn("[{}] {} failure: {}", event.storeName(), event.source(), event.message(), event.cause());
        }
    }
}
