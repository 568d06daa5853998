package com.questrail.statestore.config;

import com.questrail.statestore.observability.NullObservabilitySink;
import com.questrail.statestore.observability.StateStoreObservabilitySink;
import com.questrail.statestore.time.SystemWallClock;
import com.questrail.statestore.time.WallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Configuration for a state store.
 *
 * @param name             store name, used in thread names and log lines
 * @param observabilitySink receiver of transitions, lifecycle events and errors
 * @param effectExecutor   runs launched effect tasks; {@code null} means the
 *                         store creates (and owns) a cached thread pool
 * @param deliveryExecutor delivers states to push listeners; {@code null} means
 *                         the store creates (and owns) a cached thread pool
 * @param wallClock        timestamps observability events
 * @param shutdownTimeout  upper bound for waiting on owned executors in {@code close()}
 */
public record StateStoreConfig(
    String name,
    StateStoreObservabilitySink observabilitySink,
    Executor effectExecutor,
    Executor deliveryExecutor,
    WallClock wallClock,
    Duration shutdownTimeout
) {
    public static final String DEFAULT_NAME = "state-store";
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public StateStoreConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
    }

    public static StateStoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = DEFAULT_NAME;
        private StateStoreObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Executor effectExecutor;
        private Executor deliveryExecutor;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withObservabilitySink(StateStoreObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEffectExecutor(Executor executor) {
            this.effectExecutor = executor;
            return this;
        }

        public Builder withDeliveryExecutor(Executor executor) {
            this.deliveryExecutor = executor;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public StateStoreConfig build() {
            return new StateStoreConfig(name, observabilitySink, effectExecutor, deliveryExecutor,
                wallClock, shutdownTimeout);
        }
    }
}
