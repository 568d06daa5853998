package com.questrail.statestore.core;

import com.questrail.statestore.api.Effect;
import com.questrail.statestore.api.EffectTask;
import com.questrail.statestore.api.PreDispatchHook;
import com.questrail.statestore.api.Reducer;
import com.questrail.statestore.api.StateFeed;
import com.questrail.statestore.api.StateListener;
import com.questrail.statestore.api.StateStore;
import com.questrail.statestore.api.StateStoreException;
import com.questrail.statestore.api.StateSubscription;
import com.questrail.statestore.api.StoreClosedException;
import com.questrail.statestore.api.TransitionFailedException;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.internal.broadcast.StateBroadcastHub;
import com.questrail.statestore.internal.dispatch.DispatchLoop;
import com.questrail.statestore.internal.effect.EffectTaskRegistry;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DefaultStateStore
 * =============================================================================
 * Composition root and lifecycle owner for one store.
 *
 * <h2>What this class wires together</h2>
 * <ul>
 *   <li>{@link DispatchLoop} on a dedicated single-thread Netty executor:
 *       owns the state and serializes every transition</li>
 *   <li>{@link StateBroadcastHub}: fans committed states out to feeds and
 *       listeners</li>
 *   <li>{@link EffectTaskRegistry}: independently cancellable effects</li>
 * </ul>
 *
 * <p>This class adds no semantics of its own beyond lifecycle: argument
 * checks, the pre-dispatch hook slot, and the order in which the parts are
 * shut down.</p>
 *
 * <h2>Threads</h2>
 * <pre>
 *   {name}-dispatch   one thread, owns the state (always created by the store)
 *   {name}-effects    launched effect tasks (unless an executor is configured)
 *   {name}-delivery   push-listener delivery (unless an executor is configured)
 * </pre>
 *
 * @param <S> state type
 * @param <A> action type
 */
public final class DefaultStateStore<S, A> implements StateStore<S, A>
{
    private final StateStoreConfig config;
    private final EventExecutor dispatchExecutor;
    private final ExecutorService ownedEffectExecutor;
    private final ExecutorService ownedDeliveryExecutor;

    private final StateBroadcastHub<S> hub;
    private final DispatchLoop<S, A> loop;
    private final EffectTaskRegistry<S, A> tasks;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile PreDispatchHook<S, A> preDispatchHook;

    public DefaultStateStore(S initialState, Reducer<S, A> reducer)
    {
        this(initialState, reducer, List.of(), StateStoreConfig.defaults());
    }

    public DefaultStateStore(S initialState, Reducer<S, A> reducer, List<? extends Effect<S, A>> effects)
    {
        this(initialState, reducer, effects, StateStoreConfig.defaults());
    }

    public DefaultStateStore(S initialState,
                             Reducer<S, A> reducer,
                             List<? extends Effect<S, A>> effects,
                             StateStoreConfig config)
    {
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(reducer, "reducer");
        Objects.requireNonNull(effects, "effects");
        this.config = Objects.requireNonNull(config, "config");

        List<Effect<S, A>> registered = new ArrayList<>(effects.size());
        for (Effect<S, A> effect : effects) {
            registered.add(Objects.requireNonNull(effect, "effect"));
        }

        this.ownedEffectExecutor = config.effectExecutor() == null
            ? Executors.newCachedThreadPool(new DefaultThreadFactory(config.name() + "-effects", true))
            : null;
        this.ownedDeliveryExecutor = config.deliveryExecutor() == null
            ? Executors.newCachedThreadPool(new DefaultThreadFactory(config.name() + "-delivery", true))
            : null;
        Executor effectExecutor = ownedEffectExecutor != null ? ownedEffectExecutor : config.effectExecutor();
        Executor deliveryExecutor = ownedDeliveryExecutor != null ? ownedDeliveryExecutor : config.deliveryExecutor();

        this.dispatchExecutor = new DefaultEventExecutor(new DefaultThreadFactory(config.name() + "-dispatch", true));
        this.hub = new StateBroadcastHub<>(initialState, config, deliveryExecutor);
        this.loop = new DispatchLoop<>(
            dispatchExecutor,
            initialState,
            reducer,
            registered,
            hub::publish,
            this::runPreDispatchHook,
            this::onTransitionFailed,
            config
        );
        this.tasks = new EffectTaskRegistry<>(loop, effectExecutor, config);
    }

    public static <S, A> Builder<S, A> builder(S initialState, Reducer<S, A> reducer)
    {
        return new Builder<>(initialState, reducer);
    }

    // ---------------------------------------------------------------------
    // StateStore
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> dispatch(A action)
    {
        Objects.requireNonNull(action, "action");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new StoreClosedException("store '" + config.name() + "' is closed"));
        }
        return loop.submit(action).thenAccept(result -> { });
    }

    @Override
    public void dispatchAndWait(A action)
    {
        if (loop.inLoop()) {
            throw new IllegalStateException(
                "dispatchAndWait called on the dispatch thread of store '" + config.name() + "'");
        }
        try {
            dispatch(action).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateStoreException("interrupted while waiting for dispatch of " + action, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StateStoreException storeException) {
                throw storeException;
            }
            throw new StateStoreException("dispatch of " + action + " failed", cause);
        }
    }

    @Override
    public S currentState()
    {
        return loop.currentState();
    }

    @Override
    public StateFeed<S> subscribe()
    {
        return hub.openFeed();
    }

    @Override
    public StateSubscription subscribe(StateListener<S> listener)
    {
        return hub.addListener(listener);
    }

    @Override
    public EffectTask<A> launchEffect(Effect<S, A> effect, A action)
    {
        return tasks.launch(effect, action);
    }

    @Override
    public int cancelAllEffectTasks()
    {
        return tasks.cancelAll();
    }

    @Override
    public void setPreDispatchHook(PreDispatchHook<S, A> hook)
    {
        this.preDispatchHook = hook;
    }

    @Override
    public boolean isClosed()
    {
        return closed.get() || loop.isTerminated();
    }

    /**
     * Number of effect tasks launched and not yet settled.
     */
    public int activeEffectTaskCount()
    {
        return tasks.activeCount();
    }

    public int subscriberCount()
    {
        return hub.subscriberCount();
    }

    public StateStoreConfig config()
    {
        return config;
    }

    /**
     * Closes the store.
     *
     * <ol>
     *   <li>cancel effect tasks (no follow-up can land after this)</li>
     *   <li>fail queued and in-flight dispatches with {@link StoreClosedException}</li>
     *   <li>end every feed</li>
     *   <li>shut down the executors the store created</li>
     * </ol>
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        StoreClosedException reason = new StoreClosedException("store '" + config.name() + "' is closed");
        long timeoutMillis = config.shutdownTimeout().toMillis();

        tasks.close();
        if (dispatchExecutor.inEventLoop()) {
            loop.terminate(reason);
        } else {
            try {
                dispatchExecutor.submit(() -> loop.terminate(reason)).awaitUninterruptibly(timeoutMillis);
            } catch (RejectedExecutionException e) {
                // The dispatch thread is gone; nothing else touches the loop now.
                loop.terminate(reason);
            }
        }
        hub.terminate();

        if (ownedEffectExecutor != null) {
            // Tasks are cancelled; interrupt whatever effect code still runs.
            ownedEffectExecutor.shutdownNow();
        }
        if (ownedDeliveryExecutor != null) {
            // Let queued deliveries (including end-of-feed) run out.
            ownedDeliveryExecutor.shutdown();
        }
        io.netty.util.concurrent.Future<?> termination =
            dispatchExecutor.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS);
        if (!dispatchExecutor.inEventLoop()) {
            termination.awaitUninterruptibly(timeoutMillis);
        }
    }

    // ---------------------------------------------------------------------
    // Dispatch-thread callbacks
    // ---------------------------------------------------------------------

    private void runPreDispatchHook(A action)
    {
        PreDispatchHook<S, A> hook = preDispatchHook;
        if (hook != null) {
            hook.beforeDispatch(action, this);
        }
    }

    private void onTransitionFailed(TransitionFailedException failure)
    {
        tasks.close();
        hub.terminate();
    }

    /**
     * Fluent construction of a {@link DefaultStateStore}.
     */
    public static final class Builder<S, A>
    {
        private final S initialState;
        private final Reducer<S, A> reducer;
        private final List<Effect<S, A>> effects = new ArrayList<>();
        private StateStoreConfig config = StateStoreConfig.defaults();
        private PreDispatchHook<S, A> preDispatchHook;

        private Builder(S initialState, Reducer<S, A> reducer)
        {
            this.initialState = initialState;
            this.reducer = reducer;
        }

        public Builder<S, A> withEffect(Effect<S, A> effect)
        {
            effects.add(effect);
            return this;
        }

        public Builder<S, A> withEffects(List<? extends Effect<S, A>> effects)
        {
            this.effects.addAll(effects);
            return this;
        }

        public Builder<S, A> withConfig(StateStoreConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder<S, A> withPreDispatchHook(PreDispatchHook<S, A> hook)
        {
            this.preDispatchHook = hook;
            return this;
        }

        public DefaultStateStore<S, A> build()
        {
            DefaultStateStore<S, A> store = new DefaultStateStore<>(initialState, reducer, effects, config);
            store.setPreDispatchHook(preDispatchHook);
            return store;
        }
    }
}
