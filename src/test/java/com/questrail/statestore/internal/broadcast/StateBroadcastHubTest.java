package com.questrail.statestore.internal.broadcast;

import com.questrail.statestore.api.StateFeed;
import com.questrail.statestore.api.StateListener;
import com.questrail.statestore.api.StateStoreException;
import com.questrail.statestore.api.StateSubscription;
import com.questrail.statestore.config.StateStoreConfig;
import com.questrail.statestore.observability.RecordingObservabilitySink;
import com.questrail.statestore.observability.StoreErrorEvent;
import com.questrail.statestore.observability.SubscriberEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class StateBroadcastHubTest
{
    private static final Duration WAIT = Duration.ofSeconds(5);

    private RecordingObservabilitySink sink;
    private ExecutorService delivery;
    private StateBroadcastHub<Integer> hub;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        delivery = Executors.newCachedThreadPool();
        StateStoreConfig config = StateStoreConfig.builder()
            .withName("hub-test")
            .withObservabilitySink(sink)
            .build();
        hub = new StateBroadcastHub<>(0, config, delivery);
    }

    @AfterEach
    void tearDown() {
        hub.terminate();
        delivery.shutdownNow();
    }

    private static List<Integer> drain(StateFeed<Integer> feed, int count) throws InterruptedException {
        List<Integer> seen = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Optional<Integer> next = feed.poll(WAIT);
            assertTrue(next.isPresent(), "expected " + count + " states, got " + seen);
            seen.add(next.get());
        }
        return seen;
    }

    // ---------- Pull feeds ----------

    @Test
    void newFeedIsSeededWithCurrentState() throws Exception {
        StateFeed<Integer> feed = hub.openFeed();

        assertEquals(List.of(0), drain(feed, 1));
        assertEquals(Optional.empty(), feed.poll(Duration.ofMillis(20)));
    }

    @Test
    void lateJoinerSeesLatestThenEveryLaterState() throws Exception {
        hub.publish(1);
        hub.publish(2);

        StateFeed<Integer> late = hub.openFeed();
        hub.publish(3);
        hub.publish(4);

        assertEquals(List.of(2, 3, 4), drain(late, 3));
    }

    @Test
    void feedsAttachedTogetherSeeIdenticalSequences() throws Exception {
        StateFeed<Integer> first = hub.openFeed();
        StateFeed<Integer> second = hub.openFeed();

        for (int i = 1; i <= 50; i++) {
            hub.publish(i);
        }

        List<Integer> expected = IntStream.rangeClosed(0, 50).boxed().collect(Collectors.toList());
        assertEquals(expected, drain(first, 51));
        assertEquals(expected, drain(second, 51));
    }

    @Test
    void closingFeedDeregistersIt() throws Exception {
        StateFeed<Integer> feed = hub.openFeed();
        StateFeed<Integer> other = hub.openFeed();
        assertEquals(2, hub.subscriberCount());

        hub.publish(1);
        feed.close();

        assertEquals(1, hub.subscriberCount());
        assertFalse(feed.hasNext(), "a closed feed discards its buffer and ends");
        assertTrue(feed.isEnded());

        hub.publish(2);
        assertEquals(List.of(0, 1, 2), drain(other, 3));

        feed.close();
        assertEquals(1, hub.subscriberCount());
        assertTrue(sink.getAllEvents().stream()
            .filter(SubscriberEvent.class::isInstance)
            .map(SubscriberEvent.class::cast)
            .anyMatch(e -> e.kind() == SubscriberEvent.Kind.UNSUBSCRIBED && e.remaining() == 1));
    }

    @Test
    void interruptedReaderLeavesTheHub() throws Exception {
        StateFeed<Integer> feed = hub.openFeed();
        assertEquals(List.of(0), drain(feed, 1));

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                feed.hasNext();
            } catch (Throwable t) {
                thrown.set(t);
            }
        }, "blocked-reader");
        reader.start();
        awaitWaiting(reader);

        reader.interrupt();
        reader.join(WAIT.toMillis());

        assertInstanceOf(StateStoreException.class, thrown.get());
        assertEquals(0, hub.subscriberCount());
        for (int i = 1; i <= 1_000; i++) {
            hub.publish(i);
        }
        assertEquals(0, hub.subscriberCount());
        assertFalse(feed.hasNext());
    }

    @Test
    void interruptedPollClosesTheFeed() throws Exception {
        StateFeed<Integer> feed = hub.openFeed();
        assertEquals(List.of(0), drain(feed, 1));

        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, () -> feed.poll(WAIT));

        assertFalse(Thread.interrupted(), "the interrupt was consumed by the throw");
        assertEquals(0, hub.subscriberCount());
        hub.publish(1);
        assertEquals(Optional.empty(), feed.poll(Duration.ofMillis(20)));
    }

    @Test
    void terminateDrainsBufferedStatesThenEnds() throws Exception {
        StateFeed<Integer> feed = hub.openFeed();
        hub.publish(1);
        hub.publish(2);

        hub.terminate();
        hub.publish(3);

        List<Integer> seen = new ArrayList<>();
        while (feed.hasNext()) {
            seen.add(feed.next());
        }
        assertEquals(List.of(0, 1, 2), seen);
        assertTrue(feed.isEnded());
        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void feedOpenedAfterTerminateGetsFinalStateAndEnds() {
        hub.publish(7);
        hub.terminate();

        StateFeed<Integer> feed = hub.openFeed();

        assertTrue(feed.hasNext());
        assertEquals(7, feed.next());
        assertFalse(feed.hasNext());
        assertTrue(hub.isTerminated());
    }

    // ---------- Push listeners ----------

    @Test
    void listenerReceivesSeedThenEveryPublish() throws Exception {
        CollectingListener listener = new CollectingListener(4);
        hub.addListener(listener);

        hub.publish(1);
        hub.publish(2);
        hub.publish(3);

        assertTrue(listener.await());
        assertEquals(List.of(0, 1, 2, 3), listener.seen);
    }

    @Test
    void slowListenerDoesNotBlockPublishOrOtherSubscribers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CollectingListener slow = new CollectingListener(101) {
            @Override
            public void onState(Integer state) {
                awaitQuietly(release);
                super.onState(state);
            }
        };
        hub.addListener(slow);
        StateFeed<Integer> fast = hub.openFeed();

        long started = System.nanoTime();
        for (int i = 1; i <= 100; i++) {
            hub.publish(i);
        }
        long elapsed = System.nanoTime() - started;

        assertTrue(elapsed < TimeUnit.SECONDS.toNanos(1), "publish waited on a blocked listener");
        assertEquals(101, drain(fast, 101).size());

        release.countDown();
        assertTrue(slow.await());
        assertEquals(IntStream.rangeClosed(0, 100).boxed().collect(Collectors.toList()), slow.seen);
    }

    @Test
    void listenerFailureIsReportedAndIsolated() throws Exception {
        CollectingListener flaky = new CollectingListener(3) {
            @Override
            public void onState(Integer state) {
                super.onState(state);
                if (state == 1) {
                    throw new IllegalStateException("listener bug");
                }
            }
        };
        CollectingListener healthy = new CollectingListener(3);
        hub.addListener(flaky);
        hub.addListener(healthy);

        hub.publish(1);
        hub.publish(2);

        assertTrue(flaky.await());
        assertTrue(healthy.await());
        assertEquals(List.of(0, 1, 2), flaky.seen);
        assertEquals(List.of(0, 1, 2), healthy.seen);

        List<StoreErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals(StoreErrorEvent.Source.SUBSCRIBER, errors.get(0).source());
        assertFalse(errors.get(0).isFatal());
    }

    @Test
    void cancelledListenerStopsReceiving() throws Exception {
        CollectingListener listener = new CollectingListener(1);
        StateSubscription subscription = hub.addListener(listener);
        assertTrue(listener.await());

        subscription.close();
        assertFalse(subscription.isActive());
        assertEquals(0, hub.subscriberCount());

        hub.publish(1);
        Thread.sleep(50);
        assertEquals(List.of(0), listener.seen);
    }

    @Test
    void terminateNotifiesListenersAfterPendingStates() throws Exception {
        CollectingListener listener = new CollectingListener(3);
        hub.addListener(listener);
        hub.publish(1);
        hub.publish(2);

        hub.terminate();

        assertTrue(listener.terminated.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertEquals(List.of(0, 1, 2), listener.seen);
    }

    private static void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (thread.getState() != Thread.State.WAITING) {
            assertTrue(System.nanoTime() < deadline, thread.getName() + " never blocked");
            Thread.sleep(5);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class CollectingListener implements StateListener<Integer> {
        final List<Integer> seen = new CopyOnWriteArrayList<>();
        final CountDownLatch expected;
        final CountDownLatch terminated = new CountDownLatch(1);

        CollectingListener(int expectedCount) {
            this.expected = new CountDownLatch(expectedCount);
        }

        @Override
        public void onState(Integer state) {
            seen.add(state);
            expected.countDown();
        }

        @Override
        public void onTerminated() {
            terminated.countDown();
        }

        boolean await() throws InterruptedException {
            return expected.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
