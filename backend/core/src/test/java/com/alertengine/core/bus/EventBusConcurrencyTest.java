package com.alertengine.core.bus;

import com.alertengine.core.events.AlertDeduplicated;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusConcurrencyTest {
    private static final Instant AT = Instant.parse("2026-03-10T20:00:00Z");
    private static final int ALERTS = 6;
    private static final int REPEATS_PER_ALERT = 400;

    @Test
    void subscribersCancellingMidStreamDoNotDisturbOtherListeners() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("unexpected handler failure", error);
        });
        Map<String, LongAdder> repeatsByAlert = new ConcurrentHashMap<>();
        bus.subscribeAll(event -> repeatsByAlert
                .computeIfAbsent(((AlertDeduplicated) event).alertId(), ignored -> new LongAdder())
                .increment());

        int cancelAfter = 50;
        List<AtomicInteger> received = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            AtomicInteger count = new AtomicInteger();
            AtomicReference<EventBus.Subscription> self = new AtomicReference<>();
            self.set(bus.subscribe(AlertDeduplicated.class, event -> {
                if (count.incrementAndGet() == cancelAfter) {
                    self.get().cancel();
                }
            }));
            received.add(count);
        }

        publishRepeats(bus);

        int total = ALERTS * REPEATS_PER_ALERT;
        assertEquals(ALERTS, repeatsByAlert.size());
        repeatsByAlert.values().forEach(adder -> assertEquals(REPEATS_PER_ALERT, adder.sum()));

        int[] frozen = new int[received.size()];
        for (int i = 0; i < frozen.length; i++) {
            frozen[i] = received.get(i).get();
            assertTrue(frozen[i] >= cancelAfter && frozen[i] < total, "received " + frozen[i]);
        }
        bus.publish(new AlertDeduplicated(AT, "shop-1", "alert_late", 1));
        for (int i = 0; i < received.size(); i++) {
            assertEquals(frozen[i], received.get(i).get());
        }
    }

    @Test
    void failingHandlerIsReportedPerEventWhileFanOutContinues() throws Exception {
        LongAdder reported = new LongAdder();
        EventBus bus = new EventBus((event, error) -> reported.increment());
        bus.subscribe(AlertDeduplicated.class, event -> {
            if (event.similarAlertCount() % 2 == 0) {
                throw new IllegalStateException("cannot persist repeat " + event.similarAlertCount());
            }
        });
        LongAdder delivered = new LongAdder();
        bus.subscribe(AlertDeduplicated.class, event -> delivered.increment());

        publishRepeats(bus);

        assertEquals(ALERTS * REPEATS_PER_ALERT, delivered.sum());
        assertEquals(ALERTS * (REPEATS_PER_ALERT / 2), reported.sum());
    }

    private static void publishRepeats(EventBus bus) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(ALERTS);
        try {
            List<Future<?>> publishers = new ArrayList<>();
            for (int a = 0; a < ALERTS; a++) {
                String alertId = "alert_" + a;
                publishers.add(executor.submit(() -> {
                    start.await();
                    for (int repeat = 1; repeat <= REPEATS_PER_ALERT; repeat++) {
                        bus.publish(new AlertDeduplicated(AT, "shop-1", alertId, repeat));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> publisher : publishers) {
                publisher.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
