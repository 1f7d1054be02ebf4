package com.questrail.logic.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real-time tests; tolerances are generous.
 */
class ScheduledExecutorSchedulerTest {

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final ScheduledExecutorScheduler scheduler =
            new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void delayedTaskRuns() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    void overdueDeadlineRunsAtOnce() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(5),
                latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTaskDoesNotRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();
        Cancellable timer = scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE,
                () -> ran.set(true));

        assertTrue(timer.cancel());
        assertFalse(timer.cancel());
        Thread.sleep(100);

        assertFalse(ran.get());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        scheduler.scheduleAfter(Duration.ofMillis(40), clock, () -> {
            order.add("late");
            latch.countDown();
        });
        scheduler.scheduleAfter(Duration.ofMillis(10), clock, () -> {
            order.add("early");
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("early", "late"), order);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> { }));
    }

    @Test
    void daemonSchedulerUsesADaemonThread() throws InterruptedException {
        ScheduledExecutorScheduler daemon = ScheduledExecutorScheduler.daemon(SystemMonotonicClock.INSTANCE);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicBoolean isDaemon = new AtomicBoolean();

        daemon.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, () -> {
            isDaemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertTrue(isDaemon.get());
    }
}
