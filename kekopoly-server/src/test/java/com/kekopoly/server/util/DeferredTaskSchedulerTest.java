package com.kekopoly.server.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DeferredTaskSchedulerTest {

    private DeferredTaskScheduler scheduler;

    @BeforeEach
    public void setup() {
        scheduler = new DeferredTaskScheduler();
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdown();
    }

    @Test
    public void testTaskRunsAndLeavesNoPendingEntry() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule("k", Duration.ofMillis(10), ran::countDown);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 1000;
        while (scheduler.isPending("k") && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertFalse(scheduler.isPending("k"));
    }

    @Test
    public void testCancelPreventsRun() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        scheduler.schedule("k", Duration.ofMillis(200), runs::incrementAndGet);

        assertTrue(scheduler.cancel("k"));
        Thread.sleep(300);

        assertEquals(0, runs.get());
        assertFalse(scheduler.isPending("k"));
        assertFalse(scheduler.cancel("k"));
    }

    @Test
    public void testReschedulingReplacesEarlierTask() throws Exception {
        AtomicInteger first = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);

        scheduler.schedule("k", Duration.ofMillis(100), first::incrementAndGet);
        scheduler.schedule("k", Duration.ofMillis(150), second::countDown);

        assertTrue(second.await(2, TimeUnit.SECONDS));
        assertEquals(0, first.get());
    }

    @Test
    public void testFailingTaskDoesNotStopLaterOnes() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        scheduler.schedule("bad", Duration.ofMillis(5), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.schedule("good", Duration.ofMillis(50), ran::countDown);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
    }
}
