package com.kekopoly.server.util;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DeferredTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeferredTaskScheduler.class);

    private record Pending(long seq, ScheduledFuture<?> future) {}

    private final ScheduledExecutorService exec;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public DeferredTaskScheduler() {
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deferred-tasks");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(String key, Duration delay, Runnable task) {
        long seq = sequence.incrementAndGet();
        pending.compute(key, (k, previous) -> {
            if (previous != null) previous.future().cancel(false);
            return new Pending(seq, exec.schedule(() -> run(k, seq, task), delay.toMillis(), TimeUnit.MILLISECONDS));
        });
        log.debug("[DEFER] scheduled {} in {}ms", key, delay.toMillis());
    }

    private void run(String key, long seq, Runnable task) {
        // A replacement scheduled under the same key must stay registered.
        pending.computeIfPresent(key, (k, p) -> p.seq() == seq ? null : p);
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("[DEFER] task {} failed", key, e);
        }
    }

    @Override
    public boolean cancel(String key) {
        Pending p = pending.remove(key);
        return p != null && p.future().cancel(false);
    }

    @Override
    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    @Override
    public void shutdown() {
        pending.values().forEach(p -> p.future().cancel(false));
        pending.clear();
        exec.shutdownNow();
    }
}
