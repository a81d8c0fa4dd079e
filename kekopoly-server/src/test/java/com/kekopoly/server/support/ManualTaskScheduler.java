package com.kekopoly.server.support;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.kekopoly.server.util.TaskScheduler;

/** Holds tasks until the test fires them. */
public class ManualTaskScheduler implements TaskScheduler {

    private record Entry(Duration delay, Runnable task) {}

    private final Map<String, Entry> pending = new LinkedHashMap<>();

    @Override
    public synchronized void schedule(String key, Duration delay, Runnable task) {
        pending.put(key, new Entry(delay, task));
    }

    @Override
    public synchronized boolean cancel(String key) {
        return pending.remove(key) != null;
    }

    @Override
    public synchronized boolean isPending(String key) {
        return pending.containsKey(key);
    }

    @Override
    public synchronized void shutdown() {
        pending.clear();
    }

    public synchronized Duration delayOf(String key) {
        Entry e = pending.get(key);
        return e == null ? null : e.delay();
    }

    public synchronized List<String> keys() {
        return List.copyOf(pending.keySet());
    }

    /** Runs and removes the task under {@code key}; false if none was pending. */
    public boolean fire(String key) {
        Entry e;
        synchronized (this) {
            e = pending.remove(key);
        }
        if (e == null) return false;
        e.task().run();
        return true;
    }
}
