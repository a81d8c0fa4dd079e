package com.kekopoly.server.util;

import java.time.Duration;

/**
 * Keyed delayed work. Scheduling under a key that is already pending
 * replaces the earlier task.
 */
public interface TaskScheduler {

    void schedule(String key, Duration delay, Runnable task);

    /** @return true if a pending task was cancelled */
    boolean cancel(String key);

    boolean isPending(String key);

    void shutdown();
}
