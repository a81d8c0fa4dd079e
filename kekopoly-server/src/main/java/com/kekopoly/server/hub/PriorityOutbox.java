package com.kekopoly.server.hub;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.shared.util.Priority;

/**
 * Three bounded FIFO tiers for one client. {@link #offer} never blocks.
 * A frame whose tier is full moves up a tier; a high frame facing a full
 * high tier evicts the oldest one there; anything left over is dropped.
 * Once closed, nothing more is accepted or handed out.
 */
public class PriorityOutbox {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition pending = lock.newCondition();
    private final Map<Priority, ArrayDeque<String>> tiers = new EnumMap<>(Priority.class);
    private final Map<Priority, Integer> capacity = new EnumMap<>(Priority.class);
    private boolean closed;

    public PriorityOutbox(int highCapacity, int normalCapacity, int lowCapacity) {
        if (highCapacity < 1 || normalCapacity < 1 || lowCapacity < 1) {
            throw new IllegalArgumentException("Queue capacities must be positive");
        }
        capacity.put(Priority.HIGH, highCapacity);
        capacity.put(Priority.NORMAL, normalCapacity);
        capacity.put(Priority.LOW, lowCapacity);
        for (Priority p : Priority.values()) {
            tiers.put(p, new ArrayDeque<>());
        }
    }

    public static PriorityOutbox from(ServerConfig.Hub hub) {
        return new PriorityOutbox(hub.getHighQueueCapacity(), hub.getNormalQueueCapacity(), hub.getLowQueueCapacity());
    }

    public DeliveryOutcome offer(String frame, Priority priority) {
        lock.lock();
        try {
            if (closed) return DeliveryOutcome.CLOSED;
            Priority tier = priority;
            while (tier != null) {
                if (push(tier, frame)) {
                    return tier == priority ? DeliveryOutcome.ENQUEUED : DeliveryOutcome.ESCALATED;
                }
                if (tier == Priority.HIGH && priority == Priority.HIGH) {
                    tiers.get(Priority.HIGH).pollFirst();
                    if (push(Priority.HIGH, frame)) return DeliveryOutcome.EVICTED_OLDEST;
                }
                tier = tier.escalate();
            }
            return DeliveryOutcome.DROPPED;
        } finally {
            lock.unlock();
        }
    }

    /** Next frame of exactly this tier, or null. */
    public String poll(Priority priority) {
        lock.lock();
        try {
            return closed ? null : tiers.get(priority).pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending(Priority priority) {
        lock.lock();
        try {
            return !closed && !tiers.get(priority).isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until some tier holds a frame, the outbox closes, or the timeout
     * passes.
     *
     * @return true if at least one frame is pending
     */
    public boolean awaitPending(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!closed && isEmpty()) {
                if (nanos <= 0L) return false;
                nanos = pending.awaitNanos(nanos);
            }
            return !closed;
        } finally {
            lock.unlock();
        }
    }

    public int size(Priority priority) {
        lock.lock();
        try {
            return tiers.get(priority).size();
        } finally {
            lock.unlock();
        }
    }

    /** Discards queued frames and wakes any waiting writer. */
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            for (ArrayDeque<String> q : tiers.values()) q.clear();
            pending.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private boolean push(Priority tier, String frame) {
        ArrayDeque<String> q = tiers.get(tier);
        if (q.size() >= capacity.get(tier)) return false;
        q.addLast(frame);
        pending.signal();
        return true;
    }

    private boolean isEmpty() {
        for (ArrayDeque<String> q : tiers.values()) {
            if (!q.isEmpty()) return false;
        }
        return true;
    }
}
