package com.kekopoly.server.hub;

import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.shared.util.Priority;

/**
 * Writer loop for a single client. Each pass sends every pending high
 * frame, then at most one batch of normal frames, going back to the high
 * tier if any normal frame went out, and only then a batch of low frames.
 * Sends are spaced by a minimum interval and the socket is pinged when the
 * ping interval elapses. Exits when the outbox closes or a send fails.
 */
class OutboundPump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OutboundPump.class);

    private final Client client;
    private final int batchSize;
    private final long minSendIntervalNanos;
    private final long pingIntervalNanos;
    private final BiConsumer<Client, Exception> onFailure;

    private long lastSendNanos;
    private long lastPingNanos;

    OutboundPump(Client client, ServerConfig.Hub settings, BiConsumer<Client, Exception> onFailure) {
        this.client = client;
        this.batchSize = Math.max(1, settings.getBatchSize());
        this.minSendIntervalNanos = TimeUnit.MILLISECONDS.toNanos(settings.getMinSendIntervalMillis());
        this.pingIntervalNanos = TimeUnit.SECONDS.toNanos(Math.max(1, settings.getPingIntervalSeconds()));
        this.onFailure = onFailure;
    }

    @Override
    public void run() {
        PriorityOutbox outbox = client.outbox();
        lastPingNanos = System.nanoTime();
        try {
            while (!outbox.isClosed()) {
                long untilPing = pingIntervalNanos - (System.nanoTime() - lastPingNanos);
                if (untilPing <= 0L || !outbox.awaitPending(untilPing, TimeUnit.NANOSECONDS)) {
                    if (outbox.isClosed()) break;
                    ping();
                    continue;
                }
                drainOnce(outbox);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("[PUMP] send to {} failed: {}", client, e.getMessage());
            onFailure.accept(client, e);
            return;
        }
        log.debug("[PUMP] writer for {} stopped", client);
    }

    /** One prioritized pass. */
    void drainOnce(PriorityOutbox outbox) throws InterruptedException {
        String frame;
        while ((frame = outbox.poll(Priority.HIGH)) != null) {
            write(frame);
        }
        int sent = 0;
        while (sent < batchSize && (frame = outbox.poll(Priority.NORMAL)) != null) {
            write(frame);
            sent++;
        }
        if (sent > 0) return;
        sent = 0;
        while (sent < batchSize && (frame = outbox.poll(Priority.LOW)) != null) {
            write(frame);
            sent++;
            if (outbox.hasPending(Priority.HIGH)) return;
        }
    }

    private void write(String frame) throws InterruptedException {
        long wait = minSendIntervalNanos - (System.nanoTime() - lastSendNanos);
        if (wait > 0L && lastSendNanos != 0L) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
        ClientChannel channel = client.channel();
        if (!channel.isOpen()) {
            throw new IllegalStateException("socket closed");
        }
        channel.send(frame);
        lastSendNanos = System.nanoTime();
    }

    private void ping() {
        ClientChannel channel = client.channel();
        if (channel.isOpen()) {
            channel.sendPing();
            log.trace("[HB] ping -> {}", channel.label());
        }
        lastPingNanos = System.nanoTime();
    }
}
