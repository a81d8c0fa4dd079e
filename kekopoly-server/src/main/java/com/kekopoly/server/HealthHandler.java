package com.kekopoly.server;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kekopoly.server.store.GameStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/** {@code /healthz}: 200 when the store answers a ping in time, 503 otherwise. */
class HealthHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);

    static final long PING_TIMEOUT_MS = 2_000L;

    private final GameStore store;
    private final ExecutorService probe = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "health-probe");
        t.setDaemon(true);
        return t;
    });

    HealthHandler(GameStore store) {
        this.store = store;
    }

    @Override
    public void handle(HttpExchange t) throws IOException {
        boolean healthy = storeAnswers();
        byte[] body = (healthy ? "OK\n" : "UNAVAILABLE\n").getBytes(StandardCharsets.UTF_8);
        t.sendResponseHeaders(healthy ? 200 : 503, body.length);
        try (OutputStream os = t.getResponseBody()) {
            os.write(body);
        }
    }

    boolean storeAnswers() {
        Future<Boolean> ping = probe.submit(store::ping);
        try {
            return ping.get(PING_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ping.cancel(true);
            log.warn("[HEALTH] store ping timed out after {}ms", PING_TIMEOUT_MS);
            return false;
        } catch (ExecutionException e) {
            log.warn("[HEALTH] store ping failed: {}", e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void shutdown() {
        probe.shutdownNow();
    }
}
