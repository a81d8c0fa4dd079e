package com.kekopoly.server.reaper;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.hub.ConnectionHub;
import com.kekopoly.server.registry.SessionRegistry;

/**
 * Background ticks: silent-client sweep, stale-game sweep and the
 * presentation cache refresh. A failing tick is logged and the schedule
 * continues.
 */
public class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final SessionRegistry registry;
    private final ConnectionHub hub;
    private final ServerConfig.Hub hubSettings;
    private final ServerConfig.Reaper settings;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "reaper");
        t.setDaemon(true);
        return t;
    });

    public Reaper(SessionRegistry registry, ConnectionHub hub, ServerConfig config) {
        this.registry = registry;
        this.hub = hub;
        this.hubSettings = config.getHub();
        this.settings = config.getReaper();
    }

    public void start() {
        exec.scheduleAtFixedRate(this::sweepInactiveClients,
            settings.getInactivitySweepSeconds(), settings.getInactivitySweepSeconds(), TimeUnit.SECONDS);
        exec.scheduleAtFixedRate(this::sweepStaleGames,
            settings.getStaleSweepSeconds(), settings.getStaleSweepSeconds(), TimeUnit.SECONDS);
        exec.scheduleAtFixedRate(this::refreshCache,
            settings.getCacheRefreshSeconds(), settings.getCacheRefreshSeconds(), TimeUnit.SECONDS);
        log.info("[REAPER] started: clients every {}s, games every {}s, cache every {}s",
            settings.getInactivitySweepSeconds(), settings.getStaleSweepSeconds(), settings.getCacheRefreshSeconds());
    }

    void sweepInactiveClients() {
        try {
            int dropped = hub.checkInactiveClients(hubSettings.inactivityThreshold());
            if (dropped > 0) log.info("[REAPER] dropped {} silent client(s)", dropped);
        } catch (RuntimeException e) {
            log.error("[REAPER] inactive-client sweep failed", e);
        }
    }

    void sweepStaleGames() {
        try {
            List<String> removed = registry.cleanupStaleGames();
            if (!removed.isEmpty()) log.info("[CLEANUP] swept {} game(s): {}", removed.size(), removed);
        } catch (RuntimeException e) {
            log.error("[CLEANUP] stale-game sweep failed", e);
        }
    }

    void refreshCache() {
        try {
            hub.refreshGameInfoCache();
        } catch (RuntimeException e) {
            log.error("[REAPER] cache refresh failed", e);
        }
    }

    public void shutdown() {
        exec.shutdownNow();
        log.info("[REAPER] stopped");
    }
}
