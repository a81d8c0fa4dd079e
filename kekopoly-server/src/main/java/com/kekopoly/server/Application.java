package com.kekopoly.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kekopoly.server.config.ConfigLoader;
import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.hub.ConnectionHub;
import com.kekopoly.server.network.GameWebSocketServer;
import com.kekopoly.server.presence.PresenceTracker;
import com.kekopoly.server.queue.GameMessageQueue;
import com.kekopoly.server.queue.RedisMessageQueue;
import com.kekopoly.server.reaper.Reaper;
import com.kekopoly.server.registry.SessionRegistry;
import com.kekopoly.server.rules.RandomDiceRoller;
import com.kekopoly.server.rules.StandardRuleBook;
import com.kekopoly.server.store.GameStore;
import com.kekopoly.server.store.InMemoryGameStore;
import com.kekopoly.server.store.RedisGameStore;
import com.kekopoly.server.util.DeferredTaskScheduler;
import com.kekopoly.shared.message.MessageCodec;
import com.sun.net.httpserver.HttpServer;

import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws InterruptedException, IOException {
        ServerConfig config = new ConfigLoader().load(args);
        ServerConfig.Server server = config.getServer();
        ServerConfig.Redis redis = config.getRedis();
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.systemUTC();

        GameStore store;
        GameMessageQueue queue = null;
        if (redis.isEnabled()) {
            JedisPool pool = new JedisPool(new JedisPoolConfig(), redis.getHost(), redis.getPort(), redis.getTimeoutMillis());
            store = new RedisGameStore(pool, objectMapper);
            if (redis.isQueueEnabled()) queue = new RedisMessageQueue(pool, objectMapper);
            log.info("[BOOT] using redis at {}:{}", redis.getHost(), redis.getPort());
        } else {
            store = new InMemoryGameStore();
            log.info("[BOOT] redis disabled, games are kept in memory only");
        }

        PresenceTracker presence = new PresenceTracker(clock);
        SessionRegistry registry = new SessionRegistry(store, queue,
            new StandardRuleBook(config.getGame().getCardDeckSize()), new RandomDiceRoller(),
            new DeferredTaskScheduler(), presence, clock, config);
        MessageCodec codec = new MessageCodec(objectMapper);
        ConnectionHub hub = new ConnectionHub(registry, presence, codec, config.getHub(), clock);
        registry.loadActiveGames();

        int healthPort = server.getPort() + server.getHealthPortOffset();
        HealthHandler health = new HealthHandler(store);
        HttpServer healthServer = HttpServer.create(new InetSocketAddress(healthPort), 0);
        healthServer.createContext("/healthz", health);
        healthServer.setExecutor(null);
        healthServer.start();
        log.info("[BOOT] health endpoint on port {}", healthPort);

        GameWebSocketServer wsServer = new GameWebSocketServer(new InetSocketAddress(server.getHost(), server.getPort()),
            hub, codec, server.getConnectionLostTimeoutSeconds());
        wsServer.start();

        Reaper reaper = new Reaper(registry, hub, config);
        reaper.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] stopping");
            reaper.shutdown();
            try {
                wsServer.stop(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            hub.shutdown();
            registry.shutdown();
            healthServer.stop(0);
            health.shutdown();
            store.close();
        }, "shutdown"));

        Thread.currentThread().join();
    }
}
