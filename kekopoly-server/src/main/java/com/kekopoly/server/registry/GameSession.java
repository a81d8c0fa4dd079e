package com.kekopoly.server.registry;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.PlayerConnection;

/**
 * One live game: the authoritative document plus its lock and socket
 * bookkeeping. Every accessor except {@link #lock()} and {@link #id()}
 * requires the lock to be held.
 */
public class GameSession {

    private static final int REQUEST_HISTORY = 256;

    private final Game game;
    private final ReentrantLock lock = new ReentrantLock();
    // playerId -> latest sessionId
    private final Map<String, String> connectedPlayers = new HashMap<>();
    // sessionId -> connection
    private final Map<String, PlayerConnection> connections = new HashMap<>();
    private final Set<String> recentRequests = new LinkedHashSet<>();
    private String lastRoller;
    private long lastRollAt;

    GameSession(Game game) {
        this.game = game;
    }

    public String id() {
        return game.getId();
    }

    ReentrantLock lock() {
        return lock;
    }

    Game game() {
        return game;
    }

    PlayerConnection openConnection(String playerId, String sessionId, long now) {
        String previous = connectedPlayers.put(playerId, sessionId);
        if (previous != null && !previous.equals(sessionId)) {
            PlayerConnection old = connections.get(previous);
            if (old != null && old.isConnected()) old.markDisconnected(now);
        }
        PlayerConnection conn = new PlayerConnection(playerId, sessionId, now);
        connections.put(sessionId, conn);
        return conn;
    }

    void closeConnection(String playerId, long now) {
        String sessionId = connectedPlayers.get(playerId);
        if (sessionId == null) return;
        PlayerConnection conn = connections.get(sessionId);
        if (conn != null && conn.isConnected()) conn.markDisconnected(now);
    }

    boolean hasLiveConnection(String playerId) {
        String sessionId = connectedPlayers.get(playerId);
        if (sessionId == null) return false;
        PlayerConnection conn = connections.get(sessionId);
        return conn != null && conn.isConnected();
    }

    String sessionOf(String playerId) {
        return connectedPlayers.get(playerId);
    }

    PlayerConnection connection(String sessionId) {
        return connections.get(sessionId);
    }

    boolean seenRequest(String requestId) {
        return requestId != null && recentRequests.contains(requestId);
    }

    void rememberRequest(String requestId) {
        if (requestId == null) return;
        recentRequests.add(requestId);
        if (recentRequests.size() > REQUEST_HISTORY) {
            Iterator<String> it = recentRequests.iterator();
            it.next();
            it.remove();
        }
    }

    /** True while the player's previous roll is younger than {@code settleMillis}. */
    boolean rollSettling(String playerId, long now, long settleMillis) {
        return playerId.equals(lastRoller) && now - lastRollAt < settleMillis;
    }

    void markRoll(String playerId, long now) {
        lastRoller = playerId;
        lastRollAt = now;
    }
}
