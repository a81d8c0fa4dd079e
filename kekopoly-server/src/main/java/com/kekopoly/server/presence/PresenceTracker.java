package com.kekopoly.server.presence;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per (game, player) history of socket sessions, in the order they were
 * recorded. Memory only; rebuilt from nothing after a restart.
 */
public class PresenceTracker {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final Map<String, Map<String, List<SessionInfo>>> history = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public PresenceTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends a new session. Any entry of the same player still marked
     * CONNECTED is closed, so at most one session reads as active.
     */
    public SessionInfo recordSession(String gameId, String playerId, String sessionId, String clientInfo, SessionStatus status) {
        Instant now = clock.instant();
        SessionInfo info = new SessionInfo(sessionId, now, null, now, clientInfo, status);
        lock.writeLock().lock();
        try {
            List<SessionInfo> sessions = history
                .computeIfAbsent(key(gameId), g -> new HashMap<>())
                .computeIfAbsent(playerId, p -> new ArrayList<>());
            for (int i = 0; i < sessions.size(); i++) {
                SessionInfo s = sessions.get(i);
                if (s.status() != SessionStatus.DISCONNECTED && !s.sessionId().equals(sessionId)) {
                    sessions.set(i, s.withStatus(SessionStatus.DISCONNECTED, now));
                }
            }
            sessions.add(info);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[PRESENCE] game={} player={} session={} status={}", gameId, playerId, sessionId, status);
        return info;
    }

    /** @return false when the session is unknown */
    public boolean updateStatus(String gameId, String playerId, String sessionId, SessionStatus status) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            List<SessionInfo> sessions = sessionsOf(gameId, playerId);
            for (int i = sessions.size() - 1; i >= 0; i--) {
                SessionInfo s = sessions.get(i);
                if (s.sessionId().equals(sessionId)) {
                    sessions.set(i, s.withStatus(status, now));
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void touch(String gameId, String playerId, String sessionId) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            List<SessionInfo> sessions = sessionsOf(gameId, playerId);
            for (int i = sessions.size() - 1; i >= 0; i--) {
                if (sessions.get(i).sessionId().equals(sessionId)) {
                    sessions.set(i, sessions.get(i).touched(now));
                    return;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<SessionInfo> getAllSessions(String gameId, String playerId) {
        lock.readLock().lock();
        try {
            return List.copyOf(sessionsOf(gameId, playerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Most recent by connect time; later entries win ties. */
    public SessionInfo getLatestSession(String gameId, String playerId) {
        lock.readLock().lock();
        try {
            SessionInfo latest = null;
            for (SessionInfo s : sessionsOf(gameId, playerId)) {
                if (latest == null || !s.connectedAt().isBefore(latest.connectedAt())) latest = s;
            }
            return latest;
        } finally {
            lock.readLock().unlock();
        }
    }

    public SessionInfo getActiveSession(String gameId, String playerId) {
        lock.readLock().lock();
        try {
            for (SessionInfo s : sessionsOf(gameId, playerId)) {
                if (s.status() == SessionStatus.CONNECTED) return s;
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasHistory(String gameId, String playerId) {
        lock.readLock().lock();
        try {
            return !sessionsOf(gameId, playerId).isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear(String gameId) {
        lock.writeLock().lock();
        try {
            history.remove(key(gameId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the lock.
    private List<SessionInfo> sessionsOf(String gameId, String playerId) {
        Map<String, List<SessionInfo>> byPlayer = history.get(key(gameId));
        if (byPlayer == null) return Collections.emptyList();
        List<SessionInfo> sessions = byPlayer.get(playerId);
        return sessions == null ? Collections.emptyList() : sessions;
    }

    private static String key(String gameId) {
        return gameId.toLowerCase();
    }
}
