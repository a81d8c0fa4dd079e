package com.kekopoly.server.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.kekopoly.server.registry.GameEventPublisher;
import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.Priority;

/** Captures everything the registry publishes. */
public class RecordingPublisher implements GameEventPublisher {

    public record Published(String scope, String gameId, EventType type, Object payload) {}

    private final List<Published> events = new CopyOnWriteArrayList<>();

    @Override
    public void broadcastToGame(String gameId, EventType type, Object payload) {
        events.add(new Published("game", gameId, type, payload));
    }

    @Override
    public void broadcastToGameExcept(String gameId, String excludedPlayerId, EventType type, Object payload) {
        events.add(new Published("game-except:" + excludedPlayerId, gameId, type, payload));
    }

    @Override
    public void broadcastToLobby(EventType type, Object payload) {
        events.add(new Published("lobby", null, type, payload));
    }

    @Override
    public boolean sendToPlayerWithPriority(String gameId, String playerId, EventType type, Object payload, Priority priority) {
        events.add(new Published("player:" + playerId, gameId, type, payload));
        return true;
    }

    public List<Published> all() {
        return List.copyOf(events);
    }

    public List<Published> ofType(EventType type) {
        List<Published> out = new ArrayList<>();
        for (Published p : events) {
            if (p.type() == type) out.add(p);
        }
        return out;
    }

    public <T> T lastPayload(EventType type, Class<T> cls) {
        List<Published> matching = ofType(type);
        if (matching.isEmpty()) return null;
        return cls.cast(matching.get(matching.size() - 1).payload());
    }

    public void clear() {
        events.clear();
    }
}
