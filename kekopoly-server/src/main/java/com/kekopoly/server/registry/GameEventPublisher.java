package com.kekopoly.server.registry;

import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.Priority;

/**
 * Fan-out surface the registry pushes derived events through. The
 * connection hub is the production implementation. Calls must not block.
 */
public interface GameEventPublisher {

    void broadcastToGame(String gameId, EventType type, Object payload);

    void broadcastToGameExcept(String gameId, String excludedPlayerId, EventType type, Object payload);

    void broadcastToLobby(EventType type, Object payload);

    /** @return false when the player has no live client or the event was dropped */
    boolean sendToPlayerWithPriority(String gameId, String playerId, EventType type, Object payload, Priority priority);

    GameEventPublisher NONE = new GameEventPublisher() {
        @Override
        public void broadcastToGame(String gameId, EventType type, Object payload) {
        }

        @Override
        public void broadcastToGameExcept(String gameId, String excludedPlayerId, EventType type, Object payload) {
        }

        @Override
        public void broadcastToLobby(EventType type, Object payload) {
        }

        @Override
        public boolean sendToPlayerWithPriority(String gameId, String playerId, EventType type, Object payload, Priority priority) {
            return false;
        }
    };
}
