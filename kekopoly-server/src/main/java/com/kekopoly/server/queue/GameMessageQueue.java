package com.kekopoly.server.queue;

import com.kekopoly.server.model.Game;

/**
 * Best-effort side channel that lets a consumer replay events a client may
 * have missed. Implementations log failures and never throw.
 */
public interface GameMessageQueue {

    void enqueuePlayerTokenUpdate(String gameId, String playerId, String token);

    void enqueueGameStateUpdate(Game game);

    void enqueueGameStart(Game game);
}
