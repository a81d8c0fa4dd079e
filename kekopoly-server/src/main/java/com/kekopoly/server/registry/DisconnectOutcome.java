package com.kekopoly.server.registry;

/**
 * Result of {@link SessionRegistry#playerDisconnected}. {@code newHostId}
 * is set only when host status moved to another player.
 */
public record DisconnectOutcome(
    String gameId,
    String playerId,
    boolean changed,
    String previousHostId,
    String newHostId,
    boolean abandoned
) {

    public boolean hostChanged() {
        return newHostId != null;
    }

    static DisconnectOutcome unchanged(String gameId, String playerId, String hostId) {
        return new DisconnectOutcome(gameId, playerId, false, hostId, null, false);
    }
}
