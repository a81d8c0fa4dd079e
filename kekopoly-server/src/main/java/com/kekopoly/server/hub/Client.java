package com.kekopoly.server.hub;

/**
 * One live socket bound to a (game, player). Created when the socket
 * registers and discarded when it unregisters; a reconnect always gets a
 * fresh instance.
 */
public class Client {

    private final ClientChannel channel;
    private final PriorityOutbox outbox;
    private final String gameId;
    private final String playerId;
    private final String sessionId;
    private final long connectedAt;
    private volatile long lastPongTime;

    public Client(ClientChannel channel, PriorityOutbox outbox, String gameId, String playerId, String sessionId, long now) {
        this.channel = channel;
        this.outbox = outbox;
        this.gameId = gameId;
        this.playerId = playerId;
        this.sessionId = sessionId;
        this.connectedAt = now;
        this.lastPongTime = now;
    }

    public ClientChannel channel() { return channel; }
    public PriorityOutbox outbox() { return outbox; }
    public String gameId() { return gameId; }
    public String playerId() { return playerId; }
    public String sessionId() { return sessionId; }
    public long connectedAt() { return connectedAt; }
    public long lastPongTime() { return lastPongTime; }

    public void markPong(long now) {
        this.lastPongTime = now;
    }

    @Override
    public String toString() {
        return gameId + "/" + playerId + "#" + sessionId;
    }
}
