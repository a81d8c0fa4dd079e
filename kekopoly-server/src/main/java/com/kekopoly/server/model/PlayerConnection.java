package com.kekopoly.server.model;

public class PlayerConnection {
    private final String playerId;
    private final String sessionId;
    private final long connectedAt;
    private boolean connected;
    private Long disconnectedAt;

    public PlayerConnection(String playerId, String sessionId, long connectedAt) {
        this.playerId = playerId;
        this.sessionId = sessionId;
        this.connectedAt = connectedAt;
        this.connected = true;
    }

    public String getPlayerId() { return playerId; }
    public String getSessionId() { return sessionId; }
    public long getConnectedAt() { return connectedAt; }
    public boolean isConnected() { return connected; }
    public Long getDisconnectedAt() { return disconnectedAt; }

    public void markDisconnected(long at) {
        this.connected = false;
        this.disconnectedAt = at;
    }
}
