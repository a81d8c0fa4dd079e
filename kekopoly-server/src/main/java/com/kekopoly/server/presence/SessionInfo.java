package com.kekopoly.server.presence;

import java.time.Instant;

public record SessionInfo(
    String sessionId,
    Instant connectedAt,
    Instant disconnectedAt,
    Instant lastActivity,
    String clientInfo,
    SessionStatus status
) {

    SessionInfo withStatus(SessionStatus newStatus, Instant at) {
        Instant disconnected = newStatus == SessionStatus.DISCONNECTED ? at : disconnectedAt;
        return new SessionInfo(sessionId, connectedAt, disconnected, at, clientInfo, newStatus);
    }

    SessionInfo touched(Instant at) {
        return new SessionInfo(sessionId, connectedAt, disconnectedAt, at, clientInfo, status);
    }
}
