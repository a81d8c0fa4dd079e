package com.kekopoly.shared.dto;

public record ReconnectionDTO(String gameId, String playerId, String sessionId, String previousSessionId, long timestamp) {}
