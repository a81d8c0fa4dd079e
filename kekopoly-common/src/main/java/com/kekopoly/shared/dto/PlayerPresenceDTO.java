package com.kekopoly.shared.dto;

public record PlayerPresenceDTO(String gameId, String playerId, long timestamp) {}
