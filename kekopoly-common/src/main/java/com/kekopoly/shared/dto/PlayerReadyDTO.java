package com.kekopoly.shared.dto;

public record PlayerReadyDTO(String gameId, String playerId, boolean ready, String messageId) {}
