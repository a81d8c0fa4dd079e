package com.kekopoly.shared.dto;

public record JailEventDTO(String gameId, String playerId, boolean inJail, int jailTurns, boolean released, int position) {}
