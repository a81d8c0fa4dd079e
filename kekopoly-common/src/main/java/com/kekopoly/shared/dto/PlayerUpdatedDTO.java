package com.kekopoly.shared.dto;

public record PlayerUpdatedDTO(String gameId, PlayerInfoDTO player) {}
