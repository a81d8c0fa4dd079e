package com.kekopoly.shared.dto;

public record GameEndedDTO(String gameId, String winnerId, String reason) {}
