package com.kekopoly.shared.dto;

public record TurnChangedDTO(String gameId, String previousTurn, String currentTurn, String reason) {}
