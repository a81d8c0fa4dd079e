package com.kekopoly.shared.dto;

import java.util.List;

public record GameTurnDTO(String gameId, String currentTurn, List<String> turnOrder) {}
