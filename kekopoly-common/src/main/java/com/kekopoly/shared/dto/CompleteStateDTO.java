package com.kekopoly.shared.dto;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.kekopoly.shared.util.GameStatus;
import com.kekopoly.shared.util.MarketCondition;

public record CompleteStateDTO(
    String gameId,
    String code,
    String name,
    GameStatus status,
    String hostId,
    String currentTurn,
    List<String> turnOrder,
    int maxPlayers,
    List<PlayerStateDTO> players,
    MarketCondition marketCondition,
    String winnerId,
    JsonNode board,
    long timestamp
) {}
