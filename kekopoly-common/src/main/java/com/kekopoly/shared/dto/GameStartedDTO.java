package com.kekopoly.shared.dto;

import java.util.List;

import com.kekopoly.shared.util.GameStatus;

public record GameStartedDTO(
    String gameId,
    GameStatus status,
    String currentTurn,
    List<String> turnOrder,
    List<PlayerStateDTO> players,
    long timestamp
) {}
