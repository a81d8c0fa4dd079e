package com.kekopoly.shared.dto;

import com.kekopoly.shared.util.GameStatus;

public record GameInfoDTO(
    String gameId,
    String code,
    String name,
    GameStatus status,
    String hostId,
    String currentTurn,
    int maxPlayers,
    int playerCount,
    boolean gameStarted
) {}
