package com.kekopoly.shared.dto;

import java.util.List;

import com.kekopoly.shared.util.GameStatus;

public record ActivePlayersDTO(
    String gameId,
    String hostId,
    int maxPlayers,
    GameStatus status,
    boolean gameStarted,
    List<PlayerInfoDTO> players
) {}
