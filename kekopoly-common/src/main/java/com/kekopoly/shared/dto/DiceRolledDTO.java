package com.kekopoly.shared.dto;

import java.util.List;

public record DiceRolledDTO(
    String gameId,
    String playerId,
    String requestId,
    List<Integer> dice,
    boolean doubles,
    int fromPosition,
    int position,
    long balance,
    boolean passedStart,
    boolean extraTurn
) {}
