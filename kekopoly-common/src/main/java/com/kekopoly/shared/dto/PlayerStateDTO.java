package com.kekopoly.shared.dto;

import java.util.List;

import com.kekopoly.shared.util.PlayerStatus;

public record PlayerStateDTO(
    String id,
    PlayerStatus status,
    String characterToken,
    int position,
    long balance,
    long netWorth,
    List<String> properties,
    boolean inJail,
    int jailTurns,
    Long disconnectedAt
) {}
