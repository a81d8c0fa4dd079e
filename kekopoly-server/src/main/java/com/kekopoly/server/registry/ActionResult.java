package com.kekopoly.server.registry;

import java.util.List;

import com.kekopoly.server.rules.DiceRoll;
import com.kekopoly.shared.util.ActionType;
import com.kekopoly.shared.util.GameStatus;

/** Outcome of one accepted action; {@code roll} is null unless dice were thrown. */
public record ActionResult(
    String gameId,
    String playerId,
    ActionType action,
    DiceRoll roll,
    String currentTurn,
    GameStatus status,
    List<GameEvent> events
) {}
