package com.kekopoly.server.rules;

import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.model.Player;

/**
 * Applies every action kind except dice rolls and turn ends, which the
 * registry handles itself. Called with the session lock held; throw a
 * {@link com.kekopoly.server.error.GameException} to reject without
 * changing anything.
 */
public interface RuleBook {

    ActionOutcome apply(Game game, Player actor, GameAction action);

    /** Seeds the opaque board sub-state of a new game. */
    void initBoard(Game game);
}
