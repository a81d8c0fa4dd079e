package com.kekopoly.server.rules;

public interface DiceRoller {
    DiceRoll roll();
}
