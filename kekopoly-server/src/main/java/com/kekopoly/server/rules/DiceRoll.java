package com.kekopoly.server.rules;

import java.util.List;

public record DiceRoll(int die1, int die2) {

    public DiceRoll {
        if (die1 < 1 || die1 > 6 || die2 < 1 || die2 > 6) {
            throw new IllegalArgumentException("Dice must be 1..6, got " + die1 + "," + die2);
        }
    }

    public int sum() {
        return die1 + die2;
    }

    public boolean doubles() {
        return die1 == die2;
    }

    public List<Integer> asList() {
        return List.of(die1, die2);
    }
}
