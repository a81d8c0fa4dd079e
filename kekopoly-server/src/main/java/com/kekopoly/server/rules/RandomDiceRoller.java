package com.kekopoly.server.rules;

import java.util.concurrent.ThreadLocalRandom;

public class RandomDiceRoller implements DiceRoller {

    @Override
    public DiceRoll roll() {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        return new DiceRoll(r.nextInt(1, 7), r.nextInt(1, 7));
    }
}
