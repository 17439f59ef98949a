package com.example.dndcombat.dice;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Dice backed by a PRNG. Unseeded instances use {@link ThreadLocalRandom}; a seed gives a
 * reproducible sequence for replays.
 */
public class RandomDiceRoller implements DiceRoller {

    private final Random seeded;

    public RandomDiceRoller() {
        this.seeded = null;
    }

    public RandomDiceRoller(long seed) {
        this.seeded = new Random(seed);
    }

    @Override
    public int roll(int sides) {
        if (sides < 2) {
            throw new IllegalArgumentException("a die needs at least 2 sides: " + sides);
        }
        if (seeded != null) {
            return seeded.nextInt(sides) + 1;
        }
        return ThreadLocalRandom.current().nextInt(sides) + 1;
    }
}
