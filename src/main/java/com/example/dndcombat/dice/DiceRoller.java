package com.example.dndcombat.dice;

import java.util.ArrayList;
import java.util.List;

/**
 * Source of die rolls for the engine. Implementations decide whether rolls are random,
 * seeded, or replayed from a script, which keeps audit and replay deterministic.
 */
public interface DiceRoller {

    /**
     * Roll one die.
     * @param sides number of faces (at least 2)
     * @return a value in {@code [1, sides]}
     */
    int roll(int sides);

    default int d20() {
        return roll(20);
    }

    /**
     * Roll a d20, twice under advantage or disadvantage, keeping the higher or lower face.
     */
    default D20Roll rollD20(RollMode mode, int modifier) {
        List<Integer> faces = new ArrayList<>(2);
        faces.add(d20());
        if (mode != RollMode.NORMAL) {
            faces.add(d20());
        }
        return D20Roll.of(faces, mode, modifier);
    }
}
