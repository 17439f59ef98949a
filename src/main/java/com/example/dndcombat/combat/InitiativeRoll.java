package com.example.dndcombat.combat;

import com.example.dndcombat.dice.RollMode;

import java.util.List;

/**
 * Outcome of an initiative roll.
 *
 * @param rolls    every d20 face rolled (one when the caller supplied the roll)
 * @param kept     the face that counts
 * @param turnOrderAssigned true when this roll completed the set and turn order was (re)computed
 */
public record InitiativeRoll(
    String participantId,
    List<Integer> rolls,
    int kept,
    RollMode mode,
    int modifier,
    int total,
    boolean supplied,
    boolean turnOrderAssigned
) {
    public InitiativeRoll {
        rolls = List.copyOf(rolls);
    }
}
