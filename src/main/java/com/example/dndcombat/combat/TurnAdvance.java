package com.example.dndcombat.combat;

import com.example.dndcombat.model.ActiveCondition;

import java.util.List;

/**
 * Result of advancing the turn.
 *
 * @param newRound          whether the advance wrapped around and started a new round
 * @param expiredConditions timed conditions that ended at the round boundary
 * @param savesDue          until-save conditions on the new current participant
 */
public record TurnAdvance(
    String previousParticipantId,
    String currentParticipantId,
    int round,
    boolean newRound,
    List<ActiveCondition> expiredConditions,
    List<SaveDue> savesDue
) {
    public TurnAdvance {
        expiredConditions = List.copyOf(expiredConditions);
        savesDue = List.copyOf(savesDue);
    }
}
