package com.example.dndcombat.combat;

/**
 * Temporary hit points never stack: the larger of the old and new pool is kept.
 */
public record TempHpResult(String participantId, int previous, int requested, int tempHp) {

    public boolean replaced() {
        return tempHp != previous;
    }
}
