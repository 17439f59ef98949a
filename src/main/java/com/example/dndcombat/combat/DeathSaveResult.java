package com.example.dndcombat.combat;

/**
 * Outcome of one death saving throw and the counters it left behind.
 */
public record DeathSaveResult(
    String participantId,
    int roll,
    int successesAdded,
    int failuresAdded,
    int successes,
    int failures,
    boolean revived,
    boolean stable,
    boolean dead
) {
    public boolean isSuccess() {
        return successesAdded > 0 || revived;
    }
}
