package com.example.dndcombat.model;

/**
 * Hit points and death-save state of one participant.
 *
 * At 0 HP a participant is in exactly one of three states: dying (rolls death saves),
 * stable (three successes, counters frozen) or dead (terminal).
 */
public class ParticipantStatus {

    public static final int MAX_DEATH_SAVES = 3;

    private final String participantId;
    private final int maxHp;
    private int currentHp;
    private int tempHp;
    private boolean conscious;
    private int deathSaveSuccesses;
    private int deathSaveFailures;
    private boolean stable;
    private boolean dead;

    public ParticipantStatus(String participantId, int maxHp, int currentHp) {
        if (maxHp <= 0) {
            throw new IllegalArgumentException("maxHp must be positive: " + maxHp);
        }
        this.participantId = participantId;
        this.maxHp = maxHp;
        this.currentHp = Math.max(0, Math.min(maxHp, currentHp));
        this.conscious = this.currentHp > 0;
    }

    public ParticipantStatus(ParticipantStatus other) {
        this.participantId = other.participantId;
        this.maxHp = other.maxHp;
        this.currentHp = other.currentHp;
        this.tempHp = other.tempHp;
        this.conscious = other.conscious;
        this.deathSaveSuccesses = other.deathSaveSuccesses;
        this.deathSaveFailures = other.deathSaveFailures;
        this.stable = other.stable;
        this.dead = other.dead;
    }

    public String getParticipantId() { return participantId; }
    public int getMaxHp() { return maxHp; }
    public int getCurrentHp() { return currentHp; }
    public int getTempHp() { return tempHp; }
    public boolean isConscious() { return conscious; }
    public int getDeathSaveSuccesses() { return deathSaveSuccesses; }
    public int getDeathSaveFailures() { return deathSaveFailures; }
    public boolean isStable() { return stable; }
    public boolean isDead() { return dead; }

    /** Unconscious at 0 HP and still rolling death saves. */
    public boolean isDying() {
        return !conscious && !stable && !dead;
    }

    public void setCurrentHp(int hp) {
        this.currentHp = Math.max(0, Math.min(maxHp, hp));
        if (this.currentHp > 0) {
            conscious = true;
            stable = false;
            resetDeathSaves();
        }
    }

    public void setTempHp(int tempHp) {
        this.tempHp = Math.max(0, tempHp);
    }

    /** Drops the participant to 0 HP, unconscious and dying with fresh counters. */
    public void fallUnconscious() {
        currentHp = 0;
        conscious = false;
        stable = false;
        resetDeathSaves();
    }

    public void addDeathSaveSuccesses(int count) {
        deathSaveSuccesses = Math.min(MAX_DEATH_SAVES, deathSaveSuccesses + count);
        if (deathSaveSuccesses >= MAX_DEATH_SAVES) {
            stable = true;
        }
    }

    public void addDeathSaveFailures(int count) {
        deathSaveFailures = Math.min(MAX_DEATH_SAVES, deathSaveFailures + count);
        stable = false;
        if (deathSaveFailures >= MAX_DEATH_SAVES) {
            die();
        }
    }

    public void die() {
        currentHp = 0;
        tempHp = 0;
        conscious = false;
        stable = false;
        dead = true;
    }

    public void resetDeathSaves() {
        deathSaveSuccesses = 0;
        deathSaveFailures = 0;
    }

    @Override
    public String toString() {
        return String.format("HP %d/%d (+%d temp)%s%s%s [S%d F%d]", currentHp, maxHp, tempHp,
            conscious ? "" : " unconscious", stable ? " stable" : "", dead ? " DEAD" : "",
            deathSaveSuccesses, deathSaveFailures);
    }
}
