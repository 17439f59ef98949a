package com.example.dndcombat.model;

/**
 * A condition applied to a participant. Immutable; state changes produce a new instance.
 *
 * {@code expiresAtRound} is the last round during which a timed condition is still in effect.
 */
public final class ActiveCondition {

    private final String id;
    private final String participantId;
    private final String conditionName;
    private final DurationType durationType;
    private final Integer durationValue;
    private final Integer saveDc;
    private final Ability saveAbility;
    private final int appliedAtRound;
    private final Integer expiresAtRound;
    private final String sourceDescription;
    private final boolean active;

    public ActiveCondition(String id, String participantId, String conditionName,
                           DurationType durationType, Integer durationValue,
                           Integer saveDc, Ability saveAbility,
                           int appliedAtRound, String sourceDescription) {
        this(id, participantId, conditionName, durationType, durationValue, saveDc, saveAbility,
            appliedAtRound, computeExpiry(durationType, durationValue, appliedAtRound), sourceDescription, true);
    }

    private ActiveCondition(String id, String participantId, String conditionName,
                            DurationType durationType, Integer durationValue,
                            Integer saveDc, Ability saveAbility, int appliedAtRound,
                            Integer expiresAtRound, String sourceDescription, boolean active) {
        this.id = id;
        this.participantId = participantId;
        this.conditionName = conditionName;
        this.durationType = durationType;
        this.durationValue = durationValue;
        this.saveDc = saveDc;
        this.saveAbility = saveAbility;
        this.appliedAtRound = appliedAtRound;
        this.expiresAtRound = expiresAtRound;
        this.sourceDescription = sourceDescription;
        this.active = active;
    }

    private static Integer computeExpiry(DurationType type, Integer value, int appliedAtRound) {
        if (type == null || !type.isTimed() || value == null) return null;
        return appliedAtRound + type.toRounds(value) - 1;
    }

    public String getId() { return id; }
    public String getParticipantId() { return participantId; }
    public String getConditionName() { return conditionName; }
    public DurationType getDurationType() { return durationType; }
    public Integer getDurationValue() { return durationValue; }
    public Integer getSaveDc() { return saveDc; }
    public Ability getSaveAbility() { return saveAbility; }
    public int getAppliedAtRound() { return appliedAtRound; }
    public Integer getExpiresAtRound() { return expiresAtRound; }
    public String getSourceDescription() { return sourceDescription; }
    public boolean isActive() { return active; }

    public boolean isExpiredAt(int round) {
        return active && expiresAtRound != null && round > expiresAtRound;
    }

    public boolean isSameCondition(String name) {
        return conditionName.equalsIgnoreCase(name);
    }

    /**
     * Whether this duration outlasts another: permanent beats until-save, which beats any
     * timed duration; timed durations compare by their last active round.
     */
    public boolean outlasts(ActiveCondition other) {
        int rank = durationRank();
        int otherRank = other.durationRank();
        if (rank != otherRank) return rank > otherRank;
        if (expiresAtRound != null && other.expiresAtRound != null) {
            return expiresAtRound > other.expiresAtRound;
        }
        return false;
    }

    private int durationRank() {
        switch (durationType) {
            case PERMANENT: return 2;
            case UNTIL_SAVE: return 1;
            default: return 0;
        }
    }

    public ActiveCondition deactivate() {
        return new ActiveCondition(id, participantId, conditionName, durationType, durationValue,
            saveDc, saveAbility, appliedAtRound, expiresAtRound, sourceDescription, false);
    }

    /** Keeps this condition's identity but takes the duration of a longer application. */
    public ActiveCondition withDurationOf(ActiveCondition longer) {
        return new ActiveCondition(id, participantId, conditionName, longer.durationType, longer.durationValue,
            longer.saveDc, longer.saveAbility, longer.appliedAtRound, longer.expiresAtRound,
            longer.sourceDescription, true);
    }

    @Override
    public String toString() {
        return "ActiveCondition[" + conditionName + " on " + participantId + ", " + durationType.key
            + (expiresAtRound != null ? " until R" + expiresAtRound : "")
            + (saveDc != null ? " DC" + saveDc + " " + saveAbility : "")
            + (active ? "" : ", inactive") + "]";
    }
}
