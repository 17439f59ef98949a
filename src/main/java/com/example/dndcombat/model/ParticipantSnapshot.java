package com.example.dndcombat.model;

import java.util.List;

/**
 * Immutable view of one participant as of a committed encounter version.
 */
public record ParticipantSnapshot(
    String id,
    IdentityRef identity,
    String name,
    Integer initiative,
    int initiativeModifier,
    Integer turnOrder,
    boolean active,
    int armorClass,
    int currentHp,
    int maxHp,
    int tempHp,
    boolean conscious,
    boolean stable,
    boolean dead,
    int deathSaveSuccesses,
    int deathSaveFailures,
    List<ActiveCondition> conditions
) {
    public ParticipantSnapshot {
        conditions = List.copyOf(conditions);
    }

    public static ParticipantSnapshot of(Participant p, ParticipantStatus s, List<ActiveCondition> conditions) {
        return new ParticipantSnapshot(p.getId(), p.getIdentity(), p.getName(), p.getInitiative(),
            p.getInitiativeModifier(), p.getTurnOrder(), p.isActive(), p.getStats().armorClass(),
            s.getCurrentHp(), s.getMaxHp(), s.getTempHp(), s.isConscious(), s.isStable(), s.isDead(),
            s.getDeathSaveSuccesses(), s.getDeathSaveFailures(), conditions);
    }

    public boolean hasCondition(String conditionName) {
        return conditions.stream().anyMatch(c -> c.isActive() && c.isSameCondition(conditionName));
    }
}
