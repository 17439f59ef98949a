package com.example.dndcombat.combat;

import com.example.dndcombat.model.DamageType;

/**
 * What one application of damage did to a participant.
 */
public record DamageResult(
    String participantId,
    int rawAmount,
    DamageType damageType,
    DamageModifier modifier,
    int modifiedAmount,
    int tempHpAbsorbed,
    int hpLost,
    int currentHp,
    int tempHp,
    boolean critical,
    boolean droppedToZero,
    boolean killed,
    boolean massiveDamage,
    int deathSaveFailuresAdded,
    long damageLogId
) {
    /** Which damage-type rule changed the raw amount. */
    public enum DamageModifier {
        NONE,
        IMMUNE,
        VULNERABLE,
        RESISTANT
    }
}
