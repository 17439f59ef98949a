package com.example.dndcombat.combat;

import com.example.dndcombat.model.DamageType;

/**
 * A single-target attack with the caller's rolls already made.
 *
 * @param damageRoll       total damage as rolled; on a critical it already includes the doubled dice
 * @param targetAcOverride AC to use instead of the target's stats (cover, spells), or null
 */
public record AttackRequest(
    String attackerId,
    String targetId,
    int attackRollTotal,
    boolean natural20,
    boolean natural1,
    int damageRoll,
    DamageType damageType,
    Integer targetAcOverride,
    String description
) {
    public static AttackRequest of(String attackerId, String targetId, int attackRollTotal,
                                   boolean natural20, boolean natural1, int damageRoll, DamageType damageType) {
        return new AttackRequest(attackerId, targetId, attackRollTotal, natural20, natural1, damageRoll,
            damageType, null, null);
    }

    public AttackRequest withTargetAc(int armorClass) {
        return new AttackRequest(attackerId, targetId, attackRollTotal, natural20, natural1, damageRoll,
            damageType, armorClass, description);
    }

    public AttackRequest withDescription(String text) {
        return new AttackRequest(attackerId, targetId, attackRollTotal, natural20, natural1, damageRoll,
            damageType, targetAcOverride, text);
    }
}
