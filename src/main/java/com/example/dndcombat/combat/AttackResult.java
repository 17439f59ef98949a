package com.example.dndcombat.combat;

/**
 * Result of resolving an attack roll against one target.
 * Contains everything needed to narrate the attack.
 */
public class AttackResult {

    public enum ResultType {
        HIT,
        CRITICAL_HIT,
        MISS
    }

    private final ResultType type;
    private final String attackerId;
    private final String targetId;
    private final int attackRollTotal;
    private final int targetArmorClass;
    private final boolean natural20;
    private final boolean natural1;

    /** Damage as submitted by the caller, before resistances */
    private final int damageRoll;

    /** Null on a miss */
    private final DamageResult damage;

    private String message;

    private AttackResult(ResultType type, String attackerId, String targetId, int attackRollTotal,
                         int targetArmorClass, boolean natural20, boolean natural1, int damageRoll,
                         DamageResult damage) {
        this.type = type;
        this.attackerId = attackerId;
        this.targetId = targetId;
        this.attackRollTotal = attackRollTotal;
        this.targetArmorClass = targetArmorClass;
        this.natural20 = natural20;
        this.natural1 = natural1;
        this.damageRoll = damageRoll;
        this.damage = damage;
    }

    // Static factory methods

    public static AttackResult hit(AttackRequest request, int armorClass, DamageResult damage) {
        return new AttackResult(ResultType.HIT, request.attackerId(), request.targetId(), request.attackRollTotal(),
            armorClass, request.natural20(), request.natural1(), request.damageRoll(), damage);
    }

    public static AttackResult criticalHit(AttackRequest request, int armorClass, DamageResult damage) {
        return new AttackResult(ResultType.CRITICAL_HIT, request.attackerId(), request.targetId(),
            request.attackRollTotal(), armorClass, request.natural20(), request.natural1(), request.damageRoll(), damage);
    }

    public static AttackResult miss(AttackRequest request, int armorClass) {
        return new AttackResult(ResultType.MISS, request.attackerId(), request.targetId(), request.attackRollTotal(),
            armorClass, request.natural20(), request.natural1(), request.damageRoll(), null);
    }

    public ResultType getType() { return type; }
    public String getAttackerId() { return attackerId; }
    public String getTargetId() { return targetId; }
    public int getAttackRollTotal() { return attackRollTotal; }
    public int getTargetArmorClass() { return targetArmorClass; }
    public boolean isNatural20() { return natural20; }
    public boolean isNatural1() { return natural1; }
    public int getDamageRoll() { return damageRoll; }
    public DamageResult getDamage() { return damage; }

    public boolean isHit() { return type != ResultType.MISS; }
    public boolean isCritical() { return type == ResultType.CRITICAL_HIT; }

    /** Damage that got past modifiers, 0 on a miss. */
    public int getDamageDealt() {
        return damage != null ? damage.modifiedAmount() : 0;
    }

    public boolean isKill() {
        return damage != null && damage.killed();
    }

    public String getMessage() { return message; }
    public AttackResult setMessage(String message) { this.message = message; return this; }

    @Override
    public String toString() {
        return String.format("AttackResult[%s %s -> %s, roll=%d vs AC %d, damage=%d]",
            type, attackerId, targetId, attackRollTotal, targetArmorClass, getDamageDealt());
    }
}
