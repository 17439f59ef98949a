package com.example.dndcombat.condition;

/**
 * The kinds of d20 roll a condition can modify.
 * Targets ending in "against" apply to rolls made by others against the affected creature.
 */
public enum RollTarget {
    ATTACK_ROLLS("attack_rolls"),
    ATTACKS_AGAINST("attacks_against"),
    MELEE_ATTACKS_AGAINST("melee_attacks_against"),
    RANGED_ATTACKS_AGAINST("ranged_attacks_against"),
    ABILITY_CHECKS("ability_checks"),
    SIGHT_CHECKS("sight_checks"),
    HEARING_CHECKS("hearing_checks"),
    STRENGTH_SAVES("strength_saves"),
    DEXTERITY_SAVES("dexterity_saves"),
    CHARMER_SOCIAL_CHECKS("charmer_social_checks");

    public final String key;

    RollTarget(String key) {
        this.key = key;
    }

    public static RollTarget fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (RollTarget t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
