package com.example.dndcombat.condition;

/**
 * Non-roll mechanical effects of conditions.
 */
public enum Restriction {
    NO_ACTIONS("no_actions"),
    NO_REACTIONS("no_reactions"),
    SPEED_ZERO("speed_zero"),
    NO_SPEED_BONUSES("no_speed_bonuses"),
    CRAWL_ONLY("crawl_only"),
    CANNOT_MOVE_CLOSER_TO_SOURCE("cannot_move_closer_to_source"),
    CANNOT_SPEAK("cannot_speak"),
    FALTERING_SPEECH("faltering_speech"),
    UNAWARE("unaware"),
    DROPS_HELD_ITEMS("drops_held_items"),
    CANNOT_ATTACK_CHARMER("cannot_attack_charmer"),
    CRITICAL_WITHIN_5_FEET("critical_within_5_feet"),
    RESISTANT_TO_ALL_DAMAGE("resistant_to_all_damage"),
    IMMUNE_TO_POISON("immune_to_poison"),
    HEAVILY_OBSCURED("heavily_obscured");

    public final String key;

    Restriction(String key) {
        this.key = key;
    }

    public static Restriction fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Restriction r : values()) if (r.key.equals(k)) return r;
        return null;
    }
}
