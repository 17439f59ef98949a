package com.example.dndcombat.model;

/**
 * Ability scores, used here to tag saving throws.
 */
public enum Ability {
    STRENGTH("str", "Strength"),
    DEXTERITY("dex", "Dexterity"),
    CONSTITUTION("con", "Constitution"),
    INTELLIGENCE("int", "Intelligence"),
    WISDOM("wis", "Wisdom"),
    CHARISMA("cha", "Charisma");

    public final String key;
    public final String displayName;

    Ability(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static Ability fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Ability a : values()) {
            if (a.key.equals(k) || a.name().toLowerCase().equals(k)) return a;
        }
        return null;
    }
}
