package com.example.dndcombat.model;

/**
 * The thirteen damage types of D&D 5E.
 */
public enum DamageType {
    ACID("acid", "Acid"),
    BLUDGEONING("bludgeoning", "Bludgeoning"),
    COLD("cold", "Cold"),
    FIRE("fire", "Fire"),
    FORCE("force", "Force"),
    LIGHTNING("lightning", "Lightning"),
    NECROTIC("necrotic", "Necrotic"),
    PIERCING("piercing", "Piercing"),
    POISON("poison", "Poison"),
    PSYCHIC("psychic", "Psychic"),
    RADIANT("radiant", "Radiant"),
    SLASHING("slashing", "Slashing"),
    THUNDER("thunder", "Thunder");

    public final String key;
    public final String displayName;

    DamageType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static DamageType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (DamageType t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
