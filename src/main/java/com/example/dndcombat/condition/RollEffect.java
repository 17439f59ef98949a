package com.example.dndcombat.condition;

import com.example.dndcombat.dice.RollMode;

/**
 * What a condition does to a roll. NORMAL only appears in aggregated results, where it marks
 * advantage and disadvantage that cancelled each other.
 */
public enum RollEffect {
    NORMAL("normal"),
    ADVANTAGE("advantage"),
    DISADVANTAGE("disadvantage"),
    AUTO_FAIL("auto_fail");

    public final String key;

    RollEffect(String key) {
        this.key = key;
    }

    public RollMode toRollMode() {
        switch (this) {
            case ADVANTAGE: return RollMode.ADVANTAGE;
            case DISADVANTAGE: return RollMode.DISADVANTAGE;
            default: return RollMode.NORMAL;
        }
    }

    public static RollEffect fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (RollEffect e : values()) if (e.key.equals(k)) return e;
        return null;
    }
}
