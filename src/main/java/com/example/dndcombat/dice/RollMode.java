package com.example.dndcombat.dice;

/**
 * How a d20 is rolled. Advantage and disadvantage cancel to a normal roll no matter how many
 * sources impose each.
 */
public enum RollMode {
    NORMAL,
    ADVANTAGE,
    DISADVANTAGE;

    public static RollMode of(boolean advantage, boolean disadvantage) {
        if (advantage == disadvantage) return NORMAL;
        return advantage ? ADVANTAGE : DISADVANTAGE;
    }

    /** Keep the face this mode selects from the rolled faces. */
    public int select(int first, int second) {
        switch (this) {
            case ADVANTAGE: return Math.max(first, second);
            case DISADVANTAGE: return Math.min(first, second);
            default: return first;
        }
    }
}
