package com.example.dndcombat.model;

/**
 * How long an applied condition lasts.
 * Minutes and hours are converted to rounds at six seconds per round.
 */
public enum DurationType {
    ROUNDS("rounds", 1),
    MINUTES("minutes", 10),
    HOURS("hours", 600),
    UNTIL_SAVE("until_save", 0),
    PERMANENT("permanent", 0);

    public final String key;
    private final int roundsPerUnit;

    DurationType(String key, int roundsPerUnit) {
        this.key = key;
        this.roundsPerUnit = roundsPerUnit;
    }

    public String getKey() { return key; }

    /** True for durations measured on the round counter. */
    public boolean isTimed() { return roundsPerUnit > 0; }

    public int toRounds(int value) {
        return value * roundsPerUnit;
    }

    public static DurationType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (DurationType d : values()) {
            if (d.key.equals(k) || d.name().toLowerCase().equals(k)) return d;
        }
        return null;
    }
}
