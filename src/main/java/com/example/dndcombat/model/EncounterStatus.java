package com.example.dndcombat.model;

/**
 * Lifecycle of an encounter.
 */
public enum EncounterStatus {

    /** Participants are being gathered and initiative rolled */
    SETUP("Setup"),

    /** Turns are being taken */
    ACTIVE("Active"),

    /** Temporarily halted; reads still allowed, turn and attack mutations are not */
    PAUSED("Paused"),

    /** Finished. Terminal. */
    COMPLETED("Completed");

    private final String displayName;

    EncounterStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
