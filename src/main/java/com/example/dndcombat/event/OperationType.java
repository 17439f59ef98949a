package com.example.dndcombat.event;

/**
 * Kind of committed mutation an {@link EncounterEvent} reports.
 */
public enum OperationType {
    ENCOUNTER_CREATED("encounter_created"),
    PARTICIPANT_ADDED("participant_added"),
    INITIATIVE_ROLLED("initiative_rolled"),
    INITIATIVE_REORDERED("initiative_reordered"),
    COMBAT_STARTED("combat_started"),
    COMBAT_PAUSED("combat_paused"),
    COMBAT_RESUMED("combat_resumed"),
    COMBAT_ENDED("combat_ended"),
    TURN_ADVANCED("turn_advanced"),
    PARTICIPANT_REMOVED("participant_removed"),
    ATTACK_RESOLVED("attack_resolved"),
    AOE_RESOLVED("aoe_resolved"),
    DAMAGE_APPLIED("damage_applied"),
    HEALED("healed"),
    TEMP_HP_SET("temp_hp_set"),
    DEATH_SAVE_ROLLED("death_save_rolled"),
    CONDITION_APPLIED("condition_applied"),
    CONDITION_REMOVED("condition_removed"),
    SAVE_ATTEMPTED("save_attempted");

    public final String key;

    OperationType(String key) {
        this.key = key;
    }

    /** Operations that can change hit points and therefore add damage-log entries. */
    public boolean touchesHitPoints() {
        switch (this) {
            case ATTACK_RESOLVED:
            case AOE_RESOLVED:
            case DAMAGE_APPLIED:
            case HEALED:
            case TEMP_HP_SET:
            case DEATH_SAVE_ROLLED:
                return true;
            default:
                return false;
        }
    }

    public static OperationType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (OperationType t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
