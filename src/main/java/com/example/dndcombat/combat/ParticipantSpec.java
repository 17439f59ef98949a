package com.example.dndcombat.combat;

import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.IdentityRef;

import java.util.Objects;

/**
 * What the caller supplies to put someone into an encounter.
 *
 * @param currentHp  starting HP, null for full health
 * @param initiative a natural d20 initiative roll made up front, or null to roll later
 */
public record ParticipantSpec(
    IdentityRef identity,
    String name,
    int initiativeModifier,
    int maxHp,
    Integer currentHp,
    CreatureStats stats,
    Integer initiative
) {
    public ParticipantSpec {
        Objects.requireNonNull(identity, "identity");
        if (maxHp <= 0) {
            throw new ValidationException("maxHp must be positive: " + maxHp);
        }
        if (currentHp != null && (currentHp < 0 || currentHp > maxHp)) {
            throw new ValidationException("currentHp must be between 0 and maxHp: " + currentHp);
        }
        if (initiative != null) {
            ValidationException.requireD20("initiative", initiative);
        }
    }

    public static ParticipantSpec of(IdentityRef identity, String name, int initiativeModifier, int maxHp, CreatureStats stats) {
        return new ParticipantSpec(identity, name, initiativeModifier, maxHp, null, stats, null);
    }

    /** An ad-hoc participant identified only by name. */
    public static ParticipantSpec adHoc(String name, int initiativeModifier, int maxHp, int armorClass) {
        return of(IdentityRef.adHoc(name), name, initiativeModifier, maxHp, CreatureStats.of(armorClass));
    }

    public ParticipantSpec withCurrentHp(int hp) {
        return new ParticipantSpec(identity, name, initiativeModifier, maxHp, hp, stats, initiative);
    }

    public ParticipantSpec withInitiative(int roll) {
        return new ParticipantSpec(identity, name, initiativeModifier, maxHp, currentHp, stats, roll);
    }
}
