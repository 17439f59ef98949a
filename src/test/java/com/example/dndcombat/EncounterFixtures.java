package com.example.dndcombat;

import com.example.dndcombat.combat.Encounter;
import com.example.dndcombat.combat.ParticipantSpec;
import com.example.dndcombat.condition.ConditionsLibrary;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.IdentityRef;
import com.example.dndcombat.model.Participant;
import com.example.dndcombat.model.ParticipantStatus;

/**
 * Shared fixtures for tests that drive the rule components directly.
 */
public final class EncounterFixtures {

    public static final ConditionsLibrary LIBRARY = ConditionsLibrary.loadDefault();

    private EncounterFixtures() { }

    public static Encounter encounter() {
        return new Encounter("enc-1", "session-1");
    }

    public static String add(Encounter e, String name, int maxHp) {
        return add(e, name, maxHp, CreatureStats.of(12), 0);
    }

    public static String add(Encounter e, String name, int maxHp, CreatureStats stats, int initiativeModifier) {
        String id = e.nextParticipantId();
        Participant p = new Participant(id, e.getId(), IdentityRef.adHoc(name), name, initiativeModifier, stats,
            e.participantCount());
        e.addParticipant(p, new ParticipantStatus(id, maxHp, maxHp));
        return id;
    }

    public static ParticipantSpec spec(String name, int initiativeModifier, int maxHp, int armorClass) {
        return ParticipantSpec.adHoc(name, initiativeModifier, maxHp, armorClass);
    }
}
