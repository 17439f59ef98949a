package com.example.dndcombat;

import com.example.dndcombat.combat.ConditionTracker;
import com.example.dndcombat.combat.DamageResolver;
import com.example.dndcombat.combat.DamageResult;
import com.example.dndcombat.combat.Encounter;
import com.example.dndcombat.combat.HealResult;
import com.example.dndcombat.combat.TempHpResult;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.ParticipantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for damage modifiers, temporary HP, dropping to 0 HP and healing.
 */
class DamageResolverTest {

    private ConditionTracker conditions;
    private DamageResolver resolver;
    private Encounter encounter;

    @BeforeEach
    void setUp() {
        conditions = new ConditionTracker(EncounterFixtures.LIBRARY);
        resolver = new DamageResolver(conditions, true);
        encounter = EncounterFixtures.encounter();
    }

    // === Damage type modifiers ===

    @ParameterizedTest(name = "{0}: {1} slashing -> {2}")
    @CsvSource({
        "none,          9, 9",
        "resistant,    10, 5",
        "resistant,     7, 3",
        "resistant,     1, 0",
        "vulnerable,    7, 14",
        "immune,       12, 0",
        "everything,   10, 0",
        "vuln_and_res, 10, 20"
    })
    @DisplayName("Immunity beats vulnerability, which beats resistance")
    void damageModifiers(String profile, int raw, int expected) {
        CreatureStats stats = CreatureStats.of(12);
        switch (profile) {
            case "resistant": stats = stats.withResistances(DamageType.SLASHING); break;
            case "vulnerable": stats = stats.withVulnerabilities(DamageType.SLASHING); break;
            case "immune": stats = stats.withImmunities(DamageType.SLASHING); break;
            case "everything":
                stats = stats.withResistances(DamageType.SLASHING)
                    .withVulnerabilities(DamageType.SLASHING)
                    .withImmunities(DamageType.SLASHING);
                break;
            case "vuln_and_res":
                stats = stats.withResistances(DamageType.SLASHING).withVulnerabilities(DamageType.SLASHING);
                break;
            default: break;
        }
        String target = EncounterFixtures.add(encounter, "Target", 100, stats, 0);

        DamageResult result = resolver.applyDamage(encounter, target, raw, DamageType.SLASHING, null, "test", false);

        assertEquals(expected, result.modifiedAmount());
        assertEquals(100 - expected, encounter.status(target).getCurrentHp());
    }

    @Test
    @DisplayName("Resistance to another type does not reduce slashing")
    void resistanceIsPerType() {
        String target = EncounterFixtures.add(encounter, "Target", 30,
            CreatureStats.of(12).withResistances(DamageType.FIRE), 0);
        DamageResult result = resolver.applyDamage(encounter, target, 8, DamageType.SLASHING, null, null, false);
        assertEquals(DamageResult.DamageModifier.NONE, result.modifier());
        assertEquals(8, result.modifiedAmount());
    }

    @Test
    @DisplayName("Petrified grants resistance to all damage and immunity to poison")
    void petrifiedModifiesDamage() {
        String target = EncounterFixtures.add(encounter, "Statue", 40);
        conditions.apply(encounter, target, "Petrified", DurationType.PERMANENT, null, null, null, "gaze");

        DamageResult fire = resolver.applyDamage(encounter, target, 9, DamageType.FIRE, null, null, false);
        DamageResult poison = resolver.applyDamage(encounter, target, 9, DamageType.POISON, null, null, false);

        assertEquals(4, fire.modifiedAmount());
        assertEquals(DamageResult.DamageModifier.RESISTANT, fire.modifier());
        assertEquals(0, poison.modifiedAmount());
        assertEquals(DamageResult.DamageModifier.IMMUNE, poison.modifier());
    }

    // === Temporary hit points ===

    @Test
    @DisplayName("Temp HP absorbs damage before hit points")
    void tempHpAbsorbsFirst() {
        String target = EncounterFixtures.add(encounter, "Fighter", 20);
        resolver.setTempHp(encounter, target, 5);

        DamageResult result = resolver.applyDamage(encounter, target, 8, DamageType.BLUDGEONING, null, null, false);

        assertEquals(5, result.tempHpAbsorbed());
        assertEquals(3, result.hpLost());
        assertEquals(0, encounter.status(target).getTempHp());
        assertEquals(17, encounter.status(target).getCurrentHp());
    }

    @Test
    @DisplayName("Temp HP keeps the larger pool and never stacks")
    void tempHpTakesMaximum() {
        String target = EncounterFixtures.add(encounter, "Cleric", 20);

        resolver.setTempHp(encounter, target, 5);
        TempHpResult lower = resolver.setTempHp(encounter, target, 3);
        assertEquals(5, lower.tempHp());
        assertFalse(lower.replaced());

        TempHpResult higher = resolver.setTempHp(encounter, target, 8);
        assertEquals(8, higher.tempHp());
        assertTrue(higher.replaced());
    }

    // === Dropping to 0 HP ===

    @Test
    @DisplayName("Dropping to 0 HP knocks a participant unconscious with fresh counters")
    void dropToZero() {
        String target = EncounterFixtures.add(encounter, "Rogue", 10);

        DamageResult result = resolver.applyDamage(encounter, target, 15, DamageType.PIERCING, null, null, false);

        ParticipantStatus s = encounter.status(target);
        assertTrue(result.droppedToZero());
        assertFalse(result.killed());
        assertEquals(0, s.getCurrentHp());
        assertFalse(s.isConscious());
        assertTrue(s.isDying());
        assertEquals(0, s.getDeathSaveSuccesses());
        assertEquals(0, s.getDeathSaveFailures());
    }

    @Test
    @DisplayName("Overflow damage of at least max HP kills outright")
    void massiveDamageKills() {
        String target = EncounterFixtures.add(encounter, "Wizard", 10);

        DamageResult result = resolver.applyDamage(encounter, target, 20, DamageType.FORCE, null, null, false);

        assertTrue(result.killed());
        assertTrue(result.massiveDamage());
        assertTrue(encounter.status(target).isDead());
    }

    @Test
    @DisplayName("Massive damage can be switched off")
    void massiveDamageDisabled() {
        DamageResolver lenient = new DamageResolver(conditions, false);
        String target = EncounterFixtures.add(encounter, "Wizard", 10);

        DamageResult result = lenient.applyDamage(encounter, target, 20, DamageType.FORCE, null, null, false);

        assertFalse(result.killed());
        assertTrue(encounter.status(target).isDying());
    }

    @Test
    @DisplayName("Damage at 0 HP adds a death-save failure, two on a critical")
    void damageWhileDying() {
        String target = EncounterFixtures.add(encounter, "Bard", 12);
        resolver.applyDamage(encounter, target, 12, DamageType.SLASHING, null, null, false);

        DamageResult hit = resolver.applyDamage(encounter, target, 3, DamageType.SLASHING, null, null, false);
        assertEquals(1, hit.deathSaveFailuresAdded());
        assertEquals(1, encounter.status(target).getDeathSaveFailures());

        DamageResult crit = resolver.applyDamage(encounter, target, 3, DamageType.SLASHING, null, null, true);
        assertEquals(2, crit.deathSaveFailuresAdded());
        assertTrue(encounter.status(target).isDead());
    }

    @Test
    @DisplayName("Damage to a stable participant clears stability")
    void damageBreaksStability() {
        String target = EncounterFixtures.add(encounter, "Monk", 12);
        resolver.applyDamage(encounter, target, 12, DamageType.SLASHING, null, null, false);
        for (int i = 0; i < 3; i++) {
            resolver.rollDeathSave(encounter, target, 15);
        }
        assertTrue(encounter.status(target).isStable());

        resolver.applyDamage(encounter, target, 1, DamageType.SLASHING, null, null, false);

        assertFalse(encounter.status(target).isStable());
        assertEquals(1, encounter.status(target).getDeathSaveFailures());
    }

    @Test
    void damageToDeadParticipantIsRejected() {
        String target = EncounterFixtures.add(encounter, "Goblin", 7);
        resolver.applyDamage(encounter, target, 50, DamageType.FIRE, null, null, false);

        assertThrows(InvalidStateException.class,
            () -> resolver.applyDamage(encounter, target, 1, DamageType.FIRE, null, null, false));
        assertThrows(InvalidStateException.class, () -> resolver.heal(encounter, target, 5, null));
    }

    @Test
    void negativeAmountsAreRejected() {
        String target = EncounterFixtures.add(encounter, "Goblin", 7);
        assertThrows(ValidationException.class,
            () -> resolver.applyDamage(encounter, target, -1, DamageType.FIRE, null, null, false));
        assertThrows(ValidationException.class, () -> resolver.heal(encounter, target, -3, null));
        assertThrows(ValidationException.class, () -> resolver.setTempHp(encounter, target, -2));
    }

    // === Damage log ===

    @Test
    @DisplayName("Every application appends one log entry, even when immune")
    void damageLogAlwaysAppends() {
        String target = EncounterFixtures.add(encounter, "Golem", 50,
            CreatureStats.of(16).withImmunities(DamageType.PSYCHIC), 0);

        resolver.applyDamage(encounter, target, 10, DamageType.PSYCHIC, null, "mind blast", false);
        resolver.applyDamage(encounter, target, 4, DamageType.BLUDGEONING, null, "club", true);

        assertEquals(2, encounter.getDamageLog().size());
        DamageLogEntry first = encounter.getDamageLog().get(0);
        assertEquals(0, first.amount());
        assertEquals(10, first.rawAmount());
        assertEquals("mind blast", first.sourceDescription());
        assertTrue(encounter.getDamageLog().get(1).critical());
    }

    // === Healing ===

    @Test
    @DisplayName("Healing caps at max HP and reports overheal")
    void healCapsAtMax() {
        String target = EncounterFixtures.add(encounter, "Paladin", 20);
        resolver.applyDamage(encounter, target, 6, DamageType.SLASHING, null, null, false);

        HealResult result = resolver.heal(encounter, target, 10, "cure wounds");

        assertEquals(6, result.applied());
        assertEquals(4, result.overheal());
        assertEquals(20, result.currentHp());
        assertFalse(result.revived());
    }

    @Test
    @DisplayName("Healing an unconscious participant revives them and resets death saves")
    void healRevives() {
        String target = EncounterFixtures.add(encounter, "Ranger", 12);
        resolver.applyDamage(encounter, target, 12, DamageType.SLASHING, null, null, false);
        resolver.rollDeathSave(encounter, target, 4);

        HealResult result = resolver.heal(encounter, target, 3, "healing word");

        ParticipantStatus s = encounter.status(target);
        assertTrue(result.revived());
        assertTrue(s.isConscious());
        assertEquals(3, s.getCurrentHp());
        assertEquals(0, s.getDeathSaveFailures());
    }
}
