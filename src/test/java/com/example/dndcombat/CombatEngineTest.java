package com.example.dndcombat;

import com.example.dndcombat.combat.AoeRequest;
import com.example.dndcombat.combat.AttackRequest;
import com.example.dndcombat.combat.AttackResult;
import com.example.dndcombat.combat.CombatEngine;
import com.example.dndcombat.combat.ParticipantSpec;
import com.example.dndcombat.combat.TurnAdvance;
import com.example.dndcombat.config.EngineConfig;
import com.example.dndcombat.dice.ScriptedDiceRoller;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.NotFoundException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.event.EncounterEvent;
import com.example.dndcombat.event.OperationType;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.EncounterSnapshot;
import com.example.dndcombat.model.EncounterStatus;
import com.example.dndcombat.model.IdentityRef;
import com.example.dndcombat.model.ParticipantSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through the engine: lifecycle, atomicity, events, strict turns and concurrency.
 */
class CombatEngineTest {

    private ScriptedDiceRoller dice;
    private CombatEngine engine;

    @BeforeEach
    void setUp() {
        dice = new ScriptedDiceRoller();
        engine = new CombatEngine(EngineConfig.defaults(), EncounterFixtures.LIBRARY, dice);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private String idOf(EncounterSnapshot snap, String name) {
        return snap.participants().stream()
            .filter(p -> p.name().equals(name))
            .map(ParticipantSnapshot::id)
            .findFirst()
            .orElseThrow();
    }

    /** Aric (+2, AC 14) and Bandit (12 HP, AC 12, resists slashing), initiative rolled, not started. */
    private EncounterSnapshot twoParticipants() {
        ParticipantSpec aric = ParticipantSpec.of(IdentityRef.character("char-7"), "Aric", 2, 24, CreatureStats.of(14));
        ParticipantSpec bandit = ParticipantSpec.of(IdentityRef.creature("bandit"), "Bandit", 1, 12,
            CreatureStats.of(12).withResistances(DamageType.SLASHING));
        EncounterSnapshot created = engine.createEncounter("session-1", List.of(aric, bandit));
        String id = created.encounterId();
        engine.rollInitiative(id, idOf(created, "Aric"), 18, false, false);
        engine.rollInitiative(id, idOf(created, "Bandit"), 5, false, false);
        return engine.getStatus(id);
    }

    // === Scenario ===

    @Test
    @DisplayName("A hits B for 10 slashing; B resists and ends at 7 HP; B's turn is next")
    void endToEndScenario() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String a = idOf(setup, "Aric");
        String b = idOf(setup, "Bandit");
        assertEquals(List.of(a, b), List.of(setup.participants().get(0).id(), setup.participants().get(1).id()));

        EncounterSnapshot started = engine.start(id);
        assertEquals(EncounterStatus.ACTIVE, started.status());
        assertEquals(1, started.round());
        assertEquals(a, started.currentParticipantId());

        AttackResult attack = engine.attack(id, AttackRequest.of(a, b, 16, false, false, 10, DamageType.SLASHING));
        assertTrue(attack.isHit());
        assertEquals(5, attack.getDamageDealt());
        assertEquals(7, engine.getStatus(id).participant(b).orElseThrow().currentHp());

        TurnAdvance advance = engine.nextTurn(id);
        assertEquals(b, advance.currentParticipantId());
        assertEquals(1, engine.getDamageLog(id, b, 1).size());
    }

    // === Lifecycle ===

    @Test
    void startRequiresInitiative() {
        EncounterSnapshot created = engine.createEncounter("s", List.of(EncounterFixtures.spec("Solo", 0, 10, 10)));
        assertThrows(InvalidStateException.class, () -> engine.start(created.encounterId()));

        EncounterSnapshot empty = engine.createEncounter("s", List.of());
        assertThrows(InvalidStateException.class, () -> engine.start(empty.encounterId()));
    }

    @Test
    void preRolledInitiativeOrdersAtCreation() {
        EncounterSnapshot created = engine.createEncounter("s", List.of(
            EncounterFixtures.spec("Slow", 0, 10, 10).withInitiative(3),
            EncounterFixtures.spec("Fast", 0, 10, 10).withInitiative(17)));

        assertEquals("Fast", created.participants().get(0).name());
        assertEquals(0, created.participants().get(0).turnOrder());
    }

    @Test
    void surpriseRoundStartsAtZero() {
        String id = twoParticipants().encounterId();
        assertEquals(0, engine.start(id, true).round());
    }

    @Test
    @DisplayName("Participants can only join during setup")
    void addParticipantOnlyInSetup() {
        String id = twoParticipants().encounterId();
        String extra = engine.addParticipant(id, EncounterFixtures.spec("Late", 0, 8, 10));
        assertNotNull(extra);

        engine.rollInitiative(id, extra, 11, false, false);
        engine.start(id);
        assertThrows(InvalidStateException.class,
            () -> engine.addParticipant(id, EncounterFixtures.spec("Later", 0, 8, 10)));
    }

    @Test
    @DisplayName("Pausing blocks turns and attacks but allows initiative changes")
    void pausedEncounter() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String a = idOf(setup, "Aric");
        String b = idOf(setup, "Bandit");
        engine.start(id);
        engine.pause(id);

        assertThrows(InvalidStateException.class, () -> engine.nextTurn(id));
        assertThrows(InvalidStateException.class,
            () -> engine.attack(id, AttackRequest.of(a, b, 20, false, false, 3, DamageType.FIRE)));
        assertThrows(InvalidStateException.class,
            () -> engine.applyDamage(id, b, 3, DamageType.FIRE, null, null, false));

        EncounterSnapshot reordered = engine.reorder(id, b, 25);
        assertEquals(b, reordered.participants().get(0).id());
        assertEquals(a, reordered.currentParticipantId());

        engine.resume(id);
        assertEquals(b, engine.nextTurn(id).currentParticipantId());
    }

    @Test
    void completedEncounterIsTerminal() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        engine.start(id);
        assertEquals(EncounterStatus.COMPLETED, engine.end(id).status());

        assertThrows(InvalidStateException.class, () -> engine.nextTurn(id));
        assertThrows(InvalidStateException.class, () -> engine.end(id));
        assertThrows(InvalidStateException.class, () -> engine.heal(id, idOf(setup, "Aric"), 1, null));
        assertThrows(InvalidStateException.class, () -> engine.applyCondition(id, idOf(setup, "Aric"),
            "Prone", DurationType.ROUNDS, 1, null, null, null));
    }

    @Test
    void unknownIdsAreNotFound() {
        assertThrows(NotFoundException.class, () -> engine.getStatus("missing"));
        String id = twoParticipants().encounterId();
        assertThrows(NotFoundException.class, () -> engine.setTempHp(id, "p99", 4));
        assertThrows(NotFoundException.class, () -> engine.getActiveConditions(id, "p99"));
    }

    @Test
    void findActiveEncounterBySession() {
        String first = twoParticipants().encounterId();
        assertEquals(first, engine.findActiveEncounter("session-1").orElseThrow().encounterId());

        engine.end(first);
        assertTrue(engine.findActiveEncounter("session-1").isEmpty());
        assertTrue(engine.findActiveEncounter("other").isEmpty());
    }

    // === Atomicity and faults ===

    @Test
    @DisplayName("A rejected operation leaves the committed state and version unchanged")
    void failedOperationChangesNothing() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String a = idOf(setup, "Aric");
        String b = idOf(setup, "Bandit");
        engine.start(id);
        EncounterSnapshot before = engine.getStatus(id);

        AoeRequest missingSave = new AoeRequest(a, List.of(b, a), 13, Map.of(b, 4), 9, DamageType.FIRE, true, "burning hands");
        assertThrows(ValidationException.class, () -> engine.aoeAttack(id, missingSave));

        EncounterSnapshot after = engine.getStatus(id);
        assertSame(before, after);
        assertEquals(12, after.participant(b).orElseThrow().currentHp());
    }

    @Test
    @DisplayName("An unexpected internal failure faults the encounter")
    void unexpectedFailureFaultsEncounter() {
        CombatEngine broken = new CombatEngine(EngineConfig.defaults(), EncounterFixtures.LIBRARY, sides -> {
            throw new IllegalStateException("dice tower collapsed");
        });
        try {
            EncounterSnapshot created = broken.createEncounter("s", List.of(EncounterFixtures.spec("Solo", 0, 10, 10)));
            String id = created.encounterId();
            String solo = created.participants().get(0).id();

            InvalidStateException fault = assertThrows(InvalidStateException.class,
                () -> broken.rollInitiative(id, solo, null, false, false));
            assertTrue(fault.getCause() instanceof IllegalStateException);
            assertTrue(broken.encounter(id).isFaulted());

            assertThrows(InvalidStateException.class, () -> broken.rollInitiative(id, solo, 10, false, false));
            assertEquals(created.version(), broken.getStatus(id).version());
        } finally {
            broken.shutdown();
        }
    }

    // === Events ===

    @Test
    @DisplayName("Each committed mutation emits exactly one event, in sequence; failures emit none")
    void eventsPerMutation() throws InterruptedException {
        List<EncounterEvent> seen = new CopyOnWriteArrayList<>();
        engine.subscribe(seen::add);

        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        engine.start(id);
        assertThrows(InvalidStateException.class, () -> engine.start(id));
        engine.nextTurn(id);
        assertTrue(engine.events().awaitIdle(5, TimeUnit.SECONDS));

        List<OperationType> types = new ArrayList<>();
        for (EncounterEvent e : seen) types.add(e.type());
        assertEquals(List.of(OperationType.ENCOUNTER_CREATED, OperationType.INITIATIVE_ROLLED,
            OperationType.INITIATIVE_ROLLED, OperationType.COMBAT_STARTED, OperationType.TURN_ADVANCED), types);
        for (int i = 0; i < seen.size(); i++) {
            assertEquals(i + 1, seen.get(i).sequence());
            assertEquals(seen.get(i).sequence(), seen.get(i).snapshot().version());
        }
        assertNotNull(seen.get(4).resultAs(TurnAdvance.class));
    }

    @Test
    void typedSubscription() throws InterruptedException {
        List<EncounterEvent> turns = new CopyOnWriteArrayList<>();
        engine.events().subscribe(OperationType.TURN_ADVANCED, turns::add);

        String id = twoParticipants().encounterId();
        engine.start(id);
        engine.nextTurn(id);
        engine.nextTurn(id);
        assertTrue(engine.events().awaitIdle(5, TimeUnit.SECONDS));

        assertEquals(2, turns.size());
    }

    // === Turn enforcement ===

    @Test
    @DisplayName("Strict turn order rejects attacks out of turn")
    void strictTurnOrder() {
        CombatEngine strict = new CombatEngine(EngineConfig.defaults().withStrictTurnOrder(true), EncounterFixtures.LIBRARY, dice);
        try {
            EncounterSnapshot created = strict.createEncounter("s", List.of(
                EncounterFixtures.spec("Fast", 0, 10, 10).withInitiative(17),
                EncounterFixtures.spec("Slow", 0, 10, 10).withInitiative(3)));
            String id = created.encounterId();
            String fast = idOf(created, "Fast");
            String slow = idOf(created, "Slow");
            strict.start(id);

            assertThrows(InvalidStateException.class,
                () -> strict.attack(id, AttackRequest.of(slow, fast, 15, false, false, 4, DamageType.SLASHING)));
            assertTrue(strict.attack(id, AttackRequest.of(fast, slow, 15, false, false, 4, DamageType.SLASHING)).isHit());
        } finally {
            strict.shutdown();
        }
    }

    @Test
    void outOfTurnAttackIsLoggedByDefault() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        engine.start(id);

        engine.attack(id, AttackRequest.of(idOf(setup, "Bandit"), idOf(setup, "Aric"), 2, false, false, 4, DamageType.SLASHING));

        assertTrue(engine.getStatus(id).combatLog().stream().anyMatch(l -> l.contains("out of turn")));
    }

    // === Engine-rolled attacks and conditions ===

    @Test
    void rollAndAttackUsesEngineDice() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        engine.start(id);
        dice.enqueue(14, 6);

        AttackResult result = engine.rollAndAttack(id, idOf(setup, "Aric"), idOf(setup, "Bandit"), 4, true,
            "1d8+2", DamageType.PIERCING);

        assertTrue(result.isHit());
        assertEquals(18, result.getAttackRollTotal());
        assertEquals(8, result.getDamageDealt());
    }

    @Test
    @DisplayName("An engine-rolled attack without a damage type is rejected and the encounter keeps working")
    void rollAndAttackRequiresDamageType() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        engine.start(id);
        dice.enqueue(14, 6);

        assertThrows(ValidationException.class, () -> engine.rollAndAttack(id, idOf(setup, "Aric"),
            idOf(setup, "Bandit"), 4, true, "1d8+2", null));

        assertFalse(engine.encounter(id).isFaulted());
        assertEquals(2, dice.remaining());
        assertEquals(idOf(setup, "Bandit"), engine.nextTurn(id).currentParticipantId());
    }

    @Test
    @DisplayName("A refused engine-rolled attack draws no dice")
    void refusedRollAndAttackDrawsNoDice() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String aric = idOf(setup, "Aric");
        String bandit = idOf(setup, "Bandit");
        engine.start(id);
        engine.removeParticipant(id, bandit);
        dice.enqueue(14, 6);

        assertThrows(InvalidStateException.class,
            () -> engine.rollAndAttack(id, aric, bandit, 4, true, "1d8+2", DamageType.PIERCING));

        assertEquals(2, dice.remaining());
        assertFalse(engine.encounter(id).isFaulted());
    }

    @Test
    void conditionsThroughTheEngine() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String b = idOf(setup, "Bandit");

        String conditionId = engine.applyCondition(id, b, "Restrained", DurationType.ROUNDS, 2, null, null, "net")
            .condition().getId();
        assertEquals(1, engine.getActiveConditions(id, b).size());
        assertFalse(engine.getMechanicalEffects(id, b).isEmpty());
        assertEquals(14, engine.getConditionsLibrary().size());

        engine.removeCondition(id, conditionId);
        assertTrue(engine.getActiveConditions(id, b).isEmpty());
    }

    @Test
    void deathSaveRolledByEngine() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String b = idOf(setup, "Bandit");
        engine.start(id);
        engine.applyDamage(id, b, 15, DamageType.FIRE, idOf(setup, "Aric"), "fire bolt", false);
        dice.enqueue(20);

        assertTrue(engine.rollDeathSave(id, b, null).revived());
        assertEquals(1, engine.getStatus(id).participant(b).orElseThrow().currentHp());
    }

    @Test
    void damageLogFilters() {
        EncounterSnapshot setup = twoParticipants();
        String id = setup.encounterId();
        String a = idOf(setup, "Aric");
        String b = idOf(setup, "Bandit");
        engine.start(id);
        engine.applyDamage(id, a, 2, DamageType.FIRE, null, null, false);
        engine.applyDamage(id, b, 2, DamageType.FIRE, null, null, false);
        engine.nextTurn(id);
        engine.nextTurn(id);
        engine.applyDamage(id, b, 2, DamageType.FIRE, null, null, false);

        assertEquals(3, engine.getDamageLog(id, null, null).size());
        assertEquals(2, engine.getDamageLog(id, b, null).size());
        assertEquals(1, engine.getDamageLog(id, b, 2).size());
        assertEquals(2, engine.getDamageLog(id, null, 1).size());
    }

    // === Concurrency ===

    @Test
    @DisplayName("Concurrent writers are serialized: no lost updates")
    void concurrentDamageIsSerialized() throws Exception {
        EncounterSnapshot created = engine.createEncounter("s", List.of(
            EncounterFixtures.spec("Tarrasque", 0, 1000, 25).withInitiative(10)));
        String id = created.encounterId();
        String boss = created.participants().get(0).id();
        engine.start(id);

        int threads = 8;
        int hitsEach = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < hitsEach; i++) {
                    engine.applyDamage(id, boss, 1, DamageType.FORCE, null, null, false);
                    assertNotNull(engine.getStatus(id));
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        EncounterSnapshot end = engine.getStatus(id);
        assertEquals(1000 - threads * hitsEach, end.participant(boss).orElseThrow().currentHp());
        assertEquals(threads * hitsEach, end.damageLog().size());
        assertEquals(created.version() + 1 + threads * hitsEach, end.version());
    }

    @Test
    void encountersAreIndependent() {
        String first = twoParticipants().encounterId();
        String second = twoParticipants().encounterId();
        engine.start(first);

        assertEquals(EncounterStatus.ACTIVE, engine.getStatus(first).status());
        assertEquals(EncounterStatus.SETUP, engine.getStatus(second).status());
        assertEquals(2, engine.encounterCount());
    }
}
