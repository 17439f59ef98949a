package com.example.dndcombat;

import com.example.dndcombat.combat.ConditionTracker;
import com.example.dndcombat.combat.Encounter;
import com.example.dndcombat.combat.InitiativeRoll;
import com.example.dndcombat.combat.TurnAdvance;
import com.example.dndcombat.combat.TurnOrderManager;
import com.example.dndcombat.dice.RollMode;
import com.example.dndcombat.dice.ScriptedDiceRoller;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.Ability;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.EncounterStatus;
import com.example.dndcombat.model.Participant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for initiative, turn order and round progression.
 */
class TurnOrderManagerTest {

    private ScriptedDiceRoller dice;
    private ConditionTracker conditions;
    private TurnOrderManager turns;
    private Encounter encounter;

    @BeforeEach
    void setUp() {
        dice = new ScriptedDiceRoller();
        conditions = new ConditionTracker(EncounterFixtures.LIBRARY);
        turns = new TurnOrderManager(dice, conditions);
        encounter = EncounterFixtures.encounter();
    }

    private List<String> order() {
        return encounter.turnOrder().stream().map(Participant::getName).collect(Collectors.toList());
    }

    private void startCombat() {
        encounter.setStatus(EncounterStatus.ACTIVE);
        turns.begin(encounter, false);
    }

    // === Initiative ===

    @Test
    @DisplayName("Ties break on modifier, then on who joined first")
    void initiativeTieBreak() {
        String a = EncounterFixtures.add(encounter, "Alia", 10, CreatureStats.of(12), 2);
        String b = EncounterFixtures.add(encounter, "Borin", 10, CreatureStats.of(12), 3);
        String c = EncounterFixtures.add(encounter, "Cyra", 10, CreatureStats.of(12), 2);

        turns.rollInitiative(encounter, a, 10, false, false);
        turns.rollInitiative(encounter, b, 9, false, false);
        InitiativeRoll last = turns.rollInitiative(encounter, c, 10, false, false);

        assertTrue(last.turnOrderAssigned());
        assertEquals(List.of("Borin", "Alia", "Cyra"), order());
    }

    @Test
    @DisplayName("Turn order waits until every active participant has rolled")
    void turnOrderNeedsAllRolls() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        EncounterFixtures.add(encounter, "Borin", 10);

        InitiativeRoll roll = turns.rollInitiative(encounter, a, 15, false, false);

        assertFalse(roll.turnOrderAssigned());
        assertTrue(encounter.turnOrder().isEmpty());
        assertFalse(turns.allInitiativesResolved(encounter));
    }

    @Test
    @DisplayName("Engine rolls keep the higher face with advantage and the lower with disadvantage")
    void engineRollsWithAdvantage() {
        String a = EncounterFixtures.add(encounter, "Alia", 10, CreatureStats.of(12), 1);
        dice.enqueue(4, 17, 4, 17, 8);

        InitiativeRoll adv = turns.rollInitiative(encounter, a, null, true, false);
        assertEquals(List.of(4, 17), adv.rolls());
        assertEquals(17, adv.kept());
        assertEquals(18, adv.total());
        assertEquals(RollMode.ADVANTAGE, adv.mode());

        InitiativeRoll dis = turns.rollInitiative(encounter, a, null, false, true);
        assertEquals(4, dis.kept());

        InitiativeRoll both = turns.rollInitiative(encounter, a, null, true, true);
        assertEquals(List.of(8), both.rolls());
        assertEquals(RollMode.NORMAL, both.mode());
        assertEquals(0, dice.remaining());
    }

    @Test
    void suppliedRollMustBeD20Face() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        assertThrows(ValidationException.class, () -> turns.rollInitiative(encounter, a, 0, false, false));
        assertThrows(ValidationException.class, () -> turns.rollInitiative(encounter, a, 21, false, false));
    }

    @Test
    void reorderRecomputesTurnOrder() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 5, false, false);
        assertEquals(List.of("Alia", "Borin"), order());

        turns.reorder(encounter, b, 22);

        assertEquals(List.of("Borin", "Alia"), order());
    }

    // === Turns and rounds ===

    @Test
    @DisplayName("Wrapping past the last participant starts the next round")
    void nextTurnWrapsRounds() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 5, false, false);
        startCombat();
        assertEquals(a, encounter.currentParticipant().getId());

        TurnAdvance first = turns.nextTurn(encounter);
        assertEquals(a, first.previousParticipantId());
        assertEquals(b, first.currentParticipantId());
        assertFalse(first.newRound());
        assertEquals(1, first.round());

        TurnAdvance second = turns.nextTurn(encounter);
        assertTrue(second.newRound());
        assertEquals(2, second.round());
        assertEquals(a, second.currentParticipantId());
    }

    @Test
    @DisplayName("A 1-round condition from round 3 lasts through round 3 and ends when round 4 begins")
    void conditionExpiresAtRoundBoundary() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 5, false, false);
        startCombat();
        for (int i = 0; i < 4; i++) {
            turns.nextTurn(encounter);
        }
        assertEquals(3, encounter.getRound());

        conditions.apply(encounter, b, "Poisoned", DurationType.ROUNDS, 1, null, null, "dart");

        TurnAdvance stillRound3 = turns.nextTurn(encounter);
        assertEquals(3, stillRound3.round());
        assertTrue(stillRound3.expiredConditions().isEmpty());
        assertEquals(1, encounter.activeConditions(b).size());

        TurnAdvance round4 = turns.nextTurn(encounter);
        assertEquals(4, round4.round());
        assertEquals(1, round4.expiredConditions().size());
        assertEquals("Poisoned", round4.expiredConditions().get(0).getConditionName());
        assertTrue(encounter.activeConditions(b).isEmpty());
    }

    @Test
    @DisplayName("Until-save conditions are surfaced when their bearer's turn comes up")
    void savesDueOnTurnStart() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 5, false, false);
        startCombat();
        conditions.apply(encounter, b, "Frightened", DurationType.UNTIL_SAVE, null, 13, Ability.WISDOM, "dragon");

        TurnAdvance advance = turns.nextTurn(encounter);

        assertEquals(1, advance.savesDue().size());
        assertEquals(13, advance.savesDue().get(0).dc());
        assertEquals(Ability.WISDOM, advance.savesDue().get(0).ability());
    }

    @Test
    @DisplayName("Removing the current participant passes the turn to the next one")
    void removeCurrentParticipant() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        String c = EncounterFixtures.add(encounter, "Cyra", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 10, false, false);
        turns.rollInitiative(encounter, c, 5, false, false);
        startCombat();
        turns.nextTurn(encounter);
        assertEquals(b, encounter.currentParticipant().getId());

        turns.removeParticipant(encounter, b);

        assertEquals(c, encounter.currentParticipant().getId());
        assertEquals(List.of("Alia", "Cyra"), order());
        assertThrows(InvalidStateException.class, () -> turns.removeParticipant(encounter, b));
    }

    @Test
    @DisplayName("Removing the last participant on their turn starts the next round")
    void removeLastParticipantOnTheirTurn() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        String c = EncounterFixtures.add(encounter, "Cyra", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 10, false, false);
        turns.rollInitiative(encounter, c, 5, false, false);
        startCombat();
        conditions.apply(encounter, a, "Prone", DurationType.ROUNDS, 1, null, null, "trip");
        turns.nextTurn(encounter);
        turns.nextTurn(encounter);
        assertEquals(c, encounter.currentParticipant().getId());

        turns.removeParticipant(encounter, c);

        assertEquals(a, encounter.currentParticipant().getId());
        assertEquals(2, encounter.getRound());
        assertTrue(encounter.activeConditions(a).isEmpty());
        assertTrue(encounter.getCombatLog().stream().anyMatch(l -> l.contains("--- Round 2 ---")));

        TurnAdvance advance = turns.nextTurn(encounter);
        assertEquals(b, advance.currentParticipantId());
        assertEquals(2, advance.round());
        assertFalse(advance.newRound());
    }

    @Test
    @DisplayName("Removing someone earlier in the order keeps the current participant")
    void removeEarlierParticipant() {
        String a = EncounterFixtures.add(encounter, "Alia", 10);
        String b = EncounterFixtures.add(encounter, "Borin", 10);
        turns.rollInitiative(encounter, a, 15, false, false);
        turns.rollInitiative(encounter, b, 10, false, false);
        startCombat();
        turns.nextTurn(encounter);

        turns.removeParticipant(encounter, a);

        assertEquals(b, encounter.currentParticipant().getId());
        TurnAdvance advance = turns.nextTurn(encounter);
        assertEquals(b, advance.currentParticipantId());
        assertTrue(advance.newRound());
    }
}
