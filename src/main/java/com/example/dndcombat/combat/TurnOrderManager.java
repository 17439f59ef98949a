package com.example.dndcombat.combat;

import com.example.dndcombat.dice.D20Roll;
import com.example.dndcombat.dice.DiceRoller;
import com.example.dndcombat.dice.RollMode;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.ActiveCondition;
import com.example.dndcombat.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Initiative, turn order and round progression for an encounter.
 */
public class TurnOrderManager {

    private static final Logger logger = LoggerFactory.getLogger(TurnOrderManager.class);

    /** Highest initiative first, then highest modifier, then whoever joined first. */
    public static final Comparator<Participant> INITIATIVE_ORDER = (a, b) -> {
        int byInitiative = Integer.compare(b.getInitiative(), a.getInitiative());
        if (byInitiative != 0) return byInitiative;
        int byModifier = Integer.compare(b.getInitiativeModifier(), a.getInitiativeModifier());
        if (byModifier != 0) return byModifier;
        return Integer.compare(a.getAddOrder(), b.getAddOrder());
    };

    private final DiceRoller dice;
    private final ConditionTracker conditions;

    public TurnOrderManager(DiceRoller dice, ConditionTracker conditions) {
        this.dice = Objects.requireNonNull(dice, "dice");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
    }

    /**
     * Record a participant's initiative.
     *
     * @param roll the natural d20 result, or null to have the engine roll
     */
    public InitiativeRoll rollInitiative(Encounter encounter, String participantId, Integer roll,
                                         boolean advantage, boolean disadvantage) {
        Participant p = encounter.participant(participantId);
        if (!p.isActive()) {
            throw new InvalidStateException(p.getName() + " is no longer in the encounter");
        }
        RollMode mode = RollMode.of(advantage, disadvantage);
        int modifier = p.getInitiativeModifier();

        List<Integer> faces;
        int kept;
        boolean supplied = roll != null;
        if (supplied) {
            kept = ValidationException.requireD20("roll", roll);
            faces = List.of(kept);
        } else {
            D20Roll d20 = dice.rollD20(mode, modifier);
            faces = d20.faces();
            kept = d20.natural();
        }
        int total = kept + modifier;
        p.setInitiative(total);

        encounter.logEvent(p.getName() + " rolls initiative: " + kept + formatModifier(modifier) + " = " + total
            + (faces.size() > 1 ? " " + faces + " " + mode.name().toLowerCase() : ""));
        boolean assigned = assignTurnOrder(encounter);
        return new InitiativeRoll(participantId, faces, kept, supplied ? RollMode.NORMAL : mode,
            modifier, total, supplied, assigned);
    }

    /**
     * Overwrite a participant's initiative total, e.g. after a DM ruling.
     */
    public void reorder(Encounter encounter, String participantId, int newInitiative) {
        Participant p = encounter.participant(participantId);
        if (!p.isActive()) {
            throw new InvalidStateException(p.getName() + " is no longer in the encounter");
        }
        p.setInitiative(newInitiative);
        encounter.logEvent(p.getName() + "'s initiative is set to " + newInitiative);
        assignTurnOrder(encounter);
    }

    /**
     * Sort active participants once every one of them has initiative. The current participant keeps
     * the turn when the order changes mid-combat.
     *
     * @return true if turn order was assigned
     */
    public boolean assignTurnOrder(Encounter encounter) {
        List<Participant> active = encounter.activeParticipants();
        if (active.isEmpty() || !active.stream().allMatch(Participant::hasInitiative)) {
            return false;
        }
        Participant current = encounter.currentParticipant();

        active.sort(INITIATIVE_ORDER);
        for (Participant p : encounter.participants()) {
            p.setTurnOrder(null);
        }
        for (int i = 0; i < active.size(); i++) {
            active.get(i).setTurnOrder(i);
        }
        if (current != null && current.isActive()) {
            encounter.setTurnIndex(current.getTurnOrder());
        }
        logger.debug("[TurnOrderManager] Encounter {} turn order: {}", encounter.getId(), active);
        return true;
    }

    public boolean allInitiativesResolved(Encounter encounter) {
        List<Participant> active = encounter.activeParticipants();
        return !active.isEmpty() && active.stream().allMatch(p -> p.hasInitiative() && p.getTurnOrder() != null);
    }

    /**
     * Begin round one (or round zero for a surprise round) with the first participant in order.
     */
    public void begin(Encounter encounter, boolean surpriseRound) {
        encounter.setRound(surpriseRound ? 0 : 1);
        encounter.setTurnIndex(0);
        encounter.logEvent("=== COMBAT BEGINS ===" + (surpriseRound ? " (surprise round)" : ""));
    }

    /**
     * Pass the turn to the next active participant. Wrapping past the last one starts a new round,
     * which is when timed conditions expire.
     */
    public TurnAdvance nextTurn(Encounter encounter) {
        List<Participant> order = encounter.turnOrder();
        if (order.isEmpty()) {
            throw new InvalidStateException("No active participants left in encounter " + encounter.getId());
        }
        Participant previous = encounter.currentParticipant();

        int next = encounter.getTurnIndex() + 1;
        boolean newRound = false;
        List<ActiveCondition> expired = new ArrayList<>();
        if (next >= order.size()) {
            next = 0;
            newRound = true;
            encounter.setRound(encounter.getRound() + 1);
            encounter.logEvent("--- Round " + encounter.getRound() + " ---");
            expired = conditions.expire(encounter, encounter.getRound());
        }
        encounter.setTurnIndex(next);
        Participant current = order.get(next);
        List<SaveDue> savesDue = conditions.savesDue(encounter, current.getId());

        encounter.logEvent("It is " + current.getName() + "'s turn");
        return new TurnAdvance(previous != null ? previous.getId() : null, current.getId(),
            encounter.getRound(), newRound, expired, savesDue);
    }

    /**
     * Take a participant out of the turn order (fled, dismissed). The turn stays with the current
     * participant; if the current participant leaves, the turn passes to the one after them, and
     * leaving as the last in order starts the next round.
     */
    public void removeParticipant(Encounter encounter, String participantId) {
        Participant p = encounter.participant(participantId);
        if (!p.isActive()) {
            throw new InvalidStateException(p.getName() + " has already left the encounter");
        }
        List<Participant> before = encounter.turnOrder();
        Participant current = encounter.currentParticipant();
        int removedIndex = before.indexOf(p);

        p.setActive(false);
        p.setTurnOrder(null);
        List<Participant> after = encounter.turnOrder();
        for (int i = 0; i < after.size(); i++) {
            after.get(i).setTurnOrder(i);
        }

        encounter.logEvent(p.getName() + " is no longer in combat.");
        if (current != null && current != p) {
            encounter.setTurnIndex(current.getTurnOrder());
        } else if (removedIndex >= 0) {
            boolean wraps = current == p && !after.isEmpty() && removedIndex >= after.size();
            encounter.setTurnIndex(after.isEmpty() || removedIndex >= after.size() ? 0 : removedIndex);
            if (wraps) {
                // the last participant of the round left on their own turn
                encounter.setRound(encounter.getRound() + 1);
                encounter.logEvent("--- Round " + encounter.getRound() + " ---");
                conditions.expire(encounter, encounter.getRound());
            }
            if (current == p && !after.isEmpty()) {
                encounter.logEvent("It is " + after.get(encounter.getTurnIndex()).getName() + "'s turn");
            }
        }
    }

    private static String formatModifier(int modifier) {
        if (modifier == 0) return "";
        return modifier > 0 ? "+" + modifier : String.valueOf(modifier);
    }
}
