package com.example.dndcombat.combat;

import com.example.dndcombat.condition.ConditionDefinition;
import com.example.dndcombat.condition.ConditionsLibrary;
import com.example.dndcombat.condition.MechanicalEffects;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.Ability;
import com.example.dndcombat.model.ActiveCondition;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies, expires and removes conditions on an encounter's participants, and folds the active
 * ones into {@link MechanicalEffects}.
 *
 * A condition name is active at most once per participant. Re-applying it only ever lengthens
 * the duration.
 */
public class ConditionTracker {

    private static final Logger logger = LoggerFactory.getLogger(ConditionTracker.class);

    private final ConditionsLibrary library;

    public ConditionTracker(ConditionsLibrary library) {
        this.library = Objects.requireNonNull(library, "library");
    }

    public ConditionsLibrary getLibrary() {
        return library;
    }

    /**
     * Apply a named condition in the encounter's current round.
     *
     * @throws com.example.dndcombat.error.NotFoundException for an unknown participant or condition name
     * @throws InvalidStateException if the participant is immune to the condition
     * @throws ValidationException if the duration fields do not fit the duration type
     */
    public ConditionApplication apply(Encounter encounter, String participantId, String conditionName,
                                      DurationType durationType, Integer durationValue,
                                      Integer saveDc, Ability saveAbility, String sourceDescription) {
        Participant participant = encounter.participant(participantId);
        ConditionDefinition definition = library.get(conditionName);
        String name = definition.getName();

        if (participant.getStats().isImmuneToCondition(name)) {
            throw new InvalidStateException(participant.getName() + " is immune to " + name);
        }
        validateDuration(durationType, durationValue, saveDc, saveAbility);

        List<String> warnings = new ArrayList<>();
        List<ActiveCondition> current = encounter.activeConditions(participantId);

        ActiveCondition candidate = new ActiveCondition(encounter.nextConditionId(), participantId, name,
            durationType, durationType.isTimed() ? durationValue : null,
            durationType == DurationType.UNTIL_SAVE ? saveDc : null,
            durationType == DurationType.UNTIL_SAVE ? saveAbility : null,
            encounter.getRound(), sourceDescription);

        Optional<ActiveCondition> existing = current.stream().filter(c -> c.isSameCondition(name)).findFirst();
        if (existing.isPresent()) {
            ActiveCondition old = existing.get();
            if (!candidate.outlasts(old)) {
                warnings.add(participant.getName() + " is already " + name + " for at least as long");
                return new ConditionApplication(old, false, false, warnings, List.of());
            }
            ActiveCondition extended = old.withDurationOf(candidate);
            encounter.putCondition(extended);
            encounter.logEvent(participant.getName() + "'s " + name + " now lasts " + describeDuration(extended));
            logger.debug("[ConditionTracker] {} extended on {} in encounter {}", name, participantId, encounter.getId());
            return new ConditionApplication(extended, false, true, warnings, List.of());
        }

        for (ActiveCondition other : current) {
            ConditionDefinition otherDef = library.find(other.getConditionName()).orElse(null);
            if (otherDef == null) continue;
            if (otherDef.includes(name)) {
                warnings.add(name + " is already implied by " + otherDef.getName());
            }
            if (definition.isIncompatibleWith(otherDef.getName()) || otherDef.isIncompatibleWith(name)) {
                warnings.add(name + " conflicts with " + otherDef.getName());
            }
        }

        List<ActiveCondition> removed = new ArrayList<>();
        for (ActiveCondition other : current) {
            if (definition.includes(other.getConditionName())) {
                ActiveCondition ended = other.deactivate();
                encounter.putCondition(ended);
                removed.add(ended);
                encounter.logEvent(participant.getName() + "'s " + other.getConditionName()
                    + " is folded into " + name);
            }
        }

        encounter.putCondition(candidate);
        encounter.logEvent(participant.getName() + " is " + name + " (" + describeDuration(candidate) + ")");
        logger.debug("[ConditionTracker] {} applied to {} in encounter {}", name, participantId, encounter.getId());
        return new ConditionApplication(candidate, true, false, warnings, removed);
    }

    private static void validateDuration(DurationType type, Integer value, Integer saveDc, Ability ability) {
        if (type == null) {
            throw new ValidationException("durationType is required");
        }
        if (type.isTimed()) {
            if (value == null || value <= 0) {
                throw new ValidationException("durationValue must be positive for " + type.key + " durations");
            }
        } else if (type == DurationType.UNTIL_SAVE) {
            if (saveDc == null || saveDc <= 0) {
                throw new ValidationException("saveDc is required for until_save durations");
            }
            if (ability == null) {
                throw new ValidationException("saveAbility is required for until_save durations");
            }
        }
    }

    /**
     * End a condition explicitly.
     */
    public ActiveCondition remove(Encounter encounter, String conditionId) {
        ActiveCondition condition = encounter.condition(conditionId);
        if (!condition.isActive()) {
            throw new InvalidStateException("Condition " + conditionId + " is no longer active");
        }
        ActiveCondition ended = condition.deactivate();
        encounter.putCondition(ended);
        encounter.logEvent(encounter.participant(condition.getParticipantId()).getName()
            + " is no longer " + condition.getConditionName());
        return ended;
    }

    /**
     * Roll against an until-save condition. A total at or above the DC ends it.
     */
    public SaveAttempt attemptSave(Encounter encounter, String conditionId, int saveRollTotal) {
        ActiveCondition condition = encounter.condition(conditionId);
        if (!condition.isActive()) {
            throw new InvalidStateException("Condition " + conditionId + " is no longer active");
        }
        if (condition.getDurationType() != DurationType.UNTIL_SAVE) {
            throw new InvalidStateException(condition.getConditionName() + " does not end on a saving throw");
        }
        int dc = condition.getSaveDc();
        String name = encounter.participant(condition.getParticipantId()).getName();
        if (saveRollTotal >= dc) {
            ActiveCondition ended = condition.deactivate();
            encounter.putCondition(ended);
            encounter.logEvent(name + " saves against " + condition.getConditionName()
                + " (" + saveRollTotal + " vs DC " + dc + ")");
            return new SaveAttempt(ended, saveRollTotal, dc, true);
        }
        encounter.logEvent(name + " fails to shake off " + condition.getConditionName()
            + " (" + saveRollTotal + " vs DC " + dc + ")");
        return new SaveAttempt(condition, saveRollTotal, dc, false);
    }

    /**
     * End every timed condition whose last active round is before {@code round}.
     */
    public List<ActiveCondition> expire(Encounter encounter, int round) {
        List<ActiveCondition> expired = new ArrayList<>();
        for (ActiveCondition c : encounter.allActiveConditions()) {
            if (c.isExpiredAt(round)) {
                ActiveCondition ended = c.deactivate();
                encounter.putCondition(ended);
                expired.add(ended);
                encounter.logEvent(encounter.participant(c.getParticipantId()).getName()
                    + "'s " + c.getConditionName() + " wears off");
            }
        }
        return expired;
    }

    public List<SaveDue> savesDue(Encounter encounter, String participantId) {
        List<SaveDue> due = new ArrayList<>();
        for (ActiveCondition c : encounter.activeConditions(participantId)) {
            if (c.getDurationType() == DurationType.UNTIL_SAVE) {
                due.add(new SaveDue(participantId, c.getId(), c.getConditionName(), c.getSaveAbility(), c.getSaveDc()));
            }
        }
        return due;
    }

    public MechanicalEffects effects(Encounter encounter, String participantId) {
        encounter.participant(participantId);
        return effectsOf(encounter.activeConditions(participantId));
    }

    /** Combine a list of conditions, ignoring inactive ones and names the library no longer knows. */
    public MechanicalEffects effectsOf(List<ActiveCondition> conditions) {
        List<ConditionDefinition> defs = new ArrayList<>();
        for (ActiveCondition c : conditions) {
            if (!c.isActive()) continue;
            library.find(c.getConditionName()).ifPresent(defs::add);
        }
        return MechanicalEffects.combine(defs);
    }

    private static String describeDuration(ActiveCondition c) {
        switch (c.getDurationType()) {
            case PERMANENT: return "permanent";
            case UNTIL_SAVE: return "until a DC " + c.getSaveDc() + " " + c.getSaveAbility().key.toUpperCase() + " save";
            default: return c.getDurationValue() + " " + c.getDurationType().key + ", through round " + c.getExpiresAtRound();
        }
    }
}
