package com.example.dndcombat.combat;

import com.example.dndcombat.combat.DamageResult.DamageModifier;
import com.example.dndcombat.condition.MechanicalEffects;
import com.example.dndcombat.condition.Restriction;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.CreatureStats;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.Participant;
import com.example.dndcombat.model.ParticipantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Hit point arithmetic: damage with resistances, healing, temporary HP and death saves.
 */
public class DamageResolver {

    private static final Logger logger = LoggerFactory.getLogger(DamageResolver.class);

    private final ConditionTracker conditions;
    private final boolean massiveDamage;

    public DamageResolver(ConditionTracker conditions, boolean massiveDamage) {
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.massiveDamage = massiveDamage;
    }

    /**
     * Apply damage: type modifiers first, then temporary HP, then hit points. Always appends one
     * damage-log entry, even when nothing gets through.
     *
     * @param sourceParticipantId attacker, may be null for traps and the like
     */
    public DamageResult applyDamage(Encounter encounter, String participantId, int amount, DamageType type,
                                    String sourceParticipantId, String sourceDescription, boolean critical) {
        Participant target = encounter.participant(participantId);
        ParticipantStatus status = encounter.status(participantId);
        ValidationException.requireNonNegative("amount", amount);
        if (type == null) {
            throw new ValidationException("damageType is required");
        }
        if (status.isDead()) {
            throw new InvalidStateException(target.getName() + " is dead");
        }

        MechanicalEffects effects = conditions.effects(encounter, participantId);
        DamageModifier modifier = modifierFor(target.getStats(), effects, type);
        int modified = applyModifier(modifier, amount);

        int absorbed = Math.min(status.getTempHp(), modified);
        status.setTempHp(status.getTempHp() - absorbed);
        int remaining = modified - absorbed;

        int hpBefore = status.getCurrentHp();
        boolean dropped = false;
        boolean massive = false;
        int failuresAdded = 0;

        if (remaining > 0) {
            if (hpBefore > 0) {
                int overflow = remaining - hpBefore;
                if (overflow >= 0) {
                    dropped = true;
                    if (massiveDamage && overflow >= status.getMaxHp()) {
                        massive = true;
                        status.die();
                    } else {
                        status.fallUnconscious();
                    }
                } else {
                    status.setCurrentHp(hpBefore - remaining);
                }
            } else if (massiveDamage && remaining >= status.getMaxHp()) {
                massive = true;
                status.die();
            } else {
                // any damage at 0 HP is a failed death save, a critical hit two
                failuresAdded = critical ? 2 : 1;
                status.addDeathSaveFailures(failuresAdded);
            }
        }

        DamageLogEntry entry = encounter.appendDamage(participantId, modified, amount, type,
            sourceParticipantId, sourceDescription, critical);

        StringBuilder line = new StringBuilder();
        line.append(target.getName()).append(" takes ").append(modified).append(' ').append(type.key).append(" damage");
        if (modifier != DamageModifier.NONE) line.append(" (").append(modifier.name().toLowerCase()).append(", ").append(amount).append(" rolled)");
        if (absorbed > 0) line.append(", ").append(absorbed).append(" absorbed by temp HP");
        if (critical) line.append(" [critical]");
        encounter.logEvent(line.toString());
        if (status.isDead()) {
            encounter.logEvent(target.getName() + (massive ? " is killed outright!" : " has died."));
            logger.info("[DamageResolver] {} died in encounter {}", target.getName(), encounter.getId());
        } else if (dropped) {
            encounter.logEvent(target.getName() + " falls unconscious!");
        }

        return new DamageResult(participantId, amount, type, modifier, modified, absorbed,
            hpBefore - status.getCurrentHp(), status.getCurrentHp(), status.getTempHp(), critical,
            dropped, status.isDead(), massive, failuresAdded, entry.id());
    }

    /**
     * Immunity wins over vulnerability, which wins over resistance. Petrified counts as resistance
     * to everything and immunity to poison.
     */
    static DamageModifier modifierFor(CreatureStats stats, MechanicalEffects effects, DamageType type) {
        if (stats.isImmuneTo(type) || (type == DamageType.POISON && effects.has(Restriction.IMMUNE_TO_POISON))) {
            return DamageModifier.IMMUNE;
        }
        if (stats.isVulnerableTo(type)) {
            return DamageModifier.VULNERABLE;
        }
        if (stats.isResistantTo(type) || effects.has(Restriction.RESISTANT_TO_ALL_DAMAGE)) {
            return DamageModifier.RESISTANT;
        }
        return DamageModifier.NONE;
    }

    static int applyModifier(DamageModifier modifier, int amount) {
        switch (modifier) {
            case IMMUNE: return 0;
            case VULNERABLE: return amount * 2;
            case RESISTANT: return amount / 2;
            default: return amount;
        }
    }

    /**
     * Restore hit points up to the maximum. Any positive heal brings an unconscious participant
     * back with fresh death-save counters.
     */
    public HealResult heal(Encounter encounter, String participantId, int amount, String sourceDescription) {
        Participant target = encounter.participant(participantId);
        ParticipantStatus status = encounter.status(participantId);
        ValidationException.requireNonNegative("amount", amount);
        if (status.isDead()) {
            throw new InvalidStateException(target.getName() + " is dead and cannot be healed");
        }
        int before = status.getCurrentHp();
        int applied = Math.min(amount, status.getMaxHp() - before);
        boolean revived = amount > 0 && before == 0;
        status.setCurrentHp(before + applied);

        encounter.logEvent(target.getName() + " regains " + applied + " HP"
            + (sourceDescription != null ? " from " + sourceDescription : "")
            + (revived ? " and regains consciousness" : ""));
        return new HealResult(participantId, amount, applied, amount - applied, status.getCurrentHp(), revived);
    }

    /**
     * Grant temporary hit points; the larger pool wins.
     */
    public TempHpResult setTempHp(Encounter encounter, String participantId, int amount) {
        Participant target = encounter.participant(participantId);
        ParticipantStatus status = encounter.status(participantId);
        ValidationException.requireNonNegative("amount", amount);
        if (status.isDead()) {
            throw new InvalidStateException(target.getName() + " is dead");
        }
        int previous = status.getTempHp();
        status.setTempHp(Math.max(previous, amount));
        if (status.getTempHp() != previous) {
            encounter.logEvent(target.getName() + " gains " + status.getTempHp() + " temporary HP");
        }
        return new TempHpResult(participantId, previous, amount, status.getTempHp());
    }

    /**
     * Resolve one death saving throw for a dying participant.
     *
     * @param roll the natural d20 result
     */
    public DeathSaveResult rollDeathSave(Encounter encounter, String participantId, int roll) {
        Participant target = encounter.participant(participantId);
        ParticipantStatus status = encounter.status(participantId);
        ValidationException.requireD20("roll", roll);
        if (status.isDead()) {
            throw new InvalidStateException(target.getName() + " is dead");
        }
        if (status.isConscious()) {
            throw new InvalidStateException(target.getName() + " is conscious and does not roll death saves");
        }
        if (status.isStable()) {
            throw new InvalidStateException(target.getName() + " is stable");
        }

        int successes = 0;
        int failures = 0;
        boolean revived = false;
        if (roll == 20) {
            status.setCurrentHp(1);
            revived = true;
            encounter.logEvent(target.getName() + " rolls a natural 20 on a death save and regains 1 HP!");
        } else if (roll == 1) {
            failures = 2;
            status.addDeathSaveFailures(failures);
            encounter.logEvent(target.getName() + " rolls a natural 1 on a death save (two failures)");
        } else if (roll < 10) {
            failures = 1;
            status.addDeathSaveFailures(failures);
            encounter.logEvent(target.getName() + " fails a death save (" + roll + ")");
        } else {
            successes = 1;
            status.addDeathSaveSuccesses(successes);
            encounter.logEvent(target.getName() + " succeeds on a death save (" + roll + ")");
        }
        if (status.isDead()) {
            encounter.logEvent(target.getName() + " has died.");
        } else if (status.isStable()) {
            encounter.logEvent(target.getName() + " is stable.");
        }
        return new DeathSaveResult(participantId, roll, successes, failures,
            status.getDeathSaveSuccesses(), status.getDeathSaveFailures(), revived, status.isStable(), status.isDead());
    }
}
