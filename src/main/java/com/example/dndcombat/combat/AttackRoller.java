package com.example.dndcombat.combat;

import com.example.dndcombat.condition.MechanicalEffects;
import com.example.dndcombat.condition.Restriction;
import com.example.dndcombat.dice.D20Roll;
import com.example.dndcombat.dice.DiceExpression;
import com.example.dndcombat.dice.DiceRoller;
import com.example.dndcombat.dice.RollMode;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.Participant;

import java.util.Objects;

/**
 * Rolls attacks for the engine itself, with advantage and disadvantage taken from the attacker's and
 * the target's conditions, and builds the {@link AttackRequest} the resolver expects.
 */
public class AttackRoller {

    private final DiceRoller dice;
    private final ConditionTracker conditions;

    public AttackRoller(DiceRoller dice, ConditionTracker conditions) {
        this.dice = Objects.requireNonNull(dice, "dice");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
    }

    /** Roll mode for an attack from one participant against another. */
    public RollMode attackMode(Encounter encounter, String attackerId, String targetId, boolean melee) {
        MechanicalEffects attacker = conditions.effects(encounter, attackerId);
        MechanicalEffects target = conditions.effects(encounter, targetId);
        return MechanicalEffects.attackMode(attacker, target, melee);
    }

    public D20Roll rollAttack(Encounter encounter, String attackerId, String targetId, int attackBonus, boolean melee) {
        return dice.rollD20(attackMode(encounter, attackerId, targetId, melee), attackBonus);
    }

    /**
     * Roll to hit and, speculatively, damage. A natural 20 doubles the damage dice, and so does any
     * melee hit on a target that is paralyzed or unconscious.
     */
    public AttackRequest prepare(Encounter encounter, String attackerId, String targetId, int attackBonus,
                                 boolean melee, DiceExpression damageDice, DamageType damageType) {
        // reject before rolling so a refused attack draws no dice
        if (damageType == null) {
            throw new ValidationException("damageType is required");
        }
        requireInEncounter(encounter.participant(attackerId));
        requireInEncounter(encounter.participant(targetId));

        D20Roll roll = rollAttack(encounter, attackerId, targetId, attackBonus, melee);
        boolean autoCrit = melee && conditions.effects(encounter, targetId).has(Restriction.CRITICAL_WITHIN_5_FEET);
        int ac = encounter.participant(targetId).getStats().armorClass();
        boolean landsAsCrit = roll.isNatural20()
            || (autoCrit && !roll.isNatural1() && roll.total() >= ac);
        DiceExpression.Result damage = damageDice.roll(dice, landsAsCrit);

        String description = damageDice + " " + damageType.key
            + (roll.mode() != RollMode.NORMAL ? " with " + roll.mode().name().toLowerCase() : "");
        // a hit that becomes critical because of the target's condition is reported as a natural 20
        return new AttackRequest(attackerId, targetId, roll.total(), landsAsCrit, roll.isNatural1(),
            damage.total(), damageType, null, description);
    }

    private static void requireInEncounter(Participant p) {
        if (!p.isActive()) {
            throw new InvalidStateException(p.getName() + " is no longer in the encounter");
        }
    }
}
