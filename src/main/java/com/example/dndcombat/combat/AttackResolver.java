package com.example.dndcombat.combat;

import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;
import com.example.dndcombat.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides hits against armor class and routes damage through the {@link DamageResolver}.
 *
 * The caller's damage roll is trusted as given. Critical dice are doubled when rolling, never here.
 */
public class AttackResolver {

    private static final Logger logger = LoggerFactory.getLogger(AttackResolver.class);

    private final DamageResolver damage;

    public AttackResolver(DamageResolver damage) {
        this.damage = Objects.requireNonNull(damage, "damage");
    }

    public AttackResult resolveAttack(Encounter encounter, AttackRequest request) {
        Objects.requireNonNull(request, "request");
        Participant attacker = encounter.participant(request.attackerId());
        Participant target = encounter.participant(request.targetId());
        if (request.natural20() && request.natural1()) {
            throw new ValidationException("an attack roll cannot be both a natural 20 and a natural 1");
        }
        ValidationException.requireNonNegative("damageRoll", request.damageRoll());
        if (request.damageType() == null) {
            throw new ValidationException("damageType is required");
        }
        requireInEncounter(attacker);
        requireInEncounter(target);

        int ac = request.targetAcOverride() != null ? request.targetAcOverride() : target.getStats().armorClass();
        boolean critical = request.natural20();
        boolean hit = critical || (!request.natural1() && request.attackRollTotal() >= ac);

        if (!hit) {
            encounter.logEvent(attacker.getName() + " misses " + target.getName()
                + " (" + describeRoll(request) + " vs AC " + ac + ")");
            return AttackResult.miss(request, ac)
                .setMessage(attacker.getName() + " misses " + target.getName() + ".");
        }

        encounter.logEvent(attacker.getName() + (critical ? " critically hits " : " hits ") + target.getName()
            + " (" + describeRoll(request) + " vs AC " + ac + ")");
        DamageResult result = damage.applyDamage(encounter, target.getId(), request.damageRoll(),
            request.damageType(), attacker.getId(), sourceOf(attacker, request.description()), critical);
        logger.debug("[AttackResolver] {} -> {} in encounter {}: {}", attacker.getName(), target.getName(),
            encounter.getId(), result);

        String message = attacker.getName() + (critical ? " lands a critical hit on " : " hits ") + target.getName()
            + " for " + result.modifiedAmount() + " " + request.damageType().key + " damage.";
        AttackResult attack = critical ? AttackResult.criticalHit(request, ac, result) : AttackResult.hit(request, ac, result);
        return attack.setMessage(message);
    }

    /**
     * Resolve an area effect against every target as one unit: either all targets are damaged or,
     * on any validation failure, none are.
     */
    public List<AoeTargetResult> resolveAoe(Encounter encounter, AoeRequest request) {
        Objects.requireNonNull(request, "request");
        Participant caster = encounter.participant(request.casterId());
        if (request.targetIds().isEmpty()) {
            throw new ValidationException("at least one target is required");
        }
        ValidationException.requireNonNegative("damageRoll", request.damageRoll());
        if (request.damageType() == null) {
            throw new ValidationException("damageType is required");
        }

        Set<String> seen = new HashSet<>();
        for (String targetId : request.targetIds()) {
            requireInEncounter(encounter.participant(targetId));
            if (!seen.add(targetId)) {
                throw new ValidationException("duplicate target: " + targetId);
            }
            if (request.saveDc() != null && !request.saveRolls().containsKey(targetId)) {
                throw new ValidationException("missing save roll for target " + targetId);
            }
        }

        String source = sourceOf(caster, request.description());
        encounter.logEvent(caster.getName() + " unleashes " + (request.description() != null ? request.description() : "an area effect")
            + " on " + request.targetIds().size() + " target(s)");

        List<AoeTargetResult> results = new ArrayList<>(request.targetIds().size());
        for (String targetId : request.targetIds()) {
            Integer saveRoll = null;
            boolean saved = false;
            int amount = request.damageRoll();
            if (request.saveDc() != null) {
                saveRoll = request.saveRolls().get(targetId);
                saved = saveRoll >= request.saveDc();
                if (saved) {
                    amount = request.halfOnSave() ? amount / 2 : 0;
                }
            }
            DamageResult result = null;
            if (amount > 0 || !saved) {
                result = damage.applyDamage(encounter, targetId, amount, request.damageType(),
                    caster.getId(), source, false);
            } else {
                encounter.logEvent(encounter.participant(targetId).getName() + " avoids the effect entirely");
            }
            results.add(new AoeTargetResult(targetId, saveRoll, saved, amount, result));
        }
        return results;
    }

    private static void requireInEncounter(Participant p) {
        if (!p.isActive()) {
            throw new InvalidStateException(p.getName() + " is no longer in the encounter");
        }
    }

    private static String sourceOf(Participant attacker, String description) {
        return description != null && !description.isBlank() ? description : attacker.getName();
    }

    private static String describeRoll(AttackRequest request) {
        if (request.natural20()) return "natural 20";
        if (request.natural1()) return "natural 1";
        return String.valueOf(request.attackRollTotal());
    }
}
