package com.example.dndcombat.condition;

import com.example.dndcombat.dice.RollMode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The combined effect of every active condition on one participant.
 *
 * Per roll target: auto-fail wins outright; otherwise advantage and disadvantage from any
 * number of sources cancel to a normal roll (recorded as {@link RollEffect#NORMAL}).
 */
public final class MechanicalEffects {

    public static final MechanicalEffects NONE = new MechanicalEffects(List.of(), Map.of(), Set.of());

    private final List<String> appliedConditions;
    private final Map<RollTarget, RollEffect> rolls;
    private final Set<Restriction> restrictions;

    private MechanicalEffects(List<String> appliedConditions, Map<RollTarget, RollEffect> rolls,
                              Set<Restriction> restrictions) {
        this.appliedConditions = List.copyOf(appliedConditions);
        this.rolls = rolls.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(rolls));
        this.restrictions = restrictions.isEmpty() ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(restrictions));
    }

    public static MechanicalEffects combine(Collection<ConditionDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) return NONE;

        List<String> names = new ArrayList<>();
        Map<RollTarget, EnumSet<RollEffect>> seen = new EnumMap<>(RollTarget.class);
        Set<Restriction> restrictions = EnumSet.noneOf(Restriction.class);

        for (ConditionDefinition def : definitions) {
            names.add(def.getName());
            for (RollModifier mod : def.getRollModifiers()) {
                seen.computeIfAbsent(mod.target(), t -> EnumSet.noneOf(RollEffect.class)).add(mod.effect());
            }
            restrictions.addAll(def.getRestrictions());
        }

        Map<RollTarget, RollEffect> rolls = new EnumMap<>(RollTarget.class);
        for (Map.Entry<RollTarget, EnumSet<RollEffect>> e : seen.entrySet()) {
            rolls.put(e.getKey(), resolve(e.getValue()));
        }
        return new MechanicalEffects(names, rolls, restrictions);
    }

    private static RollEffect resolve(Set<RollEffect> effects) {
        if (effects.contains(RollEffect.AUTO_FAIL)) return RollEffect.AUTO_FAIL;
        boolean advantage = effects.contains(RollEffect.ADVANTAGE);
        boolean disadvantage = effects.contains(RollEffect.DISADVANTAGE);
        if (advantage && disadvantage) return RollEffect.NORMAL;
        if (advantage) return RollEffect.ADVANTAGE;
        if (disadvantage) return RollEffect.DISADVANTAGE;
        return RollEffect.NORMAL;
    }

    public List<String> getAppliedConditions() { return appliedConditions; }
    public Map<RollTarget, RollEffect> getRolls() { return rolls; }
    public Set<Restriction> getRestrictions() { return restrictions; }

    public RollEffect rollEffect(RollTarget target) {
        return rolls.getOrDefault(target, RollEffect.NORMAL);
    }

    public boolean has(Restriction restriction) {
        return restrictions.contains(restriction);
    }

    public boolean isEmpty() {
        return appliedConditions.isEmpty();
    }

    /**
     * Combine the attacker's own attack-roll effect with the effects on the target that apply to
     * attacks made against it, and cancel them into one roll mode.
     */
    public static RollMode attackMode(MechanicalEffects attacker, MechanicalEffects target, boolean melee) {
        List<RollEffect> sources = new ArrayList<>();
        sources.add(attacker.rollEffect(RollTarget.ATTACK_ROLLS));
        sources.add(target.rollEffect(RollTarget.ATTACKS_AGAINST));
        sources.add(target.rollEffect(melee ? RollTarget.MELEE_ATTACKS_AGAINST : RollTarget.RANGED_ATTACKS_AGAINST));
        boolean advantage = sources.contains(RollEffect.ADVANTAGE);
        boolean disadvantage = sources.contains(RollEffect.DISADVANTAGE);
        return RollMode.of(advantage, disadvantage);
    }

    @Override
    public String toString() {
        return "MechanicalEffects[" + appliedConditions + ", rolls=" + rolls + ", restrictions=" + restrictions + "]";
    }
}
