package com.example.dndcombat.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only combat statistics supplied by the character/creature subsystem.
 * Condition immunities are stored case-insensitively.
 */
public record CreatureStats(
    int armorClass,
    Set<DamageType> resistances,
    Set<DamageType> vulnerabilities,
    Set<DamageType> immunities,
    Set<String> conditionImmunities
) {
    public CreatureStats {
        resistances = freeze(resistances);
        vulnerabilities = freeze(vulnerabilities);
        immunities = freeze(immunities);
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (conditionImmunities != null) names.addAll(conditionImmunities);
        conditionImmunities = Collections.unmodifiableSet(names);
    }

    /**
     * Stats with only an armor class and no damage or condition modifiers.
     */
    public static CreatureStats of(int armorClass) {
        return new CreatureStats(armorClass, null, null, null, null);
    }

    public CreatureStats withResistances(DamageType... types) {
        return new CreatureStats(armorClass, setOf(types), vulnerabilities, immunities, conditionImmunities);
    }

    public CreatureStats withVulnerabilities(DamageType... types) {
        return new CreatureStats(armorClass, resistances, setOf(types), immunities, conditionImmunities);
    }

    public CreatureStats withImmunities(DamageType... types) {
        return new CreatureStats(armorClass, resistances, vulnerabilities, setOf(types), conditionImmunities);
    }

    public CreatureStats withConditionImmunities(String... names) {
        return new CreatureStats(armorClass, resistances, vulnerabilities, immunities, new TreeSet<>(Arrays.asList(names)));
    }

    public boolean isResistantTo(DamageType type) { return type != null && resistances.contains(type); }
    public boolean isVulnerableTo(DamageType type) { return type != null && vulnerabilities.contains(type); }
    public boolean isImmuneTo(DamageType type) { return type != null && immunities.contains(type); }

    public boolean isImmuneToCondition(String conditionName) {
        return conditionName != null && conditionImmunities.contains(conditionName);
    }

    private static Set<DamageType> freeze(Set<DamageType> types) {
        if (types == null || types.isEmpty()) return Collections.emptySet();
        return Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    private static Set<DamageType> setOf(DamageType... types) {
        if (types == null || types.length == 0) return Collections.emptySet();
        return EnumSet.copyOf(Arrays.asList(types));
    }
}
