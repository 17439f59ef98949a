package com.example.dndcombat.condition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reference entry for one named condition: its rules text and mechanical effects, plus which
 * other conditions it includes or conflicts with.
 */
public class ConditionDefinition {

    private final String name;
    private final String description;
    private final String iconName;
    private final List<RollModifier> rollModifiers;
    private final Set<Restriction> restrictions;
    private final Set<String> includes;
    private final Set<String> incompatibleWith;

    public ConditionDefinition(String name, String description, String iconName,
                               List<RollModifier> rollModifiers, Set<Restriction> restrictions,
                               Set<String> includes, Set<String> incompatibleWith) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.iconName = iconName;
        this.rollModifiers = rollModifiers == null ? List.of() : List.copyOf(rollModifiers);
        this.restrictions = restrictions == null || restrictions.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(restrictions));
        this.includes = caseInsensitive(includes);
        this.incompatibleWith = caseInsensitive(incompatibleWith);
    }

    private static Set<String> caseInsensitive(Set<String> names) {
        Set<String> out = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (names != null) out.addAll(names);
        return Collections.unmodifiableSet(out);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getIconName() { return iconName; }
    public List<RollModifier> getRollModifiers() { return rollModifiers; }
    public Set<Restriction> getRestrictions() { return restrictions; }
    public Set<String> getIncludes() { return includes; }
    public Set<String> getIncompatibleWith() { return incompatibleWith; }

    public boolean includes(String other) {
        return includes.contains(other);
    }

    public boolean isIncompatibleWith(String other) {
        return incompatibleWith.contains(other);
    }

    @Override
    public String toString() {
        return "ConditionDefinition[" + name + ", rolls=" + rollModifiers + ", restrictions=" + restrictions + "]";
    }
}
