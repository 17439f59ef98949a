package com.example.dndcombat.combat;

import com.example.dndcombat.model.ActiveCondition;

import java.util.List;

/**
 * Result of applying a condition.
 *
 * @param condition the condition now in effect (new, extended, or the unchanged existing one)
 * @param created   a new condition instance was added
 * @param replaced  an existing instance of the same condition took the new, longer duration
 * @param removed   conditions ended because the applied one includes them
 */
public record ConditionApplication(
    ActiveCondition condition,
    boolean created,
    boolean replaced,
    List<String> warnings,
    List<ActiveCondition> removed
) {
    public ConditionApplication {
        warnings = List.copyOf(warnings);
        removed = List.copyOf(removed);
    }

    /** False when the participant already had the condition with an equal or longer duration. */
    public boolean changed() {
        return created || replaced;
    }
}
