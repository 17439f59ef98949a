package com.example.dndcombat.combat;

import com.example.dndcombat.model.DamageType;

import java.util.List;
import java.util.Map;

/**
 * An area effect hitting several targets with one damage roll.
 *
 * @param saveDc    null when the effect allows no saving throw
 * @param saveRolls each target's saving throw total, keyed by participant id; required when saveDc is set
 */
public record AoeRequest(
    String casterId,
    List<String> targetIds,
    Integer saveDc,
    Map<String, Integer> saveRolls,
    int damageRoll,
    DamageType damageType,
    boolean halfOnSave,
    String description
) {
    public AoeRequest {
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
        saveRolls = saveRolls == null ? Map.of() : Map.copyOf(saveRolls);
    }
}
