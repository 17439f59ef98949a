package com.example.dndcombat.combat;

/**
 * Per-target outcome of an area effect.
 *
 * @param saveRoll the target's save total, null when no save applied
 * @param damage   null when the save negated all damage
 */
public record AoeTargetResult(String targetId, Integer saveRoll, boolean saved, int damageAfterSave, DamageResult damage) { }
