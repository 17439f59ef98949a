package com.example.dndcombat.combat;

import com.example.dndcombat.model.Ability;

/**
 * An until-save condition whose bearer may roll to end it at the start of their turn.
 */
public record SaveDue(String participantId, String conditionId, String conditionName, Ability ability, int dc) { }
