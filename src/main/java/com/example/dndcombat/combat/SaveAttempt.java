package com.example.dndcombat.combat;

import com.example.dndcombat.model.ActiveCondition;

/**
 * @param condition the condition after the attempt; inactive when the save succeeded
 */
public record SaveAttempt(ActiveCondition condition, int rollTotal, int dc, boolean success) { }
