package com.example.dndcombat.combat;

/**
 * @param applied  hit points actually restored
 * @param overheal the part of the heal that exceeded max HP
 * @param revived  the participant was at 0 HP and is conscious again
 */
public record HealResult(String participantId, int requested, int applied, int overheal, int currentHp, boolean revived) { }
