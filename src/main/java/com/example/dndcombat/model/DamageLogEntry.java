package com.example.dndcombat.model;

/**
 * One line of the append-only damage audit trail.
 * {@code amount} is the damage after immunity/vulnerability/resistance, before temp HP.
 */
public record DamageLogEntry(
    long id,
    String encounterId,
    String participantId,
    int amount,
    int rawAmount,
    DamageType damageType,
    String sourceParticipantId,
    String sourceDescription,
    int round,
    boolean critical,
    long createdAt
) { }
