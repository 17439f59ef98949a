package com.example.dndcombat.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, consistent picture of an encounter after a committed write.
 * Participants are listed in turn order once it is assigned, otherwise in the order they were added.
 */
public record EncounterSnapshot(
    String encounterId,
    String sessionId,
    EncounterStatus status,
    int round,
    int turnIndex,
    String currentParticipantId,
    List<ParticipantSnapshot> participants,
    List<DamageLogEntry> damageLog,
    List<String> combatLog,
    long version
) {
    public EncounterSnapshot {
        participants = List.copyOf(participants);
        damageLog = List.copyOf(damageLog);
        combatLog = List.copyOf(combatLog);
    }

    public Optional<ParticipantSnapshot> participant(String participantId) {
        return participants.stream().filter(p -> p.id().equals(participantId)).findFirst();
    }

    public Optional<ParticipantSnapshot> currentParticipant() {
        if (currentParticipantId == null) return Optional.empty();
        return participant(currentParticipantId);
    }
}
