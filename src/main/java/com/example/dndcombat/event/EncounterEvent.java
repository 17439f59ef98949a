package com.example.dndcombat.event;

import com.example.dndcombat.model.EncounterSnapshot;

import java.util.Objects;

/**
 * Emitted exactly once per committed mutation, after the new state is visible to readers.
 *
 * @param sequence the encounter version the mutation produced; strictly increasing per encounter
 * @param result   the operation's own result object (AttackResult, TurnAdvance, ...), may be null
 */
public record EncounterEvent(
    String encounterId,
    OperationType type,
    long sequence,
    EncounterSnapshot snapshot,
    Object result,
    long timestamp
) {
    public EncounterEvent {
        Objects.requireNonNull(encounterId, "encounterId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    public <T> T resultAs(Class<T> type) {
        return type.isInstance(result) ? type.cast(result) : null;
    }
}
