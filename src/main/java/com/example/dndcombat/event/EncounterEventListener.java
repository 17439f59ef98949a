package com.example.dndcombat.event;

/**
 * Receives committed encounter events on the dispatcher thread.
 */
@FunctionalInterface
public interface EncounterEventListener {
    void onEvent(EncounterEvent event);
}
