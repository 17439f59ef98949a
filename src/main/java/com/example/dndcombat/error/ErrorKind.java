package com.example.dndcombat.error;

/**
 * Error taxonomy surfaced to callers of the engine.
 */
public enum ErrorKind {
    /** Unknown encounter, participant or condition */
    NOT_FOUND,
    /** Operation illegal in the current state (dead target, inactive encounter, ...) */
    INVALID_STATE,
    /** Bad input: negative amounts, missing required fields */
    VALIDATION,
    /** Reserved for optimistic concurrency; unused under single-writer serialization */
    CONFLICT
}
