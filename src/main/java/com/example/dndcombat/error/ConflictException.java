package com.example.dndcombat.error;

/**
 * Reserved for optimistic-concurrency callers. The engine itself never throws it.
 */
public class ConflictException extends CombatException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
