package com.example.dndcombat.error;

/**
 * Base class for every error the engine reports. A failed operation never leaves partial state behind.
 */
public class CombatException extends RuntimeException {

    private final ErrorKind kind;

    public CombatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CombatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
