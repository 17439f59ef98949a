package com.example.dndcombat.error;

public class InvalidStateException extends CombatException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
