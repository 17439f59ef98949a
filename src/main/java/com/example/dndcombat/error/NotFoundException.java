package com.example.dndcombat.error;

public class NotFoundException extends CombatException {

    public NotFoundException(String what, String id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }
}
