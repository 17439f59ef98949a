package com.example.dndcombat.error;

public class ValidationException extends CombatException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    /** Throws unless {@code value >= 0}. */
    public static int requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new ValidationException(field + " must be non-negative: " + value);
        }
        return value;
    }

    /** Throws unless {@code value} is a face of a d20. */
    public static int requireD20(String field, int value) {
        if (value < 1 || value > 20) {
            throw new ValidationException(field + " must be between 1 and 20: " + value);
        }
        return value;
    }
}
