package com.example.dndcombat.model;

import java.util.Objects;

/**
 * Who a participant is outside of the encounter: a player character, a creature
 * from the bestiary, or a free-text name for anything improvised at the table.
 * Exactly one reference is carried; the kind says how to interpret it.
 */
public record IdentityRef(Kind kind, String ref) {

    public enum Kind { CHARACTER, CREATURE, AD_HOC }

    public IdentityRef {
        Objects.requireNonNull(kind, "kind");
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("identity reference must not be blank");
        }
    }

    public static IdentityRef character(String characterId) {
        return new IdentityRef(Kind.CHARACTER, characterId);
    }

    public static IdentityRef creature(String creatureId) {
        return new IdentityRef(Kind.CREATURE, creatureId);
    }

    public static IdentityRef adHoc(String name) {
        return new IdentityRef(Kind.AD_HOC, name);
    }

    public boolean isCharacter() { return kind == Kind.CHARACTER; }
    public boolean isCreature() { return kind == Kind.CREATURE; }
    public boolean isAdHoc() { return kind == Kind.AD_HOC; }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + ref;
    }
}
