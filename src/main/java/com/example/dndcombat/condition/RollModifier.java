package com.example.dndcombat.condition;

import java.util.Objects;

/**
 * One roll-affecting effect of a condition, e.g. {@code RollModifier(ATTACK_ROLLS, DISADVANTAGE)}.
 */
public record RollModifier(RollTarget target, RollEffect effect) {

    public RollModifier {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(effect, "effect");
    }
}
