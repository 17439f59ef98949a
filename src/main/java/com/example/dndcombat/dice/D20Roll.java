package com.example.dndcombat.dice;

import java.util.List;

/**
 * Result of a d20 roll: every face rolled, the face kept, and the flat modifier.
 */
public record D20Roll(List<Integer> faces, int natural, RollMode mode, int modifier) {

    public D20Roll {
        faces = List.copyOf(faces);
    }

    static D20Roll of(List<Integer> faces, RollMode mode, int modifier) {
        int kept = faces.size() > 1 ? mode.select(faces.get(0), faces.get(1)) : faces.get(0);
        return new D20Roll(faces, kept, faces.size() > 1 ? mode : RollMode.NORMAL, modifier);
    }

    public int total() {
        return natural + modifier;
    }

    public boolean isNatural20() {
        return natural == 20;
    }

    public boolean isNatural1() {
        return natural == 1;
    }
}
