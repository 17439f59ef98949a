package com.example.dndcombat.dice;

import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.ValidationException;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Replays a fixed sequence of pre-rolled faces, for tests and for replaying a recorded session.
 */
public class ScriptedDiceRoller implements DiceRoller {

    private final Deque<Integer> faces = new ArrayDeque<>();

    public ScriptedDiceRoller(int... faces) {
        enqueue(faces);
    }

    public synchronized void enqueue(int... more) {
        Arrays.stream(more).forEach(faces::addLast);
    }

    public synchronized int remaining() {
        return faces.size();
    }

    @Override
    public synchronized int roll(int sides) {
        Integer face = faces.pollFirst();
        if (face == null) {
            throw new InvalidStateException("dice script exhausted");
        }
        if (face < 1 || face > sides) {
            throw new ValidationException("scripted face " + face + " is not on a d" + sides);
        }
        return face;
    }
}
