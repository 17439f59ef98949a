package com.example.dndcombat.dice;

import com.example.dndcombat.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A damage expression such as {@code 1d8+3}.
 *
 * A critical hit doubles the number of dice, never the flat modifier: {@code 1d8+3} crits as
 * {@code 2d8+3}.
 */
public final class DiceExpression {

    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d+)d(\\d+)([+-]\\d+)?");

    private final int count;
    private final int sides;
    private final int modifier;

    public DiceExpression(int count, int sides, int modifier) {
        if (count < 1 || sides < 2) {
            throw new ValidationException("invalid dice: " + count + "d" + sides);
        }
        this.count = count;
        this.sides = sides;
        this.modifier = modifier;
    }

    public static DiceExpression parse(String expression) {
        if (expression == null) {
            throw new ValidationException("dice expression is required");
        }
        String normalized = expression.toLowerCase().replace(" ", "");
        Matcher m = DICE_PATTERN.matcher(normalized);
        if (!m.matches()) {
            throw new ValidationException("invalid dice expression: " + expression);
        }
        int modifier = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return new DiceExpression(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), modifier);
    }

    public int getCount() { return count; }
    public int getSides() { return sides; }
    public int getModifier() { return modifier; }

    /**
     * Roll the expression; on a critical hit roll twice as many dice and add the modifier once.
     */
    public Result roll(DiceRoller roller, boolean critical) {
        int dice = critical ? count * 2 : count;
        List<Integer> faces = new ArrayList<>(dice);
        int sum = 0;
        for (int i = 0; i < dice; i++) {
            int face = roller.roll(sides);
            faces.add(face);
            sum += face;
        }
        return new Result(Math.max(0, sum + modifier), faces, modifier, critical);
    }

    @Override
    public String toString() {
        if (modifier == 0) return count + "d" + sides;
        return count + "d" + sides + (modifier > 0 ? "+" : "") + modifier;
    }

    public record Result(int total, List<Integer> faces, int modifier, boolean critical) {
        public Result {
            faces = List.copyOf(faces);
        }
    }
}
