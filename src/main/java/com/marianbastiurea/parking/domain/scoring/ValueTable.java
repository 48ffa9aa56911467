package com.marianbastiurea.parking.domain.scoring;

import java.util.Arrays;

/**
 * Read-only state/action value table. Entries not present in the source are
 * filled with the default value. Instances are assembled through {@link Builder}
 * and never change afterwards.
 */
public final class ValueTable {

    private final double[][] values;

    private ValueTable(double[][] values) {
        this.values = values;
    }

    public static ValueTable constant(int states, int actions, double value) {
        return builder(states, actions, value).build();
    }

    public static Builder builder(int states, int actions, double defaultValue) {
        return new Builder(states, actions, defaultValue);
    }

    public double value(int state, int action) {
        check(values, state, action);
        return values[state][action];
    }

    public int states() {
        return values.length;
    }

    public int actions() {
        return values[0].length;
    }

    private static void check(double[][] values, int state, int action) {
        if (state < 0 || state >= values.length) {
            throw new IllegalArgumentException("state out of range: " + state + " (states=" + values.length + ")");
        }
        if (action < 0 || action >= values[0].length) {
            throw new IllegalArgumentException("action out of range: " + action + " (actions=" + values[0].length + ")");
        }
    }

    public static final class Builder {

        private final double[][] values;

        private Builder(int states, int actions, double defaultValue) {
            if (states < 1 || actions < 1) {
                throw new IllegalArgumentException("Value table needs at least one state and one action");
            }
            this.values = new double[states][actions];
            for (double[] row : values) {
                Arrays.fill(row, defaultValue);
            }
        }

        public Builder set(int state, int action, double value) {
            check(values, state, action);
            values[state][action] = value;
            return this;
        }

        /** Copies the current entries; later {@link #set} calls do not reach the built table. */
        public ValueTable build() {
            double[][] copy = new double[values.length][];
            for (int s = 0; s < values.length; s++) {
                copy[s] = values[s].clone();
            }
            return new ValueTable(copy);
        }
    }
}
