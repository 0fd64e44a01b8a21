/*
 * This file is part of GateSynth.
 * Copyright (c) 2024 The GateSynth authors.
 *
 * GateSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * GateSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with GateSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.gatesynth;

import java.util.Objects;

/**
 * A primitive logic gate: name, input arity, a pure boolean function and a cost. Gates are
 * immutable; equality is by name, arity, cost and function table.
 */
public final class Gate {
    public static final int MAX_ARITY = 4;

    private final String name;
    private final int arity;
    private final int cost;
    private final GateFunction function;
    /* Bit m is the output for the input row m, where input i has the value (m >> i) & 1 */
    private final int table;
    private final boolean symmetric;

    private Gate(String name, int arity, int cost, GateFunction function) {
        this.name = name;
        this.arity = arity;
        this.cost = cost;
        this.function = function;
        this.table = tabulate(arity, function);
        this.symmetric = isSymmetric(arity, table);
    }

    /**
     * Creates a gate descriptor.
     *
     * @throws ConfigurationException if the name is blank, the arity is not in {@code 1..4} or the
     *     cost is negative.
     */
    public static Gate of(String name, int arity, int cost, GateFunction function) {
        Objects.requireNonNull(function);
        Util.checkConfiguration(name != null && !name.isBlank(), "Gate name must not be blank");
        Util.checkConfiguration(
                arity >= 1 && arity <= MAX_ARITY, "Gate %s has arity %d, expected 1 to %d", name, arity, MAX_ARITY);
        Util.checkConfiguration(cost >= 0, "Gate %s has negative cost %d", name, cost);
        return new Gate(name, arity, cost, function);
    }

    private static int tabulate(int arity, GateFunction function) {
        int table = 0;
        boolean[] row = new boolean[arity];
        for (int minterm = 0; minterm < (1 << arity); minterm++) {
            for (int i = 0; i < arity; i++) {
                row[i] = ((minterm >>> i) & 1) != 0;
            }
            if (function.evaluate(row.clone())) {
                table |= 1 << minterm;
            }
        }
        return table;
    }

    private static boolean isSymmetric(int arity, int table) {
        for (int i = 0; i + 1 < arity; i++) {
            for (int minterm = 0; minterm < (1 << arity); minterm++) {
                int first = (minterm >>> i) & 1;
                int second = (minterm >>> (i + 1)) & 1;
                int swapped = (minterm & ~(0b11 << i)) | (second << i) | (first << (i + 1));
                if (((table >>> minterm) & 1) != ((table >>> swapped) & 1)) {
                    return false;
                }
            }
        }
        return true;
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    public int cost() {
        return cost;
    }

    /**
     * Whether the output is invariant under any permutation of the inputs.
     */
    public boolean isSymmetric() {
        return symmetric;
    }

    int table() {
        return table;
    }

    public boolean evaluate(boolean... inputs) {
        if (inputs.length != arity) {
            throw new IllegalArgumentException(
                    String.format("Gate %s expects %d inputs, got %d", name, arity, inputs.length));
        }
        int minterm = 0;
        for (int i = 0; i < arity; i++) {
            if (inputs[i]) {
                minterm |= 1 << i;
            }
        }
        return ((table >>> minterm) & 1) != 0;
    }

    /**
     * Applies this gate to whole columns at once, 64 rows per step, as the disjunction of the
     * minterms of the gate's table.
     */
    public TruthTable apply(TruthTable... inputs) {
        if (inputs.length != arity) {
            throw new IllegalArgumentException(
                    String.format("Gate %s expects %d inputs, got %d", name, arity, inputs.length));
        }
        int length = inputs[0].length();
        for (TruthTable input : inputs) {
            if (input.length() != length) {
                throw new IllegalArgumentException("Input columns differ in length");
            }
        }
        int wordCount = inputs[0].wordCount();
        long[] result = new long[wordCount];
        for (int w = 0; w < wordCount; w++) {
            long output = 0L;
            for (int minterm = 0; minterm < (1 << arity); minterm++) {
                if (((table >>> minterm) & 1) == 0) {
                    continue;
                }
                long term = -1L;
                for (int i = 0; i < arity; i++) {
                    long word = inputs[i].word(w);
                    term &= ((minterm >>> i) & 1) != 0 ? word : ~word;
                }
                output |= term;
            }
            result[w] = output;
        }
        return TruthTable.wrap(length, result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Gate)) {
            return false;
        }
        Gate other = (Gate) o;
        return arity == other.arity && cost == other.cost && table == other.table && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity, cost, table);
    }

    @Override
    public String toString() {
        return String.format("%s/%d[cost=%d]", name, arity, cost);
    }

    /**
     * The boolean function computed by a gate. Implementations must be pure.
     */
    @FunctionalInterface
    public interface GateFunction {
        boolean evaluate(boolean[] inputs);
    }
}
