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

import java.util.HashMap;
import java.util.Map;

/**
 * Skips gate applications that receive the same signal on several inputs, whenever the gate
 * restricted to its distinct inputs degenerates into something the search produces anyway:
 * <ul>
 *   <li>a projection onto one of the inputs, e.g. {@code AND2(x, x) = x}, which is already in
 *   the pool;</li>
 *   <li>a constant, e.g. {@code XOR2(x, x) = 0}, which is kept only for the very first signal of
 *   the pool, since the constant does not depend on the input;</li>
 *   <li>another library gate of lower arity applied to the distinct inputs, e.g.
 *   {@code AND3(x, x, y) = AND2(x, y)}, which the same level generates directly.</li>
 * </ul>
 * The reductions are derived from the gate tables, so the rules hold for arbitrary libraries,
 * including {@code NAND2(x, x)} which is only skipped if the library contains a {@code NOT}.
 */
final class DegenerateInputPruning implements PruningPolicy {
    private static final int PATTERN_COUNT = 1 << (2 * Gate.MAX_ARITY);

    private final GateLibrary library;
    private final Map<Gate, Reduction[]> reductions = new HashMap<>();

    DegenerateInputPruning(GateLibrary library) {
        this.library = library;
    }

    @Override
    public boolean shouldSkip(Gate gate, Signal[] inputs) {
        int arity = inputs.length;
        if (arity < 2) {
            return false;
        }

        // Assign each argument the index of the distinct input it carries, by first appearance
        int[] classOf = new int[arity];
        int classes = 0;
        int pattern = 0;
        for (int i = 0; i < arity; i++) {
            int clazz = -1;
            for (int j = 0; j < i; j++) {
                if (inputs[j] == inputs[i]) {
                    clazz = classOf[j];
                    break;
                }
            }
            if (clazz == -1) {
                clazz = classes;
                classes += 1;
            }
            classOf[i] = clazz;
            pattern |= clazz << (2 * i);
        }
        if (classes == arity) {
            return false;
        }

        switch (reduction(gate, pattern, classOf, classes)) {
            case PROJECTION:
            case LOWER_ARITY_GATE:
                return true;
            case CONSTANT:
                return classes != 1 || inputs[0].id() != 0;
            case NONE:
                return false;
            default:
                throw new AssertionError();
        }
    }

    private Reduction reduction(Gate gate, int pattern, int[] classOf, int classes) {
        Reduction[] byPattern = reductions.computeIfAbsent(gate, g -> new Reduction[PATTERN_COUNT]);
        Reduction reduction = byPattern[pattern];
        if (reduction == null) {
            reduction = classify(gate, classOf, classes);
            byPattern[pattern] = reduction;
        }
        return reduction;
    }

    private Reduction classify(Gate gate, int[] classOf, int classes) {
        int table = gate.table();
        int reduced = 0;
        for (int assignment = 0; assignment < (1 << classes); assignment++) {
            int minterm = 0;
            for (int i = 0; i < classOf.length; i++) {
                if (((assignment >>> classOf[i]) & 1) != 0) {
                    minterm |= 1 << i;
                }
            }
            if (((table >>> minterm) & 1) != 0) {
                reduced |= 1 << assignment;
            }
        }

        int full = (1 << (1 << classes)) - 1;
        if (reduced == 0 || reduced == full) {
            return Reduction.CONSTANT;
        }
        for (int variable = 0; variable < classes; variable++) {
            if (reduced == projection(variable, classes)) {
                return Reduction.PROJECTION;
            }
        }
        for (Gate other : library) {
            if (other.arity() == classes && other.table() == reduced) {
                return Reduction.LOWER_ARITY_GATE;
            }
        }
        return Reduction.NONE;
    }

    private static int projection(int variable, int variables) {
        int table = 0;
        for (int assignment = 0; assignment < (1 << variables); assignment++) {
            if (((assignment >>> variable) & 1) != 0) {
                table |= 1 << assignment;
            }
        }
        return table;
    }

    private enum Reduction {
        NONE,
        PROJECTION,
        CONSTANT,
        LOWER_ARITY_GATE
    }
}
