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

/**
 * Decides, before evaluation, that applying a gate to some inputs cannot yield a table which is
 * not already in the pool or produced elsewhere in the same level.
 *
 * <p>Implementations must be sound: skipping a combination must never remove a table from the
 * pool, only a redundant way of producing it.</p>
 */
@FunctionalInterface
public interface PruningPolicy {
    /**
     * @param gate
     *     The gate about to be applied.
     * @param inputs
     *     The inputs in argument order. The array must not be modified.
     *
     * @return Whether the application should be skipped.
     */
    boolean shouldSkip(Gate gate, Signal[] inputs);

    static PruningPolicy none() {
        return (gate, inputs) -> false;
    }

    static PruningPolicy degenerateInputs(GateLibrary library) {
        return new DegenerateInputPruning(library);
    }
}
