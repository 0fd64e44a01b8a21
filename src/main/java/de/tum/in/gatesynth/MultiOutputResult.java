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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Outcome of a multi-output search: a realizing signal for every reachable output, the outputs
 * which could not be realized within the budget, and the combined cost of the realized outputs
 * where shared signals are counted once.
 */
public final class MultiOutputResult {
    private final Map<String, Signal> solutions;
    private final Set<String> unreachable;
    private final int totalCost;
    private final OptionalInt firstFullMatchLevel;
    private final SignalPool pool;
    private final Progress statistics;

    MultiOutputResult(Map<String, Signal> solutions, Set<String> unreachable, OptionalInt firstFullMatchLevel,
            SignalPool pool, Progress statistics) {
        this.solutions = Collections.unmodifiableMap(new LinkedHashMap<>(solutions));
        this.unreachable = Collections.unmodifiableSet(new LinkedHashSet<>(unreachable));
        this.totalCost = Circuits.cost(solutions.values());
        this.firstFullMatchLevel = firstFullMatchLevel;
        this.pool = pool;
        this.statistics = statistics;
    }

    /**
     * The realizing signal of each reachable output, in the order of the targets.
     */
    public Map<String, Signal> solutions() {
        return solutions;
    }

    public Set<String> unreachable() {
        return unreachable;
    }

    public boolean isComplete() {
        return unreachable.isEmpty();
    }

    public int totalCost() {
        return totalCost;
    }

    /**
     * The level after which all outputs were realizable, if that happened.
     */
    public OptionalInt firstFullMatchLevel() {
        return firstFullMatchLevel;
    }

    public SignalPool pool() {
        return pool;
    }

    public Progress statistics() {
        return statistics;
    }

    public String toNetlist() {
        return Circuits.toNetlist(solutions);
    }

    @Override
    public String toString() {
        return String.format("%s, unreachable %s, total cost %d", solutions, unreachable, totalCost);
    }
}
