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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of a single-output search: either the first signal found whose table equals the target,
 * or exhaustion of the level budget.
 */
public final class SingleOutputResult {
    private final SearchState state;
    @Nullable
    private final Signal solution;
    private final SignalPool pool;
    private final Progress statistics;

    SingleOutputResult(SearchState state, @Nullable Signal solution, SignalPool pool, Progress statistics) {
        assert state != SearchState.SEARCHING;
        assert (state == SearchState.FOUND) == (solution != null);
        this.state = state;
        this.solution = solution;
        this.pool = pool;
        this.statistics = statistics;
    }

    public SearchState state() {
        return state;
    }

    public boolean isFound() {
        return state == SearchState.FOUND;
    }

    public Optional<Signal> solution() {
        return Optional.ofNullable(solution);
    }

    /**
     * Cost of the found circuit.
     *
     * @throws IllegalStateException if no solution was found.
     */
    public int cost() {
        Util.checkState(solution != null, "No solution found");
        return Circuits.cost(solution);
    }

    /**
     * The pool at the end of the search.
     */
    public SignalPool pool() {
        return pool;
    }

    public Progress statistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return solution == null
                ? String.format("Exhausted after %d levels", statistics.level())
                : String.format("%s [level=%d, cost=%d]", solution, solution.level(), cost());
    }
}
