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

import java.time.Duration;

/**
 * A snapshot of a running search.
 */
public final class Progress {
    private final int level;
    private final long signalsExplored;
    private final long signalsSkippedByPruning;
    private final int poolSize;
    private final Duration elapsed;

    Progress(int level, long signalsExplored, long signalsSkippedByPruning, int poolSize, Duration elapsed) {
        this.level = level;
        this.signalsExplored = signalsExplored;
        this.signalsSkippedByPruning = signalsSkippedByPruning;
        this.poolSize = poolSize;
        this.elapsed = elapsed;
    }

    public int level() {
        return level;
    }

    /** Gate applications evaluated so far. */
    public long signalsExplored() {
        return signalsExplored;
    }

    public long signalsSkippedByPruning() {
        return signalsSkippedByPruning;
    }

    public int poolSize() {
        return poolSize;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return String.format("level %d: %d explored, %d pruned, %d signals, %d ms",
                level, signalsExplored, signalsSkippedByPruning, poolSize, elapsed.toMillis());
    }
}
