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
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * The level loop shared by the drivers: owns the pool of one run, applies the pool cap, keeps
 * time and reports progress.
 */
final class SearchRun {
    private final SynthesisConfiguration configuration;
    private final SynthesisListener listener;
    private final SignalPool pool;
    private final LevelGenerator generator;
    private final Predicate<Signal> pinned;
    private final ToIntFunction<Signal> rank;
    private final long startNanos;

    SearchRun(SynthesisProblem problem, GateLibrary library, SynthesisConfiguration configuration,
            SynthesisListener listener, Predicate<Signal> pinned) {
        this.configuration = configuration;
        this.listener = listener;
        this.pinned = pinned;
        this.rank = Circuits.rankKey(configuration.retentionPolicy());
        this.startNanos = System.nanoTime();
        this.pool = SignalPool.seed(problem.inputs());
        this.generator = new LevelGenerator(library,
                configuration.pruning() ? PruningPolicy.degenerateInputs(library) : PruningPolicy.none());
    }

    SignalPool pool() {
        return pool;
    }

    int level() {
        return pool.newestLevel();
    }

    /**
     * Generates the next level and returns its signals. An empty result means that the pool is
     * closed under the library, no further level can add anything.
     */
    List<Signal> nextLevel(LevelGenerator.DuplicateListener duplicates) {
        generator.generate(pool, duplicates);
        configuration.poolCapPerLevel().ifPresent(cap -> pool.retainNewest(cap, rank, pinned));
        if (level() % configuration.progressInterval() == 0) {
            listener.onProgress(progress());
        }
        return pool.level(level());
    }

    boolean outOfTime() {
        return configuration.timeLimit().map(limit -> elapsed().compareTo(limit) >= 0).orElse(false);
    }

    Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    Progress progress() {
        return new Progress(level(), generator.explored(), generator.skipped(), pool.size(), elapsed());
    }
}
