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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces the signals of one complexity level: every gate of the library is applied to every
 * arity-matching combination of pool signals, the result is deduplicated against the pool.
 *
 * <p>Symmetric gates receive combinations with repetition, in pool order, so permutations of the
 * same inputs are not generated twice. Other gates receive all ordered tuples. Only tuples that
 * contain at least one signal of the previous level are considered, every other tuple was already
 * evaluated in an earlier level. Consequently, each new signal lies exactly one level above its
 * highest input.</p>
 *
 * <p>Gates are processed in library order, tuples in lexicographic pool order, which makes the
 * generated pool deterministic.</p>
 */
public final class LevelGenerator {
    private static final Logger logger = Logger.getLogger(LevelGenerator.class.getName());

    private final GateLibrary library;
    private final PruningPolicy pruning;
    private long explored = 0;
    private long skipped = 0;

    public LevelGenerator(GateLibrary library, PruningPolicy pruning) {
        this.library = library;
        this.pruning = pruning;
    }

    public List<Signal> generate(SignalPool pool) {
        return generate(pool, (gate, inputs, existing, level) -> {});
    }

    /**
     * Opens a new level in the pool and fills it.
     *
     * @param pool
     *     The pool to extend.
     * @param listener
     *     Notified about every evaluated candidate whose table already was in the pool.
     *
     * @return The signals added to the new level, in discovery order.
     */
    public List<Signal> generate(SignalPool pool, DuplicateListener listener) {
        int previous = pool.newestLevel();
        int frontier = pool.levelStart(previous);
        int domain = pool.size();
        int level = pool.openLevel();
        long exploredBefore = explored;
        long skippedBefore = skipped;

        for (Gate gate : library) {
            Signal[] inputs = new Signal[gate.arity()];
            TruthTable[] tables = new TruthTable[gate.arity()];
            CombinationIterator combinations =
                    new CombinationIterator(gate.arity(), domain, frontier, !gate.isSymmetric());
            while (combinations.hasNext()) {
                int[] combination = combinations.next();
                for (int i = 0; i < inputs.length; i++) {
                    inputs[i] = pool.signal(combination[i]);
                    tables[i] = inputs[i].bits();
                }
                if (pruning.shouldSkip(gate, inputs)) {
                    skipped += 1;
                    continue;
                }
                explored += 1;
                TruthTable bits = gate.apply(tables);
                SignalPool.Insertion insertion = pool.tryInsert(bits, gate, inputs, level);
                if (logger.isLoggable(Level.FINEST)) {
                    logger.log(Level.FINEST, "Trying {0}({1}) [level {2}] -> {3} ({4})", new Object[] {
                        gate.name(), Arrays.stream(inputs).map(Signal::toString).collect(Collectors.joining(", ")),
                        level, bits,
                        insertion.isNew() ? "new" : "duplicate of " + insertion.signal()
                    });
                }
                if (!insertion.isNew()) {
                    listener.onDuplicate(gate, inputs, insertion.signal(), level);
                }
            }
        }

        List<Signal> created = pool.level(level);
        logger.log(Level.FINER, "Level {0}: evaluated {1}, pruned {2}, created {3}", new Object[] {
            level, explored - exploredBefore, skipped - skippedBefore, created.size()
        });
        return created;
    }

    /**
     * Number of evaluated gate applications over all levels generated so far.
     */
    public long explored() {
        return explored;
    }

    /**
     * Number of gate applications skipped by the pruning policy over all levels generated so far.
     */
    public long skipped() {
        return skipped;
    }

    @FunctionalInterface
    public interface DuplicateListener {
        /**
         * Called when applying {@code gate} to {@code inputs} yields the table of the already
         * present {@code existing}. The input array is reused afterwards and must be copied if
         * retained.
         */
        void onDuplicate(Gate gate, Signal[] inputs, Signal existing, int level);
    }
}
