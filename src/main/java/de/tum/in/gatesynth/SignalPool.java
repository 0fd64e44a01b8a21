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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The arena of all distinct signals found during one search run. Signals are keyed by
 * their truth table, and at most one signal exists per table. Signals are stored in discovery
 * order, partitioned into consecutive levels; level 0 holds the input variables.
 *
 * <p>The pool is not thread safe. It has a single writer, the {@link LevelGenerator}.</p>
 */
public final class SignalPool {
    private static final Logger logger = Logger.getLogger(SignalPool.class.getName());

    private final int rows;
    private final Map<TruthTable, Signal> index = new HashMap<>();
    private final List<Signal> signals = new ArrayList<>();
    private int[] levelStarts = new int[16];
    private int levelCount = 0;
    private int nextId = 0;

    private SignalPool(int rows) {
        this.rows = rows;
    }

    /**
     * Creates a pool whose level 0 contains one leaf per input variable, in the iteration order of
     * the map. A variable whose column equals the column of an earlier variable is not added.
     */
    public static SignalPool seed(Map<String, TruthTable> inputs) {
        Util.checkConfiguration(!inputs.isEmpty(), "No input variables given");
        int rows = inputs.values().iterator().next().length();
        SignalPool pool = new SignalPool(rows);
        pool.openLevel();
        inputs.forEach((name, bits) -> {
            Util.checkConfiguration(bits.length() == rows, "Input %s has %d rows, expected %d", name, bits.length(), rows);
            if (pool.index.containsKey(bits)) {
                logger.log(Level.WARNING, "Input {0} duplicates input {1}, ignoring it",
                        new Object[] {name, pool.index.get(bits)});
                return;
            }
            Signal leaf = Signal.leaf(name, bits, pool.nextId++);
            pool.index.put(bits, leaf);
            pool.signals.add(leaf);
        });
        return pool;
    }

    public int rows() {
        return rows;
    }

    public int size() {
        return signals.size();
    }

    /**
     * Number of levels, including level 0.
     */
    public int levelCount() {
        return levelCount;
    }

    public int newestLevel() {
        return levelCount - 1;
    }

    public List<Signal> signals() {
        return Collections.unmodifiableList(signals);
    }

    public Signal signal(int position) {
        return signals.get(position);
    }

    public List<Signal> level(int level) {
        return Collections.unmodifiableList(signals.subList(levelStart(level), levelEnd(level)));
    }

    int levelStart(int level) {
        if (level < 0 || level >= levelCount) {
            throw new IndexOutOfBoundsException(String.format("Level %d out of range [0, %d)", level, levelCount));
        }
        return levelStarts[level];
    }

    int levelEnd(int level) {
        return level == levelCount - 1 ? signals.size() : levelStart(level + 1);
    }

    public Optional<Signal> lookup(TruthTable bits) {
        return Optional.ofNullable(index.get(bits));
    }

    public boolean contains(TruthTable bits) {
        return index.containsKey(bits);
    }

    /**
     * Starts a new, empty level and returns its number.
     */
    int openLevel() {
        if (levelCount == levelStarts.length) {
            levelStarts = Arrays.copyOf(levelStarts, levelStarts.length * 2);
        }
        levelStarts[levelCount] = signals.size();
        levelCount += 1;
        return levelCount - 1;
    }

    /**
     * Inserts the signal obtained by applying {@code gate} to {@code inputs} unless a signal with the
     * same table already exists, in which case the existing signal is returned and the candidate is
     * discarded. New signals always go to the newest level.
     */
    public Insertion tryInsert(TruthTable bits, Gate gate, Signal[] inputs, int level) {
        assert level == newestLevel() && level > 0;
        assert bits.length() == rows;
        Signal existing = index.get(bits);
        if (existing != null) {
            return new Insertion(existing, false);
        }
        Signal signal = Signal.derived(bits, gate, inputs, level, nextId++);
        index.put(bits, signal);
        signals.add(signal);
        return new Insertion(signal, true);
    }

    /**
     * Shrinks the newest level to at most {@code cap} signals plus all signals matching
     * {@code pinned}. Signals with a lower {@code rank} are kept first, ties go to the earlier
     * signal; the survivors keep their discovery order. The rank of each signal is computed once.
     * Dropped tables may be rediscovered by later levels, so enabling this loses completeness.
     *
     * @return The number of dropped signals.
     */
    int retainNewest(int cap, ToIntFunction<Signal> rank, Predicate<Signal> pinned) {
        int start = levelStarts[newestLevel()];
        List<Signal> newest = signals.subList(start, signals.size());
        if (newest.size() <= cap) {
            return 0;
        }

        Set<Signal> kept = new HashSet<>();
        int[] keys = new int[newest.size()];
        Integer[] order = new Integer[newest.size()];
        for (int i = 0; i < keys.length; i++) {
            Signal signal = newest.get(i);
            if (pinned.test(signal)) {
                kept.add(signal);
            }
            keys[i] = rank.applyAsInt(signal);
            order[i] = i;
        }
        int pinnedCount = kept.size();
        // Positions follow discovery order, so they break ties
        Arrays.sort(order, Comparator.<Integer>comparingInt(i -> keys[i]).thenComparingInt(i -> i));
        for (int i : order) {
            if (kept.size() - pinnedCount >= cap) {
                break;
            }
            kept.add(newest.get(i));
        }

        List<Signal> survivors = new ArrayList<>(kept.size());
        for (Signal signal : newest) {
            if (kept.contains(signal)) {
                survivors.add(signal);
            } else {
                index.remove(signal.bits());
            }
        }
        int dropped = newest.size() - survivors.size();
        newest.clear();
        signals.addAll(survivors);
        logger.log(Level.FINER, "Capped level {0}: kept {1}, dropped {2}",
                new Object[] {newestLevel(), survivors.size(), dropped});
        return dropped;
    }

    @Override
    public String toString() {
        return String.format("Pool[%d signals, %d levels, %d rows]", signals.size(), levelCount, rows);
    }

    /**
     * Result of {@link #tryInsert}: the signal now representing the table and whether it was newly
     * created.
     */
    public static final class Insertion {
        private final Signal signal;
        private final boolean isNew;

        Insertion(Signal signal, boolean isNew) {
            this.signal = signal;
            this.isNew = isNew;
        }

        public Signal signal() {
            return signal;
        }

        public boolean isNew() {
            return isNew;
        }
    }
}
