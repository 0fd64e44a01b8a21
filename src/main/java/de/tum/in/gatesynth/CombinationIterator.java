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
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates, in lexicographic order, over all tuples of {@code size} positions from
 * {@code [0, domain)} which contain at least one position from {@code [frontier, domain)}. For
 * unordered iteration only non-decreasing tuples (combinations with repetition) are produced,
 * otherwise all tuples.
 *
 * <p>The returned array is modified in-place by subsequent calls to {@link #next()}.</p>
 */
final class CombinationIterator implements Iterator<int[]> {
    private final int[] iteration;
    private final int domain;
    private final int frontier;
    private final boolean ordered;
    private boolean started = false;
    private boolean hasNext;

    CombinationIterator(int size, int domain, int frontier, boolean ordered) {
        assert size > 0 && 0 <= frontier;
        this.iteration = new int[size];
        this.domain = domain;
        this.frontier = frontier;
        this.ordered = ordered;
        this.hasNext = frontier < domain;
        if (hasNext) {
            iteration[size - 1] = frontier;
        }
    }

    @Override
    public boolean hasNext() {
        if (!started || !hasNext) {
            return hasNext;
        }
        return advance();
    }

    private boolean advance() {
        int size = iteration.length;
        int position = size - 1;
        while (position >= 0 && iteration[position] == domain - 1) {
            position -= 1;
        }
        if (position < 0) {
            hasNext = false;
            return false;
        }
        iteration[position] += 1;
        int reset = ordered ? 0 : iteration[position];
        for (int i = position + 1; i < size; i++) {
            iteration[i] = reset;
        }
        // Skip tuples lying entirely before the frontier
        if (ordered) {
            int max = 0;
            for (int i = 0; i < size - 1; i++) {
                max = Math.max(max, iteration[i]);
            }
            if (max < frontier && iteration[size - 1] < frontier) {
                iteration[size - 1] = frontier;
            }
        } else if (iteration[size - 1] < frontier) {
            iteration[size - 1] = frontier;
        }
        started = false;
        return true;
    }

    @SuppressWarnings("AssignmentOrReturnOfFieldWithMutableType")
    @Override
    public int[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No next element");
        }
        started = true;
        return iteration;
    }

    @Override
    public String toString() {
        return Arrays.toString(iteration);
    }
}
