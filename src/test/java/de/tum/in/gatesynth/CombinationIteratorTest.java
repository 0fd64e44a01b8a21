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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

public class CombinationIteratorTest {
    private static List<List<Integer>> iterate(int size, int domain, int frontier, boolean ordered) {
        List<List<Integer>> tuples = new ArrayList<>();
        CombinationIterator iterator = new CombinationIterator(size, domain, frontier, ordered);
        while (iterator.hasNext()) {
            tuples.add(asList(iterator.next()));
        }
        return tuples;
    }

    private static List<List<Integer>> bruteForce(int size, int domain, int frontier, boolean ordered) {
        List<List<Integer>> tuples = new ArrayList<>();
        int total = 1;
        for (int i = 0; i < size; i++) {
            total *= domain;
        }
        int[] tuple = new int[size];
        for (int code = 0; code < total; code++) {
            int rest = code;
            for (int i = size - 1; i >= 0; i--) {
                tuple[i] = rest % domain;
                rest /= domain;
            }
            boolean touchesFrontier = Arrays.stream(tuple).anyMatch(position -> position >= frontier);
            boolean sorted = true;
            for (int i = 0; i + 1 < size; i++) {
                sorted &= tuple[i] <= tuple[i + 1];
            }
            if (touchesFrontier && (ordered || sorted)) {
                tuples.add(asList(tuple));
            }
        }
        return tuples;
    }

    private static List<Integer> asList(int[] tuple) {
        List<Integer> list = new ArrayList<>(tuple.length);
        for (int position : tuple) {
            list.add(position);
        }
        return list;
    }

    @Test
    public void testMatchesBruteForce() {
        for (int size = 1; size <= 4; size++) {
            for (int domain = 0; domain <= 6; domain++) {
                for (int frontier = 0; frontier <= domain; frontier++) {
                    for (boolean ordered : new boolean[] {true, false}) {
                        assertThat(String.format("size %d, domain %d, frontier %d, ordered %s",
                                        size, domain, frontier, ordered),
                                iterate(size, domain, frontier, ordered),
                                is(bruteForce(size, domain, frontier, ordered)));
                    }
                }
            }
        }
    }

    @Test
    public void testCounts() {
        // 5 multisets of size 2 over 4 elements minus 3 over the first 2
        assertThat(iterate(2, 4, 2, false).size(), is(7));
        assertThat(iterate(2, 4, 2, true).size(), is(16 - 4));
        assertThat(iterate(3, 5, 0, false).size(), is(35));
    }

    @Test
    public void testExhausted() {
        CombinationIterator iterator = new CombinationIterator(2, 3, 3, true);
        assertThat(iterator.hasNext(), is(false));
        assertThrows(NoSuchElementException.class, iterator::next);
    }
}
