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

final class HashUtil {
    // Cheap multiplicative mixing, called once per truth table on construction
    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int length, long[] words) {
        int hash = length;
        for (long word : words) {
            hash = PRIME * hash + (int) (word ^ (word >>> 32));
        }
        return hash;
    }
}
