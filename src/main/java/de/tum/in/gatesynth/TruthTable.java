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

/**
 * An immutable, packed column of a truth table, i.e. the value of one boolean function for each
 * row of the input table. Row {@code r} is stored in bit {@code r % 64} of word {@code r / 64};
 * bits beyond {@link #length()} are always zero, so equality of the word arrays coincides with
 * equality of the columns.
 *
 * <p>Truth tables are the identity of signals: two signals are considered the same function iff
 * their tables are equal.</p>
 */
public final class TruthTable {
    private static final int WORD_BITS = Long.SIZE;

    private final int length;
    private final long[] words;
    private final int hash;

    private TruthTable(int length, long[] words) {
        assert words.length == wordCount(length);
        if (words.length > 0) {
            words[words.length - 1] &= lastWordMask(length);
        }
        this.length = length;
        this.words = words;
        this.hash = HashUtil.hash(length, words);
    }

    static int wordCount(int length) {
        return (length + WORD_BITS - 1) / WORD_BITS;
    }

    private static long lastWordMask(int length) {
        int remainder = length % WORD_BITS;
        return remainder == 0 ? -1L : (1L << remainder) - 1L;
    }

    /**
     * Takes ownership of the given array; the caller must not modify it afterwards.
     */
    static TruthTable wrap(int length, long[] words) {
        return new TruthTable(length, words);
    }

    public static TruthTable of(boolean... bits) {
        long[] words = new long[wordCount(bits.length)];
        for (int row = 0; row < bits.length; row++) {
            if (bits[row]) {
                words[row / WORD_BITS] |= 1L << (row % WORD_BITS);
            }
        }
        return new TruthTable(bits.length, words);
    }

    /**
     * Creates a table from {@code 0}/{@code 1} values.
     *
     * @throws IllegalArgumentException if some value is neither 0 nor 1.
     */
    public static TruthTable of(int... bits) {
        boolean[] values = new boolean[bits.length];
        for (int row = 0; row < bits.length; row++) {
            if (bits[row] != 0 && bits[row] != 1) {
                throw new IllegalArgumentException(String.format("Non-binary value %d in row %d", bits[row], row));
            }
            values[row] = bits[row] == 1;
        }
        return of(values);
    }

    /**
     * Parses a string of {@code 0} and {@code 1} characters, first character is row 0.
     */
    public static TruthTable parse(String bits) {
        boolean[] values = new boolean[bits.length()];
        for (int row = 0; row < bits.length(); row++) {
            char c = bits.charAt(row);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException(String.format("Non-binary character '%s' in %s", c, bits));
            }
            values[row] = c == '1';
        }
        return of(values);
    }

    public static TruthTable constant(int length, boolean value) {
        long[] words = new long[wordCount(length)];
        if (value) {
            Arrays.fill(words, -1L);
        }
        return new TruthTable(length, words);
    }

    /**
     * Returns the column of input variable {@code index} in the canonical table over {@code count}
     * variables: row {@code r} assigns the variable the bit {@code (r >> (count - 1 - index)) & 1},
     * so the first variable is the most significant one.
     */
    public static TruthTable variable(int index, int count) {
        if (count < 0 || count > 24) {
            throw new IllegalArgumentException("Unsupported variable count " + count);
        }
        if (index < 0 || index >= count) {
            throw new IllegalArgumentException(String.format("Variable %d out of range [0, %d)", index, count));
        }
        int rows = 1 << count;
        int shift = count - 1 - index;
        long[] words = new long[wordCount(rows)];
        for (int row = 0; row < rows; row++) {
            if (((row >>> shift) & 1) != 0) {
                words[row / WORD_BITS] |= 1L << (row % WORD_BITS);
            }
        }
        return new TruthTable(rows, words);
    }

    public int length() {
        return length;
    }

    public boolean get(int row) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException(String.format("Row %d out of range [0, %d)", row, length));
        }
        return (words[row / WORD_BITS] & (1L << (row % WORD_BITS))) != 0;
    }

    int wordCount() {
        return words.length;
    }

    long word(int index) {
        return words[index];
    }

    public int cardinality() {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    public boolean isConstant() {
        int cardinality = cardinality();
        return cardinality == 0 || cardinality == length;
    }

    public boolean[] toArray() {
        boolean[] values = new boolean[length];
        for (int row = 0; row < length; row++) {
            values[row] = get(row);
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TruthTable)) {
            return false;
        }
        TruthTable other = (TruthTable) o;
        return hash == other.hash && length == other.length && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(length);
        for (int row = 0; row < length; row++) {
            builder.append(get(row) ? '1' : '0');
        }
        return builder.toString();
    }
}
