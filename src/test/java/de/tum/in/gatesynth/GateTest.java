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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class GateTest {
    private static final TruthTable A = TruthTable.variable(0, 2);
    private static final TruthTable B = TruthTable.variable(1, 2);

    @ParameterizedTest
    @EnumSource(StandardGates.class)
    public void testColumnApplicationMatchesRows(StandardGates standard) {
        Gate gate = standard.gate(1);
        int arity = gate.arity();
        TruthTable[] inputs = new TruthTable[arity];
        for (int i = 0; i < arity; i++) {
            inputs[i] = TruthTable.variable(i, arity);
        }
        TruthTable output = gate.apply(inputs);
        for (int row = 0; row < (1 << arity); row++) {
            boolean[] values = new boolean[arity];
            for (int i = 0; i < arity; i++) {
                values[i] = inputs[i].get(row);
            }
            assertThat(output.get(row), is(gate.evaluate(values)));
            assertThat(output.get(row), is(standard.function().evaluate(values)));
        }
        // All standard gates are symmetric
        assertThat(gate.isSymmetric(), is(true));
    }

    @Test
    public void testTwoInputGates() {
        assertThat(StandardGates.AND2.gate(1).apply(A, B).toString(), is("0001"));
        assertThat(StandardGates.OR2.gate(1).apply(A, B).toString(), is("0111"));
        assertThat(StandardGates.NAND2.gate(1).apply(A, B).toString(), is("1110"));
        assertThat(StandardGates.NOR2.gate(1).apply(A, B).toString(), is("1000"));
        assertThat(StandardGates.XOR2.gate(1).apply(A, B).toString(), is("0110"));
        assertThat(StandardGates.XNOR2.gate(1).apply(A, B).toString(), is("1001"));
        assertThat(StandardGates.NOT.gate(1).apply(A).toString(), is("1100"));
    }

    @Test
    public void testWideColumns() {
        TruthTable first = TruthTable.variable(0, 8);
        TruthTable last = TruthTable.variable(7, 8);
        TruthTable xor = StandardGates.XOR2.gate(1).apply(first, last);
        for (int row = 0; row < 256; row++) {
            assertThat(xor.get(row), is(first.get(row) ^ last.get(row)));
        }
    }

    @Test
    public void testSymmetry() {
        Gate implies = Gate.of("IMPLIES", 2, 1, in -> !in[0] || in[1]);
        assertThat(implies.isSymmetric(), is(false));
        assertThat(implies.apply(A, B).toString(), is("1101"));

        Gate mux = Gate.of("MUX", 3, 1, in -> in[0] ? in[2] : in[1]);
        assertThat(mux.isSymmetric(), is(false));
        Gate majority = Gate.of("MAJ", 3, 1, in -> (in[0] ? 1 : 0) + (in[1] ? 1 : 0) + (in[2] ? 1 : 0) >= 2);
        assertThat(majority.isSymmetric(), is(true));
    }

    @Test
    public void testInvalidGates() {
        assertThrows(ConfigurationException.class, () -> Gate.of("WIDE", 5, 1, in -> true));
        assertThrows(ConfigurationException.class, () -> Gate.of("NONE", 0, 1, in -> true));
        assertThrows(ConfigurationException.class, () -> Gate.of("CHEAP", 2, -1, in -> true));
        assertThrows(ConfigurationException.class, () -> Gate.of(" ", 2, 1, in -> true));
        assertThrows(IllegalArgumentException.class, () -> StandardGates.AND2.gate(1).apply(A));
        assertThrows(IllegalArgumentException.class, () -> StandardGates.AND2.gate(1).evaluate(true));
    }

    @Test
    public void testEquality() {
        assertThat(StandardGates.AND2.gate(2), is(StandardGates.AND2.gate(2)));
        assertThat(StandardGates.AND2.gate(2).equals(StandardGates.AND2.gate(3)), is(false));
        assertThat(StandardGates.AND2.gate(2).toString(), is("AND2/2[cost=2]"));
    }

    @Test
    public void testCatalogue() {
        assertThat(StandardGates.byName("nand2").isPresent(), is(true));
        assertThat(StandardGates.byName(" Xor2 ").orElseThrow(), is(StandardGates.XOR2));
        assertThat(StandardGates.byName("MUX").isPresent(), is(false));
        assertThat(StandardGates.NOR4.arity(), is(4));

        Map<String, Integer> costs = new LinkedHashMap<>();
        costs.put("XOR2", 3);
        costs.put("and2", 2);
        GateLibrary library = StandardGates.library(costs);
        assertThat(library.size(), is(2));
        assertThat(library.gates().get(0).name(), is("XOR2"));
        assertThat(library.gate("AND2").orElseThrow().cost(), is(2));
        assertThat(library.maxArity(), is(2));
        assertThrows(ConfigurationException.class, () -> StandardGates.library(Map.of("MUX", 1)));
    }

    @Test
    public void testInvalidLibraries() {
        assertThrows(ConfigurationException.class, () -> GateLibrary.of(List.of()));
        assertThrows(ConfigurationException.class,
                () -> GateLibrary.of(StandardGates.AND2.gate(1), StandardGates.AND2.gate(2)));
    }
}
