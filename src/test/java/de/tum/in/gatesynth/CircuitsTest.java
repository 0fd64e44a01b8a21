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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import org.junit.jupiter.api.Test;

public class CircuitsTest {
    private static final Gate NAND = StandardGates.NAND2.gate(1);
    private static final Gate XOR = StandardGates.XOR2.gate(3);
    private static final Map<String, TruthTable> INPUTS = SynthesisProblem.inputsFor("A", "B");

    private final Signal a = Signal.leaf("A", INPUTS.get("A"), 0);
    private final Signal b = Signal.leaf("B", INPUTS.get("B"), 1);
    private final Signal nand = Signal.derived(TruthTable.parse("1110"), NAND, new Signal[] {a, b}, 1, 2);
    private final Signal left = Signal.derived(TruthTable.parse("1101"), NAND, new Signal[] {a, nand}, 2, 3);
    private final Signal right = Signal.derived(TruthTable.parse("1011"), NAND, new Signal[] {b, nand}, 2, 4);
    private final Signal xor = Signal.derived(TruthTable.parse("0110"), NAND, new Signal[] {left, right}, 3, 5);

    @Test
    public void testCollect() {
        assertThat(Circuits.collect(List.of(xor)), contains(a, b, nand, left, right, xor));
    }

    @Test
    public void testSharedCost() {
        assertThat(Circuits.cost(xor), is(4));
        assertThat(Circuits.cost(List.of(xor, nand, left)), is(4));
        assertThat(Circuits.cost(a), is(0));
        Signal direct = Signal.derived(TruthTable.parse("0110"), XOR, new Signal[] {a, b}, 1, 6);
        assertThat(Circuits.cost(List.of(direct, nand)), is(4));
    }

    @Test
    public void testEvaluate() {
        assertThat(Circuits.evaluate(xor, INPUTS), is(TruthTable.parse("0110")));
        assertThat(Circuits.evaluate(left, INPUTS), is(left.bits()));
        assertThrows(IllegalArgumentException.class, () -> Circuits.evaluate(xor, Map.of("A", INPUTS.get("A"))));
    }

    @Test
    public void testExpression() {
        assertThat(xor.toString(), is("NAND2(NAND2(A, NAND2(A, B)), NAND2(B, NAND2(A, B)))"));
        assertThat(xor.ownCost(), is(1));
        assertThat(xor.isDetached(), is(false));
    }

    @Test
    public void testNetlist() {
        String separator = System.lineSeparator();
        assertThat(Circuits.toNetlist(ImmutableMap.of("Sum", xor, "Left", left, "Input", a)),
                is("N1 = NAND2(A, B)" + separator
                        + "N2 = NAND2(A, N1)" + separator
                        + "N3 = NAND2(B, N1)" + separator
                        + "N4 = NAND2(N2, N3)" + separator
                        + "Sum = N4" + separator
                        + "Left = N2" + separator
                        + "Input = A" + separator));
    }

    @Test
    public void testRankKey() {
        Signal direct = Signal.derived(TruthTable.parse("0110"), XOR, new Signal[] {a, b}, 1, 6);
        ToIntFunction<Signal> circuitCost = Circuits.rankKey(SynthesisConfiguration.RetentionPolicy.CIRCUIT_COST);
        assertThat(circuitCost.applyAsInt(nand), is(1));
        assertThat(circuitCost.applyAsInt(direct), is(3));
        assertThat(circuitCost.applyAsInt(xor), is(4));

        ToIntFunction<Signal> ownCost = Circuits.rankKey(SynthesisConfiguration.RetentionPolicy.OWN_COST);
        assertThat(ownCost.applyAsInt(xor), is(1));
        assertThat(ownCost.applyAsInt(direct), is(3));

        ToIntFunction<Signal> discovery = Circuits.rankKey(SynthesisConfiguration.RetentionPolicy.DISCOVERY_ORDER);
        assertThat(discovery.applyAsInt(xor), is(5));
    }
}
