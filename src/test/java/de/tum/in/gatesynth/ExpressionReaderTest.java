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

import de.tum.in.gatesynth.TableReader.InvalidFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ExpressionReaderTest {
    @Test
    public void testHalfAdder() throws IOException, InvalidFormatException {
        SynthesisProblem problem = ExpressionReader.read(new BufferedReader(new StringReader(
                "Sum : XOR(A, B)\n\nCarry : AND(A, B) [complexity=1]\n")));
        assertThat(problem.inputs().keySet(), contains("A", "B"));
        assertThat(problem.targets().keySet(), contains("Sum", "Carry"));
        assertThat(problem.targets().get("Sum").toString(), is("0110"));
        assertThat(problem.targets().get("Carry").toString(), is("0001"));
    }

    @Test
    public void testUnnamedOutputs() throws InvalidFormatException {
        SynthesisProblem single = ExpressionReader.parse(List.of("NAND2(A, B)"));
        assertThat(single.targets().keySet(), contains("Output"));
        assertThat(single.targets().get("Output").toString(), is("1110"));

        SynthesisProblem several = ExpressionReader.parse(List.of("NOT(A)", "OR(A, B)"));
        assertThat(several.targets().keySet(), contains("Output1", "Output2"));
    }

    @Test
    public void testVariablesAreSorted() throws InvalidFormatException {
        SynthesisProblem problem = ExpressionReader.parse(List.of("Out : AND3(C, A1, A)"));
        assertThat(problem.inputs().keySet(), contains("A", "A1", "C"));
        assertThat(problem.targets().get("Out").toString(), is("00000001"));

        SynthesisProblem identity = ExpressionReader.parse(List.of("B"));
        assertThat(identity.targets().get("Output"), is(identity.inputs().get("B")));
    }

    @Test
    public void testNestedExpression() throws InvalidFormatException {
        ExpressionReader.Expression expression = ExpressionReader.parseExpression("nand(NAND(A,B) , C)");
        assertThat(expression.toString(), is("NAND2(NAND2(A, B), C)"));
        assertThat(expression.evaluate(SynthesisProblem.inputsFor("A", "B", "C")).toString(), is("10101011"));
    }

    @Test
    public void testComplexityAnnotationAnywhere() throws InvalidFormatException {
        SynthesisProblem problem = ExpressionReader.parse(List.of(
                "Sum [complexity=2] : XOR(A, B)",
                "Carry : AND(A, [complexity=1] B) [complexity=1]"));
        assertThat(problem.targets().keySet(), contains("Sum", "Carry"));
        assertThat(problem.targets().get("Sum").toString(), is("0110"));
        assertThat(problem.targets().get("Carry").toString(), is("0001"));
    }

    @Test
    public void testInputsOnly() throws InvalidFormatException {
        List<String> lines = List.of("no outputs", "B C1 A");
        assertThat(ExpressionReader.isInputsOnly(lines), is(true));
        Map<String, TruthTable> inputs = ExpressionReader.parseInputsOnly(lines);
        assertThat(inputs.keySet(), contains("A", "B", "C1"));
        assertThat(inputs, is(SynthesisProblem.inputsFor("A", "B", "C1")));

        assertThat(ExpressionReader.isInputsOnly(List.of("NOT(A)")), is(false));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parse(lines));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseInputsOnly(List.of("NO OUTPUTS")));
        assertThrows(InvalidFormatException.class,
                () -> ExpressionReader.parseInputsOnly(List.of("NO OUTPUTS", "A b")));
        assertThrows(InvalidFormatException.class,
                () -> ExpressionReader.parseInputsOnly(List.of("NO OUTPUTS", "A A")));
    }

    @Test
    public void testMalformedExpressions() {
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parse(List.of()));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("FOO(A)"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("NOT(A, B)"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("AND(A, B))"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("AND(A, B"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("AND(A; B)"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression("a"));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parseExpression(""));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parse(List.of(": NOT(A)")));
        assertThrows(InvalidFormatException.class, () -> ExpressionReader.parse(List.of("X : A", "X : B")));
    }
}
