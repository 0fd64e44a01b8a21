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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SynthesisBenchmark {
    private static Map<String, TruthTable> fullAdder(Map<String, TruthTable> inputs) {
        Gate xor = StandardGates.XOR2.gate(0);
        Gate or = StandardGates.OR2.gate(0);
        Gate and = StandardGates.AND2.gate(0);
        TruthTable a = inputs.get("A");
        TruthTable b = inputs.get("B");
        TruthTable carryIn = inputs.get("Cin");
        return ImmutableMap.of(
                "Sum", xor.apply(xor.apply(a, b), carryIn),
                "Cout", or.apply(and.apply(a, b), and.apply(carryIn, xor.apply(a, b))));
    }

    @Benchmark
    public static void xorFromNand(SynthesisState state, Blackhole bh) {
        Map<String, TruthTable> inputs = SynthesisProblem.inputsFor("A", "B");
        bh.consume(new SingleOutputSynthesizer(state.nand(), state.configuration(), SynthesisListener.silent())
                .search(inputs, TruthTable.parse("0110")));
    }

    @Benchmark
    public static void fullAdderFromNand(SynthesisState state, Blackhole bh) {
        bh.consume(new MultiOutputSynthesizer(state.nand(), state.configuration(), SynthesisListener.silent())
                .search(state.inputs(), fullAdder(state.inputs())));
    }

    @Benchmark
    public static void fullAdderFromMixedLibrary(SynthesisState state, Blackhole bh) {
        bh.consume(new MultiOutputSynthesizer(state.mixed(), state.configuration(), SynthesisListener.silent())
                .search(state.inputs(), fullAdder(state.inputs())));
    }
}
