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

import java.util.Map;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class SynthesisState {
    @Param({"true", "false"})
    private boolean pruning;

    private SynthesisConfiguration configuration;
    private GateLibrary nand;
    private GateLibrary mixed;
    private Map<String, TruthTable> inputs;

    @Setup(Level.Trial)
    public void setUp() {
        configuration = ImmutableSynthesisConfiguration.builder().pruning(pruning).build();
        nand = GateLibrary.of(StandardGates.NAND2.gate(1));
        mixed = GateLibrary.of(StandardGates.NOT.gate(1), StandardGates.AND2.gate(2), StandardGates.OR2.gate(2),
                StandardGates.XOR2.gate(3), StandardGates.AND3.gate(3));
        inputs = SynthesisProblem.inputsFor("A", "B", "Cin");
    }

    public SynthesisConfiguration configuration() {
        return configuration;
    }

    public GateLibrary nand() {
        return nand;
    }

    public GateLibrary mixed() {
        return mixed;
    }

    public Map<String, TruthTable> inputs() {
        return inputs;
    }
}
