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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The catalogue of named primitives that gate tables may refer to.
 */
public enum StandardGates {
    NOT(1, in -> !in[0]),
    AND2(2, in -> in[0] && in[1]),
    OR2(2, in -> in[0] || in[1]),
    NOR2(2, in -> !(in[0] || in[1])),
    NAND2(2, in -> !(in[0] && in[1])),
    XOR2(2, in -> in[0] ^ in[1]),
    XNOR2(2, in -> !(in[0] ^ in[1])),
    AND3(3, in -> in[0] && in[1] && in[2]),
    OR3(3, in -> in[0] || in[1] || in[2]),
    NAND3(3, in -> !(in[0] && in[1] && in[2])),
    NOR3(3, in -> !(in[0] || in[1] || in[2])),
    AND4(4, in -> in[0] && in[1] && in[2] && in[3]),
    OR4(4, in -> in[0] || in[1] || in[2] || in[3]),
    NAND4(4, in -> !(in[0] && in[1] && in[2] && in[3])),
    NOR4(4, in -> !(in[0] || in[1] || in[2] || in[3]));

    private static final Map<String, StandardGates> INDEX;

    static {
        Map<String, StandardGates> index = new HashMap<>();
        for (StandardGates gate : values()) {
            index.put(gate.name(), gate);
        }
        INDEX = Collections.unmodifiableMap(index);
    }

    private final int arity;
    private final Gate.GateFunction function;

    StandardGates(int arity, Gate.GateFunction function) {
        this.arity = arity;
        this.function = function;
    }

    public int arity() {
        return arity;
    }

    public Gate.GateFunction function() {
        return function;
    }

    public Gate gate(int cost) {
        return Gate.of(name(), arity, cost, function);
    }

    /**
     * Looks up a gate by name, ignoring case.
     */
    public static Optional<StandardGates> byName(String name) {
        return Optional.ofNullable(INDEX.get(name.strip().toUpperCase(Locale.ROOT)));
    }

    /**
     * Builds a library from gate names and costs, in the iteration order of the given map.
     *
     * @throws ConfigurationException if a name is not part of the catalogue.
     */
    public static GateLibrary library(Map<String, Integer> costs) {
        List<Gate> gates = new ArrayList<>(costs.size());
        costs.forEach((name, cost) -> {
            StandardGates gate = byName(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown gate " + name));
            gates.add(gate.gate(cost));
        });
        return GateLibrary.of(gates);
    }
}
