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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated input of a search: the columns of the input variables and the target columns. All
 * columns have {@code 2^n} rows for {@code n} input variables.
 */
public final class SynthesisProblem {
    public static final int MAX_VARIABLES = 24;

    private final Map<String, TruthTable> inputs;
    private final Map<String, TruthTable> targets;
    private final int rows;

    private SynthesisProblem(Map<String, TruthTable> inputs, Map<String, TruthTable> targets, int rows) {
        this.inputs = inputs;
        this.targets = targets;
        this.rows = rows;
    }

    /**
     * @throws ConfigurationException if there are no inputs or no targets, if the number of input
     *     variables exceeds {@link #MAX_VARIABLES}, or if some column does not have {@code 2^n} rows.
     */
    public static SynthesisProblem of(Map<String, TruthTable> inputs, Map<String, TruthTable> targets) {
        Util.checkConfiguration(!inputs.isEmpty(), "No input variables given");
        Util.checkConfiguration(!targets.isEmpty(), "No targets given");
        Util.checkConfiguration(inputs.size() <= MAX_VARIABLES, "%d input variables exceed the maximum of %d",
                inputs.size(), MAX_VARIABLES);
        int rows = 1 << inputs.size();
        inputs.forEach((name, bits) -> {
            Util.checkConfiguration(name != null && !name.isBlank(), "Blank input name");
            Util.checkConfiguration(bits.length() == rows, "Input %s has %d rows, expected 2^%d = %d",
                    name, bits.length(), inputs.size(), rows);
        });
        targets.forEach((name, bits) -> {
            Util.checkConfiguration(name != null && !name.isBlank(), "Blank target name");
            Util.checkConfiguration(bits.length() == rows, "Target %s has %d rows, expected 2^%d = %d",
                    name, bits.length(), inputs.size(), rows);
        });
        return new SynthesisProblem(
                Collections.unmodifiableMap(new LinkedHashMap<>(inputs)),
                Collections.unmodifiableMap(new LinkedHashMap<>(targets)),
                rows);
    }

    public static SynthesisProblem of(Map<String, TruthTable> inputs, TruthTable target) {
        return of(inputs, Map.of("Output", target));
    }

    /**
     * Builds the canonical input columns for the given variables, see
     * {@link TruthTable#variable(int, int)}.
     */
    public static Map<String, TruthTable> inputsFor(List<String> names) {
        Util.checkConfiguration(names.size() <= MAX_VARIABLES, "%d input variables exceed the maximum of %d",
                names.size(), MAX_VARIABLES);
        Map<String, TruthTable> inputs = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            TruthTable previous = inputs.put(names.get(i), TruthTable.variable(i, names.size()));
            Util.checkConfiguration(previous == null, "Variable %s given twice", names.get(i));
        }
        return inputs;
    }

    public static Map<String, TruthTable> inputsFor(String... names) {
        return inputsFor(Arrays.asList(names));
    }

    public Map<String, TruthTable> inputs() {
        return inputs;
    }

    public Map<String, TruthTable> targets() {
        return targets;
    }

    public int rows() {
        return rows;
    }

    public int variableCount() {
        return inputs.size();
    }

    @Override
    public String toString() {
        return String.format("%s -> %s", inputs.keySet(), targets.keySet());
    }
}
