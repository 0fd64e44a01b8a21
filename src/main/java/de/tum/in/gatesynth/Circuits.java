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

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Operations on circuits, i.e. the DAGs spanned by signals and their inputs.
 */
public final class Circuits {
    private Circuits() {}

    /**
     * Returns all signals reachable from the given roots, each exactly once, inputs before the
     * signals using them.
     */
    public static Set<Signal> collect(Collection<Signal> roots) {
        Set<Signal> visited = new LinkedHashSet<>();
        for (Signal root : roots) {
            collect(root, visited);
        }
        return visited;
    }

    private static void collect(Signal signal, Set<Signal> visited) {
        if (visited.contains(signal)) {
            return;
        }
        for (Signal input : signal.inputs()) {
            collect(input, visited);
        }
        visited.add(signal);
    }

    /**
     * The cost of realizing all given signals together: the own cost of every distinct reachable
     * signal, so shared sub-circuits are counted once.
     */
    public static int cost(Collection<Signal> roots) {
        int cost = 0;
        for (Signal signal : collect(roots)) {
            cost += signal.ownCost();
        }
        return cost;
    }

    public static int cost(Signal root) {
        return cost(List.of(root));
    }

    /**
     * Recomputes the table of {@code signal} from its origin.
     *
     * @throws IllegalArgumentException if a leaf variable is missing from {@code inputs}.
     */
    public static TruthTable evaluate(Signal signal, Map<String, TruthTable> inputs) {
        return evaluate(signal, inputs, new HashMap<>());
    }

    private static TruthTable evaluate(Signal signal, Map<String, TruthTable> inputs, Map<Signal, TruthTable> cache) {
        TruthTable cached = cache.get(signal);
        if (cached != null) {
            return cached;
        }
        TruthTable result;
        if (signal.isLeaf()) {
            result = inputs.get(signal.variable());
            if (result == null) {
                throw new IllegalArgumentException("No value for input " + signal.variable());
            }
        } else {
            List<Signal> signalInputs = signal.inputs();
            TruthTable[] arguments = new TruthTable[signalInputs.size()];
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = evaluate(signalInputs.get(i), inputs, cache);
            }
            result = signal.gate().apply(arguments);
        }
        cache.put(signal, result);
        return result;
    }

    /**
     * Renders the circuit realizing the given outputs with one line per distinct gate instance, so
     * that shared nodes appear once, followed by one line per output.
     */
    public static String toNetlist(Map<String, Signal> outputs) {
        Map<Signal, String> names = new HashMap<>();
        StringBuilder builder = new StringBuilder();
        int gates = 0;
        for (Signal signal : collect(outputs.values())) {
            if (signal.isLeaf()) {
                names.put(signal, signal.variable());
                continue;
            }
            gates += 1;
            String name = "N" + gates;
            names.put(signal, name);
            builder.append(name).append(" = ").append(signal.gate().name()).append('(');
            List<Signal> inputs = signal.inputs();
            for (int i = 0; i < inputs.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(names.get(inputs.get(i)));
            }
            builder.append(')').append(System.lineSeparator());
        }
        outputs.forEach((output, signal) ->
                builder.append(output).append(" = ").append(names.get(signal)).append(System.lineSeparator()));
        return builder.toString();
    }

    /**
     * The key by which the pool cap ranks the signals of a level; lower keys are kept first.
     */
    static ToIntFunction<Signal> rankKey(SynthesisConfiguration.RetentionPolicy policy) {
        switch (policy) {
            case CIRCUIT_COST:
                return signal -> cost(signal);
            case OWN_COST:
                return Signal::ownCost;
            case DISCOVERY_ORDER:
                return Signal::id;
            default:
                throw new AssertionError();
        }
    }
}
