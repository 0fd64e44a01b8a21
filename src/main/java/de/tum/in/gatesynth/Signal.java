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
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A node of a synthesized circuit: one boolean function of the inputs, given by its truth table,
 * together with its provenance. A signal is either a <i>leaf</i> (an input variable) or
 * <i>derived</i> by applying a gate to earlier signals. Inputs of a derived signal are shared
 * references, so a set of signals forms a DAG.
 *
 * <p>Signals are immutable and use identity equality. Their table is always the one obtained by
 * evaluating the origin, see {@link Circuits#evaluate(Signal, java.util.Map)}.</p>
 */
public final class Signal {
    /* Id of signals that live outside a pool, see #detached */
    static final int DETACHED = -1;

    private final TruthTable bits;
    @Nullable
    private final String variable;
    @Nullable
    private final Gate gate;
    private final List<Signal> inputs;
    private final int level;
    private final int id;

    private Signal(TruthTable bits, @Nullable String variable, @Nullable Gate gate, List<Signal> inputs, int level,
            int id) {
        this.bits = bits;
        this.variable = variable;
        this.gate = gate;
        this.inputs = inputs;
        this.level = level;
        this.id = id;
    }

    static Signal leaf(String variable, TruthTable bits, int id) {
        return new Signal(bits, variable, null, List.of(), 0, id);
    }

    static Signal derived(TruthTable bits, Gate gate, Signal[] inputs, int level, int id) {
        assert inputs.length == gate.arity();
        assert Arrays.stream(inputs).allMatch(input -> input.level < level);
        return new Signal(bits, null, gate, Collections.unmodifiableList(Arrays.asList(inputs.clone())), level, id);
    }

    /**
     * Creates a derived signal which is not registered in any pool, used to record alternative
     * realizations of a function that is already present in the pool.
     */
    static Signal detached(TruthTable bits, Gate gate, Signal[] inputs, int level) {
        return derived(bits, gate, inputs, level, DETACHED);
    }

    public TruthTable bits() {
        return bits;
    }

    public boolean isLeaf() {
        return gate == null;
    }

    /**
     * The input variable of a leaf.
     *
     * @throws IllegalStateException if this signal is derived.
     */
    public String variable() {
        Util.checkState(variable != null, "Signal %s is not a leaf", this);
        return variable;
    }

    /**
     * The gate producing a derived signal.
     *
     * @throws IllegalStateException if this signal is a leaf.
     */
    public Gate gate() {
        Util.checkState(gate != null, "Signal %s is a leaf", this);
        return gate;
    }

    public List<Signal> inputs() {
        return inputs;
    }

    /**
     * The generation pass in which this signal was produced, {@code 0} for leaves.
     */
    public int level() {
        return level;
    }

    /**
     * The cost of this signal's own gate application, {@code 0} for leaves.
     */
    public int ownCost() {
        return gate == null ? 0 : gate.cost();
    }

    /**
     * Creation sequence number within the owning pool, or {@code -1} for detached signals.
     */
    public int id() {
        return id;
    }

    public boolean isDetached() {
        return id == DETACHED;
    }

    @Override
    public String toString() {
        if (gate == null) {
            return Objects.requireNonNull(variable);
        }
        StringBuilder builder = new StringBuilder();
        appendExpression(builder);
        return builder.toString();
    }

    private void appendExpression(StringBuilder builder) {
        if (gate == null) {
            builder.append(variable);
            return;
        }
        builder.append(gate.name()).append('(');
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            inputs.get(i).appendExpression(builder);
        }
        builder.append(')');
    }
}
