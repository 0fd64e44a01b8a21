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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, ordered collection of gates. The order is the order in which the level generator
 * applies the gates and therefore fixes the discovery order of signals.
 */
public final class GateLibrary implements Iterable<Gate> {
    private final List<Gate> gates;
    private final Map<String, Gate> byName;

    private GateLibrary(List<Gate> gates, Map<String, Gate> byName) {
        this.gates = gates;
        this.byName = byName;
    }

    /**
     * @throws ConfigurationException if the collection is empty or contains two gates of the same
     *     name.
     */
    public static GateLibrary of(Collection<Gate> gates) {
        Util.checkConfiguration(!gates.isEmpty(), "Gate library is empty");
        Map<String, Gate> byName = new LinkedHashMap<>();
        for (Gate gate : gates) {
            Gate previous = byName.put(gate.name(), gate);
            Util.checkConfiguration(previous == null, "Gate %s is defined twice", gate.name());
        }
        return new GateLibrary(
                Collections.unmodifiableList(new ArrayList<>(gates)), Collections.unmodifiableMap(byName));
    }

    public static GateLibrary of(Gate... gates) {
        return of(Arrays.asList(gates));
    }

    public List<Gate> gates() {
        return gates;
    }

    public Optional<Gate> gate(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return gates.size();
    }

    public int maxArity() {
        int max = 0;
        for (Gate gate : gates) {
            max = Math.max(max, gate.arity());
        }
        return max;
    }

    @Override
    public Iterator<Gate> iterator() {
        return gates.iterator();
    }

    @Override
    public String toString() {
        return gates.toString();
    }
}
