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

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Searches a circuit for a single target column: levels are generated until a signal with the
 * target table appears or the level budget is spent.
 *
 * <p>The solution is the first matching signal in discovery order, so it has the lowest possible
 * level. Among several circuits of that level, the one built by the earlier gate of the library
 * and the earlier input combination wins.</p>
 */
public final class SingleOutputSynthesizer {
    private static final Logger logger = Logger.getLogger(SingleOutputSynthesizer.class.getName());

    private final GateLibrary library;
    private final SynthesisConfiguration configuration;
    private final SynthesisListener listener;

    public SingleOutputSynthesizer(GateLibrary library) {
        this(library, ImmutableSynthesisConfiguration.builder().build());
    }

    public SingleOutputSynthesizer(GateLibrary library, SynthesisConfiguration configuration) {
        this(library, configuration, SynthesisListener.logging(logger));
    }

    public SingleOutputSynthesizer(GateLibrary library, SynthesisConfiguration configuration,
            SynthesisListener listener) {
        this.library = library;
        this.configuration = configuration;
        this.listener = listener;
    }

    /**
     * @throws ConfigurationException if the columns are inconsistent, see
     *     {@link SynthesisProblem#of(Map, Map)}.
     */
    public SingleOutputResult search(Map<String, TruthTable> inputs, TruthTable target) {
        return search(SynthesisProblem.of(inputs, target));
    }

    /**
     * @throws ConfigurationException if the problem does not have exactly one target.
     */
    public SingleOutputResult search(SynthesisProblem problem) {
        Util.checkConfiguration(problem.targets().size() == 1, "Expected one target, got %s",
                problem.targets().keySet());
        TruthTable target = problem.targets().values().iterator().next();
        SearchRun run = new SearchRun(problem, library, configuration, listener, signal -> signal.bits().equals(target));
        logger.log(Level.FINE, "Searching {0} with {1}", new Object[] {problem, library});

        SearchState state = SearchState.SEARCHING;
        Signal solution = run.pool().lookup(target).orElse(null);
        if (solution != null) {
            state = SearchState.FOUND;
        }
        while (state == SearchState.SEARCHING) {
            if (run.level() >= configuration.maxComplexity() || run.outOfTime()) {
                state = SearchState.EXHAUSTED;
                break;
            }
            List<Signal> created = run.nextLevel((gate, inputs, existing, level) -> {});
            if (created.isEmpty()) {
                logger.log(Level.FINE, "Pool closed under the library at level {0}", run.level());
                state = SearchState.EXHAUSTED;
                break;
            }
            solution = run.pool().lookup(target).orElse(null);
            if (solution != null) {
                state = SearchState.FOUND;
            }
        }

        SingleOutputResult result = new SingleOutputResult(state, solution, run.pool(), run.progress());
        logger.log(Level.INFO, "Search for {0} finished: {1}", new Object[] {target, result});
        return result;
    }
}
