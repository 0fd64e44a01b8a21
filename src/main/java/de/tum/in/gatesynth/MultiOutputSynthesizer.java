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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Searches circuits for several targets over one shared pool, so that intermediate signals can be
 * reused between outputs.
 *
 * <p>The search does not stop when every target became reachable. It keeps generating up to
 * {@link SynthesisConfiguration#continuationLevelsAfterFirstMatch()} further levels (bounded by
 * {@link SynthesisConfiguration#maxComplexity()}), recording every realization of a target found
 * on the way, including the ones discarded by deduplication. At the end, the combination of
 * realizations with the lowest total cost is selected.</p>
 *
 * <p>This is a best-effort minimization: it only combines realizations that the bounded search
 * actually encountered, so the returned circuit is not guaranteed to be globally cheapest.</p>
 */
public final class MultiOutputSynthesizer {
    private static final Logger logger = Logger.getLogger(MultiOutputSynthesizer.class.getName());

    private final GateLibrary library;
    private final SynthesisConfiguration configuration;
    private final SynthesisListener listener;

    public MultiOutputSynthesizer(GateLibrary library) {
        this(library, ImmutableSynthesisConfiguration.builder().build());
    }

    public MultiOutputSynthesizer(GateLibrary library, SynthesisConfiguration configuration) {
        this(library, configuration, SynthesisListener.logging(logger));
    }

    public MultiOutputSynthesizer(GateLibrary library, SynthesisConfiguration configuration,
            SynthesisListener listener) {
        this.library = library;
        this.configuration = configuration;
        this.listener = listener;
    }

    /**
     * @throws ConfigurationException if the columns are inconsistent, see
     *     {@link SynthesisProblem#of(Map, Map)}.
     */
    public MultiOutputResult search(Map<String, TruthTable> inputs, Map<String, TruthTable> targets) {
        return search(SynthesisProblem.of(inputs, targets));
    }

    public MultiOutputResult search(SynthesisProblem problem) {
        // Outputs with equal columns share their realizations
        Map<TruthTable, Realizations> realizations = new LinkedHashMap<>();
        problem.targets().values().forEach(bits -> realizations.computeIfAbsent(bits, Realizations::new));

        SearchRun run = new SearchRun(problem, library, configuration, listener,
                signal -> realizations.containsKey(signal.bits()));
        logger.log(Level.FINE, "Searching {0} with {1}", new Object[] {problem, library});

        LevelGenerator.DuplicateListener alternatives = (gate, inputs, existing, level) -> {
            Realizations target = realizations.get(existing.bits());
            if (target == null || configuration.maxAlternativesPerTarget() == 0) {
                return;
            }
            for (Signal input : inputs) {
                // A realization using the target itself is never cheaper than the target
                if (input.bits().equals(existing.bits())) {
                    return;
                }
            }
            target.offer(Signal.detached(existing.bits(), gate, inputs, level),
                    configuration.maxAlternativesPerTarget());
        };

        record(run.pool().level(0), realizations);
        int firstFullMatch = allRealized(realizations) ? 0 : -1;
        while (true) {
            if (firstFullMatch >= 0
                    && run.level() >= firstFullMatch + configuration.continuationLevelsAfterFirstMatch()) {
                break;
            }
            if (run.level() >= configuration.maxComplexity()) {
                break;
            }
            if (run.outOfTime()) {
                logger.log(Level.FINE, "Time limit reached at level {0}", run.level());
                break;
            }
            List<Signal> created = run.nextLevel(alternatives);
            if (created.isEmpty()) {
                logger.log(Level.FINE, "Pool closed under the library at level {0}", run.level());
                break;
            }
            record(created, realizations);
            if (firstFullMatch < 0) {
                if (allRealized(realizations)) {
                    firstFullMatch = run.level();
                    logger.log(Level.FINE, "All targets reachable at level {0}", firstFullMatch);
                } else if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Remaining targets after level {0}: {1}",
                            new Object[] {run.level(), remaining(problem, realizations)});
                }
            }
        }

        Map<TruthTable, Signal> chosen = choose(realizations);
        Map<String, Signal> solutions = new LinkedHashMap<>();
        Set<String> unreachable = new LinkedHashSet<>();
        problem.targets().forEach((name, bits) -> {
            Signal signal = chosen.get(bits);
            if (signal == null) {
                unreachable.add(name);
            } else {
                solutions.put(name, signal);
            }
        });

        MultiOutputResult result = new MultiOutputResult(solutions, unreachable,
                firstFullMatch < 0 ? OptionalInt.empty() : OptionalInt.of(firstFullMatch), run.pool(), run.progress());
        logger.log(Level.INFO, "Search finished: {0}", result);
        return result;
    }

    private static void record(List<Signal> signals, Map<TruthTable, Realizations> realizations) {
        for (Signal signal : signals) {
            Realizations target = realizations.get(signal.bits());
            if (target != null) {
                target.offer(signal, Integer.MAX_VALUE);
            }
        }
    }

    private static List<String> remaining(SynthesisProblem problem, Map<TruthTable, Realizations> realizations) {
        List<String> names = new ArrayList<>();
        problem.targets().forEach((name, bits) -> {
            if (realizations.get(bits).isEmpty()) {
                names.add(name);
            }
        });
        return names;
    }

    private static boolean allRealized(Map<TruthTable, Realizations> realizations) {
        return realizations.values().stream().noneMatch(Realizations::isEmpty);
    }

    private Map<TruthTable, Signal> choose(Map<TruthTable, Realizations> realizations) {
        List<TruthTable> reached = new ArrayList<>();
        List<List<Signal>> candidates = new ArrayList<>();
        realizations.forEach((bits, target) -> {
            if (!target.isEmpty()) {
                reached.add(bits);
                candidates.add(target.ordered());
            }
        });
        Map<TruthTable, Signal> chosen = new LinkedHashMap<>();
        if (reached.isEmpty()) {
            return chosen;
        }
        int[] choice = SolutionSelector.select(candidates, configuration.maxEnumeratedAssignments());
        for (int i = 0; i < choice.length; i++) {
            chosen.put(reached.get(i), candidates.get(i).get(choice[i]));
        }
        return chosen;
    }

    /**
     * All recorded realizations of one target table: the pool signal, once found, and a bounded
     * number of detached alternatives, the individually cheapest ones.
     */
    private static final class Realizations {
        private static final Comparator<Candidate> ORDER = Comparator.comparingInt((Candidate c) -> c.cost)
                .thenComparingInt(c -> c.signal.level())
                .thenComparingInt(c -> c.sequence);

        private final TruthTable bits;
        private final List<Candidate> candidates = new ArrayList<>();
        private int alternatives = 0;
        private int sequence = 0;

        Realizations(TruthTable bits) {
            this.bits = bits;
        }

        boolean isEmpty() {
            return candidates.isEmpty();
        }

        void offer(Signal signal, int maxAlternatives) {
            assert signal.bits().equals(bits);
            Candidate candidate = new Candidate(signal, Circuits.cost(signal), sequence++);
            if (signal.isDetached()) {
                if (alternatives >= maxAlternatives) {
                    Candidate worst = null;
                    for (Candidate existing : candidates) {
                        if (existing.signal.isDetached() && (worst == null || ORDER.compare(existing, worst) > 0)) {
                            worst = existing;
                        }
                    }
                    if (worst == null || ORDER.compare(candidate, worst) >= 0) {
                        return;
                    }
                    candidates.remove(worst);
                    alternatives -= 1;
                }
                alternatives += 1;
                logger.log(Level.FINEST, "Alternative for {0}: {1}", new Object[] {bits, signal});
            }
            candidates.add(candidate);
        }

        List<Signal> ordered() {
            List<Candidate> sorted = new ArrayList<>(candidates);
            sorted.sort(ORDER);
            List<Signal> signals = new ArrayList<>(sorted.size());
            for (Candidate candidate : sorted) {
                signals.add(candidate.signal);
            }
            return signals;
        }
    }

    private static final class Candidate {
        final Signal signal;
        final int cost;
        final int sequence;

        Candidate(Signal signal, int cost, int sequence) {
            this.signal = signal;
            this.cost = cost;
            this.sequence = sequence;
        }
    }
}
