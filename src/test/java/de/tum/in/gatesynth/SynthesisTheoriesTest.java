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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the search invariants on random functions of three variables over a complete library.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SynthesisTheoriesTest {
    private static final Logger logger = Logger.getLogger(SynthesisTheoriesTest.class.getName());

    private static final int RANDOM_TARGETS = 40;
    private static final Map<String, TruthTable> INPUTS = SynthesisProblem.inputsFor("A", "B", "C");
    private static final GateLibrary LIBRARY = GateLibrary.of(
            StandardGates.NOT.gate(1),
            StandardGates.AND2.gate(2),
            StandardGates.OR2.gate(2),
            StandardGates.NAND2.gate(1),
            StandardGates.XOR2.gate(3));

    private static TruthTable randomTable(Random random) {
        boolean[] bits = new boolean[8];
        for (int row = 0; row < bits.length; row++) {
            bits[row] = random.nextBoolean();
        }
        return TruthTable.of(bits);
    }

    static Stream<TruthTable> targets() {
        Random random = new Random(0L);
        return IntStream.range(0, RANDOM_TARGETS).mapToObj(i -> randomTable(random));
    }

    static Stream<Arguments> targetPairs() {
        Random random = new Random(1L);
        return IntStream.range(0, RANDOM_TARGETS / 4)
                .mapToObj(i -> Arguments.of(randomTable(random), randomTable(random)));
    }

    private static SynthesisConfiguration configuration(boolean pruning) {
        return ImmutableSynthesisConfiguration.builder().pruning(pruning).build();
    }

    @ParameterizedTest
    @MethodSource("targets")
    public void testSingleOutputSolutionIsCorrect(TruthTable target) {
        SingleOutputResult result = new SingleOutputSynthesizer(LIBRARY, configuration(true), SynthesisListener.silent())
                .search(INPUTS, target);
        assertThat(result.isFound(), is(true));
        Signal solution = result.solution().orElseThrow();
        assertThat(Circuits.evaluate(solution, INPUTS), is(target));
        assertThat(solution.level(), lessThanOrEqualTo(SynthesisConfiguration.DEFAULT_MAX_COMPLEXITY));
        for (Signal signal : Circuits.collect(List.of(solution))) {
            if (!signal.isLeaf()) {
                assertThat(signal.level() > signal.inputs().stream().mapToInt(Signal::level).max().orElseThrow(),
                        is(true));
            }
        }
        logger.log(Level.FINE, "{0} = {1}", new Object[] {target, solution});
    }

    @ParameterizedTest
    @MethodSource("targets")
    public void testPruningPreservesMinimalLevel(TruthTable target) {
        SingleOutputResult pruned = new SingleOutputSynthesizer(LIBRARY, configuration(true), SynthesisListener.silent())
                .search(INPUTS, target);
        SingleOutputResult full = new SingleOutputSynthesizer(LIBRARY, configuration(false), SynthesisListener.silent())
                .search(INPUTS, target);
        assertThat(pruned.solution().orElseThrow().level(), is(full.solution().orElseThrow().level()));
        assertThat(pruned.statistics().signalsExplored(), lessThanOrEqualTo(full.statistics().signalsExplored()));
    }

    @ParameterizedTest
    @MethodSource("targetPairs")
    public void testMultiOutputSolutionIsCorrect(TruthTable first, TruthTable second) {
        Map<String, TruthTable> targets = ImmutableMap.of("First", first, "Second", second);
        MultiOutputResult result = new MultiOutputSynthesizer(LIBRARY, configuration(true), SynthesisListener.silent())
                .search(INPUTS, targets);
        assertThat(result.isComplete(), is(true));
        targets.forEach((name, bits) -> assertThat(Circuits.evaluate(result.solutions().get(name), INPUTS), is(bits)));

        int separate = Circuits.cost(result.solutions().get("First")) + Circuits.cost(result.solutions().get("Second"));
        assertThat(result.totalCost(), lessThanOrEqualTo(separate));
        assertThat(result.totalCost(), is(Circuits.cost(result.solutions().values())));
    }
}
