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

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class SynthesisConfiguration {
    public static final int DEFAULT_MAX_COMPLEXITY = 10;
    public static final int DEFAULT_CONTINUATION_LEVELS = 1;
    public static final int DEFAULT_MAX_ALTERNATIVES_PER_TARGET = 16;
    public static final int DEFAULT_MAX_ENUMERATED_ASSIGNMENTS = 1 << 16;

    /**
     * Hard ceiling on the number of generation passes.
     */
    @Value.Default
    public int maxComplexity() {
        return DEFAULT_MAX_COMPLEXITY;
    }

    /**
     * If present, each level keeps at most this many new signals (plus signals matching a target),
     * ranked by {@link #retentionPolicy()}. This trades completeness for tractability: a dropped
     * table is only found again if a later level rediscovers it.
     */
    public abstract OptionalInt poolCapPerLevel();

    @Value.Default
    public RetentionPolicy retentionPolicy() {
        return RetentionPolicy.CIRCUIT_COST;
    }

    /**
     * Multi-output search only: how many levels to generate after all targets became reachable.
     */
    @Value.Default
    public int continuationLevelsAfterFirstMatch() {
        return DEFAULT_CONTINUATION_LEVELS;
    }

    @Value.Default
    public boolean pruning() {
        return true;
    }

    /**
     * Multi-output search only: bound on the alternative realizations recorded per target.
     */
    @Value.Default
    public int maxAlternativesPerTarget() {
        return DEFAULT_MAX_ALTERNATIVES_PER_TARGET;
    }

    /**
     * Multi-output search only: up to this many assignments are enumerated exhaustively when
     * selecting the cheapest combination of realizations, beyond it a local descent is used.
     */
    @Value.Default
    public int maxEnumeratedAssignments() {
        return DEFAULT_MAX_ENUMERATED_ASSIGNMENTS;
    }

    /**
     * Emit a progress snapshot every this many levels.
     */
    @Value.Default
    public int progressInterval() {
        return 1;
    }

    /**
     * Wall clock budget, checked between levels.
     */
    public abstract Optional<Duration> timeLimit();

    @Value.Check
    protected void check() {
        Util.checkConfiguration(maxComplexity() >= 0, "Negative maximal complexity %d", maxComplexity());
        Util.checkConfiguration(poolCapPerLevel().orElse(1) > 0, "Pool cap must be positive");
        Util.checkConfiguration(continuationLevelsAfterFirstMatch() >= 0, "Negative continuation %d",
                continuationLevelsAfterFirstMatch());
        Util.checkConfiguration(maxAlternativesPerTarget() >= 0, "Negative alternative bound %d",
                maxAlternativesPerTarget());
        Util.checkConfiguration(maxEnumeratedAssignments() > 0, "Assignment bound must be positive");
        Util.checkConfiguration(progressInterval() > 0, "Progress interval must be positive");
        Util.checkConfiguration(timeLimit().map(limit -> !limit.isNegative()).orElse(true), "Negative time limit");
    }

    /**
     * Ranking used to decide which signals survive the {@link #poolCapPerLevel() pool cap}. Ties are
     * broken by discovery order.
     */
    public enum RetentionPolicy {
        /** Cost of the whole circuit below the signal, shared nodes counted once. */
        CIRCUIT_COST,
        /** Cost of the signal's own gate. */
        OWN_COST,
        /** First discovered first. */
        DISCOVERY_ORDER
    }
}
